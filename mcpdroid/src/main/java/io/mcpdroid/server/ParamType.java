/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.server;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 工具参数的声明类型到JSON Schema类型的映射。未声明类型的参数按 {@link #STRING} 处理。
 */
public enum ParamType {

	STRING("string", null),

	INTEGER("integer", null),

	NUMBER("number", null),

	BOOLEAN("boolean", null),

	OBJECT("object", null),

	STRING_ARRAY("array", "string"),

	INTEGER_ARRAY("array", "integer");

	private final String jsonSchemaType;

	private final String itemType;

	ParamType(String jsonSchemaType, String itemType) {
		this.jsonSchemaType = jsonSchemaType;
		this.itemType = itemType;
	}

	public String jsonSchemaType() {
		return this.jsonSchemaType;
	}

	public boolean isArray() {
		return this.itemType != null;
	}

	/**
	 * 生成单个参数的schema片段，数组类型附带 {@code items} 子schema。
	 * @param description 参数描述，为 {@code null} 时省略
	 * @return 可直接序列化的schema映射
	 */
	public Map<String, Object> toJsonSchemaMap(String description) {
		Map<String, Object> property = new LinkedHashMap<>();
		property.put("type", this.jsonSchemaType);
		if (isArray()) {
			property.put("items", Map.of("type", this.itemType));
		}
		if (description != null) {
			property.put("description", description);
		}
		return property;
	}

}
