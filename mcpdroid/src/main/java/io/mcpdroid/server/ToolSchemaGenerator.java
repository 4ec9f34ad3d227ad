/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.server;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import io.mcpdroid.spec.McpSchema;

/**
 * 从 {@link ToolDefinition} 生成 {@link McpSchema.Tool}：描述、输入schema和行为提示。
 */
public final class ToolSchemaGenerator {

	private static final List<String> READ_ONLY_KEYWORDS = List.of("获取", "查询", "列出", "get", "list", "query");

	private static final List<String> DESTRUCTIVE_KEYWORDS = List.of("删除", "卸载", "清除", "delete", "remove",
			"uninstall", "clear");

	private ToolSchemaGenerator() {
	}

	public static McpSchema.Tool generate(ToolDefinition definition) {
		String description = description(definition.documentation());
		return new McpSchema.Tool(definition.name(), description, inputSchema(definition),
				annotations(description));
	}

	/**
	 * 文档文本的第一个非空行。
	 */
	static String description(String documentation) {
		for (String line : documentation.split("\\R")) {
			if (!line.isBlank()) {
				return line.strip();
			}
		}
		return "";
	}

	static McpSchema.JsonSchema inputSchema(ToolDefinition definition) {
		Map<String, Object> properties = new LinkedHashMap<>();
		List<String> required = new ArrayList<>();
		for (ToolDefinition.Param param : definition.params()) {
			String paramDescription = paramDescription(definition.documentation(), param.name());
			properties.put(param.name(), param.type().toJsonSchemaMap(paramDescription));
			if (param.required()) {
				required.add(param.name());
			}
		}
		return new McpSchema.JsonSchema("object", properties, required.isEmpty() ? null : List.copyOf(required));
	}

	/**
	 * 在文档中查找 {@code "<param>: <text>"} 行并返回冒号后的文本，没有匹配时返回 {@code null}。
	 */
	static String paramDescription(String documentation, String paramName) {
		String prefix = paramName + ":";
		for (String line : documentation.split("\\R")) {
			String trimmed = line.strip();
			if (trimmed.startsWith(prefix)) {
				return trimmed.substring(prefix.length()).strip();
			}
		}
		return null;
	}

	/**
	 * 根据描述中的关键字推断行为提示。只读提示优先于破坏性提示。
	 */
	static McpSchema.ToolAnnotations annotations(String description) {
		String text = description.toLowerCase(Locale.ROOT);
		if (containsAny(text, READ_ONLY_KEYWORDS)) {
			return new McpSchema.ToolAnnotations(true, null);
		}
		if (containsAny(text, DESTRUCTIVE_KEYWORDS)) {
			return new McpSchema.ToolAnnotations(null, true);
		}
		return McpSchema.ToolAnnotations.none();
	}

	private static boolean containsAny(String text, List<String> keywords) {
		for (String keyword : keywords) {
			if (text.contains(keyword)) {
				return true;
			}
		}
		return false;
	}

}
