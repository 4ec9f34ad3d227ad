/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.server;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.mcpdroid.util.Assert;

/**
 * 工具的声明式描述：名称、文档文本和参数列表。注册时由 {@link ToolSchemaGenerator}
 * 据此生成工具描述、输入schema和行为提示，运行时无需任何反射。
 *
 * <p>
 * 文档文本的第一行作为工具描述；形如 {@code "<param>: <text>"} 的行作为对应参数的描述：
 * <pre>{@code
 * ToolDefinition.builder("sync_operations")
 *     .documentation("""
 *         多设备同步操作
 *
 *         Args:
 *             action: 操作类型，create、wait、set、release
 *             lock_name: 锁名称
 *         """)
 *     .param("action", ParamType.STRING)
 *     .param("lock_name", ParamType.STRING)
 *     .optionalParam("timeout", ParamType.INTEGER, 30)
 *     .build();
 * }</pre>
 *
 * @param name 工具名，不带 {@code tools/} 前缀
 * @param documentation 结构化文档文本
 * @param params 按声明顺序排列的参数
 */
public record ToolDefinition(String name, String documentation, List<Param> params) {

	public ToolDefinition {
		Assert.hasText(name, "Tool name must not be empty");
		Assert.isTrue(!name.contains("/"), "Tool name must not contain '/': " + name);
		documentation = (documentation != null) ? documentation : "";
		params = (params != null) ? List.copyOf(params) : List.of();
	}

	/**
	 * 已声明参数的默认值，只包含非必需且默认值不为 {@code null} 的参数。
	 * @return 参数名到默认值的映射
	 */
	public Map<String, Object> defaults() {
		Map<String, Object> defaults = new LinkedHashMap<>();
		for (Param param : this.params) {
			if (!param.required() && param.defaultValue() != null) {
				defaults.put(param.name(), param.defaultValue());
			}
		}
		return Collections.unmodifiableMap(defaults);
	}

	public static Builder builder(String name) {
		return new Builder(name);
	}

	/**
	 * 单个参数的声明。
	 *
	 * @param name 参数名
	 * @param type 声明类型
	 * @param required 没有默认值的参数为必需参数
	 * @param defaultValue 默认值，可以为 {@code null}
	 */
	public record Param(String name, ParamType type, boolean required, Object defaultValue) {

		public Param {
			Assert.hasText(name, "Parameter name must not be empty");
			type = (type != null) ? type : ParamType.STRING;
		}

	}

	public static class Builder {

		private final String name;

		private String documentation;

		private final List<Param> params = new ArrayList<>();

		private Builder(String name) {
			this.name = name;
		}

		public Builder documentation(String documentation) {
			this.documentation = documentation;
			return this;
		}

		/**
		 * 声明一个未指定类型的必需参数，类型按字符串处理。
		 */
		public Builder param(String paramName) {
			return param(paramName, null);
		}

		/**
		 * 声明一个必需参数。
		 */
		public Builder param(String paramName, ParamType type) {
			this.params.add(new Param(paramName, type, true, null));
			return this;
		}

		/**
		 * 声明一个带默认值的可选参数，默认值可以为 {@code null}。
		 */
		public Builder optionalParam(String paramName, ParamType type, Object defaultValue) {
			this.params.add(new Param(paramName, type, false, defaultValue));
			return this;
		}

		public Builder optionalParam(String paramName, ParamType type) {
			return optionalParam(paramName, type, null);
		}

		public ToolDefinition build() {
			return new ToolDefinition(this.name, this.documentation, this.params);
		}

	}

}
