/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.server;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import io.mcpdroid.spec.McpError;
import io.mcpdroid.spec.McpSchema;
import io.mcpdroid.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * 工具注册表。所有工具都以 {@code tools/<name>} 为键存放，注册顺序即 {@code tools/list} 的输出顺序。
 *
 * <p>
 * 注册表在构造时写入两个内置元工具：
 * <ul>
 * <li>{@code tools/list} 返回除元工具外的全部工具描述
 * <li>{@code tools/call} 按名称调用工具并把返回值包装为 {@link McpSchema.CallToolResult}
 * </ul>
 * 其余工具既可以通过 {@code tools/call} 调用，也可以直接以 {@code tools/<name>} 作为方法名调用。
 *
 * <p>
 * 线程安全：注册、注销和查找在同一把锁下进行，工具处理程序本身在锁外执行。
 */
public class McpToolRegistry {

	private static final Logger logger = LoggerFactory.getLogger(McpToolRegistry.class);

	private static final Set<String> RESERVED_NAMES = Set.of(McpSchema.TOOL_LIST, McpSchema.TOOL_CALL);

	private final Object lock = new Object();

	private final Map<String, RegisteredTool> tools = new LinkedHashMap<>();

	public McpToolRegistry() {
		registerBuiltIn(ToolDefinition.builder(McpSchema.TOOL_LIST).documentation("列出所有可用的工具").build(),
				params -> Mono.fromSupplier(() -> new McpSchema.ListToolsResult(list())));
		registerBuiltIn(ToolDefinition.builder(McpSchema.TOOL_CALL)
			.documentation("""
					按名称调用工具

					name: 要调用的工具名
					parameters: 传递给工具的参数
					""")
			.param("name", ParamType.STRING)
			.optionalParam("parameters", ParamType.OBJECT)
			.build(), this::handleCall);
	}

	/**
	 * 注册工具。同名工具会被覆盖（后写入者生效），覆盖时记录警告。
	 * @param specification 工具规范
	 * @throws IllegalArgumentException 工具名为保留名 {@code list} 或 {@code call}
	 */
	public void register(McpServerFeatures.AsyncToolSpecification specification) {
		Assert.notNull(specification, "Tool specification must not be null");
		String name = specification.name();
		Assert.isTrue(!RESERVED_NAMES.contains(name), "Tool name is reserved: " + name);

		RegisteredTool tool = new RegisteredTool(ToolSchemaGenerator.generate(specification.definition()),
				specification.definition(), specification.call(), false);
		synchronized (this.lock) {
			if (this.tools.put(McpSchema.toolMethod(name), tool) != null) {
				logger.warn("Replace existing tool handler for: {}", name);
			}
		}
		logger.debug("Registered tool: {}", name);
	}

	/**
	 * 注销工具。内置元工具不能被注销。
	 * @param name 不带命名空间的工具名
	 * @return 工具存在并被移除时返回 {@code true}
	 */
	public boolean unregister(String name) {
		Assert.hasText(name, "Tool name must not be empty");
		if (RESERVED_NAMES.contains(name)) {
			return false;
		}
		synchronized (this.lock) {
			return this.tools.remove(McpSchema.toolMethod(name)) != null;
		}
	}

	public boolean contains(String name) {
		synchronized (this.lock) {
			RegisteredTool tool = this.tools.get(McpSchema.toolMethod(name));
			return tool != null && !tool.builtIn();
		}
	}

	/**
	 * 按注册顺序返回全部工具描述，不包括内置的 {@code list} 和 {@code call}。
	 */
	public List<McpSchema.Tool> list() {
		List<McpSchema.Tool> result = new ArrayList<>();
		synchronized (this.lock) {
			for (RegisteredTool tool : this.tools.values()) {
				if (!tool.builtIn()) {
					result.add(tool.tool());
				}
			}
		}
		return result;
	}

	/**
	 * 按名称调用工具。
	 * @param name 不带命名空间的工具名
	 * @param params 调用参数，缺失的参数使用声明的默认值
	 * @return 包装了工具返回值的结果；工具不存在时以 {@link McpError} 结束
	 */
	public Mono<McpSchema.CallToolResult> call(String name, Map<String, Object> params) {
		RegisteredTool tool;
		synchronized (this.lock) {
			tool = this.tools.get(McpSchema.toolMethod(name));
		}
		if (tool == null) {
			return Mono.error(McpError.toolNotFound(name));
		}
		return tool.invoke(params)
			.map(McpSchema.CallToolResult::new)
			.defaultIfEmpty(new McpSchema.CallToolResult(null));
	}

	/**
	 * 查找方法名对应的处理函数。
	 * @param method 完整方法名，例如 {@code tools/list}
	 * @return 处理函数；方法不存在时返回 {@code null}
	 */
	Function<Map<String, Object>, Mono<Object>> route(String method) {
		RegisteredTool tool;
		synchronized (this.lock) {
			tool = this.tools.get(method);
		}
		return (tool != null) ? tool::invoke : null;
	}

	private void registerBuiltIn(ToolDefinition definition, Function<Map<String, Object>, Mono<Object>> handler) {
		this.tools.put(McpSchema.toolMethod(definition.name()),
				new RegisteredTool(ToolSchemaGenerator.generate(definition), definition, handler, true));
	}

	private Mono<Object> handleCall(Map<String, Object> params) {
		Object name = params.get("name");
		if (!(name instanceof String toolName) || toolName.isBlank()) {
			return Mono.error(new McpError(McpSchema.ErrorCodes.METHOD_NOT_FOUND, "Missing tool name"));
		}
		Object parameters = params.get("parameters");
		if (parameters != null && !(parameters instanceof Map)) {
			return Mono.error(new McpError(McpSchema.ErrorCodes.INVALID_PARAMS, "Tool parameters must be an object"));
		}
		@SuppressWarnings("unchecked")
		Map<String, Object> toolParams = (Map<String, Object>) parameters;
		McpSchema.CallToolRequest request = new McpSchema.CallToolRequest(toolName, toolParams);
		return call(request.name(), request.parameters()).cast(Object.class);
	}

	private record RegisteredTool(McpSchema.Tool tool, ToolDefinition definition,
			Function<Map<String, Object>, Mono<Object>> handler, boolean builtIn) {

		Mono<Object> invoke(Map<String, Object> params) {
			Map<String, Object> arguments = new LinkedHashMap<>(this.definition.defaults());
			if (params != null) {
				arguments.putAll(params);
			}
			return Mono.defer(() -> this.handler.apply(arguments));
		}
	}

}
