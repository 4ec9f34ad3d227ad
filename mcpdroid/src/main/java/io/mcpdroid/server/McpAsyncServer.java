/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.server;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpdroid.server.lifecycle.ResourceLifecycleManager;
import io.mcpdroid.spec.McpError;
import io.mcpdroid.spec.McpSchema;
import io.mcpdroid.spec.McpServerTransportProvider;
import io.mcpdroid.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * 服务器的异步实现。持有工具注册表、请求调度器、传输提供者和资源生命周期管理器，
 * 工具可以在运行时通过 {@link #addTool} 和 {@link #removeTool} 增减。
 *
 * <p>
 * 关闭顺序：先关闭传输（不再接受新请求），再执行 {@link ResourceLifecycleManager#cleanup()}。
 *
 * @see McpServer
 * @see McpSyncServer
 */
public class McpAsyncServer {

	private static final Logger logger = LoggerFactory.getLogger(McpAsyncServer.class);

	private final McpServerTransportProvider transportProvider;

	private final McpToolRegistry registry;

	private final McpRequestDispatcher dispatcher;

	private final ResourceLifecycleManager lifecycleManager;

	McpAsyncServer(McpServerTransportProvider transportProvider, ObjectMapper objectMapper,
			McpServerFeatures.Async features, Duration requestTimeout, ResourceLifecycleManager lifecycleManager) {
		this.transportProvider = transportProvider;
		this.lifecycleManager = lifecycleManager;
		this.registry = new McpToolRegistry();
		for (McpServerFeatures.AsyncToolSpecification tool : features.tools()) {
			this.registry.register(tool);
		}
		this.dispatcher = new McpRequestDispatcher(objectMapper, this.registry, requestTimeout);
		this.transportProvider.setRequestDispatcher(this.dispatcher);
		logger.info("Server started with {} tool(s)", features.tools().size());
	}

	/**
	 * 在运行时添加工具，同名工具会被覆盖。
	 * @param toolSpecification 工具规范
	 * @return 添加完成后完成的Mono
	 */
	public Mono<Void> addTool(McpServerFeatures.AsyncToolSpecification toolSpecification) {
		if (toolSpecification == null) {
			return Mono.error(new McpError("Tool specification must not be null"));
		}
		return Mono.fromRunnable(() -> this.registry.register(toolSpecification));
	}

	/**
	 * 在运行时移除工具。
	 * @param toolName 不带命名空间的工具名
	 * @return 移除完成后完成的Mono；工具不存在时以 {@link McpError} 结束
	 */
	public Mono<Void> removeTool(String toolName) {
		if (toolName == null) {
			return Mono.error(new McpError("Tool name must not be null"));
		}
		return Mono.defer(() -> {
			if (this.registry.unregister(toolName)) {
				logger.debug("Removed tool handler: {}", toolName);
				return Mono.empty();
			}
			return Mono.error(McpError.toolNotFound(toolName));
		});
	}

	/**
	 * 按名称调用工具，等价于 {@code tools/call}。
	 */
	public Mono<McpSchema.CallToolResult> callTool(String toolName, Map<String, Object> params) {
		if (toolName == null) {
			return Mono.error(new McpError("Tool name must not be null"));
		}
		return this.registry.call(toolName, params);
	}

	public List<McpSchema.Tool> listTools() {
		return this.registry.list();
	}

	public McpRequestDispatcher getDispatcher() {
		return this.dispatcher;
	}

	public ResourceLifecycleManager getLifecycleManager() {
		return this.lifecycleManager;
	}

	/**
	 * 优雅地关闭服务器。
	 * @return 关闭完成后完成的Mono
	 */
	public Mono<Void> closeGracefully() {
		return this.transportProvider.closeGracefully().then(Mono.<Void>fromRunnable(this.lifecycleManager::cleanup));
	}

	/**
	 * 立即关闭服务器。
	 */
	public void close() {
		this.transportProvider.close();
		this.lifecycleManager.cleanup();
	}

	static McpAsyncServer create(McpServerTransportProvider transportProvider, ObjectMapper objectMapper,
			McpServerFeatures.Async features, Duration requestTimeout, ResourceLifecycleManager lifecycleManager) {
		Assert.notNull(transportProvider, "Transport provider must not be null");
		Assert.notNull(objectMapper, "ObjectMapper must not be null");
		Assert.notNull(lifecycleManager, "Lifecycle manager must not be null");
		return new McpAsyncServer(transportProvider, objectMapper, features, requestTimeout, lifecycleManager);
	}

}
