/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.server;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpdroid.server.lifecycle.ResourceLifecycleManager;
import io.mcpdroid.spec.McpServerTransportProvider;
import io.mcpdroid.util.Assert;
import reactor.core.publisher.Mono;

/**
 * 用于创建服务器的工厂接口。服务器通过JSON-RPC向调用方暴露工具。
 *
 * <p>
 * 该接口提供工厂方法来创建以下两种服务器：
 * <ul>
 * <li>{@link McpAsyncServer} 处理函数返回 {@link Mono}
 * <li>{@link McpSyncServer} 处理函数直接返回结果，并在工作线程上执行
 * </ul>
 *
 * <p>
 * 创建同步服务器的示例：<pre>{@code
 * McpServer.sync(transportProvider)
 *     .requestTimeout(Duration.ofSeconds(60))
 *     .tool(ToolDefinition.builder("list_devices").documentation("列出已连接的设备").build(),
 *           args -> bridge.listDevices())
 *     .controller(coordinator)
 *     .build();
 * }</pre>
 *
 * <p>
 * 错误处理：处理函数抛出 {@link io.mcpdroid.spec.McpError} 时，调用方会收到对应的错误码和消息；
 * 其它异常统一转换为内部错误。
 */
public interface McpServer {

	/**
	 * 开始构建同步服务器。
	 * @param transportProvider 传输层实现
	 * @return 同步服务器构建器
	 */
	static SyncSpecification sync(McpServerTransportProvider transportProvider) {
		return new SyncSpecification(transportProvider);
	}

	/**
	 * 开始构建异步服务器。
	 * @param transportProvider 传输层实现
	 * @return 异步服务器构建器
	 */
	static AsyncSpecification async(McpServerTransportProvider transportProvider) {
		return new AsyncSpecification(transportProvider);
	}

	/**
	 * 异步服务器构建器。
	 */
	class AsyncSpecification {

		private final McpServerTransportProvider transportProvider;

		private ObjectMapper objectMapper;

		private Duration requestTimeout;

		private ResourceLifecycleManager lifecycleManager;

		private final List<McpServerFeatures.AsyncToolSpecification> tools = new ArrayList<>();

		private final List<Object> controllers = new ArrayList<>();

		private AsyncSpecification(McpServerTransportProvider transportProvider) {
			Assert.notNull(transportProvider, "Transport provider must not be null");
			this.transportProvider = transportProvider;
		}

		/**
		 * 设置单个请求的最长处理时间，超时的请求以内部错误结束。默认不限制。
		 * @param requestTimeout 超时时间，不能为null
		 * @return 构建器实例
		 */
		public AsyncSpecification requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "Request timeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public AsyncSpecification objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "ObjectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		/**
		 * 使用指定的生命周期管理器，默认创建一个新的实例。
		 */
		public AsyncSpecification lifecycleManager(ResourceLifecycleManager lifecycleManager) {
			Assert.notNull(lifecycleManager, "Lifecycle manager must not be null");
			this.lifecycleManager = lifecycleManager;
			return this;
		}

		/**
		 * 注册需要在服务器关闭时释放的控制器。
		 */
		public AsyncSpecification controller(Object controller) {
			Assert.notNull(controller, "Controller must not be null");
			this.controllers.add(controller);
			return this;
		}

		public AsyncSpecification tool(ToolDefinition definition,
				Function<Map<String, Object>, Mono<Object>> handler) {
			this.tools.add(new McpServerFeatures.AsyncToolSpecification(definition, handler));
			return this;
		}

		public AsyncSpecification tools(List<McpServerFeatures.AsyncToolSpecification> toolSpecifications) {
			Assert.notNull(toolSpecifications, "Tool handlers list must not be null");
			this.tools.addAll(toolSpecifications);
			return this;
		}

		public AsyncSpecification tools(McpServerFeatures.AsyncToolSpecification... toolSpecifications) {
			Assert.notNull(toolSpecifications, "Tool handlers list must not be null");
			return tools(Arrays.asList(toolSpecifications));
		}

		public McpAsyncServer build() {
			ObjectMapper mapper = (this.objectMapper != null) ? this.objectMapper : new ObjectMapper();
			ResourceLifecycleManager manager = (this.lifecycleManager != null) ? this.lifecycleManager
					: new ResourceLifecycleManager();
			this.controllers.forEach(manager::registerController);
			return McpAsyncServer.create(this.transportProvider, mapper, new McpServerFeatures.Async(this.tools),
					this.requestTimeout, manager);
		}

	}

	/**
	 * 同步服务器构建器。
	 */
	class SyncSpecification {

		private final AsyncSpecification delegate;

		private final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

		private SyncSpecification(McpServerTransportProvider transportProvider) {
			this.delegate = new AsyncSpecification(transportProvider);
		}

		public SyncSpecification requestTimeout(Duration requestTimeout) {
			this.delegate.requestTimeout(requestTimeout);
			return this;
		}

		public SyncSpecification objectMapper(ObjectMapper objectMapper) {
			this.delegate.objectMapper(objectMapper);
			return this;
		}

		public SyncSpecification lifecycleManager(ResourceLifecycleManager lifecycleManager) {
			this.delegate.lifecycleManager(lifecycleManager);
			return this;
		}

		public SyncSpecification controller(Object controller) {
			this.delegate.controller(controller);
			return this;
		}

		public SyncSpecification tool(ToolDefinition definition, Function<Map<String, Object>, Object> handler) {
			this.tools.add(new McpServerFeatures.SyncToolSpecification(definition, handler));
			return this;
		}

		public SyncSpecification tools(List<McpServerFeatures.SyncToolSpecification> toolSpecifications) {
			Assert.notNull(toolSpecifications, "Tool handlers list must not be null");
			this.tools.addAll(toolSpecifications);
			return this;
		}

		public SyncSpecification tools(McpServerFeatures.SyncToolSpecification... toolSpecifications) {
			Assert.notNull(toolSpecifications, "Tool handlers list must not be null");
			return tools(Arrays.asList(toolSpecifications));
		}

		public McpSyncServer build() {
			McpServerFeatures.Async asyncFeatures = McpServerFeatures.Async
				.fromSync(new McpServerFeatures.Sync(this.tools));
			this.delegate.tools(asyncFeatures.tools());
			return new McpSyncServer(this.delegate.build());
		}

	}

}
