/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.server;

import java.util.List;
import java.util.Map;

import io.mcpdroid.server.lifecycle.ResourceLifecycleManager;
import io.mcpdroid.spec.McpSchema;
import io.mcpdroid.util.Assert;

/**
 * {@link McpAsyncServer} 的阻塞门面，供启动代码和测试使用。
 *
 * <p>
 * 这里的阻塞只发生在调用线程上：通过HTTP到达的请求仍由调度器处理，同步工具处理函数仍在
 * {@code boundedElastic} 工作线程上执行。
 */
public class McpSyncServer {

	private final McpAsyncServer asyncServer;

	public McpSyncServer(McpAsyncServer asyncServer) {
		Assert.notNull(asyncServer, "Async server must not be null");
		this.asyncServer = asyncServer;
	}

	/**
	 * 注册同步工具，同名工具会被替换。
	 * @throws IllegalArgumentException 工具名为保留名称 {@code list} 或 {@code call}
	 */
	public void addTool(McpServerFeatures.SyncToolSpecification tool) {
		this.asyncServer.addTool(McpServerFeatures.AsyncToolSpecification.fromSync(tool)).block();
	}

	/**
	 * @throws io.mcpdroid.spec.McpError 工具不存在
	 */
	public void removeTool(String toolName) {
		this.asyncServer.removeTool(toolName).block();
	}

	/**
	 * 在调用线程上调用工具并等待结果，不经过JSON-RPC编解码。声明的默认参数同样生效。
	 * @param toolName 工具名
	 * @param params 工具参数，可以为 {@code null}
	 * @return 工具返回值的包装
	 * @throws io.mcpdroid.spec.McpError 工具不存在或处理函数抛出类型化错误
	 */
	public McpSchema.CallToolResult callTool(String toolName, Map<String, Object> params) {
		return this.asyncServer.callTool(toolName, params).block();
	}

	public List<McpSchema.Tool> listTools() {
		return this.asyncServer.listTools();
	}

	public ResourceLifecycleManager getLifecycleManager() {
		return this.asyncServer.getLifecycleManager();
	}

	/**
	 * 关闭传输层后执行资源清理，两步都完成后返回。
	 */
	public void closeGracefully() {
		this.asyncServer.closeGracefully().block();
	}

	public void close() {
		this.asyncServer.close();
	}

	public McpAsyncServer getAsyncServer() {
		return this.asyncServer;
	}

}
