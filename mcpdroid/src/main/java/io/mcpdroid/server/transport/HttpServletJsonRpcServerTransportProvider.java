/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.server.transport;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpdroid.server.McpRequestDispatcher;
import io.mcpdroid.spec.McpSchema;
import io.mcpdroid.spec.McpServerTransportProvider;
import io.mcpdroid.util.Assert;
import jakarta.servlet.ServletException;
import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * 基于Servlet的JSON-RPC over HTTP传输实现。
 *
 * <p>
 * 只处理一个端点（默认为 {@code /jsonrpc}）上的POST请求：
 * <ul>
 * <li>请求体原样交给 {@link McpRequestDispatcher}，无论结果成功还是JSON-RPC错误，HTTP状态码都是200</li>
 * <li>其它路径返回404</li>
 * <li>关闭过程中的请求返回503</li>
 * </ul>
 *
 * @see McpServerTransportProvider
 * @see HttpServlet
 */
@WebServlet(asyncSupported = true)
public class HttpServletJsonRpcServerTransportProvider extends HttpServlet implements McpServerTransportProvider {

	/** 该类的日志记录器 */
	private static final Logger logger = LoggerFactory.getLogger(HttpServletJsonRpcServerTransportProvider.class);

	public static final String UTF_8 = "UTF-8";

	public static final String APPLICATION_JSON = "application/json";

	/** JSON-RPC请求的默认端点路径 */
	public static final String DEFAULT_ENDPOINT = "/jsonrpc";

	/** 用于序列化响应的JSON对象映射器 */
	private final ObjectMapper objectMapper;

	/** 处理JSON-RPC请求的端点路径 */
	private final String endpoint;

	/** 指示传输是否正在关闭的标志 */
	private final AtomicBoolean isClosing = new AtomicBoolean(false);

	private volatile McpRequestDispatcher dispatcher;

	/**
	 * 创建新的传输实例。
	 * @param objectMapper 用于响应序列化的JSON对象映射器
	 * @param endpoint 客户端发送请求的端点路径
	 */
	public HttpServletJsonRpcServerTransportProvider(ObjectMapper objectMapper, String endpoint) {
		Assert.notNull(objectMapper, "ObjectMapper must not be null");
		Assert.hasText(endpoint, "Endpoint must not be empty");
		this.objectMapper = objectMapper;
		this.endpoint = endpoint;
	}

	@Override
	public void setRequestDispatcher(McpRequestDispatcher dispatcher) {
		this.dispatcher = dispatcher;
	}

	public String getEndpoint() {
		return this.endpoint;
	}

	/**
	 * 处理JSON-RPC请求。
	 * @param request HTTP servlet请求
	 * @param response HTTP servlet响应
	 * @throws ServletException 如果发生servlet特定错误
	 * @throws IOException 如果发生I/O错误
	 */
	@Override
	protected void doPost(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {

		if (isClosing.get()) {
			response.sendError(HttpServletResponse.SC_SERVICE_UNAVAILABLE, "Server is shutting down");
			return;
		}

		String requestURI = request.getRequestURI();
		if (!requestURI.endsWith(endpoint)) {
			response.sendError(HttpServletResponse.SC_NOT_FOUND);
			return;
		}

		McpRequestDispatcher currentDispatcher = this.dispatcher;
		if (currentDispatcher == null) {
			response.sendError(HttpServletResponse.SC_SERVICE_UNAVAILABLE, "Server is not ready");
			return;
		}

		byte[] body = request.getInputStream().readAllBytes();

		McpSchema.JSONRPCResponse jsonRpcResponse;
		try {
			// 为Servlet兼容性而阻塞
			jsonRpcResponse = currentDispatcher.dispatch(body).block();
		}
		catch (Exception e) {
			logger.error("Error processing request", e);
			jsonRpcResponse = McpSchema.JSONRPCResponse.failure(null, McpSchema.ErrorCodes.INTERNAL_ERROR,
					"Internal error");
		}

		response.setContentType(APPLICATION_JSON);
		response.setCharacterEncoding(UTF_8);
		response.setStatus(HttpServletResponse.SC_OK);
		PrintWriter writer = response.getWriter();
		writer.write(serialize(jsonRpcResponse));
		writer.flush();
	}

	/**
	 * 序列化响应。结果无法序列化时改为返回同一id的内部错误响应。
	 */
	private String serialize(McpSchema.JSONRPCResponse jsonRpcResponse) throws IOException {
		try {
			return objectMapper.writeValueAsString(jsonRpcResponse);
		}
		catch (JsonProcessingException e) {
			logger.error("Failed to serialize response for request {}", jsonRpcResponse.id(), e);
			return objectMapper.writeValueAsString(McpSchema.JSONRPCResponse.failure(jsonRpcResponse.id(),
					McpSchema.ErrorCodes.INTERNAL_ERROR, "Internal error"));
		}
	}

	/**
	 * 标记传输为关闭状态，之后的请求都会得到503。
	 * @return 立即完成的Mono
	 */
	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			if (isClosing.compareAndSet(false, true)) {
				logger.debug("JSON-RPC transport on {} is closing", endpoint);
			}
		});
	}

	/**
	 * 在servlet被销毁时关闭传输。
	 */
	@Override
	public void destroy() {
		closeGracefully().block();
		super.destroy();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * HttpServletJsonRpcServerTransportProvider的构建器。
	 */
	public static class Builder {

		private ObjectMapper objectMapper = new ObjectMapper();

		private String endpoint = DEFAULT_ENDPOINT;

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "ObjectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		/**
		 * 设置处理请求的端点路径，默认为 {@link #DEFAULT_ENDPOINT}。
		 * @param endpoint 端点路径
		 * @return 构建器实例
		 */
		public Builder endpoint(String endpoint) {
			Assert.hasText(endpoint, "Endpoint must not be empty");
			this.endpoint = endpoint;
			return this;
		}

		public HttpServletJsonRpcServerTransportProvider build() {
			return new HttpServletJsonRpcServerTransportProvider(objectMapper, endpoint);
		}

	}

}
