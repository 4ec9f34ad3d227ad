/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.client;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpdroid.spec.McpError;
import io.mcpdroid.spec.McpSchema;
import io.mcpdroid.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 使用Java的HttpClient实现的同步JSON-RPC客户端。
 *
 * <p>
 * 每次调用发送一个POST请求并等待响应，请求ID从1开始递增。JSON-RPC错误以 {@link McpError} 抛出。
 *
 * <pre>{@code
 * McpHttpClient client = McpHttpClient.builder("http://localhost:8000").build();
 * List<McpSchema.Tool> tools = client.listTools();
 * Object result = client.callTool("share_between_devices", Map.of("action", "list_keys"));
 * }</pre>
 */
public class McpHttpClient {

	private static final Logger logger = LoggerFactory.getLogger(McpHttpClient.class);

	/** 默认端点路径 */
	public static final String DEFAULT_ENDPOINT = "/jsonrpc";

	private final HttpClient httpClient;

	private final URI endpointUri;

	private final ObjectMapper objectMapper;

	private final Duration requestTimeout;

	private final AtomicLong requestIds = new AtomicLong();

	McpHttpClient(HttpClient httpClient, URI endpointUri, ObjectMapper objectMapper, Duration requestTimeout) {
		this.httpClient = httpClient;
		this.endpointUri = endpointUri;
		this.objectMapper = objectMapper;
		this.requestTimeout = requestTimeout;
	}

	/**
	 * 获取服务器上的工具列表。
	 */
	public List<McpSchema.Tool> listTools() {
		Object result = requestResult(McpSchema.METHOD_TOOLS_LIST, Map.of());
		return this.objectMapper.convertValue(result, McpSchema.ListToolsResult.class).tools();
	}

	/**
	 * 通过 {@code tools/call} 调用工具。
	 * @param name 工具名
	 * @param parameters 工具参数
	 * @return 工具的返回值
	 */
	public Object callTool(String name, Map<String, Object> parameters) {
		Assert.hasText(name, "Tool name must not be empty");
		Map<String, Object> params = new LinkedHashMap<>();
		params.put("name", name);
		params.put("parameters", (parameters != null) ? parameters : Map.of());
		Object result = requestResult(McpSchema.METHOD_TOOLS_CALL, params);
		return this.objectMapper.convertValue(result, McpSchema.CallToolResult.class).result();
	}

	/**
	 * 发送请求并返回结果；响应为错误时抛出 {@link McpError}。
	 */
	public Object requestResult(String method, Map<String, Object> params) {
		McpSchema.JSONRPCResponse response = request(method, params);
		if (response.error() != null) {
			throw new McpError(response.error());
		}
		return response.result();
	}

	/**
	 * 发送请求并返回完整的响应信封。
	 * @param method 方法名
	 * @param params 方法参数
	 * @return 响应信封
	 */
	public McpSchema.JSONRPCResponse request(String method, Map<String, Object> params) {
		McpSchema.JSONRPCRequest request = new McpSchema.JSONRPCRequest(McpSchema.JSONRPC_VERSION, method,
				this.requestIds.incrementAndGet(), params);
		try {
			return send(this.objectMapper.writeValueAsString(request));
		}
		catch (IOException e) {
			throw new McpError("Failed to serialize request: " + e.getMessage());
		}
	}

	/**
	 * 发送原始请求体并解析响应信封。
	 * @param body 原始请求体
	 * @return 响应信封
	 */
	public McpSchema.JSONRPCResponse send(String body) {
		HttpRequest httpRequest = HttpRequest.newBuilder(this.endpointUri)
			.header("Content-Type", "application/json")
			.timeout(this.requestTimeout)
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();
		try {
			HttpResponse<String> response = this.httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
			if (response.statusCode() != 200) {
				logger.error("Unexpected HTTP status {} from {}", response.statusCode(), this.endpointUri);
				throw new McpError("Unexpected HTTP status: " + response.statusCode());
			}
			return this.objectMapper.readValue(response.body(), McpSchema.JSONRPCResponse.class);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new McpError("Interrupted while waiting for response");
		}
		catch (IOException e) {
			throw new McpError("Failed to send request: " + e.getMessage());
		}
	}

	public URI getEndpointUri() {
		return this.endpointUri;
	}

	public static Builder builder(String baseUri) {
		return new Builder(baseUri);
	}

	/**
	 * {@link McpHttpClient}的构建器。
	 */
	public static class Builder {

		private final String baseUri;

		private String endpoint = DEFAULT_ENDPOINT;

		private HttpClient.Builder clientBuilder = HttpClient.newBuilder()
			.version(HttpClient.Version.HTTP_1_1)
			.connectTimeout(Duration.ofSeconds(10));

		private ObjectMapper objectMapper = new ObjectMapper();

		private Duration requestTimeout = Duration.ofSeconds(60);

		Builder(String baseUri) {
			Assert.hasText(baseUri, "baseUri must not be empty");
			this.baseUri = baseUri;
		}

		public Builder endpoint(String endpoint) {
			Assert.hasText(endpoint, "endpoint must not be empty");
			this.endpoint = endpoint;
			return this;
		}

		public Builder clientBuilder(HttpClient.Builder clientBuilder) {
			Assert.notNull(clientBuilder, "clientBuilder must not be null");
			this.clientBuilder = clientBuilder;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "objectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "requestTimeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public McpHttpClient build() {
			URI endpointUri = URI.create(this.baseUri).resolve(this.endpoint);
			return new McpHttpClient(this.clientBuilder.build(), endpointUri, this.objectMapper, this.requestTimeout);
		}

	}

}
