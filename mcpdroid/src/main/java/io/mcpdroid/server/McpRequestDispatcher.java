/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.server;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.NullNode;
import io.mcpdroid.spec.McpError;
import io.mcpdroid.spec.McpSchema;
import io.mcpdroid.spec.McpSchema.JSONRPCRequest;
import io.mcpdroid.spec.McpSchema.JSONRPCResponse;
import io.mcpdroid.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * JSON-RPC请求调度器：解析请求体、校验信封、路由到工具注册表并生成唯一的响应。
 *
 * <p>
 * 错误映射：
 * <ul>
 * <li>空请求体或无效JSON：{@code -32700}，id为 {@code null}
 * <li>批量请求（JSON数组）或不合法的信封：{@code -32600}
 * <li>未知方法：{@code -32601}
 * <li>处理程序抛出的 {@link McpError}：原样返回其错误码和消息
 * <li>其它任何异常：{@code -32603}，消息固定为 {@code Internal error}，详细信息只记录在服务端日志中
 * </ul>
 *
 * <p>
 * 调度器不持有全局锁，多个请求可以并发处理。
 */
public class McpRequestDispatcher {

	private static final Logger logger = LoggerFactory.getLogger(McpRequestDispatcher.class);

	private static final TypeReference<Map<String, Object>> PARAMS_TYPE = new TypeReference<>() {
	};

	static final String INTERNAL_ERROR_MESSAGE = "Internal error";

	private final ObjectMapper objectMapper;

	private final ObjectReader reader;

	private final McpToolRegistry registry;

	private final Duration requestTimeout;

	/**
	 * @param objectMapper 用于解析请求的ObjectMapper
	 * @param registry 工具注册表
	 * @param requestTimeout 单个请求的最长处理时间，为 {@code null} 时不限制
	 */
	public McpRequestDispatcher(ObjectMapper objectMapper, McpToolRegistry registry, Duration requestTimeout) {
		Assert.notNull(objectMapper, "ObjectMapper must not be null");
		Assert.notNull(registry, "Tool registry must not be null");
		this.objectMapper = objectMapper;
		this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
		this.registry = registry;
		this.requestTimeout = requestTimeout;
	}

	public Mono<JSONRPCResponse> dispatch(String body) {
		return dispatch((body != null) ? body.getBytes(StandardCharsets.UTF_8) : null);
	}

	/**
	 * 处理一个请求体。返回的Mono总是发出恰好一个响应，永远不会以错误结束。
	 * @param body 原始请求体字节，必须是UTF-8编码；非法的UTF-8序列按解析错误处理
	 * @return JSON-RPC响应
	 */
	public Mono<JSONRPCResponse> dispatch(byte[] body) {
		return Mono.defer(() -> {
			JSONRPCRequest request;
			try {
				request = parse(body);
			}
			catch (RejectedRequestException e) {
				logger.debug("Rejected request: {}", e.getMessage());
				return Mono.just(JSONRPCResponse.failure(e.id, e.code, e.getMessage()));
			}
			logger.debug("Received request: {}", request);
			return handle(request);
		});
	}

	private Mono<JSONRPCResponse> handle(JSONRPCRequest request) {
		Function<Map<String, Object>, Mono<Object>> handler = this.registry.route(request.method());
		if (handler == null) {
			McpError error = McpError.methodNotFound(request.method());
			return Mono.just(JSONRPCResponse.failure(request.id(), error.getCode(), error.getMessage()));
		}

		Mono<Object> invocation = Mono.defer(() -> handler.apply(request.params()));
		if (this.requestTimeout != null) {
			invocation = invocation.timeout(this.requestTimeout);
		}
		return invocation.map(result -> JSONRPCResponse.success(request.id(), result))
			.defaultIfEmpty(JSONRPCResponse.success(request.id(), NullNode.getInstance()))
			.onErrorResume(error -> Mono.just(toErrorResponse(request, error)));
	}

	private JSONRPCResponse toErrorResponse(JSONRPCRequest request, Throwable error) {
		if (error instanceof McpError mcpError) {
			logger.warn("Request {} [{}] failed: {}", request.id(), request.method(), mcpError.getMessage());
			return new JSONRPCResponse(McpSchema.JSONRPC_VERSION, request.id(), null, mcpError.getJsonRpcError());
		}
		if (error instanceof TimeoutException) {
			logger.warn("Request {} [{}] timed out after {}", request.id(), request.method(), this.requestTimeout);
			return JSONRPCResponse.failure(request.id(), McpSchema.ErrorCodes.INTERNAL_ERROR,
					"Request timed out after " + this.requestTimeout.toMillis() + "ms");
		}
		logger.error("Request {} [{}] failed with an unexpected error", request.id(), request.method(), error);
		return JSONRPCResponse.failure(request.id(), McpSchema.ErrorCodes.INTERNAL_ERROR, INTERNAL_ERROR_MESSAGE);
	}

	JSONRPCRequest parse(byte[] body) {
		if (body == null || body.length == 0) {
			throw new RejectedRequestException(null, McpSchema.ErrorCodes.PARSE_ERROR, "Parse error: empty body");
		}

		JsonNode root;
		try {
			root = this.reader.readTree(body);
		}
		catch (IOException e) {
			throw new RejectedRequestException(null, McpSchema.ErrorCodes.PARSE_ERROR, "Parse error: " + describe(e));
		}
		if (root == null || root.isMissingNode()) {
			throw new RejectedRequestException(null, McpSchema.ErrorCodes.PARSE_ERROR, "Parse error: empty body");
		}
		if (root.isArray()) {
			throw new RejectedRequestException(null, McpSchema.ErrorCodes.INVALID_REQUEST,
					"Invalid Request: batch requests are not supported");
		}
		if (!root.isObject()) {
			throw new RejectedRequestException(null, McpSchema.ErrorCodes.INVALID_REQUEST,
					"Invalid Request: expected a JSON object");
		}

		JsonNode idNode = root.get("id");
		Object id;
		if (idNode == null || idNode.isNull()) {
			id = null;
		}
		else if (idNode.isTextual()) {
			id = idNode.textValue();
		}
		else if (idNode.isNumber()) {
			id = idNode.numberValue();
		}
		else {
			throw new RejectedRequestException(null, McpSchema.ErrorCodes.INVALID_REQUEST,
					"Invalid Request: id must be a string, number or null");
		}

		// "version" 是 "jsonrpc" 的别名
		JsonNode versionNode = root.has("jsonrpc") ? root.get("jsonrpc") : root.get("version");
		if (versionNode == null || !versionNode.isTextual()
				|| !McpSchema.JSONRPC_VERSION.equals(versionNode.textValue())) {
			throw new RejectedRequestException(id, McpSchema.ErrorCodes.INVALID_REQUEST,
					"Invalid Request: jsonrpc must be \"" + McpSchema.JSONRPC_VERSION + "\"");
		}

		JsonNode methodNode = root.get("method");
		if (methodNode == null || !methodNode.isTextual() || methodNode.textValue().isBlank()) {
			throw new RejectedRequestException(id, McpSchema.ErrorCodes.INVALID_REQUEST,
					"Invalid Request: method must be a non-empty string");
		}

		JsonNode paramsNode = root.get("params");
		Map<String, Object> params;
		if (paramsNode == null || paramsNode.isNull()) {
			params = Map.of();
		}
		else if (paramsNode.isObject()) {
			params = this.objectMapper.convertValue(paramsNode, PARAMS_TYPE);
		}
		else {
			throw new RejectedRequestException(id, McpSchema.ErrorCodes.INVALID_REQUEST,
					"Invalid Request: params must be an object");
		}

		return new JSONRPCRequest(McpSchema.JSONRPC_VERSION, methodNode.textValue(), id, params);
	}

	private static String describe(IOException e) {
		if (e instanceof JsonProcessingException jsonError) {
			return jsonError.getOriginalMessage();
		}
		return e.getMessage();
	}

	/**
	 * 在调用任何处理程序之前就被拒绝的请求。
	 */
	static final class RejectedRequestException extends RuntimeException {

		private final Object id;

		private final int code;

		RejectedRequestException(Object id, int code, String message) {
			super(message);
			this.id = id;
			this.code = code;
		}

		Object id() {
			return this.id;
		}

		int code() {
			return this.code;
		}

	}

}
