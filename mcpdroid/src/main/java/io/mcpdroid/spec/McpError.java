/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.spec;

import io.mcpdroid.spec.McpSchema.JSONRPCResponse.JSONRPCError;

/**
 * 工具处理程序抛出的类型化应用错误。错误码和消息会原样返回给调用方；
 * 其它任何异常都会被调度器转换为 {@link McpSchema.ErrorCodes#INTERNAL_ERROR}。
 */
public class McpError extends RuntimeException {

	private final JSONRPCError jsonRpcError;

	public McpError(JSONRPCError jsonRpcError) {
		super(jsonRpcError.message());
		this.jsonRpcError = jsonRpcError;
	}

	public McpError(int code, String message) {
		this(new JSONRPCError(code, message, null));
	}

	public McpError(String message) {
		this(McpSchema.ErrorCodes.APPLICATION_ERROR, message);
	}

	public JSONRPCError getJsonRpcError() {
		return this.jsonRpcError;
	}

	public int getCode() {
		return this.jsonRpcError.code();
	}

	public static McpError methodNotFound(String name) {
		return new McpError(McpSchema.ErrorCodes.METHOD_NOT_FOUND, "Method not found: " + name);
	}

	public static McpError toolNotFound(String toolName) {
		return new McpError(McpSchema.ErrorCodes.METHOD_NOT_FOUND, "Tool not found: " + toolName);
	}

}
