/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.tools;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpdroid.coordination.CoordinationResult;
import io.mcpdroid.spec.McpError;
import io.mcpdroid.spec.McpSchema;

/**
 * 工具参数的类型转换，以及把 {@link CoordinationResult} 转换为工具返回的JSON映射。
 */
final class ToolArguments {

	private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {
	};

	/** 时长参数的上限：一天 */
	static final long MAX_SECONDS = Duration.ofDays(1).toSeconds();

	private ToolArguments() {
	}

	static String string(Map<String, Object> args, String key) {
		Object value = args.get(key);
		if (value == null) {
			return null;
		}
		return (value instanceof String text) ? text : String.valueOf(value);
	}

	/**
	 * 读取以秒为单位的时长参数，接受整数或小数，精确到毫秒。负数按0处理，过大的值截断为 {@link #MAX_SECONDS}。
	 */
	static Duration seconds(Map<String, Object> args, String key, int defaultSeconds) {
		Object value = args.get(key);
		if (value == null) {
			return Duration.ofSeconds(Math.max(defaultSeconds, 0));
		}
		double seconds;
		if (value instanceof Number number) {
			seconds = number.doubleValue();
		}
		else {
			try {
				seconds = Double.parseDouble(String.valueOf(value).strip());
			}
			catch (NumberFormatException e) {
				throw new McpError(McpSchema.ErrorCodes.INVALID_PARAMS, "Parameter " + key + " must be a number");
			}
		}
		if (Double.isNaN(seconds)) {
			throw new McpError(McpSchema.ErrorCodes.INVALID_PARAMS, "Parameter " + key + " must be a number");
		}
		double clamped = Math.min(Math.max(seconds, 0), MAX_SECONDS);
		return Duration.ofMillis(Math.round(clamped * 1000));
	}

	/**
	 * 读取字符串列表参数。参数可以是JSON数组、JSON数组形式的字符串或单个字符串。
	 */
	static List<String> stringList(Map<String, Object> args, String key, ObjectMapper objectMapper) {
		Object value = args.get(key);
		if (value == null) {
			return List.of();
		}
		if (value instanceof List<?> list) {
			return toStrings(list);
		}
		String text = String.valueOf(value).strip();
		if (text.isEmpty()) {
			return List.of();
		}
		if (text.startsWith("[")) {
			try {
				return toStrings(objectMapper.readValue(text, LIST_TYPE));
			}
			catch (JsonProcessingException e) {
				throw new McpError(McpSchema.ErrorCodes.INVALID_PARAMS,
						"Parameter " + key + " must be an array of strings");
			}
		}
		return List.of(text);
	}

	private static List<String> toStrings(List<?> values) {
		List<String> result = new ArrayList<>();
		for (Object element : values) {
			if (element != null) {
				result.add(String.valueOf(element));
			}
		}
		return result;
	}

	/**
	 * 转换为 {@code {success, message, <payloadKey>}}。失败时附带 {@code failure} 类型，不带负载。
	 */
	static Map<String, Object> toResult(CoordinationResult<?> result, String payloadKey) {
		Map<String, Object> map = new LinkedHashMap<>();
		map.put("success", result.success());
		if (result.message() != null) {
			map.put("message", result.message());
		}
		if (!result.success()) {
			map.put("failure", result.failure().name());
		}
		else if (payloadKey != null && result.value() != null) {
			map.put(payloadKey, result.value());
		}
		return map;
	}

	static Map<String, Object> unsupportedAction(String action) {
		Map<String, Object> map = new LinkedHashMap<>();
		map.put("success", false);
		map.put("message", "不支持的操作类型: " + action);
		map.put("failure", CoordinationResult.FailureKind.INVALID_ARGUMENT.name());
		return map;
	}

}
