/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.coordination;

import io.mcpdroid.util.Assert;

/**
 * 协调操作的显式结果。成功时 {@code failure} 为 {@code null}，失败时 {@code value} 为 {@code null}。
 *
 * @param success 操作是否成功
 * @param failure 失败类型，成功时为 {@code null}
 * @param message 可读的结果描述
 * @param value 操作返回的值，可以为 {@code null}
 * @param <T> 返回值类型
 */
public record CoordinationResult<T>(boolean success, FailureKind failure, String message, T value) {

	/**
	 * 失败类型。
	 */
	public enum FailureKind {

		/** 组、信号或数据键不存在 */
		NOT_FOUND,

		/** 目标设备不在当前已连接的设备列表中 */
		DEVICE_NOT_CONNECTED,

		/** 参数缺失或不合法 */
		INVALID_ARGUMENT,

		/** 等待超时 */
		TIMEOUT

	}

	public static <T> CoordinationResult<T> ok(String message, T value) {
		return new CoordinationResult<>(true, null, message, value);
	}

	public static <T> CoordinationResult<T> ok(String message) {
		return new CoordinationResult<>(true, null, message, null);
	}

	public static <T> CoordinationResult<T> fail(FailureKind failure, String message) {
		Assert.notNull(failure, "Failure kind must not be null");
		return new CoordinationResult<>(false, failure, message, null);
	}

}
