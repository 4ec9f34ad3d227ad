/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.util;

import java.util.Collection;

import reactor.util.annotation.Nullable;

/**
 * 构建器、注册入口和记录类型使用的参数检查。检查失败时抛出 {@link IllegalArgumentException}，
 * 异常消息由调用方给出。
 *
 * <p>
 * 工具参数的检查不走这里：工具调用方传入的非法参数以 {@code INVALID_ARGUMENT} 结果返回，
 * 而不是异常。{@link #isBlank(String)} 供这类检查复用。
 */
public final class Assert {

	private Assert() {
	}

	public static void notNull(@Nullable Object object, String message) {
		if (object == null) {
			fail(message);
		}
	}

	/**
	 * 要求字符串至少包含一个非空白字符，例如工具名、设备序列号和端点路径。
	 */
	public static void hasText(@Nullable String text, String message) {
		if (isBlank(text)) {
			fail(message);
		}
	}

	/**
	 * 要求集合至少有一个元素，例如设备组的成员列表。
	 */
	public static void notEmpty(@Nullable Collection<?> collection, String message) {
		if (collection == null || collection.isEmpty()) {
			fail(message);
		}
	}

	public static void isTrue(boolean condition, String message) {
		if (!condition) {
			fail(message);
		}
	}

	/**
	 * @return {@code null}、空串或只包含空白字符时为 {@code true}
	 */
	public static boolean isBlank(@Nullable String text) {
		return text == null || text.isBlank();
	}

	private static void fail(String message) {
		throw new IllegalArgumentException(message);
	}

}
