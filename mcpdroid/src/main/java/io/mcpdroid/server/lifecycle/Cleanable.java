/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.server.lifecycle;

/**
 * 持有需要在服务器关闭时释放的资源的控制器。
 */
@FunctionalInterface
public interface Cleanable {

	/**
	 * 释放资源。可能被调用多次，实现应保持幂等。
	 */
	void cleanup();

}
