/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.device;

/**
 * 设备传输层无法完成调用时抛出，例如可执行文件无法启动或命令超时。
 */
public class DeviceBridgeException extends RuntimeException {

	public DeviceBridgeException(String message) {
		super(message);
	}

	public DeviceBridgeException(String message, Throwable cause) {
		super(message, cause);
	}

}
