/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.device;

import java.time.Duration;
import java.util.List;

/**
 * 访问设备的窄接口。协调器和工具只通过它查询已连接的设备并执行命令，
 * 不关心底层是ADB还是其它传输。
 *
 * <p>
 * 实现可以同时实现 {@link io.mcpdroid.server.lifecycle.Cleanable}，在服务器关闭时释放资源。
 */
public interface DeviceBridge {

	/**
	 * 查询当前已连接的设备。每次调用都重新查询，不做缓存。
	 * @return 设备列表，没有设备时为空列表
	 * @throws DeviceBridgeException 无法访问设备传输层
	 */
	List<DeviceInfo> listDevices();

	/**
	 * 在指定设备上执行shell命令。
	 * @param deviceId 设备序列号，为 {@code null} 时使用默认设备
	 * @param command shell命令
	 * @param timeout 最长执行时间
	 * @return 命令输出和退出码
	 * @throws DeviceBridgeException 命令无法启动、超时或被中断
	 */
	CommandOutput execute(String deviceId, String command, Duration timeout);

	/**
	 * 判断设备当前是否已连接。
	 * @param deviceId 设备序列号
	 * @return 设备出现在 {@link #listDevices()} 的结果中时返回 {@code true}
	 */
	default boolean isConnected(String deviceId) {
		for (DeviceInfo device : listDevices()) {
			if (device.serial().equals(deviceId)) {
				return true;
			}
		}
		return false;
	}

}
