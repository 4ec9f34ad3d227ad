/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.coordination;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.mcpdroid.coordination.CoordinationResult.FailureKind;
import io.mcpdroid.device.CommandOutput;
import io.mcpdroid.device.DeviceBridge;
import io.mcpdroid.device.DeviceInfo;
import io.mcpdroid.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 命名的设备组，可以在组内所有设备上依次执行同一条命令。
 *
 * <p>
 * 锁只保护组映射。设备校验和命令执行都在锁外进行：执行前先取成员快照，执行期间对组的修改不影响本次执行。
 */
public class DeviceGroups {

	private static final Logger logger = LoggerFactory.getLogger(DeviceGroups.class);

	private final Object lock = new Object();

	private final Map<String, List<String>> groups = new LinkedHashMap<>();

	private final DeviceBridge deviceBridge;

	public DeviceGroups(DeviceBridge deviceBridge) {
		Assert.notNull(deviceBridge, "Device bridge must not be null");
		this.deviceBridge = deviceBridge;
	}

	/**
	 * 创建设备组，同名的组会被替换。所有设备都必须在当前已连接的设备列表中，否则不写入任何内容。
	 * @param name 组名
	 * @param deviceIds 成员设备ID
	 * @return 操作结果
	 */
	public CoordinationResult<DeviceGroup> create(String name, List<String> deviceIds) {
		if (Assert.isBlank(name)) {
			return CoordinationResult.fail(FailureKind.INVALID_ARGUMENT, "未指定组名称");
		}
		if (deviceIds == null || deviceIds.isEmpty()) {
			return CoordinationResult.fail(FailureKind.INVALID_ARGUMENT, "未指定设备ID列表");
		}

		Set<String> connected = new HashSet<>();
		for (DeviceInfo device : this.deviceBridge.listDevices()) {
			connected.add(device.serial());
		}
		for (String deviceId : deviceIds) {
			if (!connected.contains(deviceId)) {
				return CoordinationResult.fail(FailureKind.DEVICE_NOT_CONNECTED, "设备 " + deviceId + " 不存在或未连接");
			}
		}

		DeviceGroup group = new DeviceGroup(name, deviceIds);
		synchronized (this.lock) {
			this.groups.put(name, group.deviceIds());
		}
		logger.debug("Created device group {} with {} device(s)", name, deviceIds.size());
		return CoordinationResult.ok("已创建设备组 " + name, group);
	}

	/**
	 * 按创建顺序列出所有设备组。
	 */
	public CoordinationResult<List<DeviceGroup>> list() {
		List<DeviceGroup> result = new ArrayList<>();
		synchronized (this.lock) {
			this.groups.forEach((name, ids) -> result.add(new DeviceGroup(name, ids)));
		}
		return CoordinationResult.ok(result.isEmpty() ? "无设备组" : "共 " + result.size() + " 个设备组", result);
	}

	/**
	 * 在组内每个设备上依次执行命令。单个设备失败（非零退出码或异常）会被记录，执行继续。
	 * @param name 组名
	 * @param command shell命令
	 * @param timeout 每个设备上的最长执行时间
	 * @return 按成员顺序排列的执行结果
	 */
	public CoordinationResult<List<GroupCommandResult>> execute(String name, String command, Duration timeout) {
		if (Assert.isBlank(name)) {
			return CoordinationResult.fail(FailureKind.INVALID_ARGUMENT, "未指定组名称");
		}
		if (Assert.isBlank(command)) {
			return CoordinationResult.fail(FailureKind.INVALID_ARGUMENT, "未指定要执行的命令");
		}

		List<String> members;
		synchronized (this.lock) {
			members = this.groups.get(name);
		}
		if (members == null) {
			return CoordinationResult.fail(FailureKind.NOT_FOUND, "设备组 " + name + " 不存在");
		}

		List<GroupCommandResult> results = new ArrayList<>();
		for (String deviceId : members) {
			try {
				CommandOutput output = this.deviceBridge.execute(deviceId, command, timeout);
				results.add(new GroupCommandResult(deviceId, output.isSuccess(), output.stdout(), output.stderr()));
			}
			catch (RuntimeException e) {
				logger.warn("Command failed on device {}: {}", deviceId, e.getMessage());
				results.add(new GroupCommandResult(deviceId, false, "", String.valueOf(e.getMessage())));
			}
		}
		return CoordinationResult.ok("已在 " + results.size() + " 个设备上执行命令", results);
	}

	/**
	 * 删除设备组。
	 */
	public CoordinationResult<Void> delete(String name) {
		if (Assert.isBlank(name)) {
			return CoordinationResult.fail(FailureKind.INVALID_ARGUMENT, "未指定组名称");
		}
		boolean removed;
		synchronized (this.lock) {
			removed = this.groups.remove(name) != null;
		}
		if (!removed) {
			return CoordinationResult.fail(FailureKind.NOT_FOUND, "设备组 " + name + " 不存在");
		}
		return CoordinationResult.ok("已删除设备组 " + name);
	}

}
