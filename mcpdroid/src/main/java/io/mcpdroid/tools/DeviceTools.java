/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.tools;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.mcpdroid.device.CommandOutput;
import io.mcpdroid.device.DeviceBridge;
import io.mcpdroid.device.DeviceBridgeException;
import io.mcpdroid.device.DeviceInfo;
import io.mcpdroid.server.McpServerFeatures;
import io.mcpdroid.server.ParamType;
import io.mcpdroid.server.ToolDefinition;
import io.mcpdroid.spec.McpError;
import io.mcpdroid.util.Assert;

/**
 * 直接访问设备的基础工具。
 */
public class DeviceTools {

	static final ToolDefinition LIST_DEVICES = ToolDefinition.builder("list_devices")
		.documentation("""
				列出已连接的设备

				Returns:
				    设备列表 [{serial, status}]
				""")
		.build();

	static final ToolDefinition EXECUTE_SHELL = ToolDefinition.builder("execute_shell")
		.documentation("""
				在设备上执行shell命令

				Args:
				    command: 要执行的shell命令
				    device_id: 设备ID，默认为本服务器的设备
				    timeout: 命令超时时间(秒)
				""")
		.param("command", ParamType.STRING)
		.optionalParam("device_id", ParamType.STRING)
		.optionalParam("timeout", ParamType.INTEGER, 30)
		.build();

	private final DeviceBridge deviceBridge;

	public DeviceTools(DeviceBridge deviceBridge) {
		Assert.notNull(deviceBridge, "Device bridge must not be null");
		this.deviceBridge = deviceBridge;
	}

	public List<McpServerFeatures.SyncToolSpecification> specifications() {
		return List.of(new McpServerFeatures.SyncToolSpecification(LIST_DEVICES, this::listDevices),
				new McpServerFeatures.SyncToolSpecification(EXECUTE_SHELL, this::executeShell));
	}

	Map<String, Object> listDevices(Map<String, Object> args) {
		List<DeviceInfo> devices;
		try {
			devices = this.deviceBridge.listDevices();
		}
		catch (DeviceBridgeException e) {
			throw new McpError(e.getMessage());
		}
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("success", true);
		result.put("devices", devices);
		return result;
	}

	Map<String, Object> executeShell(Map<String, Object> args) {
		String command = ToolArguments.string(args, "command");
		if (Assert.isBlank(command)) {
			Map<String, Object> result = new LinkedHashMap<>();
			result.put("success", false);
			result.put("message", "未指定要执行的命令");
			return result;
		}

		CommandOutput output;
		try {
			output = this.deviceBridge.execute(ToolArguments.string(args, "device_id"), command,
					ToolArguments.seconds(args, "timeout", 30));
		}
		catch (DeviceBridgeException e) {
			throw new McpError(e.getMessage());
		}

		Map<String, Object> result = new LinkedHashMap<>();
		result.put("success", output.isSuccess());
		result.put("output", output.stdout());
		result.put("error", output.stderr());
		result.put("exit_code", output.exitCode());
		return result;
	}

}
