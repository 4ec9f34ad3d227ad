/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.tools;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpdroid.coordination.MultiDeviceCoordinator;
import io.mcpdroid.device.DeviceBridgeException;
import io.mcpdroid.server.McpServerFeatures;
import io.mcpdroid.server.ParamType;
import io.mcpdroid.server.ToolDefinition;
import io.mcpdroid.spec.McpError;
import io.mcpdroid.util.Assert;

/**
 * 多设备协作工具：设备间消息、同步信号、设备组和共享数据。
 *
 * <p>
 * 每个工具通过 {@code action} 参数选择具体操作，返回 {@code {success, message, ...}} 形式的映射。
 * 协调操作的失败（例如设备未连接）是正常的返回值，不会转换为JSON-RPC错误。
 */
public class MultiDeviceTools {

	static final Duration GROUP_COMMAND_TIMEOUT = Duration.ofSeconds(30);

	static final ToolDefinition DEVICE_MESSAGING = ToolDefinition.builder("device_messaging")
		.documentation("""
				设备间消息传递

				Args:
				    action: 操作类型，send（发送消息）、receive（接收消息）、clear（清空消息）
				    device_id: 目标设备ID或来源设备ID
				    message: 要发送的消息内容
				    sender: 发送方设备ID，默认为本服务器的设备ID
				    timeout: 接收消息的超时时间(秒)
				""")
		.param("action", ParamType.STRING)
		.optionalParam("device_id", ParamType.STRING)
		.optionalParam("message", ParamType.STRING)
		.optionalParam("sender", ParamType.STRING)
		.optionalParam("timeout", ParamType.INTEGER, 5)
		.build();

	static final ToolDefinition SYNC_OPERATIONS = ToolDefinition.builder("sync_operations")
		.documentation("""
				多设备同步操作

				Args:
				    action: 操作类型，create（创建锁）、wait（等待锁）、set（设置锁）、release（释放锁）
				    lock_name: 锁名称
				    timeout: 等待超时时间(秒)
				""")
		.param("action", ParamType.STRING)
		.param("lock_name", ParamType.STRING)
		.optionalParam("timeout", ParamType.INTEGER, 30)
		.build();

	static final ToolDefinition DEVICE_GROUP_ACTIONS = ToolDefinition.builder("device_group_actions")
		.documentation("""
				设备组操作

				Args:
				    action: 操作类型，create（创建组）、list（列出组）、execute（执行命令）、delete（删除组）
				    group_name: 组名称
				    device_ids: 设备ID列表，在create操作时使用
				    command: 要执行的shell命令，在execute操作时使用
				""")
		.param("action", ParamType.STRING)
		.optionalParam("group_name", ParamType.STRING)
		.optionalParam("device_ids", ParamType.STRING_ARRAY)
		.optionalParam("command", ParamType.STRING)
		.build();

	static final ToolDefinition SHARE_BETWEEN_DEVICES = ToolDefinition.builder("share_between_devices")
		.documentation("""
				设备间数据共享

				Args:
				    action: 操作类型，share_data（共享数据）、get_data（获取数据）、list_keys（列出所有键）
				    data_key: 数据键，在share_data和get_data操作时使用
				    data_value: 数据值，在share_data操作时使用
				""")
		.param("action", ParamType.STRING)
		.optionalParam("data_key", ParamType.STRING)
		.optionalParam("data_value", ParamType.OBJECT)
		.build();

	private final MultiDeviceCoordinator coordinator;

	private final ObjectMapper objectMapper;

	public MultiDeviceTools(MultiDeviceCoordinator coordinator, ObjectMapper objectMapper) {
		Assert.notNull(coordinator, "Coordinator must not be null");
		Assert.notNull(objectMapper, "ObjectMapper must not be null");
		this.coordinator = coordinator;
		this.objectMapper = objectMapper;
	}

	public List<McpServerFeatures.SyncToolSpecification> specifications() {
		return List.of(new McpServerFeatures.SyncToolSpecification(DEVICE_MESSAGING, this::deviceMessaging),
				new McpServerFeatures.SyncToolSpecification(SYNC_OPERATIONS, this::syncOperations),
				new McpServerFeatures.SyncToolSpecification(DEVICE_GROUP_ACTIONS, this::deviceGroupActions),
				new McpServerFeatures.SyncToolSpecification(SHARE_BETWEEN_DEVICES, this::shareBetweenDevices));
	}

	Map<String, Object> deviceMessaging(Map<String, Object> args) {
		String action = ToolArguments.string(args, "action");
		String deviceId = ToolArguments.string(args, "device_id");
		switch (String.valueOf(action)) {
			case "send":
				return bridgeCall(() -> ToolArguments.toResult(this.coordinator.mailboxes()
					.send(deviceId, ToolArguments.string(args, "sender"), ToolArguments.string(args, "message")), null));
			case "receive":
				return ToolArguments.toResult(this.coordinator.mailboxes()
					.receive(orLocalDevice(deviceId), ToolArguments.seconds(args, "timeout", 5)), "messages");
			case "clear":
				return ToolArguments.toResult(this.coordinator.mailboxes().clear(orLocalDevice(deviceId)), null);
			default:
				return ToolArguments.unsupportedAction(action);
		}
	}

	Map<String, Object> syncOperations(Map<String, Object> args) {
		String action = ToolArguments.string(args, "action");
		String lockName = ToolArguments.string(args, "lock_name");
		switch (String.valueOf(action)) {
			case "create":
				return ToolArguments.toResult(this.coordinator.signals().create(lockName), null);
			case "wait":
				return ToolArguments.toResult(
						this.coordinator.signals().await(lockName, ToolArguments.seconds(args, "timeout", 30)), null);
			case "set":
				return ToolArguments.toResult(this.coordinator.signals().set(lockName), null);
			case "release":
				return ToolArguments.toResult(this.coordinator.signals().release(lockName), null);
			default:
				return ToolArguments.unsupportedAction(action);
		}
	}

	Map<String, Object> deviceGroupActions(Map<String, Object> args) {
		String action = ToolArguments.string(args, "action");
		String groupName = ToolArguments.string(args, "group_name");
		switch (String.valueOf(action)) {
			case "create":
				List<String> deviceIds = ToolArguments.stringList(args, "device_ids", this.objectMapper);
				return bridgeCall(
						() -> ToolArguments.toResult(this.coordinator.groups().create(groupName, deviceIds), "group"));
			case "list":
				return ToolArguments.toResult(this.coordinator.groups().list(), "groups");
			case "execute":
				return ToolArguments.toResult(this.coordinator.groups()
					.execute(groupName, ToolArguments.string(args, "command"), GROUP_COMMAND_TIMEOUT), "results");
			case "delete":
				return ToolArguments.toResult(this.coordinator.groups().delete(groupName), null);
			default:
				return ToolArguments.unsupportedAction(action);
		}
	}

	Map<String, Object> shareBetweenDevices(Map<String, Object> args) {
		String action = ToolArguments.string(args, "action");
		String dataKey = ToolArguments.string(args, "data_key");
		switch (String.valueOf(action)) {
			case "share_data":
				return ToolArguments.toResult(this.coordinator.blackboard().share(dataKey, args.get("data_value")),
						null);
			case "get_data":
				return ToolArguments.toResult(this.coordinator.blackboard().get(dataKey), "data");
			case "list_keys":
				return ToolArguments.toResult(this.coordinator.blackboard().keys(), "keys");
			default:
				return ToolArguments.unsupportedAction(action);
		}
	}

	private String orLocalDevice(String deviceId) {
		return !Assert.isBlank(deviceId) ? deviceId : this.coordinator.localDeviceId();
	}

	/**
	 * 设备传输层的失败以应用错误返回给调用方。
	 */
	private static Map<String, Object> bridgeCall(Supplier<Map<String, Object>> call) {
		try {
			return call.get();
		}
		catch (DeviceBridgeException e) {
			throw new McpError(e.getMessage());
		}
	}

}
