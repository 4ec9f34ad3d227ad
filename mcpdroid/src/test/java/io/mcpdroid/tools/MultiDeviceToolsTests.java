/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.tools;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpdroid.coordination.DeviceGroup;
import io.mcpdroid.coordination.MailboxMessage;
import io.mcpdroid.coordination.MultiDeviceCoordinator;
import io.mcpdroid.device.DeviceBridge;
import io.mcpdroid.device.DeviceBridgeException;
import io.mcpdroid.device.DeviceInfo;
import io.mcpdroid.spec.McpError;
import io.mcpdroid.spec.McpSchema;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MultiDeviceToolsTests {

	private DeviceBridge bridge;

	private MultiDeviceTools tools;

	@BeforeEach
	void setUp() {
		this.bridge = mock(DeviceBridge.class);
		when(this.bridge.listDevices())
			.thenReturn(List.of(new DeviceInfo("d1", "device"), new DeviceInfo("d2", "device")));
		when(this.bridge.isConnected("d1")).thenReturn(true);
		when(this.bridge.isConnected("d2")).thenReturn(true);
		this.tools = new MultiDeviceTools(new MultiDeviceCoordinator(this.bridge, "d1"), new ObjectMapper());
	}

	@Test
	void specificationsExposeFourTools() {
		assertThat(this.tools.specifications()).extracting(spec -> spec.definition().name())
			.containsExactly("device_messaging", "sync_operations", "device_group_actions", "share_between_devices");
	}

	@Test
	void sendThenReceiveOnLocalDevice() {
		Map<String, Object> sent = this.tools
			.deviceMessaging(Map.of("action", "send", "device_id", "d1", "message", "hi", "sender", "d2"));
		assertThat(sent).containsEntry("success", true).containsEntry("message", "消息已发送");

		Map<String, Object> received = this.tools.deviceMessaging(Map.of("action", "receive", "timeout", 0));

		assertThat(received).containsEntry("success", true);
		assertThat(received.get("messages")).asInstanceOf(InstanceOfAssertFactories.LIST)
			.singleElement()
			.extracting("content", "sender")
			.containsExactly("hi", "d2");
	}

	@Test
	void sendToDisconnectedDeviceReportsFailure() {
		Map<String, Object> result = this.tools
			.deviceMessaging(Map.of("action", "send", "device_id", "ghost", "message", "hi"));

		assertThat(result).containsEntry("success", false)
			.containsEntry("failure", "DEVICE_NOT_CONNECTED")
			.doesNotContainKey("messages");
	}

	@Test
	void bridgeFailureBecomesApplicationError() {
		when(this.bridge.isConnected(anyString())).thenThrow(new DeviceBridgeException("adb not found"));

		assertThatThrownBy(
				() -> this.tools.deviceMessaging(Map.of("action", "send", "device_id", "d1", "message", "hi")))
			.isInstanceOf(McpError.class)
			.hasMessage("adb not found")
			.extracting("code")
			.isEqualTo(McpSchema.ErrorCodes.APPLICATION_ERROR);
	}

	@Test
	void syncOperationsRoundTrip() {
		assertThat(this.tools.syncOperations(Map.of("action", "create", "lock_name", "l"))).containsEntry("success",
				true);
		assertThat(this.tools.syncOperations(Map.of("action", "set", "lock_name", "l"))).containsEntry("success",
				true);
		assertThat(this.tools.syncOperations(Map.of("action", "wait", "lock_name", "l", "timeout", 1)))
			.containsEntry("success", true);
		assertThat(this.tools.syncOperations(Map.of("action", "release", "lock_name", "l")))
			.containsEntry("success", true);
		assertThat(this.tools.syncOperations(Map.of("action", "wait", "lock_name", "l", "timeout", 0)))
			.containsEntry("success", false)
			.containsEntry("failure", "TIMEOUT");
	}

	@ParameterizedTest
	@ValueSource(strings = { "[\"d1\",\"d2\"]", " [ \"d1\", \"d2\" ] " })
	void deviceIdsAcceptJsonArrayString(String deviceIds) {
		Map<String, Object> result = this.tools
			.deviceGroupActions(Map.of("action", "create", "group_name", "g", "device_ids", deviceIds));

		assertThat(result).containsEntry("success", true)
			.containsEntry("group", new DeviceGroup("g", List.of("d1", "d2")));
	}

	@Test
	void deviceIdsAcceptSingleStringAndList() {
		assertThat(this.tools.deviceGroupActions(Map.of("action", "create", "group_name", "a", "device_ids", "d1")))
			.containsEntry("group", new DeviceGroup("a", List.of("d1")));
		assertThat(this.tools
			.deviceGroupActions(Map.of("action", "create", "group_name", "b", "device_ids", List.of("d2", "d1"))))
			.containsEntry("group", new DeviceGroup("b", List.of("d2", "d1")));

		assertThat(this.tools.deviceGroupActions(Map.of("action", "list")).get("groups")).asInstanceOf(InstanceOfAssertFactories.LIST).hasSize(2);
	}

	@Test
	void malformedDeviceIdsIsInvalidParams() {
		assertThatThrownBy(() -> this.tools
			.deviceGroupActions(Map.of("action", "create", "group_name", "g", "device_ids", "[\"d1\"")))
			.isInstanceOf(McpError.class)
			.extracting("code")
			.isEqualTo(McpSchema.ErrorCodes.INVALID_PARAMS);
	}

	@Test
	void shareAndReadData() {
		this.tools.shareBetweenDevices(Map.of("action", "share_data", "data_key", "k", "data_value", Map.of("a", 1)));

		assertThat(this.tools.shareBetweenDevices(Map.of("action", "get_data", "data_key", "k")))
			.containsEntry("data", Map.of("a", 1));
		assertThat(this.tools.shareBetweenDevices(Map.of("action", "list_keys"))).containsEntry("keys", List.of("k"));
		assertThat(this.tools.shareBetweenDevices(Map.of("action", "get_data", "data_key", "missing")))
			.containsEntry("failure", "NOT_FOUND");
	}

	@Test
	void unsupportedActionIsReportedNotThrown() {
		Map<String, Object> result = this.tools.shareBetweenDevices(Map.of("action", "explode"));

		assertThat(result).containsEntry("success", false)
			.containsEntry("failure", "INVALID_ARGUMENT")
			.containsEntry("message", "不支持的操作类型: explode");
		assertThat(this.tools.syncOperations(Map.of())).containsEntry("success", false);
	}

	@Test
	void clearDefaultsToLocalDevice() {
		this.tools.deviceMessaging(Map.of("action", "send", "device_id", "d1", "message", "x"));

		assertThat(this.tools.deviceMessaging(Map.of("action", "clear"))).containsEntry("success", true);
		assertThat(this.tools.deviceMessaging(Map.of("action", "receive", "timeout", 0)).get("messages")).asInstanceOf(InstanceOfAssertFactories.LIST)
			.isEmpty();
	}

	@Test
	void messagesSerializeWithSnakeCaseKeys() {
		MailboxMessage message = new MailboxMessage(1L, "d2", "hi");

		assertThat(new ObjectMapper().convertValue(message, Map.class)).containsOnlyKeys("timestamp", "sender",
				"content");
	}

}
