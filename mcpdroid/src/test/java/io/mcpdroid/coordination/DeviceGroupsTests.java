/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.coordination;

import java.time.Duration;
import java.util.List;

import io.mcpdroid.coordination.CoordinationResult.FailureKind;
import io.mcpdroid.device.CommandOutput;
import io.mcpdroid.device.DeviceBridge;
import io.mcpdroid.device.DeviceBridgeException;
import io.mcpdroid.device.DeviceInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DeviceGroupsTests {

	private static final Duration TIMEOUT = Duration.ofSeconds(30);

	private DeviceBridge bridge;

	private DeviceGroups groups;

	@BeforeEach
	void setUp() {
		this.bridge = mock(DeviceBridge.class);
		when(this.bridge.listDevices())
			.thenReturn(List.of(new DeviceInfo("d1", "device"), new DeviceInfo("d2", "device")));
		this.groups = new DeviceGroups(this.bridge);
	}

	@Test
	void createAndList() {
		CoordinationResult<DeviceGroup> created = this.groups.create("phones", List.of("d1", "d2"));

		assertThat(created.success()).isTrue();
		assertThat(created.value().deviceIds()).containsExactly("d1", "d2");
		assertThat(this.groups.list().value()).containsExactly(new DeviceGroup("phones", List.of("d1", "d2")));
		assertThat(this.groups.list().message()).isEqualTo("共 1 个设备组");
	}

	@Test
	void emptyListHasDedicatedMessage() {
		assertThat(this.groups.list().message()).isEqualTo("无设备组");
		assertThat(this.groups.list().value()).isEmpty();
	}

	@Test
	void createWithDisconnectedDeviceWritesNothing() {
		CoordinationResult<DeviceGroup> result = this.groups.create("phones", List.of("d1", "ghost"));

		assertThat(result.failure()).isEqualTo(FailureKind.DEVICE_NOT_CONNECTED);
		assertThat(result.message()).contains("ghost");
		assertThat(this.groups.list().value()).isEmpty();
	}

	@Test
	void createValidatesArguments() {
		assertThat(this.groups.create("", List.of("d1")).failure()).isEqualTo(FailureKind.INVALID_ARGUMENT);
		assertThat(this.groups.create("g", List.of()).failure()).isEqualTo(FailureKind.INVALID_ARGUMENT);
	}

	@Test
	void createReplacesGroupWithSameName() {
		this.groups.create("g", List.of("d1", "d2"));
		this.groups.create("g", List.of("d2"));

		assertThat(this.groups.list().value()).singleElement()
			.extracting(DeviceGroup::deviceIds)
			.isEqualTo(List.of("d2"));
	}

	@Test
	void executeContinuesPastFailingDevice() {
		when(this.bridge.execute(eq("d1"), eq("getprop"), any())).thenReturn(new CommandOutput("ok", "", 0));
		when(this.bridge.execute(eq("d2"), eq("getprop"), any()))
			.thenThrow(new DeviceBridgeException("device offline"));
		this.groups.create("phones", List.of("d1", "d2"));

		CoordinationResult<List<GroupCommandResult>> result = this.groups.execute("phones", "getprop", TIMEOUT);

		assertThat(result.success()).isTrue();
		assertThat(result.value()).containsExactly(new GroupCommandResult("d1", true, "ok", ""),
				new GroupCommandResult("d2", false, "", "device offline"));
	}

	@Test
	void nonZeroExitIsReportedAsFailure() {
		when(this.bridge.execute(eq("d1"), any(), any())).thenReturn(new CommandOutput("", "not found", 127));
		this.groups.create("g", List.of("d1"));

		assertThat(this.groups.execute("g", "nope", TIMEOUT).value()).singleElement().satisfies(entry -> {
			assertThat(entry.success()).isFalse();
			assertThat(entry.error()).isEqualTo("not found");
		});
	}

	@Test
	void executeOnUnknownGroupIsNotFound() {
		assertThat(this.groups.execute("missing", "ls", TIMEOUT).failure()).isEqualTo(FailureKind.NOT_FOUND);
	}

	@Test
	void deleteRemovesGroup() {
		this.groups.create("g", List.of("d1"));

		assertThat(this.groups.delete("g").success()).isTrue();
		assertThat(this.groups.delete("g").failure()).isEqualTo(FailureKind.NOT_FOUND);
		assertThat(this.groups.list().value()).isEmpty();
	}

}
