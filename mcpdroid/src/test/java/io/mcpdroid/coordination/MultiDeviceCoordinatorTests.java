/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.coordination;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import io.mcpdroid.device.DeviceBridge;
import io.mcpdroid.device.DeviceInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@Timeout(15)
class MultiDeviceCoordinatorTests {

	@Test
	void cleanupReleasesWaitersAndDropsMessages() {
		DeviceBridge bridge = mock(DeviceBridge.class);
		when(bridge.isConnected("d1")).thenReturn(true);
		when(bridge.listDevices()).thenReturn(List.of(new DeviceInfo("d1", "device")));
		MultiDeviceCoordinator coordinator = new MultiDeviceCoordinator(bridge, "d1");

		coordinator.signals().create("done");
		coordinator.mailboxes().send("d1", null, "pending");
		CompletableFuture<CoordinationResult<Boolean>> waiter = CompletableFuture
			.supplyAsync(() -> coordinator.signals().await("done", Duration.ofSeconds(30)));

		await().atMost(Duration.ofSeconds(5)).until(() -> {
			coordinator.cleanup();
			return waiter.isDone();
		});

		assertThat(waiter.join().success()).isTrue();
		assertThat(coordinator.mailboxes().receive("d1", Duration.ZERO).value()).isEmpty();
		assertThat(coordinator.localDeviceId()).isEqualTo("d1");
	}

}
