/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.server.lifecycle;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@Timeout(10)
class ResourceLifecycleManagerTests {

	private final ResourceLifecycleManager manager = new ResourceLifecycleManager();

	@Test
	void cleanupRunsOnlyOnce() {
		Cleanable controller = mock(Cleanable.class);
		this.manager.registerController(controller);

		this.manager.cleanup();
		this.manager.cleanup();

		verify(controller, times(1)).cleanup();
		assertThat(this.manager.isCleanedUp()).isTrue();
	}

	@Test
	void sameControllerIsRegisteredOnce() {
		Cleanable controller = mock(Cleanable.class);
		this.manager.registerController(controller);
		this.manager.registerController(controller);

		this.manager.cleanup();

		verify(controller, times(1)).cleanup();
	}

	@Test
	void failingControllerDoesNotStopTheOthers() throws Exception {
		Cleanable failing = mock(Cleanable.class);
		doThrow(new IllegalStateException("boom")).when(failing).cleanup();
		AutoCloseable closeable = mock(AutoCloseable.class);
		doThrow(new Exception("close failed")).when(closeable).close();
		Cleanable last = mock(Cleanable.class);

		this.manager.registerController(failing);
		this.manager.registerController(closeable);
		this.manager.registerController(last);

		assertThatCode(this.manager::cleanup).doesNotThrowAnyException();

		verify(failing).cleanup();
		verify(closeable).close();
		verify(last).cleanup();
	}

	@Test
	void controllersAreReleasedInRegistrationOrder() {
		List<String> order = new ArrayList<>();
		this.manager.registerController((Cleanable) () -> order.add("first"));
		this.manager.registerController((AutoCloseable) () -> order.add("second"));
		this.manager.registerController("plain object");
		this.manager.registerController((Cleanable) () -> order.add("third"));

		this.manager.cleanup();

		assertThat(order).containsExactly("first", "second", "third");
	}

	@Test
	void aliveWorkersAreInterrupted() throws InterruptedException {
		CountDownLatch started = new CountDownLatch(1);
		CountDownLatch interrupted = new CountDownLatch(1);
		Thread worker = new Thread(() -> {
			started.countDown();
			try {
				Thread.sleep(TimeUnit.MINUTES.toMillis(1));
			}
			catch (InterruptedException e) {
				interrupted.countDown();
			}
		}, "test-worker");
		worker.setDaemon(true);
		worker.start();
		assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

		this.manager.registerWorker(worker);
		this.manager.cleanup();

		assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
		worker.join(5000);
		assertThat(worker.isAlive()).isFalse();
	}

	@Test
	void finishedWorkersAreSkipped() throws InterruptedException {
		Thread worker = new Thread(() -> {
		});
		worker.start();
		worker.join();
		this.manager.registerWorker(worker);

		assertThatCode(this.manager::cleanup).doesNotThrowAnyException();
	}

}
