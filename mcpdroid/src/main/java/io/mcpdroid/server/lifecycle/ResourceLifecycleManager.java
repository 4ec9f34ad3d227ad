/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.server.lifecycle;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import io.mcpdroid.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 管理服务器持有的控制器和后台工作线程，并提供唯一的、幂等的清理入口。
 *
 * <p>
 * 清理可以从三个地方触发：正常退出、SIGTERM/SIGINT（通过 {@link #installShutdownHook()}
 * 安装的JVM关闭钩子）以及服务器的显式关闭。只有第一次调用真正执行清理，之后的调用立即返回。
 *
 * <p>
 * 限制：工作线程只会收到中断信号。忽略中断的线程无法被强制终止，它会一直运行到自己结束。
 */
public class ResourceLifecycleManager {

	private static final Logger logger = LoggerFactory.getLogger(ResourceLifecycleManager.class);

	private final Object lock = new Object();

	private final List<Object> controllers = new ArrayList<>();

	private final List<Thread> workers = new ArrayList<>();

	private final AtomicBoolean cleanedUp = new AtomicBoolean(false);

	private final AtomicBoolean hookInstalled = new AtomicBoolean(false);

	/**
	 * 注册控制器。实现了 {@link Cleanable} 或 {@link AutoCloseable} 的控制器会在清理时被释放，
	 * 其它控制器会被跳过。同一个引用重复注册不会产生效果。
	 * @param controller 控制器
	 */
	public void registerController(Object controller) {
		Assert.notNull(controller, "Controller must not be null");
		synchronized (this.lock) {
			if (!containsIdentity(this.controllers, controller)) {
				this.controllers.add(controller);
			}
		}
	}

	/**
	 * 注册后台工作线程。同一个线程重复注册不会产生效果。
	 * @param worker 工作线程
	 */
	public void registerWorker(Thread worker) {
		Assert.notNull(worker, "Worker must not be null");
		synchronized (this.lock) {
			if (!containsIdentity(this.workers, worker)) {
				this.workers.add(worker);
			}
		}
	}

	public boolean isCleanedUp() {
		return this.cleanedUp.get();
	}

	/**
	 * 中断所有存活的工作线程，然后依次释放每个控制器。单个控制器的失败只记录日志，
	 * 不影响其余控制器。此方法不会抛出异常。
	 */
	public void cleanup() {
		if (!this.cleanedUp.compareAndSet(false, true)) {
			return;
		}

		List<Thread> workerSnapshot;
		List<Object> controllerSnapshot;
		synchronized (this.lock) {
			workerSnapshot = new ArrayList<>(this.workers);
			controllerSnapshot = new ArrayList<>(this.controllers);
		}

		logger.info("Cleaning up {} controller(s) and {} worker(s)", controllerSnapshot.size(),
				workerSnapshot.size());

		for (Thread worker : workerSnapshot) {
			if (worker.isAlive()) {
				logger.debug("Interrupting worker thread: {}", worker.getName());
				worker.interrupt();
			}
		}

		for (Object controller : controllerSnapshot) {
			try {
				if (controller instanceof Cleanable cleanable) {
					cleanable.cleanup();
				}
				else if (controller instanceof AutoCloseable closeable) {
					closeable.close();
				}
				else {
					logger.debug("Controller {} has no cleanup method, skipping", controller.getClass().getName());
				}
			}
			catch (Exception e) {
				logger.error("Failed to clean up controller {}", controller.getClass().getName(), e);
			}
		}
	}

	/**
	 * 安装JVM关闭钩子，在正常退出、SIGTERM和SIGINT时执行 {@link #cleanup()}。重复调用只安装一次。
	 */
	public void installShutdownHook() {
		if (this.hookInstalled.compareAndSet(false, true)) {
			Runtime.getRuntime().addShutdownHook(new Thread(this::cleanup, "mcpdroid-shutdown"));
		}
	}

	private static boolean containsIdentity(List<?> list, Object candidate) {
		for (Object element : list) {
			if (element == candidate) {
				return true;
			}
		}
		return false;
	}

}
