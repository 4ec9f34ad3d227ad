/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.coordination;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import io.mcpdroid.coordination.CoordinationResult.FailureKind;
import io.mcpdroid.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 命名的同步信号。每个信号只有两个状态：未设置和已设置。
 *
 * <p>
 * {@code set} 唤醒所有等待者，信号保持已设置状态直到 {@code release}。{@code await} 和 {@code set}
 * 会自动创建不存在的信号。等待在锁外进行，不会阻塞其它信号的操作。
 */
public class SyncSignals {

	private static final Logger logger = LoggerFactory.getLogger(SyncSignals.class);

	private final Object lock = new Object();

	private final Map<String, Signal> signals = new HashMap<>();

	/**
	 * 创建信号；信号已存在时把它重置为未设置状态，正在等待的调用方继续等待同一个信号。
	 */
	public CoordinationResult<Void> create(String name) {
		if (Assert.isBlank(name)) {
			return CoordinationResult.fail(FailureKind.INVALID_ARGUMENT, "未指定锁名称");
		}
		Signal existing;
		synchronized (this.lock) {
			existing = this.signals.get(name);
			if (existing == null) {
				this.signals.put(name, new Signal());
			}
		}
		if (existing != null) {
			existing.reset();
		}
		return CoordinationResult.ok("已创建锁 " + name);
	}

	/**
	 * 等待信号被设置。
	 * @param name 信号名
	 * @param timeout 最长等待时间
	 * @return 信号在超时前被设置时成功，值为 {@code true}；超时时失败类型为
	 * {@link FailureKind#TIMEOUT}
	 */
	public CoordinationResult<Boolean> await(String name, Duration timeout) {
		if (Assert.isBlank(name)) {
			return CoordinationResult.fail(FailureKind.INVALID_ARGUMENT, "未指定锁名称");
		}
		Signal signal = getOrCreate(name);
		boolean triggered;
		try {
			triggered = signal.await(timeout);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.debug("Interrupted while waiting for signal {}", name);
			triggered = false;
		}
		if (triggered) {
			return CoordinationResult.ok("锁 " + name + " 已触发", Boolean.TRUE);
		}
		return CoordinationResult.fail(FailureKind.TIMEOUT, "等待锁 " + name + " 超时");
	}

	/**
	 * 设置信号并唤醒所有等待者。
	 */
	public CoordinationResult<Void> set(String name) {
		if (Assert.isBlank(name)) {
			return CoordinationResult.fail(FailureKind.INVALID_ARGUMENT, "未指定锁名称");
		}
		getOrCreate(name).set();
		return CoordinationResult.ok("已设置锁 " + name);
	}

	/**
	 * 把信号重置为未设置状态。
	 */
	public CoordinationResult<Void> release(String name) {
		if (Assert.isBlank(name)) {
			return CoordinationResult.fail(FailureKind.INVALID_ARGUMENT, "未指定锁名称");
		}
		Signal signal;
		synchronized (this.lock) {
			signal = this.signals.get(name);
		}
		if (signal == null) {
			return CoordinationResult.fail(FailureKind.NOT_FOUND, "锁 " + name + " 不存在");
		}
		signal.reset();
		return CoordinationResult.ok("已释放锁 " + name);
	}

	public boolean isSet(String name) {
		Signal signal;
		synchronized (this.lock) {
			signal = this.signals.get(name);
		}
		return signal != null && signal.isSet();
	}

	/**
	 * 设置所有信号，唤醒所有等待者。
	 */
	public void setAll() {
		List<Signal> snapshot;
		synchronized (this.lock) {
			snapshot = new ArrayList<>(this.signals.values());
		}
		snapshot.forEach(Signal::set);
	}

	private Signal getOrCreate(String name) {
		synchronized (this.lock) {
			return this.signals.computeIfAbsent(name, key -> new Signal());
		}
	}

	/**
	 * 每次 {@code set} 都会递增代数。等待者记录进入时的代数，代数变化即视为已被触发，
	 * 即使信号在它重新获得监视器之前已被 {@code release}。
	 */
	private static final class Signal {

		private boolean set;

		private long generation;

		synchronized void set() {
			this.set = true;
			this.generation++;
			notifyAll();
		}

		synchronized void reset() {
			this.set = false;
		}

		synchronized boolean isSet() {
			return this.set;
		}

		synchronized boolean await(Duration timeout) throws InterruptedException {
			long entryGeneration = this.generation;
			long remaining = (timeout != null) ? Math.max(timeout.toNanos(), 0) : 0;
			long deadline = System.nanoTime() + remaining;
			while (!this.set && this.generation == entryGeneration) {
				if (remaining <= 0) {
					return false;
				}
				TimeUnit.NANOSECONDS.timedWait(this, remaining);
				remaining = deadline - System.nanoTime();
			}
			return true;
		}

	}

}
