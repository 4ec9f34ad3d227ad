/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.coordination;

import io.mcpdroid.device.DeviceBridge;
import io.mcpdroid.server.lifecycle.Cleanable;
import io.mcpdroid.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 多设备协作控制器：设备邮箱、同步信号、设备组和共享数据。
 *
 * <p>
 * 四个部分各自独立加锁，互不阻塞。关闭时 {@link #cleanup()} 设置所有信号以唤醒等待者，并清空所有邮箱。
 */
public class MultiDeviceCoordinator implements Cleanable {

	private static final Logger logger = LoggerFactory.getLogger(MultiDeviceCoordinator.class);

	private final DeviceMailboxes mailboxes;

	private final SyncSignals signals;

	private final DeviceGroups groups;

	private final Blackboard blackboard;

	private final String localDeviceId;

	/**
	 * @param deviceBridge 设备访问接口
	 * @param localDeviceId 本服务器配置的设备ID，可以为 {@code null}
	 */
	public MultiDeviceCoordinator(DeviceBridge deviceBridge, String localDeviceId) {
		Assert.notNull(deviceBridge, "Device bridge must not be null");
		this.localDeviceId = localDeviceId;
		this.mailboxes = new DeviceMailboxes(deviceBridge, localDeviceId);
		this.signals = new SyncSignals();
		this.groups = new DeviceGroups(deviceBridge);
		this.blackboard = new Blackboard();
	}

	public DeviceMailboxes mailboxes() {
		return this.mailboxes;
	}

	public SyncSignals signals() {
		return this.signals;
	}

	public DeviceGroups groups() {
		return this.groups;
	}

	public Blackboard blackboard() {
		return this.blackboard;
	}

	public String localDeviceId() {
		return this.localDeviceId;
	}

	@Override
	public void cleanup() {
		logger.info("Cleaning up multi-device coordinator");
		this.signals.setAll();
		this.mailboxes.clearAll();
	}

}
