/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.coordination;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import io.mcpdroid.coordination.CoordinationResult.FailureKind;
import io.mcpdroid.device.DeviceBridge;
import io.mcpdroid.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 每个设备一个先进先出的邮箱。
 *
 * <p>
 * 锁只保护邮箱映射本身；等待消息在锁外进行，设备列表查询也在锁外进行。
 */
public class DeviceMailboxes {

	private static final Logger logger = LoggerFactory.getLogger(DeviceMailboxes.class);

	static final String UNKNOWN_SENDER = "unknown";

	private final Object lock = new Object();

	private final Map<String, BlockingQueue<MailboxMessage>> mailboxes = new HashMap<>();

	private final DeviceBridge deviceBridge;

	private final String localDeviceId;

	/**
	 * @param deviceBridge 用于检查目标设备是否已连接
	 * @param localDeviceId 本服务器配置的设备ID，作为默认发送方，可以为 {@code null}
	 */
	public DeviceMailboxes(DeviceBridge deviceBridge, String localDeviceId) {
		Assert.notNull(deviceBridge, "Device bridge must not be null");
		this.deviceBridge = deviceBridge;
		this.localDeviceId = localDeviceId;
	}

	/**
	 * 向设备的邮箱投递一条消息。目标设备必须在当前已连接的设备列表中。
	 * @param deviceId 目标设备ID
	 * @param sender 发送方，为空时使用本服务器的设备ID，两者都没有时为 {@code unknown}
	 * @param content 消息内容
	 * @return 操作结果
	 */
	public CoordinationResult<Void> send(String deviceId, String sender, String content) {
		if (Assert.isBlank(deviceId)) {
			return CoordinationResult.fail(FailureKind.INVALID_ARGUMENT, "未指定目标设备ID");
		}
		if (Assert.isBlank(content)) {
			return CoordinationResult.fail(FailureKind.INVALID_ARGUMENT, "消息内容不能为空");
		}
		if (!this.deviceBridge.isConnected(deviceId)) {
			return CoordinationResult.fail(FailureKind.DEVICE_NOT_CONNECTED, "设备 " + deviceId + " 不存在或未连接");
		}

		MailboxMessage message = new MailboxMessage(System.currentTimeMillis(), resolveSender(sender), content);
		mailbox(deviceId).add(message);
		logger.debug("Message from {} queued for {}", message.sender(), deviceId);
		return CoordinationResult.ok("消息已发送");
	}

	/**
	 * 取出设备邮箱中的消息。
	 *
	 * <p>
	 * 设备还没有邮箱时创建一个并立即返回空列表。否则取出所有已排队的消息；队列为空时最多等待到
	 * {@code now + timeout} 这一个截止时间，收到第一条消息后把此刻排队的消息一并取出并返回。
	 * @param deviceId 设备ID
	 * @param timeout 等待第一条消息的最长时间
	 * @return 按投递顺序排列的消息，超时时为空列表
	 */
	public CoordinationResult<List<MailboxMessage>> receive(String deviceId, Duration timeout) {
		if (Assert.isBlank(deviceId)) {
			return CoordinationResult.fail(FailureKind.INVALID_ARGUMENT, "未指定来源设备ID");
		}

		BlockingQueue<MailboxMessage> queue;
		synchronized (this.lock) {
			queue = this.mailboxes.get(deviceId);
			if (queue == null) {
				this.mailboxes.put(deviceId, new LinkedBlockingQueue<>());
				return CoordinationResult.ok("无消息", List.of());
			}
		}

		List<MailboxMessage> messages = new ArrayList<>();
		queue.drainTo(messages);
		if (messages.isEmpty() && timeout != null && !timeout.isNegative() && !timeout.isZero()) {
			try {
				MailboxMessage first = queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
				if (first != null) {
					messages.add(first);
					queue.drainTo(messages);
				}
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.debug("Interrupted while waiting for messages for {}", deviceId);
			}
		}
		return CoordinationResult.ok("收到 " + messages.size() + " 条消息", messages);
	}

	/**
	 * 清空设备邮箱。设备没有邮箱时同样视为成功。
	 * @param deviceId 设备ID
	 * @return 操作结果
	 */
	public CoordinationResult<Void> clear(String deviceId) {
		if (Assert.isBlank(deviceId)) {
			return CoordinationResult.fail(FailureKind.INVALID_ARGUMENT, "未指定设备ID");
		}
		BlockingQueue<MailboxMessage> queue;
		synchronized (this.lock) {
			queue = this.mailboxes.get(deviceId);
		}
		if (queue == null) {
			return CoordinationResult.ok("无消息队列需要清空");
		}
		queue.clear();
		return CoordinationResult.ok("消息已清空");
	}

	/**
	 * 清空所有设备的邮箱。
	 */
	public void clearAll() {
		synchronized (this.lock) {
			this.mailboxes.values().forEach(BlockingQueue::clear);
		}
	}

	private BlockingQueue<MailboxMessage> mailbox(String deviceId) {
		synchronized (this.lock) {
			return this.mailboxes.computeIfAbsent(deviceId, id -> new LinkedBlockingQueue<>());
		}
	}

	private String resolveSender(String sender) {
		if (!Assert.isBlank(sender)) {
			return sender;
		}
		return (this.localDeviceId != null) ? this.localDeviceId : UNKNOWN_SENDER;
	}

}
