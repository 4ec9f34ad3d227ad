/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.coordination;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 设备邮箱中的一条消息。
 *
 * @param timestamp 发送时间，Unix纪元毫秒
 * @param sender 发送方设备ID
 * @param content 消息内容
 */
public record MailboxMessage( // @formatter:off
	@JsonProperty("timestamp") long timestamp,
	@JsonProperty("sender") String sender,
	@JsonProperty("content") String content) { // @formatter:on
}
