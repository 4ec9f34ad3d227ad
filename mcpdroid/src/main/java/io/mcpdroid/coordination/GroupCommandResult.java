/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.coordination;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 设备组中单个设备的命令执行结果。
 *
 * @param deviceId 设备ID
 * @param success 退出码为0时为 {@code true}
 * @param output 标准输出
 * @param error 标准错误或异常信息
 */
public record GroupCommandResult( // @formatter:off
	@JsonProperty("device_id") String deviceId,
	@JsonProperty("success") boolean success,
	@JsonProperty("output") String output,
	@JsonProperty("error") String error) { // @formatter:on
}
