/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.device;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.mcpdroid.util.Assert;

/**
 * {@code adb devices} 输出中的一行。
 *
 * @param serial 设备序列号
 * @param status 设备状态，例如 {@code device}、{@code offline}、{@code unauthorized}
 */
public record DeviceInfo( // @formatter:off
	@JsonProperty("serial") String serial,
	@JsonProperty("status") String status) { // @formatter:on

	public static final String STATUS_ONLINE = "device";

	public DeviceInfo {
		Assert.hasText(serial, "Device serial must not be empty");
	}

	@JsonIgnore
	public boolean isOnline() {
		return STATUS_ONLINE.equals(this.status);
	}

}
