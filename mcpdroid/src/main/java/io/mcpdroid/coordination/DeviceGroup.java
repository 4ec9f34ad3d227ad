/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.coordination;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.mcpdroid.util.Assert;

/**
 * 命名的设备组。
 *
 * @param name 组名
 * @param deviceIds 按创建时顺序排列的成员设备ID
 */
public record DeviceGroup( // @formatter:off
	@JsonProperty("name") String name,
	@JsonProperty("device_ids") List<String> deviceIds) { // @formatter:on

	public DeviceGroup {
		Assert.hasText(name, "Group name must not be empty");
		Assert.notEmpty(deviceIds, "Group must have at least one device");
		deviceIds = List.copyOf(deviceIds);
	}

}
