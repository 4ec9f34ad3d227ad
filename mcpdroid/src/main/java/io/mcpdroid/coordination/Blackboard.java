/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.coordination;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.mcpdroid.coordination.CoordinationResult.FailureKind;
import io.mcpdroid.util.Assert;

/**
 * 设备间共享的键值数据。后写入者生效，读取方只能轮询，没有变更通知。
 */
public class Blackboard {

	private final Object lock = new Object();

	private final Map<String, Object> entries = new LinkedHashMap<>();

	public CoordinationResult<Void> share(String key, Object value) {
		if (Assert.isBlank(key)) {
			return CoordinationResult.fail(FailureKind.INVALID_ARGUMENT, "未指定数据键");
		}
		if (value == null) {
			return CoordinationResult.fail(FailureKind.INVALID_ARGUMENT, "未指定数据值");
		}
		synchronized (this.lock) {
			this.entries.put(key, value);
		}
		return CoordinationResult.ok("数据已共享，键: " + key);
	}

	public CoordinationResult<Object> get(String key) {
		if (Assert.isBlank(key)) {
			return CoordinationResult.fail(FailureKind.INVALID_ARGUMENT, "未指定数据键");
		}
		synchronized (this.lock) {
			if (!this.entries.containsKey(key)) {
				return CoordinationResult.fail(FailureKind.NOT_FOUND, "共享数据中不存在键: " + key);
			}
			return CoordinationResult.ok("已获取数据，键: " + key, this.entries.get(key));
		}
	}

	/**
	 * 按首次写入顺序返回所有键。
	 */
	public CoordinationResult<List<String>> keys() {
		synchronized (this.lock) {
			return CoordinationResult.ok("共 " + this.entries.size() + " 个键", new ArrayList<>(this.entries.keySet()));
		}
	}

}
