/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.device;

/**
 * 设备命令的执行结果。
 *
 * @param stdout 标准输出
 * @param stderr 标准错误
 * @param exitCode 进程退出码，0表示成功
 */
public record CommandOutput(String stdout, String stderr, int exitCode) {

	public CommandOutput {
		stdout = (stdout != null) ? stdout : "";
		stderr = (stderr != null) ? stderr : "";
	}

	public boolean isSuccess() {
		return this.exitCode == 0;
	}

}
