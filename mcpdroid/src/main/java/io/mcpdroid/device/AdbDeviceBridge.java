/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.device;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import io.mcpdroid.server.lifecycle.Cleanable;
import io.mcpdroid.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 通过 {@code adb} 可执行文件访问设备的 {@link DeviceBridge} 实现。
 *
 * <p>
 * 每次调用启动一个 {@code adb} 子进程，标准输出和标准错误在后台线程中读取。
 * 超时的进程会被强制结束。{@link #cleanup()} 结束所有仍在运行的子进程。
 */
public class AdbDeviceBridge implements DeviceBridge, Cleanable {

	private static final Logger logger = LoggerFactory.getLogger(AdbDeviceBridge.class);

	private static final Duration LIST_DEVICES_TIMEOUT = Duration.ofSeconds(10);

	private static final String DEVICES_HEADER = "List of devices";

	private final String adbPath;

	private final String defaultDeviceId;

	private final Set<Process> runningProcesses = ConcurrentHashMap.newKeySet();

	private final ExecutorService outputReaders = Executors.newCachedThreadPool(runnable -> {
		Thread thread = new Thread(runnable, "adb-output-reader");
		thread.setDaemon(true);
		return thread;
	});

	/**
	 * @param adbPath {@code adb} 可执行文件路径
	 * @param defaultDeviceId 未指定设备时使用的设备序列号，可以为 {@code null}
	 */
	public AdbDeviceBridge(String adbPath, String defaultDeviceId) {
		Assert.hasText(adbPath, "ADB path must not be empty");
		this.adbPath = adbPath;
		this.defaultDeviceId = defaultDeviceId;
	}

	@Override
	public List<DeviceInfo> listDevices() {
		CommandOutput output = run(List.of(this.adbPath, "devices"), LIST_DEVICES_TIMEOUT);
		if (!output.isSuccess()) {
			logger.error("Failed to list devices: {}", output.stderr().strip());
			return List.of();
		}
		return parseDevices(output.stdout());
	}

	@Override
	public CommandOutput execute(String deviceId, String command, Duration timeout) {
		Assert.hasText(command, "Command must not be empty");
		Assert.notNull(timeout, "Timeout must not be null");
		List<String> commandLine = new ArrayList<>();
		commandLine.add(this.adbPath);
		String target = (deviceId != null) ? deviceId : this.defaultDeviceId;
		if (target != null) {
			commandLine.add("-s");
			commandLine.add(target);
		}
		commandLine.add("shell");
		commandLine.add(command);
		return run(commandLine, timeout);
	}

	/**
	 * 解析 {@code adb devices} 的输出，跳过标题行和守护进程的提示行。
	 */
	static List<DeviceInfo> parseDevices(String stdout) {
		List<DeviceInfo> devices = new ArrayList<>();
		for (String rawLine : stdout.strip().split("\\R")) {
			String line = rawLine.strip();
			if (line.isEmpty() || line.startsWith("*") || line.startsWith(DEVICES_HEADER)) {
				continue;
			}
			String[] parts = line.split("\\s+");
			if (parts.length >= 2) {
				devices.add(new DeviceInfo(parts[0], parts[1]));
			}
		}
		return devices;
	}

	private CommandOutput run(List<String> commandLine, Duration timeout) {
		logger.debug("Executing: {}", commandLine);
		Process process;
		try {
			process = new ProcessBuilder(commandLine).start();
		}
		catch (IOException e) {
			throw new DeviceBridgeException("Failed to start " + commandLine.get(0) + ": " + e.getMessage(), e);
		}
		this.runningProcesses.add(process);
		try {
			process.getOutputStream().close();
			CompletableFuture<String> stdout = readAsync(process.getInputStream());
			CompletableFuture<String> stderr = readAsync(process.getErrorStream());
			if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
				process.destroyForcibly();
				throw new DeviceBridgeException("Command timed out after " + timeout.toSeconds() + " seconds");
			}
			return new CommandOutput(stdout.get(timeout.toMillis(), TimeUnit.MILLISECONDS),
					stderr.get(timeout.toMillis(), TimeUnit.MILLISECONDS), process.exitValue());
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			process.destroyForcibly();
			throw new DeviceBridgeException("Interrupted while executing command", e);
		}
		catch (IOException | ExecutionException | TimeoutException e) {
			process.destroyForcibly();
			throw new DeviceBridgeException("Failed to read command output: " + e.getMessage(), e);
		}
		finally {
			this.runningProcesses.remove(process);
		}
	}

	private CompletableFuture<String> readAsync(InputStream stream) {
		return CompletableFuture.supplyAsync(() -> {
			try (stream) {
				return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
			}
			catch (IOException e) {
				throw new DeviceBridgeException("Failed to read process output", e);
			}
		}, this.outputReaders);
	}

	/**
	 * 结束所有仍在运行的 {@code adb} 子进程并停止输出读取线程。
	 */
	@Override
	public void cleanup() {
		for (Process process : this.runningProcesses) {
			logger.debug("Destroying running adb process {}", process.pid());
			process.destroyForcibly();
		}
		this.runningProcesses.clear();
		this.outputReaders.shutdownNow();
	}

}
