/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpdroid.coordination.MultiDeviceCoordinator;
import io.mcpdroid.device.AdbDeviceBridge;
import io.mcpdroid.server.McpServer;
import io.mcpdroid.server.McpServerFeatures;
import io.mcpdroid.server.McpSyncServer;
import io.mcpdroid.server.lifecycle.Cleanable;
import io.mcpdroid.server.lifecycle.ResourceLifecycleManager;
import io.mcpdroid.server.transport.HttpServletJsonRpcServerTransportProvider;
import io.mcpdroid.tools.DeviceTools;
import io.mcpdroid.tools.MultiDeviceTools;
import jakarta.servlet.Servlet;
import org.apache.catalina.Context;
import org.apache.catalina.LifecycleException;
import org.apache.catalina.Wrapper;
import org.apache.catalina.connector.Connector;
import org.apache.catalina.startup.Tomcat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * 服务器启动入口：解析命令行，组装设备桥接、协调器和工具，并在内嵌Tomcat上提供JSON-RPC端点。
 */
@Command(name = "mcpdroid", mixinStandardHelpOptions = true, version = "mcpdroid 0.1.0",
		description = "JSON-RPC tool server for coordinating Android devices")
public class McpDroidServerApplication implements Callable<Integer> {

	private static final Logger logger = LoggerFactory.getLogger(McpDroidServerApplication.class);

	@Option(names = { "--adb-path" }, defaultValue = "adb", description = "ADB命令路径")
	String adbPath;

	@Option(names = { "--device-id" }, description = "设备ID，如果有多个设备连接时需要指定")
	String deviceId;

	@Option(names = { "--host" }, defaultValue = "0.0.0.0", description = "服务器监听地址")
	String host;

	@Option(names = { "--port" }, defaultValue = "8000", description = "服务器监听端口")
	int port;

	@Option(names = { "--endpoint" }, defaultValue = HttpServletJsonRpcServerTransportProvider.DEFAULT_ENDPOINT,
			description = "JSON-RPC端点路径")
	String endpoint;

	@Option(names = { "--request-timeout" }, defaultValue = "300",
			description = "单个请求的最长处理时间(秒)，0表示不限制")
	long requestTimeoutSeconds;

	@Option(names = { "--debug" }, defaultValue = "false", description = "启用调试日志")
	boolean debug;

	public static void main(String[] args) {
		int exitCode = new CommandLine(new McpDroidServerApplication()).execute(args);
		System.exit(exitCode);
	}

	@Override
	public Integer call() throws Exception {
		if (this.debug) {
			enableDebugLogging();
		}

		ObjectMapper objectMapper = new ObjectMapper();
		ResourceLifecycleManager lifecycleManager = new ResourceLifecycleManager();
		AdbDeviceBridge deviceBridge = new AdbDeviceBridge(this.adbPath, this.deviceId);
		MultiDeviceCoordinator coordinator = new MultiDeviceCoordinator(deviceBridge, this.deviceId);

		HttpServletJsonRpcServerTransportProvider transportProvider = HttpServletJsonRpcServerTransportProvider
			.builder()
			.objectMapper(objectMapper)
			.endpoint(this.endpoint)
			.build();

		List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();
		tools.addAll(new DeviceTools(deviceBridge).specifications());
		tools.addAll(new MultiDeviceTools(coordinator, objectMapper).specifications());

		McpServer.SyncSpecification specification = McpServer.sync(transportProvider)
			.objectMapper(objectMapper)
			.lifecycleManager(lifecycleManager)
			.controller((Cleanable) transportProvider::close)
			.controller(coordinator)
			.controller(deviceBridge)
			.tools(tools);
		if (this.requestTimeoutSeconds > 0) {
			specification.requestTimeout(Duration.ofSeconds(this.requestTimeoutSeconds));
		}
		McpSyncServer server = specification.build();

		Tomcat tomcat = createTomcat(this.host, this.port, transportProvider);
		lifecycleManager.registerController((AutoCloseable) () -> stopTomcat(tomcat));
		lifecycleManager.installShutdownHook();

		tomcat.start();
		logger.info("MCPDroid server listening on http://{}:{}{} with {} tool(s)", this.host, this.port,
				this.endpoint, server.listTools().size());
		tomcat.getServer().await();
		return 0;
	}

	/**
	 * 创建内嵌Tomcat，把传输servlet映射到根路径，由servlet自己检查端点路径。
	 */
	static Tomcat createTomcat(String host, int port, Servlet servlet) {
		Tomcat tomcat = new Tomcat();
		tomcat.setHostname(host);
		tomcat.setPort(port);

		String baseDir = System.getProperty("java.io.tmpdir");
		tomcat.setBaseDir(baseDir);

		Context context = tomcat.addContext("", baseDir);

		Wrapper wrapper = context.createWrapper();
		wrapper.setName("jsonRpcServlet");
		wrapper.setServlet(servlet);
		wrapper.setLoadOnStartup(1);
		wrapper.setAsyncSupported(true);
		context.addChild(wrapper);
		context.addServletMappingDecoded("/*", "jsonRpcServlet");

		Connector connector = tomcat.getConnector();
		connector.setProperty("address", host);
		return tomcat;
	}

	private static void stopTomcat(Tomcat tomcat) throws LifecycleException {
		tomcat.stop();
		tomcat.destroy();
	}

	private static void enableDebugLogging() {
		if (LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME) instanceof ch.qos.logback.classic.Logger root) {
			root.setLevel(Level.DEBUG);
		}
	}

}
