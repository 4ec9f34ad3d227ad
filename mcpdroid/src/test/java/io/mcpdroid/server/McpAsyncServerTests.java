/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.server;

import java.time.Duration;
import java.util.Map;

import io.mcpdroid.server.lifecycle.ResourceLifecycleManager;
import io.mcpdroid.server.transport.HttpServletJsonRpcServerTransportProvider;
import io.mcpdroid.spec.McpError;
import io.mcpdroid.spec.McpSchema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * {@link McpAsyncServer} 的测试。
 */
@Timeout(15)
class McpAsyncServerTests {

	private static final ToolDefinition PING = ToolDefinition.builder("ping").documentation("连通性检查").build();

	private McpAsyncServer createServer() {
		return McpServer.async(HttpServletJsonRpcServerTransportProvider.builder().build())
			.tool(PING, args -> Mono.just("pong"))
			.build();
	}

	@Test
	void testAddAndRemoveTool() {
		var server = createServer();
		var echo = new McpServerFeatures.AsyncToolSpecification(ToolDefinition.builder("echo").build(),
				args -> Mono.just(args));

		StepVerifier.create(server.addTool(echo)).verifyComplete();
		assertThat(server.listTools()).extracting(McpSchema.Tool::name).containsExactly("ping", "echo");

		StepVerifier.create(server.removeTool("echo")).verifyComplete();
		assertThat(server.listTools()).extracting(McpSchema.Tool::name).containsExactly("ping");

		StepVerifier.create(server.closeGracefully()).verifyComplete();
	}

	@Test
	void testInvalidToolArguments() {
		var server = createServer();

		StepVerifier.create(server.addTool(null)).verifyErrorSatisfies(error -> assertThat(error)
			.isInstanceOf(McpError.class)
			.hasMessage("Tool specification must not be null"));
		StepVerifier.create(server.removeTool("missing"))
			.verifyErrorSatisfies(error -> assertThat(error).isInstanceOf(McpError.class)
				.hasMessage("Tool not found: missing"));

		server.close();
	}

	@Test
	void testDispatchThroughServer() {
		var server = createServer();

		StepVerifier
			.create(server.getDispatcher()
				.dispatch("{\"jsonrpc\":\"2.0\",\"id\":\"p\",\"method\":\"tools/call\",\"params\":{\"name\":\"ping\"}}"))
			.assertNext(response -> {
				assertThat(response.id()).isEqualTo("p");
				assertThat(response.result()).isEqualTo(new McpSchema.CallToolResult("pong"));
			})
			.verifyComplete();

		server.close();
	}

	@Test
	void testCloseGracefullyRunsSharedLifecycleManager() {
		ResourceLifecycleManager lifecycleManager = new ResourceLifecycleManager();
		var server = McpServer.async(HttpServletJsonRpcServerTransportProvider.builder().build())
			.lifecycleManager(lifecycleManager)
			.requestTimeout(Duration.ofSeconds(1))
			.build();

		StepVerifier.create(server.closeGracefully()).verifyComplete();

		assertThat(server.getLifecycleManager()).isSameAs(lifecycleManager);
		assertThat(lifecycleManager.isCleanedUp()).isTrue();
	}

	@Test
	void testToolsFromList() {
		var server = McpServer.async(HttpServletJsonRpcServerTransportProvider.builder().build())
			.tools(new McpServerFeatures.AsyncToolSpecification(PING, args -> Mono.just(Map.of("ok", true))))
			.build();

		assertThat(server.listTools()).singleElement().satisfies(tool -> {
			assertThat(tool.name()).isEqualTo("ping");
			assertThat(tool.description()).isEqualTo("连通性检查");
		});

		server.close();
	}

}
