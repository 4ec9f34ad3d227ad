/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.server;

import java.util.Map;

import io.mcpdroid.spec.McpError;
import io.mcpdroid.spec.McpSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class McpToolRegistryTests {

	private McpToolRegistry registry;

	@BeforeEach
	void setUp() {
		registry = new McpToolRegistry();
	}

	private static McpServerFeatures.AsyncToolSpecification echo(String name) {
		return new McpServerFeatures.AsyncToolSpecification(ToolDefinition.builder(name)
			.documentation("回显参数")
			.param("text")
			.optionalParam("repeat", ParamType.INTEGER, 1)
			.build(), args -> Mono.just(args));
	}

	@Test
	void listNeverIncludesMetaTools() {
		assertThat(registry.list()).isEmpty();

		registry.register(echo("echo"));

		assertThat(registry.list()).extracting(McpSchema.Tool::name).containsExactly("echo");
	}

	@Test
	void listPreservesRegistrationOrder() {
		registry.register(echo("b"));
		registry.register(echo("a"));
		registry.register(echo("c"));

		assertThat(registry.list()).extracting(McpSchema.Tool::name).containsExactly("b", "a", "c");
	}

	@Test
	void reservedNamesCannotBeRegistered() {
		assertThatThrownBy(() -> registry.register(echo("list"))).isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("reserved");
		assertThatThrownBy(() -> registry.register(echo("call"))).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void lastRegistrationWins() {
		registry.register(echo("tool"));
		registry.register(new McpServerFeatures.AsyncToolSpecification(
				ToolDefinition.builder("tool").documentation("second").build(), args -> Mono.just("second")));

		assertThat(registry.list()).singleElement().extracting(McpSchema.Tool::description).isEqualTo("second");
		StepVerifier.create(registry.call("tool", Map.of()))
			.assertNext(result -> assertThat(result.result()).isEqualTo("second"))
			.verifyComplete();
	}

	@Test
	void callAppliesDeclaredDefaults() {
		registry.register(echo("echo"));

		StepVerifier.create(registry.call("echo", Map.of("text", "hi")))
			.assertNext(result -> assertThat(result.result()).isEqualTo(Map.of("text", "hi", "repeat", 1)))
			.verifyComplete();
	}

	@Test
	void callOfUnknownToolFailsWithMethodNotFound() {
		StepVerifier.create(registry.call("missing", Map.of())).expectErrorSatisfies(error -> {
			assertThat(error).isInstanceOf(McpError.class).hasMessage("Tool not found: missing");
			assertThat(((McpError) error).getCode()).isEqualTo(McpSchema.ErrorCodes.METHOD_NOT_FOUND);
		}).verify();
	}

	@Test
	void emptyHandlerResultIsWrappedAsNull() {
		registry.register(new McpServerFeatures.AsyncToolSpecification(ToolDefinition.builder("nothing").build(),
				args -> Mono.empty()));

		StepVerifier.create(registry.call("nothing", Map.of()))
			.assertNext(result -> assertThat(result.result()).isNull())
			.verifyComplete();
	}

	@Test
	void unregisterRemovesTool() {
		registry.register(echo("echo"));

		assertThat(registry.unregister("echo")).isTrue();
		assertThat(registry.unregister("echo")).isFalse();
		assertThat(registry.unregister("list")).isFalse();
		assertThat(registry.contains("echo")).isFalse();
		assertThat(registry.route("tools/list")).isNotNull();
	}

	@Test
	void routeResolvesNamespacedMethods() {
		registry.register(echo("echo"));

		assertThat(registry.route("tools/echo")).isNotNull();
		assertThat(registry.route("echo")).isNull();
		assertThat(registry.route("tools/unknown")).isNull();
	}

	@Test
	void builtInCallDispatchesByName() {
		registry.register(echo("echo"));

		StepVerifier
			.create(registry.route("tools/call").apply(Map.of("name", "echo", "parameters", Map.of("text", "x"))))
			.assertNext(result -> assertThat(result).isInstanceOf(McpSchema.CallToolResult.class)
				.extracting("result")
				.isEqualTo(Map.of("text", "x", "repeat", 1)))
			.verifyComplete();
	}

	@Test
	void builtInCallWithoutNameIsMethodNotFound() {
		StepVerifier.create(registry.route("tools/call").apply(Map.of()))
			.expectErrorSatisfies(error -> {
				assertThat(((McpError) error).getCode()).isEqualTo(McpSchema.ErrorCodes.METHOD_NOT_FOUND);
				assertThat(error).hasMessage("Missing tool name");
			})
			.verify();
	}

	@Test
	void builtInListReturnsToolDescriptors() {
		registry.register(echo("echo"));

		StepVerifier.create(registry.route("tools/list").apply(Map.of()))
			.assertNext(result -> assertThat(((McpSchema.ListToolsResult) result).tools())
				.extracting(McpSchema.Tool::name)
				.containsExactly("echo"))
			.verifyComplete();
	}

}
