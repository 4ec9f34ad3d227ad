/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.server;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import io.mcpdroid.util.Assert;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 服务器可以支持的功能规范。
 */
public class McpServerFeatures {

	/**
	 * 异步服务器功能规范。
	 *
	 * @param tools 工具规范列表
	 */
	record Async(List<McpServerFeatures.AsyncToolSpecification> tools) {

		Async {
			tools = (tools != null) ? List.copyOf(tools) : List.of();
		}

		/**
		 * 将同步规范转换为异步规范，并把阻塞代码卸载到工作线程上执行，防止阻塞传输层。
		 * @param syncSpec 可能包含阻塞调用的同步规范
		 * @return 不会阻塞调用方的异步规范
		 */
		static Async fromSync(Sync syncSpec) {
			List<McpServerFeatures.AsyncToolSpecification> tools = new ArrayList<>();
			for (var tool : syncSpec.tools()) {
				tools.add(AsyncToolSpecification.fromSync(tool));
			}
			return new Async(tools);
		}
	}

	/**
	 * 同步服务器功能规范。
	 *
	 * @param tools 工具规范列表
	 */
	record Sync(List<McpServerFeatures.SyncToolSpecification> tools) {

		Sync {
			tools = (tools != null) ? List.copyOf(tools) : List.of();
		}
	}

	/**
	 * 具有异步处理函数的工具规范。工具是服务器暴露给调用方的可执行操作，
	 * 处理函数接收已经补全默认值的参数映射，返回任意可被JSON序列化的值。
	 *
	 * <p>
	 * 示例：<pre>{@code
	 * new McpServerFeatures.AsyncToolSpecification(
	 *     ToolDefinition.builder("list_devices").documentation("列出已连接的设备").build(),
	 *     args -> Mono.fromCallable(bridge::listDevices)
	 * )
	 * }</pre>
	 *
	 * @param definition 工具的声明式描述，据此生成名称、描述和输入schema
	 * @param call 实现工具逻辑的函数。处理程序可以抛出或发出
	 * {@link io.mcpdroid.spec.McpError} 来返回类型化的错误码
	 */
	public record AsyncToolSpecification(ToolDefinition definition, Function<Map<String, Object>, Mono<Object>> call) {

		public AsyncToolSpecification {
			Assert.notNull(definition, "Tool definition must not be null");
			Assert.notNull(call, "Tool handler must not be null");
		}

		public String name() {
			return this.definition.name();
		}

		static AsyncToolSpecification fromSync(SyncToolSpecification tool) {
			Assert.notNull(tool, "Tool specification must not be null");
			return new AsyncToolSpecification(tool.definition(),
					map -> Mono.fromCallable(() -> tool.call().apply(map)).subscribeOn(Schedulers.boundedElastic()));
		}
	}

	/**
	 * 具有同步处理函数的工具规范。处理函数在 {@code boundedElastic} 调度器上执行，
	 * 可以安全地进行阻塞调用（设备命令、等待信号、轮询邮箱）。
	 *
	 * @param definition 工具的声明式描述
	 * @param call 实现工具逻辑的函数，返回值为 {@code null} 时结果为JSON {@code null}
	 */
	public record SyncToolSpecification(ToolDefinition definition, Function<Map<String, Object>, Object> call) {

		public SyncToolSpecification {
			Assert.notNull(definition, "Tool definition must not be null");
			Assert.notNull(call, "Tool handler must not be null");
		}
	}

}
