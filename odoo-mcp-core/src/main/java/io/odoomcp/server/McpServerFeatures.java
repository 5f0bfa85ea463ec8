/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.server;

import java.time.Duration;
import java.util.Map;

import io.odoomcp.spec.McpSchema;
import io.odoomcp.util.Assert;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Feature specifications the bridge can serve.
 */
public final class McpServerFeatures {

	private McpServerFeatures() {
	}

	/**
	 * Handles one tool invocation. Implementations return a JSON-compatible value (a
	 * {@code Map}, {@code List}, {@code String}, number, boolean or a Jackson-serializable
	 * record), or fail the returned {@link Mono}.
	 */
	@FunctionalInterface
	public interface ToolCallHandler {

		Mono<Object> handle(ToolCallContext context, Map<String, Object> arguments);

	}

	/**
	 * Blocking variant of {@link ToolCallHandler}, adapted onto the bounded elastic
	 * scheduler so that it never runs on a container or heartbeat thread.
	 */
	@FunctionalInterface
	public interface SyncToolCallHandler {

		Object handle(ToolCallContext context, Map<String, Object> arguments) throws Exception;

	}

	/**
	 * Specification of a tool with its asynchronous handler function.
	 *
	 * @param tool The tool definition including name, description, and input schema
	 * @param callHandler The function that implements the tool's logic
	 * @param timeout Upper bound for one call, or {@code null} to use the server default
	 */
	public record AsyncToolSpecification(McpSchema.Tool tool, ToolCallHandler callHandler, Duration timeout) {

		public AsyncToolSpecification {
			Assert.notNull(tool, "Tool must not be null");
			Assert.notNull(callHandler, "Call handler must not be null");
			Assert.isTrue(timeout == null || (!timeout.isNegative() && !timeout.isZero()),
					"Timeout must be positive");
		}

		public AsyncToolSpecification(McpSchema.Tool tool, ToolCallHandler callHandler) {
			this(tool, callHandler, null);
		}

		public String name() {
			return this.tool.name();
		}

		public static Builder builder() {
			return new Builder();
		}

		/**
		 * Builder for {@link AsyncToolSpecification}.
		 */
		public static class Builder {

			private McpSchema.Tool tool;

			private ToolCallHandler callHandler;

			private Duration timeout;

			public Builder tool(McpSchema.Tool tool) {
				this.tool = tool;
				return this;
			}

			public Builder callHandler(ToolCallHandler callHandler) {
				this.callHandler = callHandler;
				return this;
			}

			public Builder syncCallHandler(SyncToolCallHandler handler) {
				Assert.notNull(handler, "Call handler must not be null");
				this.callHandler = (context, arguments) -> Mono.fromCallable(() -> handler.handle(context, arguments))
					.subscribeOn(Schedulers.boundedElastic());
				return this;
			}

			public Builder timeout(Duration timeout) {
				this.timeout = timeout;
				return this;
			}

			public AsyncToolSpecification build() {
				Assert.notNull(tool, "Tool must not be null");
				Assert.notNull(callHandler, "Call handler must not be null");
				return new AsyncToolSpecification(tool, callHandler, timeout);
			}

		}
	}

}
