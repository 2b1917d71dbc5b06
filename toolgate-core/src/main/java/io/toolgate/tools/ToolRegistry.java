/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.tools;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.toolgate.error.ErrorContext;
import io.toolgate.error.ErrorKind;
import io.toolgate.error.McpErrorHandler;
import io.toolgate.error.RecoveryStrategies;
import io.toolgate.session.UserContext;
import io.toolgate.spec.McpError;
import io.toolgate.spec.McpSchema.ErrorCodes;
import io.toolgate.util.Assert;
import io.toolgate.util.Utils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.annotation.Nullable;

/**
 * In-memory registry of the tools a server exposes.
 * <p>
 * Tools are indexed by name and by category in thread-safe maps. Registration validates
 * the name and shape of a tool; execution checks authorization and arguments before
 * running the handler on {@link Schedulers#boundedElastic()} under a soft deadline.
 * {@link #executeTool} never signals an error: every failure is reported as an
 * unsuccessful {@link ToolResult}.
 */
public class ToolRegistry {

	private static final Logger logger = LoggerFactory.getLogger(ToolRegistry.class);

	private static final int MOST_USED_LIMIT = 10;

	private final ToolRegistryConfig config;

	private final McpErrorHandler errorHandler;

	private final ConcurrentHashMap<String, ToolSpecification> tools = new ConcurrentHashMap<>();

	// category -> tool names
	private final ConcurrentHashMap<String, Set<String>> categories = new ConcurrentHashMap<>();

	private final ConcurrentHashMap<String, ToolStats> toolStats = new ConcurrentHashMap<>();

	private final List<ToolRegistryListener> listeners = new CopyOnWriteArrayList<>();

	private final Object statsLock = new Object();

	private long totalExecutions;

	private long successfulExecutions;

	private long failedExecutions;

	private long totalExecutionTime;

	public ToolRegistry(ToolRegistryConfig config, McpErrorHandler errorHandler) {
		Assert.notNull(config, "config must not be null");
		Assert.notNull(errorHandler, "errorHandler must not be null");
		this.config = config;
		this.errorHandler = errorHandler;
	}

	public void addListener(ToolRegistryListener listener) {
		Assert.notNull(listener, "listener must not be null");
		this.listeners.add(listener);
	}

	public void removeListener(ToolRegistryListener listener) {
		this.listeners.remove(listener);
	}

	public void registerTool(ToolSpecification tool) {
		registerTool(tool, ToolRegistrationOptions.DEFAULT);
	}

	/**
	 * Registers a tool.
	 * @param tool the tool to register
	 * @param options per-registration overrides
	 * @throws McpError INVALID_PARAMS when the name or shape is invalid, the name is taken
	 * and overwriting is not allowed, or the registry is full
	 */
	public synchronized void registerTool(ToolSpecification tool, ToolRegistrationOptions options) {
		Assert.notNull(tool, "tool must not be null");
		ToolRegistrationOptions effectiveOptions = options == null ? ToolRegistrationOptions.DEFAULT : options;
		ToolDefinition definition = applyOptions(tool.definition(), effectiveOptions);
		ErrorContext context = ErrorContext.builder()
			.operation("registerTool")
			.detail("toolName", definition.name())
			.build();

		try {
			ToolNameValidator.validate(definition.name());
			validateShape(definition, tool.handler());
		}
		catch (IllegalArgumentException e) {
			throw errorHandler.handleValidationError(e.getMessage(), context);
		}

		ToolSpecification existing = this.tools.get(definition.name());
		if (existing != null) {
			boolean allowOverwrite = effectiveOptions.allowOverwrite() != null ? effectiveOptions.allowOverwrite()
					: config.allowOverwrite();
			if (!allowOverwrite) {
				throw errorHandler.handleValidationError("Tool already registered: " + definition.name(), context);
			}
			removeFromCategory(existing.definition());
		}
		else if (this.tools.size() >= config.maxTools()) {
			throw errorHandler.handleValidationError(
					"Tool registry is full (maxTools: " + config.maxTools() + ")", context);
		}

		this.tools.put(definition.name(), tool.withDefinition(definition));
		this.categories.computeIfAbsent(definition.category(), key -> ConcurrentHashMap.newKeySet())
			.add(definition.name());
		this.toolStats.putIfAbsent(definition.name(), ToolStats.empty(definition.name()));

		logger.info("Registered tool: {} (category: {}, version: {}{})", definition.name(), definition.category(),
				definition.version(), existing != null ? ", replaced" : "");
		notifyListeners(listener -> listener.onToolRegistered(definition));
	}

	private static ToolDefinition applyOptions(ToolDefinition definition, ToolRegistrationOptions options) {
		Assert.notNull(definition, "tool definition must not be null");
		Map<String, Object> metadata = new LinkedHashMap<>(definition.metadata());
		metadata.putAll(options.metadata());
		return new ToolDefinition(definition.name(), definition.description(),
				Utils.hasText(options.category()) ? options.category()
						: Utils.hasText(definition.category()) ? definition.category()
								: ToolDefinition.DEFAULT_CATEGORY,
				Utils.hasText(options.version()) ? options.version()
						: Utils.hasText(definition.version()) ? definition.version() : ToolDefinition.DEFAULT_VERSION,
				definition.parameters(), options.enabled() != null ? options.enabled() : definition.enabled(),
				definition.authRequirement(), metadata);
	}

	private static void validateShape(ToolDefinition definition, ToolHandler handler) {
		if (!Utils.hasText(definition.description())) {
			throw new IllegalArgumentException("Tool description must not be empty: '" + definition.name() + "'");
		}
		if (definition.parameters() == null) {
			throw new IllegalArgumentException("Tool parameters must not be null: '" + definition.name() + "'");
		}
		Set<String> names = new HashSet<>();
		for (ToolParameter parameter : definition.parameters()) {
			if (parameter == null || !Utils.hasText(parameter.name())) {
				throw new IllegalArgumentException("Tool parameter names must not be empty: '" + definition.name() + "'");
			}
			if (parameter.type() == null) {
				throw new IllegalArgumentException("Tool parameter '" + parameter.name() + "' must declare a type");
			}
			if (!names.add(parameter.name())) {
				throw new IllegalArgumentException("Duplicate tool parameter: '" + parameter.name() + "'");
			}
		}
		if (handler == null) {
			throw new IllegalArgumentException("Tool handler must not be null: '" + definition.name() + "'");
		}
	}

	/**
	 * Removes a tool.
	 * @param name the tool name
	 * @return whether the tool was registered
	 */
	public synchronized boolean unregisterTool(String name) {
		ToolSpecification removed = this.tools.remove(name);
		if (removed == null) {
			return false;
		}
		removeFromCategory(removed.definition());
		this.toolStats.remove(name);
		logger.info("Unregistered tool: {}", name);
		notifyListeners(listener -> listener.onToolUnregistered(name));
		return true;
	}

	private void removeFromCategory(ToolDefinition definition) {
		this.categories.computeIfPresent(definition.category(), (category, names) -> {
			names.remove(definition.name());
			return names.isEmpty() ? null : names;
		});
	}

	public boolean enableTool(String name) {
		return setEnabled(name, true);
	}

	public boolean disableTool(String name) {
		return setEnabled(name, false);
	}

	private boolean setEnabled(String name, boolean enabled) {
		ToolSpecification updated = this.tools.computeIfPresent(name,
				(key, tool) -> tool.withDefinition(tool.definition().withEnabled(enabled)));
		if (updated == null) {
			return false;
		}
		logger.info("Tool {} {}", name, enabled ? "enabled" : "disabled");
		notifyListeners(listener -> listener.onToolEnabled(name, enabled));
		return true;
	}

	@Nullable
	public ToolDefinition getTool(String name) {
		ToolSpecification tool = this.tools.get(name);
		return tool != null ? tool.definition() : null;
	}

	public boolean hasTool(String name) {
		return this.tools.containsKey(name);
	}

	/**
	 * Enabled tools, sorted by name.
	 */
	public List<ToolDefinition> getAvailableTools() {
		// ConcurrentHashMap does not guarantee iteration order
		return this.tools.values()
			.stream()
			.map(ToolSpecification::definition)
			.filter(ToolDefinition::enabled)
			.sorted(Comparator.comparing(ToolDefinition::name))
			.toList();
	}

	public List<ToolDefinition> getToolsByCategory(String category) {
		Set<String> names = this.categories.getOrDefault(category, Set.of());
		return names.stream()
			.map(this::getTool)
			.filter(tool -> tool != null)
			.sorted(Comparator.comparing(ToolDefinition::name))
			.toList();
	}

	/**
	 * Case-insensitive search over name, description and category.
	 */
	public List<ToolDefinition> searchTools(String query) {
		if (!Utils.hasText(query)) {
			return List.of();
		}
		String needle = query.toLowerCase(Locale.ROOT);
		return this.tools.values()
			.stream()
			.map(ToolSpecification::definition)
			.filter(tool -> contains(tool.name(), needle) || contains(tool.description(), needle)
					|| contains(tool.category(), needle))
			.sorted(Comparator.comparing(ToolDefinition::name))
			.toList();
	}

	private static boolean contains(String value, String needle) {
		return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
	}

	public Set<String> getCategories() {
		return new TreeSet<>(this.categories.keySet());
	}

	@Nullable
	public ToolStats getToolStats(String name) {
		return this.toolStats.get(name);
	}

	public int getToolCount() {
		return this.tools.size();
	}

	public RegistryStats getRegistryStats() {
		List<ToolDefinition> all = this.tools.values().stream().map(ToolSpecification::definition).toList();
		int enabled = (int) all.stream().filter(ToolDefinition::enabled).count();
		Map<String, Integer> byCategory = new TreeMap<>();
		for (ToolDefinition tool : all) {
			byCategory.merge(tool.category(), 1, Integer::sum);
		}
		List<ToolStats> mostUsed = this.toolStats.values()
			.stream()
			.filter(stats -> stats.executions() > 0)
			.sorted(Comparator.comparingLong(ToolStats::executions).reversed().thenComparing(ToolStats::name))
			.limit(MOST_USED_LIMIT)
			.toList();
		synchronized (statsLock) {
			double average = totalExecutions == 0 ? 0 : (double) totalExecutionTime / totalExecutions;
			return new RegistryStats(all.size(), enabled, all.size() - enabled, totalExecutions, successfulExecutions,
					failedExecutions, average, byCategory, mostUsed);
		}
	}

	/**
	 * Runs a tool on behalf of a session.
	 * @param name the tool name
	 * @param arguments call arguments, may be {@code null}
	 * @param context the invoking session and user
	 * @return the result of the call; never an error signal
	 */
	public Mono<ToolResult> executeTool(String name, @Nullable Map<String, Object> arguments,
			ToolExecutionContext context) {
		return Mono.defer(() -> {
			long startNanos = System.nanoTime();
			ErrorContext errorContext = ErrorContext.builder()
				.requestId(context.requestId())
				.sessionId(context.session().getId())
				.operation("executeTool")
				.detail("toolName", name)
				.build();

			ToolSpecification tool = name == null ? null : this.tools.get(name);
			if (tool == null || !tool.definition().enabled()) {
				McpError notFound = errorHandler.createError(ErrorCodes.TOOL_NOT_FOUND, "Tool not found: " + name,
						errorContext);
				return Mono.just(ToolResult.failure(ToolError.from(notFound)));
			}

			McpError denied = authorize(tool.definition(), context.user(), errorContext);
			if (denied != null) {
				return Mono.just(complete(name, ToolResult.failure(ToolError.from(denied)), startNanos));
			}

			Map<String, Object> provided = arguments == null ? Map.of() : arguments;
			Map<String, Object> validated;
			try {
				validated = config.validateParameters()
						? ToolArgumentValidator.validate(tool.definition().parameters(), provided)
						: ToolArgumentValidator.applyDefaults(tool.definition().parameters(), provided);
			}
			catch (IllegalArgumentException e) {
				McpError invalid = errorHandler.handleValidationError(e.getMessage(), errorContext);
				return Mono.just(complete(name, ToolResult.failure(ToolError.from(invalid)), startNanos));
			}

			logger.debug("Executing tool {} for session {}", name, context.session().getId());
			return Mono.defer(() -> tool.handler().execute(validated, context))
				.subscribeOn(Schedulers.boundedElastic())
				.timeout(config.executionTimeout())
				.switchIfEmpty(Mono.fromSupplier(() -> ToolResult.success(null)))
				.map(result -> result.success() || result.error() != null ? result
						: ToolResult.failure(new ToolError(ErrorCodes.TOOL_EXECUTION_FAILED,
								"Tool execution failed: " + name, null)))
				.onErrorResume(error -> Mono
					.just(ToolResult.failure(ToolError.from(executionFailure(name, error, errorContext)))))
				.map(result -> complete(name, result, startNanos));
		});
	}

	@Nullable
	private McpError authorize(ToolDefinition tool, @Nullable UserContext user, ErrorContext context) {
		ToolAuthRequirement requirement = tool.authRequirement();
		boolean restricted = requirement.required() || !requirement.permissions().isEmpty()
				|| !requirement.groups().isEmpty() || requirement.minimumLevel().ordinal() > 0;
		if (!restricted) {
			return null;
		}
		if (user == null) {
			return errorHandler.createError(ErrorCodes.AUTHORIZATION_FAILED,
					"Authentication required to use tool: " + tool.name(), context,
					RecoveryStrategies.forKind(ErrorKind.AUTHENTICATION_FAILED));
		}

		Set<String> missingPermissions = new TreeSet<>(requirement.permissions());
		missingPermissions.removeAll(user.permissions());
		Set<String> missingGroups = new TreeSet<>(requirement.groups());
		missingGroups.removeAll(user.groups());
		boolean levelTooLow = !user.level().isAtLeast(requirement.minimumLevel());
		if (missingPermissions.isEmpty() && missingGroups.isEmpty() && !levelTooLow) {
			return null;
		}

		ErrorContext detailed = context.withDetail("userId", user.userId());
		if (!missingPermissions.isEmpty()) {
			detailed = detailed.withDetail("missingPermissions", new ArrayList<>(missingPermissions));
		}
		if (!missingGroups.isEmpty()) {
			detailed = detailed.withDetail("missingGroups", new ArrayList<>(missingGroups));
		}
		if (levelTooLow) {
			detailed = detailed.withDetail("requiredLevel", requirement.minimumLevel().name());
		}
		return errorHandler.handleAuthenticationError(ErrorKind.AUTHORIZATION_FAILED,
				"Insufficient permissions to use tool: " + tool.name(), detailed);
	}

	private McpError executionFailure(String name, Throwable error, ErrorContext context) {
		if (error instanceof TimeoutException) {
			return errorHandler.createError(ErrorCodes.TOOL_EXECUTION_FAILED,
					"Tool execution timed out after " + config.executionTimeout().toMillis() + "ms",
					context.withDetail("toolName", name), RecoveryStrategies.forKind(ErrorKind.TIMEOUT));
		}
		logger.debug("Tool {} failed", name, error);
		return errorHandler.handleToolError(name, error, context);
	}

	private ToolResult complete(String name, ToolResult result, long startNanos) {
		long executionTime = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
		long now = System.currentTimeMillis();
		ToolResult completed = result.withMetadata(new ToolResult.ExecutionMetadata(executionTime, now));
		if (config.trackStatistics()) {
			this.toolStats.computeIfPresent(name, (key, stats) -> stats.record(result.success(), executionTime, now));
			synchronized (statsLock) {
				totalExecutions++;
				totalExecutionTime += executionTime;
				if (result.success()) {
					successfulExecutions++;
				}
				else {
					failedExecutions++;
				}
			}
		}
		logger.debug("Tool {} completed in {}ms (success: {})", name, executionTime, result.success());
		notifyListeners(listener -> listener.onToolExecuted(name, completed));
		return completed;
	}

	private void notifyListeners(Consumer<ToolRegistryListener> event) {
		for (ToolRegistryListener listener : this.listeners) {
			try {
				event.accept(listener);
			}
			catch (Exception e) {
				logger.error("Tool registry listener failed", e);
			}
		}
	}

}
