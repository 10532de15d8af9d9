package me.golemcore.toolgate.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolgate.domain.catalog.CapabilityCatalog;
import me.golemcore.toolgate.domain.component.CommandToolComponent;
import me.golemcore.toolgate.domain.component.ToolComponent;
import me.golemcore.toolgate.domain.model.Capability;
import me.golemcore.toolgate.domain.model.RequestContext;
import me.golemcore.toolgate.domain.model.ToolCall;
import me.golemcore.toolgate.domain.model.ToolDefinition;
import me.golemcore.toolgate.domain.model.ToolFailureKind;
import me.golemcore.toolgate.domain.model.ToolResult;
import me.golemcore.toolgate.infrastructure.config.ToolgateProperties;
import me.golemcore.toolgate.port.outbound.DesktopLane;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Registry of available tools and the single entry point for running them.
 *
 * <p>
 * Every call passes the same gates, in order:
 * <ol>
 * <li>lookup by sanitized name (unknown and disabled tools are rejected)</li>
 * <li>origin deny list</li>
 * <li>approval, when the tool or the classified command requires it</li>
 * <li>hard safeguard blocks</li>
 * <li>desktop lane for desktop tools when a lane is attached, inline
 * otherwise</li>
 * <li>execution with timeout</li>
 * <li>truncation of oversized content</li>
 * </ol>
 * {@link #execute(RequestContext, ToolCall)} never throws: every failure comes
 * back as an error {@link ToolResult}.
 */
@Service
@Slf4j
public class ToolRegistry {

    private static final String TRUNCATION_MARKER = "\n\n[Output truncated: exceeded %d characters]";

    private final Map<String, ToolComponent> tools = new ConcurrentHashMap<>();
    private final Map<String, String> categories = new ConcurrentHashMap<>();
    private final List<ToolRegistryListener> listeners = new CopyOnWriteArrayList<>();
    private final AccessPolicy policy;
    private final CommandSafeguard safeguard;
    private final int maxResultChars;
    private final long toolTimeoutSeconds;
    private final long approvalTimeoutSeconds;
    private volatile DesktopLane desktopLane;

    public ToolRegistry(CapabilityCatalog catalog, AccessPolicy policy, CommandSafeguard safeguard,
            ToolgateProperties properties) {
        this.policy = policy;
        this.safeguard = safeguard;
        this.maxResultChars = properties.getRegistry().getMaxResultChars();
        this.toolTimeoutSeconds = properties.getRegistry().getToolTimeoutSeconds();
        this.approvalTimeoutSeconds = properties.getApproval().getTimeoutSeconds();
        if (maxResultChars <= 0) {
            throw new IllegalArgumentException("toolgate.registry.max-result-chars must be positive");
        }
        for (Capability capability : catalog.list()) {
            tools.put(capability.getName(), capability.getTool());
            if (capability.getCategory() != null) {
                categories.put(capability.getName(), capability.getCategory());
            }
        }
        log.info("[Registry] Registered {} tools: {}", tools.size(), tools.keySet());
    }

    // ==================== REGISTRATION ====================

    public void register(Capability capability) {
        register(capability.getTool(), capability.getCategory());
    }

    /**
     * Registers or replaces a tool. Replacing logs a warning.
     */
    public void register(ToolComponent tool, String category) {
        String name = tool.getToolName();
        ToolComponent previous = tools.put(name, tool);
        if (category != null) {
            categories.put(name, category);
        } else {
            categories.remove(name);
        }
        if (previous != null) {
            log.warn("[Registry] Tool '{}' registered twice, keeping the later registration", name);
        } else {
            log.info("[Registry] Registered tool: {}", name);
        }
        notifyListeners(List.of(name), List.of());
    }

    public boolean unregister(String name) {
        ToolComponent removed = tools.remove(name);
        categories.remove(name);
        if (removed == null) {
            return false;
        }
        log.info("[Registry] Unregistered tool: {}", name);
        notifyListeners(List.of(), List.of(name));
        return true;
    }

    public Optional<ToolComponent> get(String name) {
        return Optional.ofNullable(name != null ? tools.get(name) : null);
    }

    public Optional<String> categoryOf(String name) {
        return Optional.ofNullable(name != null ? categories.get(name) : null);
    }

    public List<String> names() {
        return tools.keySet().stream().sorted().toList();
    }

    /**
     * Definitions of enabled tools sorted by name.
     */
    public List<ToolDefinition> listDefinitions() {
        return tools.values().stream()
                .filter(ToolComponent::isEnabled)
                .map(ToolComponent::getDefinition)
                .sorted(Comparator.comparing(ToolDefinition::getName))
                .toList();
    }

    public void addListener(ToolRegistryListener listener) {
        listeners.add(listener);
    }

    private void notifyListeners(List<String> added, List<String> removed) {
        if (added.isEmpty() && removed.isEmpty()) {
            return;
        }
        for (ToolRegistryListener listener : listeners) {
            try {
                listener.onToolsChanged(added, removed);
            } catch (RuntimeException e) {
                log.warn("[Registry] Listener failed: {}", e.getMessage(), e);
            }
        }
    }

    // ==================== DESKTOP LANE ====================

    public void attachDesktopLane(DesktopLane lane) {
        this.desktopLane = lane;
        log.info("[Registry] Desktop lane {}", lane != null ? "attached" : "detached");
    }

    public void detachDesktopLane() {
        attachDesktopLane(null);
    }

    public boolean hasDesktopLane() {
        return desktopLane != null;
    }

    public boolean isDesktopTool(String name) {
        return DesktopTools.isDesktopTool(name) || CapabilityCatalog.CATEGORY_DESKTOP.equals(categories.get(name));
    }

    // ==================== EXECUTION ====================

    /**
     * Runs a tool call through the dispatch pipeline.
     */
    public ToolResult execute(RequestContext context, ToolCall toolCall) {
        if (toolCall == null) {
            return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, "Tool call is required");
        }
        RequestContext ctx = context != null ? context : RequestContext.user();
        Map<String, Object> input = toolCall.getInput() != null ? toolCall.getInput() : Map.of();
        String toolName = sanitizeToolName(toolCall.getName());

        ToolComponent tool = toolName != null ? tools.get(toolName) : null;
        if (tool == null) {
            log.warn("[Registry] Unknown tool: {}", toolCall.getName());
            return cap(unknownTool(toolCall.getName()));
        }
        if (!tool.isEnabled()) {
            return ToolResult.failure(ToolFailureKind.DISABLED, "Tool \"" + toolName + "\" is currently disabled");
        }

        if (policy.isDeniedForOrigin(ctx.getOrigin(), toolName)) {
            log.warn("[Registry] Tool {} denied for {}-origin request (session={})", toolName,
                    ctx.getOrigin().wireName(), ctx.getSessionId());
            return ToolResult.failure(ToolFailureKind.ORIGIN_DENIED, String.format(
                    "Tool \"%s\" is not permitted for %s-origin requests", toolName, ctx.getOrigin().wireName()));
        }

        if (needsApproval(tool, input)) {
            ToolResult refusal = awaitApproval(ctx, toolName, input);
            if (refusal != null) {
                return cap(refusal);
            }
        }

        Optional<String> blocked = safeguard.check(tool, input);
        if (blocked.isPresent()) {
            return cap(ToolResult.failure(ToolFailureKind.SAFEGUARD_BLOCKED, blocked.get()));
        }

        DesktopLane lane = desktopLane;
        ToolResult result;
        if (lane != null && isDesktopTool(toolName)) {
            log.debug("[Registry] Routing {} through desktop lane", toolName);
            result = runInLane(lane, ctx, tool, input);
        } else {
            result = invoke(ctx, tool, input);
        }
        return cap(result);
    }

    private boolean needsApproval(ToolComponent tool, Map<String, Object> input) {
        if (tool instanceof CommandToolComponent commandTool) {
            Optional<String> command = commandTool.extractCommand(input);
            if (command.isPresent()) {
                return policy.requiresApproval(command.get());
            }
        }
        return tool.requiresApproval();
    }

    private ToolResult awaitApproval(RequestContext ctx, String toolName, Map<String, Object> input) {
        String requestId = UUID.randomUUID().toString();
        log.info("[Registry] Tool {} requires approval (request={}, origin={})", toolName, requestId,
                ctx.getOrigin().wireName());
        CompletableFuture<Boolean> pending = policy.requestApproval(ctx, requestId, toolName, input);
        try {
            Boolean approved = ctx.guard(pending).get(approvalTimeoutSeconds, TimeUnit.SECONDS);
            if (Boolean.TRUE.equals(approved)) {
                log.info("[Registry] Approval granted for {} (request={})", toolName, requestId);
                return null;
            }
            log.info("[Registry] Approval denied for {} (request={})", toolName, requestId);
            return ToolResult.failure(ToolFailureKind.APPROVAL_DENIED, "Tool execution denied by user");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            withdraw(ctx, requestId);
            return ToolResult.failure(ToolFailureKind.CANCELLED, "Approval wait interrupted");
        } catch (TimeoutException e) {
            withdraw(ctx, requestId);
            return ToolResult.failure(ToolFailureKind.APPROVAL_DENIED,
                    "Approval timed out after " + approvalTimeoutSeconds + " seconds");
        } catch (CancellationException e) {
            withdraw(ctx, requestId);
            return ToolResult.failure(ToolFailureKind.CANCELLED, "Request cancelled while waiting for approval");
        } catch (ExecutionException e) {
            withdraw(ctx, requestId);
            if (isCallerAbort(e.getCause())) {
                return ToolResult.failure(ToolFailureKind.CANCELLED,
                        "Request cancelled while waiting for approval: " + safeCauseMessage(e));
            }
            return ToolResult.failure(ToolFailureKind.APPROVAL_DENIED, "Approval error: " + safeCauseMessage(e));
        }
    }

    private void withdraw(RequestContext ctx, String requestId) {
        if (policy.getApprovalPort() != null && !policy.isAutoApproved(ctx)) {
            policy.getApprovalPort().cancel(requestId);
        }
    }

    private ToolResult runInLane(DesktopLane lane, RequestContext ctx, ToolComponent tool,
            Map<String, Object> input) {
        CompletableFuture<ToolResult> queued = lane.enqueue(ctx, () -> invokeExclusive(ctx, tool, input));
        try {
            return ctx.guard(queued).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(ToolFailureKind.CANCELLED, "Desktop lane wait interrupted");
        } catch (CancellationException e) {
            return ToolResult.failure(ToolFailureKind.CANCELLED, "Request cancelled while waiting for desktop lane");
        } catch (ExecutionException e) {
            if (isCallerAbort(e.getCause())) {
                return ToolResult.failure(ToolFailureKind.CANCELLED,
                        "Request cancelled while waiting for desktop lane: " + safeCauseMessage(e));
            }
            return ToolResult.failure("Tool execution failed: " + safeCauseMessage(e));
        }
    }

    /**
     * Runs a desktop tool on the lane worker. The worker waits on the tool's own
     * future, not the caller's guarded view, so a caller that gives up does not
     * release the lane while the tool is still driving the desktop.
     */
    private ToolResult invokeExclusive(RequestContext ctx, ToolComponent tool, Map<String, Object> input) {
        CompletableFuture<ToolResult> future;
        try {
            future = tool.execute(ctx, input);
        } catch (RuntimeException e) {
            log.error("[Registry] Tool {} failed", tool.getToolName(), e);
            return ToolResult.failure("Tool execution failed: " + safeCauseMessage(e));
        }
        ToolResult result = await(tool, future, TimeUnit.SECONDS.toMillis(toolTimeoutSeconds));
        if (!future.isDone()) {
            future.cancel(true);
        }
        return result;
    }

    private ToolResult invoke(RequestContext ctx, ToolComponent tool, Map<String, Object> input) {
        long timeoutMillis = ctx.remaining()
                .map(Duration::toMillis)
                .map(left -> Math.min(left, TimeUnit.SECONDS.toMillis(toolTimeoutSeconds)))
                .orElse(TimeUnit.SECONDS.toMillis(toolTimeoutSeconds));
        CompletableFuture<ToolResult> future;
        try {
            future = tool.execute(ctx, input);
        } catch (RuntimeException e) {
            log.error("[Registry] Tool {} failed", tool.getToolName(), e);
            return ToolResult.failure("Tool execution failed: " + safeCauseMessage(e));
        }
        return await(tool, ctx.guard(future), timeoutMillis);
    }

    private ToolResult await(ToolComponent tool, CompletableFuture<ToolResult> future, long timeoutMillis) {
        try {
            ToolResult result = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
            if (result == null) {
                return ToolResult.failure("Tool " + tool.getToolName() + " returned no result");
            }
            log.debug("[Registry] Tool {} completed, error={}, length={}", tool.getToolName(), result.isError(),
                    result.getContent() != null ? result.getContent().length() : 0);
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(ToolFailureKind.CANCELLED, "Tool execution interrupted");
        } catch (TimeoutException e) {
            log.warn("[Registry] Tool {} timed out after {} ms", tool.getToolName(), timeoutMillis);
            return ToolResult.failure("Tool execution timed out after " + timeoutMillis + " ms");
        } catch (CancellationException e) {
            return ToolResult.failure(ToolFailureKind.CANCELLED, "Request cancelled");
        } catch (ExecutionException e) {
            if (isCallerAbort(e.getCause())) {
                return ToolResult.failure(ToolFailureKind.CANCELLED, "Request cancelled: " + safeCauseMessage(e));
            }
            log.error("[Registry] Tool {} failed", tool.getToolName(), e);
            return ToolResult.failure("Tool execution failed: " + safeCauseMessage(e));
        }
    }

    private static boolean isCallerAbort(Throwable cause) {
        return cause instanceof CancellationException || cause instanceof TimeoutException;
    }

    /**
     * Caps content at the configured size: exactly that many characters followed
     * by a truncation marker.
     */
    ToolResult cap(ToolResult result) {
        String content = result.getContent();
        if (content == null || content.length() <= maxResultChars) {
            return result;
        }
        log.warn("[Registry] Truncating tool result from {} to {} characters", content.length(), maxResultChars);
        return result.toBuilder()
                .content(content.substring(0, maxResultChars) + String.format(TRUNCATION_MARKER, maxResultChars))
                .build();
    }

    private ToolResult unknownTool(String requested) {
        String available = String.join(", ", names());
        return ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL, String.format(
                "TOOL ERROR: \"%s\" does not exist. You do NOT have that tool. Do NOT call it again.\n\n%s\n"
                        + "Your available tools are: %s",
                requested, correctionHint(requested), available));
    }

    static String correctionHint(String name) {
        String normalized = name != null ? name.toLowerCase(Locale.ROOT) : "";
        return switch (normalized) {
        case "websearch", "web_search", "webfetch", "web_fetch", "fetch" ->
            "INSTEAD USE: browser(url: \"https://...\", mode: \"text\")";
        case "read", "read_file" -> "INSTEAD USE: file(action: \"read\", path: \"/path/to/file\")";
        case "write", "write_file" -> "INSTEAD USE: file(action: \"write\", path: \"/path\", content: \"...\")";
        case "edit" -> "INSTEAD USE: file(action: \"edit\", path: \"/path\", old_string: \"...\", new_string: \"...\")";
        case "grep" -> "INSTEAD USE: file(action: \"grep\", pattern: \"...\", path: \"/dir\")";
        case "glob" -> "INSTEAD USE: file(action: \"glob\", pattern: \"**/*.java\")";
        case "bash", "exec", "run_command" ->
            "INSTEAD USE: shell(resource: \"bash\", action: \"exec\", command: \"...\")";
        case "remember", "memory" -> "INSTEAD USE: agent(resource: \"memory\", action: \"store\", key: \"...\", value: \"...\")";
        case "cron", "remind", "schedule" ->
            "INSTEAD USE: agent(resource: \"reminder\", action: \"create\", schedule: \"...\", message: \"...\")";
        default -> "Check your available tools and use the correct name.";
        };
    }

    private static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    private static String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Registry] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }
}
