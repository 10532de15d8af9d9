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
import me.golemcore.toolgate.domain.model.AccessLevel;
import me.golemcore.toolgate.domain.model.AskMode;
import me.golemcore.toolgate.domain.model.Origin;
import me.golemcore.toolgate.domain.model.PolicySnapshot;
import me.golemcore.toolgate.domain.model.RequestContext;
import me.golemcore.toolgate.infrastructure.config.ToolgateProperties;
import me.golemcore.toolgate.port.outbound.ApprovalPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BooleanSupplier;

/**
 * Access control applied by the registry before a tool runs.
 *
 * <p>
 * Holds the global {@link AccessLevel}, the {@link AskMode}, the allowlist of
 * safe commands, the per-origin tool deny lists and the approval hook.
 * Non-user origins are denied the shell by default; user and system origins
 * have no deny list.
 *
 * <p>
 * Approval decisions for command tools:
 * <ul>
 * <li>autonomous mode or FULL level - never ask</li>
 * <li>DENY level - always ask</li>
 * <li>ALLOWLIST level - allowlisted commands ask only with
 * {@code ALWAYS}, other commands ask unless the mode is {@code OFF}</li>
 * </ul>
 * Read-mostly; guarded by a read/write lock so settings can change at runtime.
 */
@Component
@Slf4j
public class AccessPolicy {

    static final String SHELL_TOOL = "shell";

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final CommandClassifier classifier;

    private AccessLevel level;
    private AskMode askMode;
    private final Set<String> allowlist = new HashSet<>();
    private final Map<Origin, Set<String>> originDenyList = new EnumMap<>(Origin.class);
    private ApprovalPort approvalPort;
    private BooleanSupplier autonomousCheck;

    @Autowired
    public AccessPolicy(ToolgateProperties properties, CommandClassifier classifier, ApprovalPort approvalPort) {
        this(classifier, AccessLevel.parse(properties.getPolicy().getLevel()),
                AskMode.parse(properties.getPolicy().getAskMode()));
        ToolgateProperties.PolicyProperties policy = properties.getPolicy();
        allowlist.addAll(policy.getAllowlist());
        policy.getOriginDeny().forEach((origin, tools) -> originDenyList.put(Origin.fromWire(origin),
                new LinkedHashSet<>(tools)));
        boolean autonomous = policy.isAutonomous();
        this.autonomousCheck = () -> autonomous;
        this.approvalPort = approvalPort;
        log.info("[Policy] level={}, askMode={}, allowlist={} entries, originDeny={}", level, askMode,
                allowlist.size(), originDenyList);
    }

    /**
     * Policy with the default allowlist and origin deny lists and no approval
     * hook.
     */
    public AccessPolicy(CommandClassifier classifier, AccessLevel level, AskMode askMode) {
        this.classifier = classifier;
        this.level = level;
        this.askMode = askMode;
        this.allowlist.addAll(CommandClassifier.SAFE_BINS);
        this.originDenyList.putAll(defaultOriginDenyList());
        this.autonomousCheck = () -> false;
    }

    public static Map<Origin, Set<String>> defaultOriginDenyList() {
        Map<Origin, Set<String>> defaults = new EnumMap<>(Origin.class);
        defaults.put(Origin.COMM, new LinkedHashSet<>(List.of(SHELL_TOOL)));
        defaults.put(Origin.PLUGIN, new LinkedHashSet<>(List.of(SHELL_TOOL)));
        defaults.put(Origin.SKILL, new LinkedHashSet<>(List.of(SHELL_TOOL)));
        return defaults;
    }

    // ==================== CHECKS ====================

    /**
     * True when the tool is on the deny list of the origin. Independent of the
     * access level.
     */
    public boolean isDeniedForOrigin(Origin origin, String toolName) {
        lock.readLock().lock();
        try {
            Set<String> denied = originDenyList.get(origin);
            return denied != null && denied.contains(toolName);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Whether a command needs approval under the current level and ask mode.
     */
    public boolean requiresApproval(String command) {
        lock.readLock().lock();
        try {
            if (autonomousCheck.getAsBoolean() || level == AccessLevel.FULL) {
                return false;
            }
            if (level == AccessLevel.DENY) {
                return true;
            }
            if (classifier.isAllowlisted(command, allowlist)) {
                return askMode == AskMode.ALWAYS;
            }
            return askMode != AskMode.OFF;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Calls without a human in the loop that may proceed without asking: system
     * origin, autonomous mode and FULL level.
     */
    public boolean isAutoApproved(RequestContext context) {
        lock.readLock().lock();
        try {
            return context.getOrigin() == Origin.SYSTEM || autonomousCheck.getAsBoolean()
                    || level == AccessLevel.FULL;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Asks the approval hook. Auto-approved contexts complete immediately; a
     * missing hook denies.
     */
    public CompletableFuture<Boolean> requestApproval(RequestContext context, String requestId, String toolName,
            Map<String, Object> input) {
        if (isAutoApproved(context)) {
            log.debug("[Policy] Auto-approved {} for {} origin", toolName, context.getOrigin().wireName());
            return CompletableFuture.completedFuture(true);
        }
        ApprovalPort port = getApprovalPort();
        if (port == null) {
            log.warn("[Policy] No approval hook configured, denying {}", toolName);
            return CompletableFuture.completedFuture(false);
        }
        return port.requestApproval(context, requestId, toolName, input);
    }

    // ==================== SETTINGS ====================

    public AccessLevel getLevel() {
        lock.readLock().lock();
        try {
            return level;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void setLevel(AccessLevel level) {
        lock.writeLock().lock();
        try {
            log.info("[Policy] Access level changed: {} -> {}", this.level, level);
            this.level = level;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public AskMode getAskMode() {
        lock.readLock().lock();
        try {
            return askMode;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void setAskMode(AskMode askMode) {
        lock.writeLock().lock();
        try {
            log.info("[Policy] Ask mode changed: {} -> {}", this.askMode, askMode);
            this.askMode = askMode;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void addToAllowlist(String command) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("Allowlist entry must not be blank");
        }
        lock.writeLock().lock();
        try {
            allowlist.add(command.trim());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void denyForOrigin(Origin origin, String toolName) {
        lock.writeLock().lock();
        try {
            originDenyList.computeIfAbsent(origin, key -> new LinkedHashSet<>()).add(toolName);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void allowForOrigin(Origin origin, String toolName) {
        lock.writeLock().lock();
        try {
            Set<String> denied = originDenyList.get(origin);
            if (denied != null) {
                denied.remove(toolName);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public ApprovalPort getApprovalPort() {
        lock.readLock().lock();
        try {
            return approvalPort;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void setApprovalPort(ApprovalPort approvalPort) {
        lock.writeLock().lock();
        try {
            this.approvalPort = approvalPort;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Installs a live check for autonomous mode, evaluated on every decision.
     */
    public void setAutonomousCheck(BooleanSupplier autonomousCheck) {
        lock.writeLock().lock();
        try {
            this.autonomousCheck = autonomousCheck != null ? autonomousCheck : () -> false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public PolicySnapshot snapshot() {
        lock.readLock().lock();
        try {
            Map<Origin, Set<String>> denyCopy = new EnumMap<>(Origin.class);
            originDenyList.forEach((origin, tools) -> denyCopy.put(origin, Set.copyOf(tools)));
            return new PolicySnapshot(level, askMode, Set.copyOf(allowlist), Collections.unmodifiableMap(denyCopy),
                    autonomousCheck.getAsBoolean());
        } finally {
            lock.readLock().unlock();
        }
    }
}
