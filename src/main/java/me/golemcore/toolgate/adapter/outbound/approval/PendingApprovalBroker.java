package me.golemcore.toolgate.adapter.outbound.approval;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolgate.domain.model.ApprovalDecisionEvent;
import me.golemcore.toolgate.domain.model.ApprovalRequestedEvent;
import me.golemcore.toolgate.domain.model.PendingApproval;
import me.golemcore.toolgate.domain.model.RequestContext;
import me.golemcore.toolgate.infrastructure.config.ToolgateProperties;
import me.golemcore.toolgate.port.outbound.ApprovalPort;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Default approval hook correlating approval requests with decisions by id.
 *
 * <p>
 * Each request is kept as a pending entry and announced with an
 * {@link ApprovalRequestedEvent}. Decisions arrive either as an
 * {@link ApprovalDecisionEvent} (published by any inbound adapter) or directly
 * through {@link #resolve(String, boolean)} (the HTTP surface).
 *
 * <p>
 * Features:
 * <ul>
 * <li>Requests deny automatically after {@code toolgate.approval.timeout-seconds}
 * <li>Callers that stop waiting withdraw their request via {@link #cancel(String)}
 * <li>Scheduled cleanup of stale pending entries
 * </ul>
 */
@Component
@Slf4j
public class PendingApprovalBroker implements ApprovalPort {

    private static final int MAX_DESCRIPTION_LENGTH = 200;

    private final Map<String, Entry> pending = new ConcurrentHashMap<>();
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final long timeoutSeconds;
    private final long cleanupIntervalSeconds;
    private ScheduledExecutorService cleanupExecutor;

    public PendingApprovalBroker(ToolgateProperties properties, ApplicationEventPublisher eventPublisher,
            Clock clock) {
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.timeoutSeconds = properties.getApproval().getTimeoutSeconds();
        this.cleanupIntervalSeconds = properties.getApproval().getCleanupIntervalSeconds();
    }

    @PostConstruct
    public void init() {
        cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "approval-cleanup");
            t.setDaemon(true);
            return t;
        });
        cleanupExecutor.scheduleAtFixedRate(this::evictStale, cleanupIntervalSeconds, cleanupIntervalSeconds,
                TimeUnit.SECONDS);
    }

    @PreDestroy
    public void destroy() {
        if (cleanupExecutor != null) {
            cleanupExecutor.shutdownNow();
            try {
                cleanupExecutor.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        pending.values().forEach(entry -> entry.future().complete(false));
        pending.clear();
    }

    @Override
    public CompletableFuture<Boolean> requestApproval(RequestContext context, String requestId, String toolName,
            Map<String, Object> input) {
        CompletableFuture<Boolean> future = new CompletableFuture<>();
        PendingApproval approval = new PendingApproval(requestId, toolName, context.getOrigin(),
                context.getSessionId(), describe(toolName, input), input, Instant.now(clock));
        pending.put(requestId, new Entry(approval, future));
        log.info("[Approval] Waiting for approval {}: {}", requestId, approval.description());

        eventPublisher.publishEvent(new ApprovalRequestedEvent(approval));

        return future.orTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .exceptionally(ex -> {
                    log.info("[Approval] Approval {} timed out or failed, denying", requestId);
                    pending.remove(requestId);
                    return false;
                });
    }

    @Override
    public void cancel(String requestId) {
        Entry entry = pending.remove(requestId);
        if (entry != null) {
            log.info("[Approval] Approval {} withdrawn by caller", requestId);
            entry.future().complete(false);
        }
    }

    /**
     * Applies a decision.
     *
     * @return false when no request with this id is pending
     */
    public boolean resolve(String requestId, boolean approved) {
        Entry entry = pending.remove(requestId);
        if (entry == null) {
            log.debug("[Approval] No pending approval for id: {}", requestId);
            return false;
        }
        log.info("[Approval] Approval {} {}", requestId, approved ? "granted" : "denied");
        entry.future().complete(approved);
        return true;
    }

    @EventListener
    public void onApprovalDecision(ApprovalDecisionEvent event) {
        resolve(event.approvalId(), event.approved());
    }

    public List<PendingApproval> listPending() {
        return pending.values().stream()
                .map(Entry::approval)
                .sorted(Comparator.comparing(PendingApproval::createdAt))
                .toList();
    }

    public Optional<PendingApproval> getPending(String requestId) {
        return Optional.ofNullable(pending.get(requestId)).map(Entry::approval);
    }

    void evictStale() {
        Instant cutoff = Instant.now(clock).minusSeconds(timeoutSeconds + 30);
        pending.entrySet().removeIf(e -> {
            if (e.getValue().approval().createdAt().isBefore(cutoff)) {
                log.debug("[Approval] Cleaning up stale approval: {}", e.getKey());
                e.getValue().future().complete(false);
                return true;
            }
            return false;
        });
    }

    static String describe(String toolName, Map<String, Object> input) {
        Object command = input.get("command");
        Object path = input.get("path");
        Object action = input.get("action");
        String text;
        if (command != null) {
            text = "Run " + toolName + " command: " + command;
        } else if (path != null) {
            text = toolName + " " + (action != null ? action : "access") + ": " + path;
        } else if (action != null) {
            text = toolName + " " + action;
        } else {
            text = "Run " + toolName;
        }
        if (text.length() > MAX_DESCRIPTION_LENGTH) {
            return text.substring(0, MAX_DESCRIPTION_LENGTH - 3) + "...";
        }
        return text;
    }

    private record Entry(PendingApproval approval, CompletableFuture<Boolean> future) {
    }
}
