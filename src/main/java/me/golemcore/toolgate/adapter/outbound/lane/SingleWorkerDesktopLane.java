package me.golemcore.toolgate.adapter.outbound.lane;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolgate.domain.model.RequestContext;
import me.golemcore.toolgate.domain.model.ToolFailureKind;
import me.golemcore.toolgate.domain.model.ToolResult;
import me.golemcore.toolgate.port.outbound.DesktopLane;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Desktop lane backed by one worker thread. The executor's FIFO queue gives
 * arrival-order processing; the single thread gives mutual exclusion.
 *
 * <p>
 * A task whose caller was cancelled or passed its deadline while queued is
 * skipped when the worker reaches it.
 */
@Component
@ConditionalOnProperty(prefix = "toolgate.desktop-lane", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class SingleWorkerDesktopLane implements DesktopLane {

    private final ExecutorService worker;
    private final AtomicInteger size = new AtomicInteger();

    public SingleWorkerDesktopLane() {
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "desktop-lane");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletableFuture<ToolResult> enqueue(RequestContext context, Supplier<ToolResult> task) {
        CompletableFuture<ToolResult> result = new CompletableFuture<>();
        int queued = size.incrementAndGet();
        log.debug("[Lane] Enqueued task, {} in lane", queued);
        try {
            worker.execute(() -> run(context, task, result));
        } catch (RejectedExecutionException e) {
            size.decrementAndGet();
            log.warn("[Lane] Rejected task: lane is shut down");
            result.complete(ToolResult.failure("Desktop lane is shut down"));
        }
        return result;
    }

    private void run(RequestContext context, Supplier<ToolResult> task, CompletableFuture<ToolResult> result) {
        try {
            if (context.isDone()) {
                log.debug("[Lane] Skipping task: caller {}", context.isCancelled() ? "cancelled" : "expired");
                result.complete(ToolResult.failure(ToolFailureKind.CANCELLED,
                        "Request cancelled before the desktop lane reached it"));
                return;
            }
            result.complete(task.get());
        } catch (RuntimeException e) {
            log.error("[Lane] Desktop task failed", e);
            result.complete(ToolResult.failure("Desktop task failed: " + e.getMessage()));
        } finally {
            size.decrementAndGet();
        }
    }

    @Override
    public int size() {
        return size.get();
    }

    @PreDestroy
    public void shutdown() {
        worker.shutdownNow();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Lane] Worker did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
