package me.golemcore.toolgate.domain.model;

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

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Immutable per-call context threaded explicitly through the dispatch pipeline.
 *
 * <p>
 * Carries the security-relevant {@link Origin}, the session identifier, an
 * optional deadline and a {@link CancellationSignal}. Suspension points
 * (approval wait, desktop lane wait) bind their futures through
 * {@link #guard(CompletableFuture)} so a caller can abandon them.
 */
@Getter
@Builder(toBuilder = true)
public final class RequestContext {

    private final Origin origin;
    private final String sessionId;
    private final String requestId;
    private final Instant deadline;
    private final CancellationSignal cancellation;

    public static RequestContext user() {
        return RequestContext.builder().origin(Origin.USER).build();
    }

    public static RequestContext of(Origin origin) {
        return RequestContext.builder().origin(origin).build();
    }

    public Origin getOrigin() {
        return origin != null ? origin : Origin.USER;
    }

    public RequestContext withOrigin(Origin newOrigin) {
        return toBuilder().origin(newOrigin).build();
    }

    public RequestContext withDeadline(Instant newDeadline) {
        return toBuilder().deadline(newDeadline).build();
    }

    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(Instant.now(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    public boolean isCancelled() {
        return cancellation != null && cancellation.isCancelled();
    }

    public boolean isExpired() {
        return deadline != null && !Instant.now().isBefore(deadline);
    }

    /**
     * True when the caller no longer wants the result.
     */
    public boolean isDone() {
        return isCancelled() || isExpired();
    }

    /**
     * Returns a future mirroring {@code pending} that additionally fails with
     * {@link CancellationException} on cancellation and with
     * {@link TimeoutException} once the deadline passes. The original future is
     * left untouched.
     */
    public <T> CompletableFuture<T> guard(CompletableFuture<T> pending) {
        CompletableFuture<T> guarded = new CompletableFuture<>();
        pending.whenComplete((value, failure) -> {
            if (failure != null) {
                guarded.completeExceptionally(failure);
            } else {
                guarded.complete(value);
            }
        });
        if (cancellation != null) {
            Runnable detach = cancellation.onCancel(
                    () -> guarded.completeExceptionally(new CancellationException("Request cancelled")));
            guarded.whenComplete((value, failure) -> detach.run());
        }
        if (deadline != null) {
            long millis = Duration.between(Instant.now(), deadline).toMillis();
            if (millis <= 0) {
                guarded.completeExceptionally(new TimeoutException("Request deadline exceeded"));
            } else {
                guarded.orTimeout(millis, TimeUnit.MILLISECONDS);
            }
        }
        return guarded;
    }
}
