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

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation flag shared between a caller and the work it started.
 *
 * <p>
 * Listeners registered with {@link #onCancel(Runnable)} run once, on the
 * thread calling {@link #cancel()}. Each registration returns a handle that
 * detaches it, so a signal reused across many calls does not accumulate them.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Set<Runnable> listeners = ConcurrentHashMap.newKeySet();

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable listener : listeners) {
            if (listeners.remove(listener)) {
                listener.run();
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Runs {@code action} on cancellation, immediately when already cancelled.
     *
     * @return handle removing the registration; a no-op once the action ran
     */
    public Runnable onCancel(Runnable action) {
        Runnable registration = action::run;
        listeners.add(registration);
        if (cancelled.get() && listeners.remove(registration)) {
            registration.run();
        }
        return () -> listeners.remove(registration);
    }

    int listenerCount() {
        return listeners.size();
    }
}
