package me.golemcore.toolgate.port.outbound;

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

import me.golemcore.toolgate.domain.model.RequestContext;
import me.golemcore.toolgate.domain.model.ToolResult;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Serialization point for tools sharing one exclusive OS resource. Tasks run one
 * at a time in arrival order.
 */
public interface DesktopLane {

    /**
     * Queues a task. The returned future completes with the task's result, or
     * with an error result when the caller's context was cancelled or expired
     * before the task started.
     */
    CompletableFuture<ToolResult> enqueue(RequestContext context, Supplier<ToolResult> task);

    /**
     * Number of tasks waiting or running.
     */
    int size();
}
