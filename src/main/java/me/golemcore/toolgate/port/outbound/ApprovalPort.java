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

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for asking a human to approve a tool call before it runs. Implemented by
 * the host (chat button, dashboard, terminal prompt).
 */
public interface ApprovalPort {

    /**
     * Request approval for a tool call.
     *
     * @param context
     *            context of the waiting call
     * @param requestId
     *            correlation id generated by the registry
     * @param toolName
     *            the tool requesting approval
     * @param input
     *            the raw call input, shown to the approver
     * @return future that completes with true (approved) or false (denied/timeout)
     */
    CompletableFuture<Boolean> requestApproval(RequestContext context, String requestId, String toolName,
            Map<String, Object> input);

    /**
     * Withdraws a pending request whose caller stopped waiting. Unknown ids are
     * ignored.
     */
    default void cancel(String requestId) {
        // nothing pending by default
    }
}
