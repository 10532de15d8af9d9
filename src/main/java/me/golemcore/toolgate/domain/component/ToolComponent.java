package me.golemcore.toolgate.domain.component;

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
import me.golemcore.toolgate.domain.model.ToolDefinition;
import me.golemcore.toolgate.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Component representing an executable tool that can be invoked by the agent.
 * Tools expose their JSON Schema definition for function calling and implement
 * the execution logic. Calls always arrive through the tool registry, which has
 * already applied origin, approval and safeguard checks.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool definition with JSON Schema for function calling. The
     * returned instance must be the same between calls so hosts can cache it.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Whether every call to this tool needs human approval. Command tools may
     * return true here as a fallback and let the policy classify the concrete
     * command instead.
     */
    default boolean requiresApproval() {
        return false;
    }

    /**
     * Executes the tool with the specified parameters and returns the result.
     * Failures are reported as error results, not as exceptional completion.
     *
     * @param context
     *            the request context of the call
     * @param parameters
     *            the execution parameters as a map
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(RequestContext context, Map<String, Object> parameters);

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }
}
