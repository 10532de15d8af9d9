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

/**
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * No tool is registered under the requested name.
     */
    UNKNOWN_TOOL,

    /**
     * Tool is registered but currently disabled.
     */
    DISABLED,

    /**
     * Tool is on the deny list of the request origin.
     */
    ORIGIN_DENIED,

    /**
     * Input was rejected by a hard safety block that no policy can override.
     */
    SAFEGUARD_BLOCKED,

    /**
     * Approval was required but denied, or the approval wait failed.
     */
    APPROVAL_DENIED,

    /**
     * Malformed input or an unknown resource/action pair for a domain tool.
     */
    VALIDATION_FAILED,

    /**
     * The caller cancelled the request or its deadline expired while waiting.
     */
    CANCELLED,

    /**
     * Tool execution failed during runtime (exceptions, timeouts, non-zero exit,
     * etc.).
     */
    EXECUTION_FAILED
}
