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
import lombok.Value;

/**
 * Result of a tool execution. Content is the text handed back to the calling
 * agent; for failures it carries the human-readable explanation and
 * {@link #getFailureKind()} classifies it.
 *
 * <p>
 * Results are immutable. The registry caps oversized content by building a new
 * instance with {@code toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class ToolResult {

    String content;
    Object data;
    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isError()
    boolean error;
    ToolFailureKind failureKind;

    public boolean isSuccess() {
        return !error;
    }

    /**
     * Creates a successful tool result with output text.
     */
    public static ToolResult success(String content) {
        return ToolResult.builder()
                .content(content)
                .build();
    }

    /**
     * Creates a successful tool result with output text and structured data.
     */
    public static ToolResult success(String content, Object data) {
        return ToolResult.builder()
                .content(content)
                .data(data)
                .build();
    }

    /**
     * Creates an execution failure with an error message.
     */
    public static ToolResult failure(String content) {
        return failure(ToolFailureKind.EXECUTION_FAILED, content);
    }

    public static ToolResult failure(ToolFailureKind kind, String content) {
        return ToolResult.builder()
                .error(true)
                .failureKind(kind)
                .content(content)
                .build();
    }
}
