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
import lombok.Singular;
import lombok.Value;
import me.golemcore.toolgate.domain.component.ToolComponent;

import java.util.Set;

/**
 * Registration record pairing one tool with the platforms it supports and its
 * display category. An empty platform set, or one containing
 * {@link Platform#ALL}, means the tool runs everywhere.
 */
@Value
@Builder
public class Capability {

    ToolComponent tool;
    @Singular
    Set<Platform> platforms;
    String category;
    boolean requiresSetup;

    public String getName() {
        return tool.getToolName();
    }

    public boolean isAvailableOn(Platform platform) {
        return platforms.isEmpty() || platforms.contains(Platform.ALL) || platforms.contains(platform);
    }
}
