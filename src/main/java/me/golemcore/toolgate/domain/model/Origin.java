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

import java.util.Arrays;
import java.util.Locale;

/**
 * Trust provenance of a tool call. Access control keys off this value, so every
 * entry point that bridges non-user traffic (inter-agent messages, plugins,
 * skills, scheduled jobs) must tag its requests explicitly.
 */
public enum Origin {

    /** Direct interaction with the owning user. */
    USER("user"),

    /** Inter-agent communication. */
    COMM("comm"),

    /** Third-party app or plugin. */
    PLUGIN("plugin"),

    /** Skill-initiated call. */
    SKILL("skill"),

    /** Internal system task such as a scheduled job or heartbeat. */
    SYSTEM("system");

    private final String wireName;

    Origin(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire name (case-insensitive, "app" accepted for plugins). Blank
     * input maps to {@link #USER}.
     */
    public static Origin fromWire(String value) {
        if (value == null || value.isBlank()) {
            return USER;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("app".equals(normalized)) {
            return PLUGIN;
        }
        return Arrays.stream(values())
                .filter(origin -> origin.wireName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown origin: " + value));
    }
}
