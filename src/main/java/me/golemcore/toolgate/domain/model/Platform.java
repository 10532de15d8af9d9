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

import java.util.Locale;

/**
 * Operating system a capability can run on.
 */
public enum Platform {

    DARWIN("darwin"), LINUX("linux"), WINDOWS("windows"), IOS("ios"), ANDROID("android"),

    /** Wildcard: available everywhere. */
    ALL("all");

    private final String wireName;

    Platform(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Platform fromWire(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("macos".equals(normalized) || "mac".equals(normalized)) {
            return DARWIN;
        }
        for (Platform platform : values()) {
            if (platform.wireName.equals(normalized)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Unknown platform: " + value);
    }

    /**
     * Detects the platform of the running JVM from {@code os.name} and
     * {@code java.vendor}.
     */
    public static Platform detect() {
        return detect(System.getProperty("os.name", ""), System.getProperty("java.vendor", ""));
    }

    static Platform detect(String osName, String vendor) {
        String os = osName.toLowerCase(Locale.ROOT);
        if (vendor.toLowerCase(Locale.ROOT).contains("android")) {
            return ANDROID;
        }
        if (os.contains("mac") || os.contains("darwin")) {
            return DARWIN;
        }
        if (os.contains("win")) {
            return WINDOWS;
        }
        if (os.contains("ios")) {
            return IOS;
        }
        return LINUX;
    }
}
