package me.golemcore.toolgate.domain.service;

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

/**
 * Names of tools that drive the shared screen, input devices or browser window.
 * At most one of them may run at a time.
 */
public final class DesktopTools {

    public static final Set<String> NAMES = Set.of(
            "desktop", "accessibility", "screenshot", "app", "browser",
            "window", "menubar", "dialog", "shortcuts");

    private DesktopTools() {
    }

    public static boolean isDesktopTool(String toolName) {
        return toolName != null && NAMES.contains(toolName);
    }
}
