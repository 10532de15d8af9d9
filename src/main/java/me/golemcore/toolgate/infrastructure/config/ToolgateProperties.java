package me.golemcore.toolgate.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code toolgate.*} prefix:
 * <ul>
 * <li>{@link CatalogProperties} - platform override and category
 * permissions</li>
 * <li>{@link PolicyProperties} - access level, ask mode, allowlist, origin deny
 * lists</li>
 * <li>{@link ApprovalProperties} - approval wait limits</li>
 * <li>{@link RegistryProperties} - result cap and execution timeout</li>
 * <li>{@link DesktopLaneProperties} - desktop serialization lane</li>
 * <li>{@link ToolsProperties} - built-in tool settings</li>
 * <li>{@link SecurityProperties} - management API token</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "toolgate")
@Data
public class ToolgateProperties {

    private CatalogProperties catalog = new CatalogProperties();
    private PolicyProperties policy = new PolicyProperties();
    private ApprovalProperties approval = new ApprovalProperties();
    private RegistryProperties registry = new RegistryProperties();
    private DesktopLaneProperties desktopLane = new DesktopLaneProperties();
    private ToolsProperties tools = new ToolsProperties();
    private SecurityProperties security = new SecurityProperties();

    // ==================== CATALOG ====================

    @Data
    public static class CatalogProperties {
        /** Overrides the detected platform (darwin, linux, windows, ios, android). */
        private String platform;
        /** Permission switches keyed by permission name (contacts, system, media, desktop). */
        private Map<String, Boolean> permissions = new HashMap<>();
    }

    // ==================== POLICY ====================

    @Data
    public static class PolicyProperties {
        private String level = "allowlist";
        private String askMode = "on-miss";
        private List<String> allowlist = new ArrayList<>();
        /**
         * Tool names denied per origin wire name. Origins present here replace the
         * built-in defaults for that origin.
         */
        private Map<String, List<String>> originDeny = new HashMap<>();
        private boolean autonomous = false;
    }

    // ==================== APPROVAL ====================

    @Data
    public static class ApprovalProperties {
        private int timeoutSeconds = 300;
        private int cleanupIntervalSeconds = 60;
    }

    // ==================== REGISTRY ====================

    @Data
    public static class RegistryProperties {
        private int maxResultChars = 100_000;
        private int toolTimeoutSeconds = 300;
    }

    // ==================== DESKTOP LANE ====================

    @Data
    public static class DesktopLaneProperties {
        private boolean enabled = true;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private FileToolProperties file = new FileToolProperties();
        private ShellToolProperties shell = new ShellToolProperties();
        private BrowserToolProperties browser = new BrowserToolProperties();
    }

    @Data
    public static class FileToolProperties {
        private boolean enabled = true;
        private String workspace = System.getProperty("user.home") + "/.golemcore/workspace";
        private int maxReadBytes = 1_048_576;
    }

    @Data
    public static class ShellToolProperties {
        private boolean enabled = true;
        private String workspace = System.getProperty("user.home") + "/.golemcore/workspace";
        private int defaultTimeout = 30;
        private int maxTimeout = 300;
    }

    @Data
    public static class BrowserToolProperties {
        private boolean enabled = true;
        private boolean headless = true;
        private int timeout = 30_000;
        private String userAgent = "Mozilla/5.0 (compatible; GolemCoreToolgate/1.0)";
    }

    // ==================== SECURITY ====================

    @Data
    public static class SecurityProperties {
        /** Bearer token for /api/**. Blank generates an ephemeral token at startup. */
        private String apiToken;
    }
}
