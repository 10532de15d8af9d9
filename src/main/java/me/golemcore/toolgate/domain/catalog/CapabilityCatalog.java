package me.golemcore.toolgate.domain.catalog;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolgate.domain.model.Capability;
import me.golemcore.toolgate.domain.model.Platform;
import me.golemcore.toolgate.infrastructure.config.ToolgateProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Platform-filtered list of capabilities available to the registry.
 *
 * <p>
 * Built in one pass from the {@link CapabilityProvider} beans. A capability is
 * kept when its platform set covers the current platform and its category is not
 * switched off through {@code toolgate.catalog.permissions.<key>}. Two providers
 * declaring the same tool name fail construction; a later {@link #register}
 * replaces the entry.
 *
 * <p>
 * Read-only after construction.
 */
@Component
@Slf4j
public class CapabilityCatalog {

    public static final String CATEGORY_PRODUCTIVITY = "productivity";
    public static final String CATEGORY_SYSTEM = "system";
    public static final String CATEGORY_MEDIA = "media";
    public static final String CATEGORY_DESKTOP = "desktop";

    private static final Map<String, String> CATEGORY_PERMISSIONS = Map.of(
            CATEGORY_PRODUCTIVITY, "contacts",
            CATEGORY_SYSTEM, "system",
            CATEGORY_MEDIA, "media",
            CATEGORY_DESKTOP, "desktop");

    private final Platform platform;
    private final Map<String, Boolean> permissions;
    private final Map<String, Capability> capabilities = new LinkedHashMap<>();

    @Autowired
    public CapabilityCatalog(List<CapabilityProvider> providers, ToolgateProperties properties) {
        this(providers, resolvePlatform(properties.getCatalog().getPlatform()),
                properties.getCatalog().getPermissions());
    }

    public CapabilityCatalog(List<CapabilityProvider> providers, Platform platform, Map<String, Boolean> permissions) {
        this.platform = platform;
        this.permissions = permissions != null ? Map.copyOf(permissions) : Map.of();
        Map<String, Capability> declared = new LinkedHashMap<>();
        for (CapabilityProvider provider : providers) {
            for (Capability capability : provider.capabilities()) {
                if (declared.putIfAbsent(capability.getName(), capability) != null) {
                    throw new IllegalStateException("Capability '" + capability.getName() + "' declared twice");
                }
            }
        }
        declared.values().forEach(this::register);
        log.info("[Catalog] {} capabilities available on {}: {}", capabilities.size(), platform.wireName(),
                capabilities.keySet());
    }

    /**
     * Creates a catalog from explicit capabilities without permission filtering.
     */
    public static CapabilityCatalog of(Platform platform, Capability... capabilities) {
        List<Capability> list = List.of(capabilities);
        return new CapabilityCatalog(List.of(() -> list), platform, Map.of());
    }

    /**
     * Adds a capability when it passes platform and permission filtering.
     *
     * @return false when the capability was filtered out
     */
    public final boolean register(Capability capability) {
        String name = capability.getName();
        if (!capability.isAvailableOn(platform)) {
            log.debug("[Catalog] Skipping {}: not available on {}", name, platform.wireName());
            return false;
        }
        if (!isCategoryPermitted(capability.getCategory())) {
            log.info("[Catalog] Skipping {}: category '{}' disabled by permissions", name, capability.getCategory());
            return false;
        }
        Capability previous = capabilities.put(name, capability);
        if (previous != null) {
            log.warn("[Catalog] Capability '{}' registered twice, keeping the later registration", name);
        }
        return true;
    }

    private boolean isCategoryPermitted(String category) {
        String permission = category != null ? CATEGORY_PERMISSIONS.get(category) : null;
        if (permission == null) {
            return true;
        }
        return permissions.getOrDefault(permission, Boolean.TRUE);
    }

    public Platform platform() {
        return platform;
    }

    public Optional<Capability> get(String name) {
        return Optional.ofNullable(capabilities.get(name));
    }

    public List<Capability> list() {
        return Collections.unmodifiableList(new ArrayList<>(capabilities.values()));
    }

    public List<Capability> listByCategory(String category) {
        return capabilities.values().stream()
                .filter(capability -> category.equals(capability.getCategory()))
                .toList();
    }

    private static Platform resolvePlatform(String override) {
        if (override == null || override.isBlank()) {
            return Platform.detect();
        }
        return Platform.fromWire(override);
    }
}
