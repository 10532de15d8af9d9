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

import me.golemcore.toolgate.domain.model.Capability;
import me.golemcore.toolgate.domain.model.Platform;
import me.golemcore.toolgate.testsupport.StubTool;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityCatalogTest {

    private static Capability capability(String name, String category, Platform... platforms) {
        Capability.CapabilityBuilder builder = Capability.builder()
                .tool(StubTool.returning(name, name))
                .category(category);
        for (Platform platform : platforms) {
            builder.platform(platform);
        }
        return builder.build();
    }

    @Test
    void shouldKeepOnlyCapabilitiesAvailableOnPlatform() {
        CapabilityCatalog catalog = CapabilityCatalog.of(Platform.LINUX,
                capability("file", "files", Platform.ALL),
                capability("imessage", "productivity", Platform.DARWIN),
                capability("shell", "system", Platform.DARWIN, Platform.LINUX),
                capability("notes", "productivity"));

        assertEquals(List.of("file", "shell", "notes"),
                catalog.list().stream().map(Capability::getName).toList());
        assertTrue(catalog.get("imessage").isEmpty());
        assertEquals(Platform.LINUX, catalog.platform());
    }

    @Test
    void shouldReturnFalseWhenRegistrationIsFiltered() {
        CapabilityCatalog catalog = CapabilityCatalog.of(Platform.WINDOWS);

        assertFalse(catalog.register(capability("imessage", "productivity", Platform.DARWIN)));
        assertTrue(catalog.register(capability("file", "files", Platform.ALL)));
    }

    @Test
    void shouldDropCategoriesWithDisabledPermission() {
        CapabilityCatalog catalog = new CapabilityCatalog(
                List.of(() -> List.of(
                        capability("contacts", CapabilityCatalog.CATEGORY_PRODUCTIVITY, Platform.ALL),
                        capability("browser", CapabilityCatalog.CATEGORY_DESKTOP, Platform.ALL),
                        capability("custom", "unmapped", Platform.ALL))),
                Platform.DARWIN, Map.of("contacts", false, "desktop", true));

        assertTrue(catalog.get("contacts").isEmpty());
        assertTrue(catalog.get("browser").isPresent());
        assertTrue(catalog.get("custom").isPresent());
    }

    @Test
    void shouldFailOnDuplicateDeclaration() {
        Capability first = capability("file", "files", Platform.ALL);
        Capability second = capability("file", "system", Platform.ALL);

        IllegalStateException exception = assertThrows(IllegalStateException.class,
                () -> CapabilityCatalog.of(Platform.LINUX, first, second));

        assertEquals("Capability 'file' declared twice", exception.getMessage());
    }

    @Test
    void shouldReplaceOnLaterRegister() {
        Capability first = capability("file", "files", Platform.ALL);
        Capability second = capability("file", "system", Platform.ALL);
        CapabilityCatalog catalog = CapabilityCatalog.of(Platform.LINUX, first);

        assertTrue(catalog.register(second));

        assertEquals(1, catalog.list().size());
        assertSame(second, catalog.get("file").orElseThrow());
    }

    @Test
    void shouldListByCategory() {
        CapabilityCatalog catalog = CapabilityCatalog.of(Platform.LINUX,
                capability("shell", "system", Platform.ALL),
                capability("file", "files", Platform.ALL),
                capability("process", "system", Platform.ALL));

        assertEquals(List.of("shell", "process"),
                catalog.listByCategory("system").stream().map(Capability::getName).toList());
    }

    @Test
    void shouldReturnUnmodifiableList() {
        CapabilityCatalog catalog = CapabilityCatalog.of(Platform.LINUX, capability("file", "files"));

        assertThrows(UnsupportedOperationException.class, () -> catalog.list().clear());
    }
}
