package me.golemcore.toolgate.domain.strap;

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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class StrapDomainTest {

    enum Res implements StrapResource {
        MEMORY, REMINDER;

        @Override
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    enum Act implements StrapAction {
        STORE, RECALL, LIST, DELETE, CREATE, PAUSE;

        @Override
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    enum Single implements StrapResource {
        FILE;

        @Override
        public String wireName() {
            return "file";
        }
    }

    private final StrapDomain<Res, Act> domain = StrapDomain.builder("agent", Res.class, Act.class)
            .resource(Res.MEMORY, Act.STORE, Act.RECALL, Act.LIST, Act.DELETE)
            .resource(Res.REMINDER, Act.CREATE, Act.LIST, Act.DELETE, Act.PAUSE)
            .alias("routine", Res.REMINDER)
            .alias("cron", Res.REMINDER)
            .alias("Job", Res.REMINDER)
            .build();

    @Test
    void shouldRouteExplicitResourceAndAction() throws StrapValidationException {
        StrapRoute<Res, Act> route = domain.route("memory", "store");
        assertEquals(Res.MEMORY, route.resource());
        assertEquals(Act.STORE, route.action());
    }

    @Test
    void shouldNormalizeAliasesCaseInsensitively() throws StrapValidationException {
        assertEquals(Res.REMINDER, domain.route("routine", "create").resource());
        assertEquals(Res.REMINDER, domain.route("CRON", "pause").resource());
        assertEquals(Res.REMINDER, domain.route("job", "list").resource());
        assertEquals(Res.MEMORY, domain.route(" Memory ", "RECALL").resource());
    }

    @Test
    void shouldInferResourceWhenActionBelongsToOneResource() throws StrapValidationException {
        assertEquals(Res.REMINDER, domain.route(null, "pause").resource());
        assertEquals(Res.MEMORY, domain.route("", "recall").resource());
    }

    @Test
    void shouldRequireResourceForSharedAction() {
        StrapValidationException ex = assertThrows(StrapValidationException.class,
                () -> domain.route(null, "list"));
        assertEquals("resource is required for action 'list' (valid: memory, reminder)", ex.getMessage());
    }

    @Test
    void shouldListValidResourcesForUnknownResource() {
        StrapValidationException ex = assertThrows(StrapValidationException.class,
                () -> domain.route("calendar", "list"));
        assertTrue(ex.getMessage().startsWith("unknown resource: calendar"));
        assertTrue(ex.getMessage().contains("memory"));
        assertTrue(ex.getMessage().contains("reminder"));
    }

    @Test
    void shouldListValidActionsForResource() {
        StrapValidationException ex = assertThrows(StrapValidationException.class,
                () -> domain.route("memory", "pause"));
        assertEquals("unknown action 'pause' for resource 'memory' (valid: store, recall, list, delete)",
                ex.getMessage());
    }

    @Test
    void shouldReportUnknownActionWithoutResource() {
        StrapValidationException ex = assertThrows(StrapValidationException.class,
                () -> domain.route(null, "explode"));
        assertTrue(ex.getMessage().contains("unknown action 'explode'"));
        assertTrue(ex.getMessage().contains("valid resources: memory, reminder"));
    }

    @Test
    void shouldRequireAction() {
        StrapValidationException ex = assertThrows(StrapValidationException.class,
                () -> domain.route("memory", "  "));
        assertTrue(ex.getMessage().startsWith("action is required"));
    }

    @Test
    void shouldAlwaysInferSingleResource() throws StrapValidationException {
        StrapDomain<Single, Act> single = StrapDomain.builder("file", Single.class, Act.class)
                .resource(Single.FILE, Act.CREATE, Act.DELETE)
                .build();

        assertTrue(single.isSingleResource());
        assertEquals(Single.FILE, single.route(null, "create").resource());
    }

    @Test
    void shouldExposeResourceAndActionNamesInDeclarationOrder() {
        assertEquals(List.of("memory", "reminder"), domain.resourceNames());
        assertEquals(List.of("create", "list", "delete", "pause"), domain.actionNames("routine"));
    }

    @Test
    void shouldRejectAliasForUndeclaredResource() {
        StrapDomain.Builder<Res, Act> builder = StrapDomain.builder("agent", Res.class, Act.class)
                .resource(Res.MEMORY, Act.STORE)
                .alias("cron", Res.REMINDER);
        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void shouldRejectAliasShadowingAnotherResource() {
        StrapDomain.Builder<Res, Act> builder = StrapDomain.builder("agent", Res.class, Act.class)
                .resource(Res.MEMORY, Act.STORE)
                .resource(Res.REMINDER, Act.CREATE)
                .alias("memory", Res.REMINDER);
        assertThrows(IllegalStateException.class, builder::build);
    }
}
