package me.golemcore.toolgate.tools;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolgate.domain.model.MemoryEntry;
import me.golemcore.toolgate.domain.model.Reminder;
import me.golemcore.toolgate.domain.model.RequestContext;
import me.golemcore.toolgate.domain.model.ToolDefinition;
import me.golemcore.toolgate.domain.model.ToolFailureKind;
import me.golemcore.toolgate.domain.model.ToolResult;
import me.golemcore.toolgate.domain.strap.AbstractDomainTool;
import me.golemcore.toolgate.domain.strap.StrapAction;
import me.golemcore.toolgate.domain.strap.StrapDomain;
import me.golemcore.toolgate.domain.strap.StrapField;
import me.golemcore.toolgate.domain.strap.StrapResource;
import me.golemcore.toolgate.domain.strap.StrapRoute;
import me.golemcore.toolgate.domain.strap.StrapSchemaBuilder;
import me.golemcore.toolgate.domain.strap.StrapValidationException;
import me.golemcore.toolgate.port.outbound.MemoryPort;
import me.golemcore.toolgate.port.outbound.SchedulerPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Agent self-management tool: long-term memory and reminders.
 *
 * <p>
 * The agent echoes the user's wording, so reminder synonyms (routine, job, cron,
 * schedule, event, calendar) are accepted as resource names.
 */
@Component
@Slf4j
public class AgentTool extends AbstractDomainTool<AgentTool.Resource, AgentTool.Action> {

    public static final String NAME = "agent";

    private static final int DEFAULT_SEARCH_LIMIT = 10;

    public enum Resource implements StrapResource {
        MEMORY("memory", "facts kept across conversations"), REMINDER("reminder", "cron-based reminders");

        private final String wireName;
        private final String description;

        Resource(String wireName, String description) {
            this.wireName = wireName;
            this.description = description;
        }

        @Override
        public String wireName() {
            return wireName;
        }

        @Override
        public String description() {
            return description;
        }
    }

    public enum Action implements StrapAction {
        STORE, RECALL, SEARCH, LIST, DELETE, CREATE, PAUSE, RESUME, RUN;

        @Override
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private static final StrapDomain<Resource, Action> DOMAIN = buildDomain();

    private final MemoryPort memoryPort;
    private final SchedulerPort schedulerPort;
    private final ObjectMapper objectMapper;

    public AgentTool(MemoryPort memoryPort, SchedulerPort schedulerPort, ObjectMapper objectMapper) {
        super(DOMAIN);
        this.memoryPort = memoryPort;
        this.schedulerPort = schedulerPort;
        this.objectMapper = objectMapper;
    }

    private static StrapDomain<Resource, Action> buildDomain() {
        StrapDomain.Builder<Resource, Action> builder = StrapDomain.builder(NAME, Resource.class, Action.class)
                .resource(Resource.MEMORY, Action.STORE, Action.RECALL, Action.SEARCH, Action.LIST, Action.DELETE)
                .resource(Resource.REMINDER, Action.CREATE, Action.LIST, Action.DELETE, Action.PAUSE, Action.RESUME,
                        Action.RUN)
                .alias("memories", Resource.MEMORY)
                .alias("remember", Resource.MEMORY);
        List.of("routine", "routines", "remind", "reminders", "schedule", "schedules", "job", "jobs", "cron",
                "event", "events", "calendar")
                .forEach(alias -> builder.alias(alias, Resource.REMINDER));
        return builder.build();
    }

    @Override
    protected ToolDefinition buildDefinition() {
        return StrapSchemaBuilder.definition(DOMAIN,
                "Manage your own memory and reminders.",
                List.of(
                        StrapField.builder().name("key").description("Memory key")
                                .requiredFor("store").requiredFor("recall").build(),
                        StrapField.builder().name("value").description("Memory value").requiredFor("store").build(),
                        StrapField.builder().name("tags").type("array").items("string")
                                .description("Tags for the memory").build(),
                        StrapField.builder().name("query").description("Search text").requiredFor("search").build(),
                        StrapField.builder().name("limit").type("integer").description("Maximum results")
                                .defaultValue(DEFAULT_SEARCH_LIMIT).build(),
                        StrapField.string("id", "Reminder id (for delete, pause, resume, run) or memory key"),
                        StrapField.string("name", "Reminder name"),
                        StrapField.builder().name("schedule")
                                .description("Cron expression, 5 or 6 fields (e.g. \"0 9 * * MON-FRI\")")
                                .requiredFor("create").build(),
                        StrapField.builder().name("message").description("Reminder text").requiredFor("create")
                                .build()),
                List.of(
                        "agent(resource: \"memory\", action: \"store\", key: \"favorite_color\", value: \"blue\")",
                        "agent(action: \"recall\", key: \"favorite_color\")",
                        "agent(resource: \"reminder\", action: \"create\", schedule: \"0 9 * * *\", "
                                + "message: \"Stand-up\")",
                        "agent(resource: \"reminder\", action: \"list\")"));
    }

    @Override
    protected CompletableFuture<ToolResult> handle(RequestContext context, StrapRoute<Resource, Action> route,
            Map<String, Object> parameters) {
        try {
            AgentInput input = objectMapper.convertValue(parameters, AgentInput.class);
            ToolResult result = route.resource() == Resource.MEMORY ? memory(route, input)
                    : reminder(route, input);
            return CompletableFuture.completedFuture(result);
        } catch (StrapValidationException e) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, e.getMessage()));
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, "Invalid input: " + e.getMessage()));
        }
    }

    // ==================== MEMORY ====================

    private ToolResult memory(StrapRoute<Resource, Action> route, AgentInput input) throws StrapValidationException {
        switch (route.action()) {
        case STORE -> {
            String key = require(input.getKey(), "key", route);
            String value = require(input.getValue(), "value", route);
            MemoryEntry entry = memoryPort.store(key, value, input.getTags());
            return ToolResult.success("Stored memory: " + entry.getKey());
        }
        case RECALL -> {
            String key = require(input.getKey() != null ? input.getKey() : input.getId(), "key", route);
            return memoryPort.recall(key)
                    .map(entry -> ToolResult.success(entry.getValue(), entry))
                    .orElseGet(() -> ToolResult.failure("No memory stored under key: " + key));
        }
        case SEARCH -> {
            String query = require(input.getQuery(), "query", route);
            int limit = input.getLimit() != null && input.getLimit() > 0 ? input.getLimit() : DEFAULT_SEARCH_LIMIT;
            return formatMemories(memoryPort.search(query, limit), "No memories match: " + query);
        }
        case LIST -> {
            return formatMemories(memoryPort.list(), "No memories stored");
        }
        case DELETE -> {
            String key = require(input.getKey() != null ? input.getKey() : input.getId(), "key", route);
            return memoryPort.delete(key) ? ToolResult.success("Deleted memory: " + key)
                    : ToolResult.failure("No memory stored under key: " + key);
        }
        default -> throw new StrapValidationException("unsupported memory action: " + route.action().wireName());
        }
    }

    private static ToolResult formatMemories(List<MemoryEntry> entries, String emptyMessage) {
        if (entries.isEmpty()) {
            return ToolResult.success(emptyMessage);
        }
        String text = entries.stream()
                .map(entry -> "- " + entry.getKey() + ": " + entry.getValue()
                        + (entry.getTags().isEmpty() ? "" : " [" + String.join(", ", entry.getTags()) + "]"))
                .collect(Collectors.joining("\n"));
        return ToolResult.success(text, Map.of("count", entries.size()));
    }

    // ==================== REMINDER ====================

    private ToolResult reminder(StrapRoute<Resource, Action> route, AgentInput input)
            throws StrapValidationException {
        switch (route.action()) {
        case CREATE -> {
            String schedule = require(input.getSchedule(), "schedule", route);
            String message = require(input.getMessage(), "message", route);
            Reminder reminder = schedulerPort.create(input.getName(), schedule, message);
            return ToolResult.success("Created reminder " + reminder.getId() + " (" + reminder.getCronExpression()
                    + "), next run: " + reminder.getNextRunAt(), reminder);
        }
        case LIST -> {
            List<Reminder> reminders = schedulerPort.list();
            if (reminders.isEmpty()) {
                return ToolResult.success("No reminders");
            }
            return ToolResult.success(reminders.stream()
                    .map(r -> "- " + r.getId() + " " + r.getName() + " [" + r.getCronExpression() + "]"
                            + (r.isPaused() ? " (paused)" : ""))
                    .collect(Collectors.joining("\n")), Map.of("count", reminders.size()));
        }
        case DELETE -> {
            String id = require(input.getId(), "id", route);
            return schedulerPort.delete(id) ? ToolResult.success("Deleted reminder " + id) : unknownReminder(id);
        }
        case PAUSE, RESUME -> {
            String id = require(input.getId(), "id", route);
            boolean pause = route.action() == Action.PAUSE;
            Optional<Reminder> updated = schedulerPort.setPaused(id, pause);
            return updated.map(r -> ToolResult.success((pause ? "Paused" : "Resumed") + " reminder " + id, r))
                    .orElseGet(() -> unknownReminder(id));
        }
        case RUN -> {
            String id = require(input.getId(), "id", route);
            return schedulerPort.runNow(id)
                    .map(r -> ToolResult.success("Reminder " + id + " fired: " + r.getMessage(), r))
                    .orElseGet(() -> unknownReminder(id));
        }
        default -> throw new StrapValidationException("unsupported reminder action: " + route.action().wireName());
        }
    }

    private ToolResult unknownReminder(String id) {
        List<String> ids = new ArrayList<>();
        schedulerPort.list().forEach(r -> ids.add(r.getId()));
        return ToolResult.failure("Unknown reminder: " + id + (ids.isEmpty() ? "" : " (known: "
                + String.join(", ", ids) + ")"));
    }

    private static String require(String value, String name, StrapRoute<Resource, Action> route)
            throws StrapValidationException {
        if (value == null || value.isBlank()) {
            throw new StrapValidationException(name + " is required for action '" + route.action().wireName()
                    + "' on resource '" + route.resource().wireName() + "'");
        }
        return value;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class AgentInput {
        private String key;
        private String value;
        private List<String> tags;
        private String query;
        private Integer limit;
        private String id;
        private String name;
        private String schedule;
        private String message;
    }
}
