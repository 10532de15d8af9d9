package me.golemcore.toolgate.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.toolgate.adapter.outbound.memory.InMemoryMemoryAdapter;
import me.golemcore.toolgate.adapter.outbound.scheduler.InMemorySchedulerAdapter;
import me.golemcore.toolgate.domain.model.Reminder;
import me.golemcore.toolgate.domain.model.RequestContext;
import me.golemcore.toolgate.domain.model.ToolFailureKind;
import me.golemcore.toolgate.domain.model.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AgentToolTest {

    private static final String RESOURCE = "resource";
    private static final String ACTION = "action";

    private InMemorySchedulerAdapter scheduler;
    private AgentTool tool;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-14T08:00:00Z"), ZoneOffset.UTC);
        scheduler = new InMemorySchedulerAdapter(clock);
        tool = new AgentTool(new InMemoryMemoryAdapter(clock), scheduler, new ObjectMapper());
    }

    private ToolResult run(Map<String, Object> params) {
        return tool.execute(RequestContext.user(), params).join();
    }

    // ===== memory =====

    @Test
    void shouldStoreAndRecallMemory() {
        ToolResult stored = run(Map.of(RESOURCE, "memory", ACTION, "store", "key", "color", "value", "blue"));
        assertEquals("Stored memory: color", stored.getContent());

        ToolResult recalled = run(Map.of(ACTION, "recall", "key", "color"));
        assertTrue(recalled.isSuccess());
        assertEquals("blue", recalled.getContent());
    }

    @Test
    void shouldRecallById() {
        run(Map.of(ACTION, "store", "key", "city", "value", "Lisbon"));

        assertEquals("Lisbon", run(Map.of(ACTION, "recall", "id", "city")).getContent());
    }

    @Test
    void shouldReportMissingMemory() {
        ToolResult result = run(Map.of(ACTION, "recall", "key", "nothing"));

        assertTrue(result.isError());
        assertEquals("No memory stored under key: nothing", result.getContent());
    }

    @Test
    void shouldSearchByTag() {
        run(Map.of(ACTION, "store", "key", "editor", "value", "vim", "tags", List.of("tools")));
        run(Map.of(ACTION, "store", "key", "drink", "value", "tea"));

        ToolResult result = run(Map.of(ACTION, "search", "query", "TOOLS"));

        assertEquals("- editor: vim [tools]", result.getContent());
    }

    @Test
    void shouldRequireResourceForSharedListAction() {
        ToolResult result = run(Map.of(ACTION, "list"));

        assertEquals(ToolFailureKind.VALIDATION_FAILED, result.getFailureKind());
        assertTrue(result.getContent().contains("resource is required for action 'list'"));
    }

    @Test
    void shouldRequireValueForStore() {
        ToolResult result = run(Map.of(ACTION, "store", "key", "k"));

        assertEquals(ToolFailureKind.VALIDATION_FAILED, result.getFailureKind());
        assertTrue(result.getContent().startsWith("value is required for action 'store'"));
    }

    @Test
    void shouldDeleteMemory() {
        run(Map.of(ACTION, "store", "key", "tmp", "value", "x"));

        assertTrue(run(Map.of(RESOURCE, "memory", ACTION, "delete", "key", "tmp")).isSuccess());
        assertEquals("No memories stored", run(Map.of(RESOURCE, "memories", ACTION, "list")).getContent());
    }

    // ===== reminders =====

    @Test
    void shouldCreateReminderWithFiveFieldCron() {
        ToolResult result = run(Map.of(ACTION, "create", "schedule", "0 9 * * *", "message", "Stand-up"));

        assertTrue(result.isSuccess());
        Reminder reminder = (Reminder) result.getData();
        assertEquals(Instant.parse("2026-03-14T09:00:00Z"), reminder.getNextRunAt());
        assertTrue(result.getContent().startsWith("Created reminder " + reminder.getId()));
    }

    @ParameterizedTest
    @ValueSource(strings = { "reminder", "reminders", "routine", "cron", "calendar", "jobs" })
    void shouldAcceptReminderAliases(String alias) {
        ToolResult result = run(Map.of(RESOURCE, alias, ACTION, "list"));

        assertTrue(result.isSuccess());
        assertEquals("No reminders", result.getContent());
    }

    @Test
    void shouldRejectInvalidCron() {
        ToolResult result = run(Map.of(ACTION, "create", "schedule", "every day", "message", "x"));

        assertEquals(ToolFailureKind.VALIDATION_FAILED, result.getFailureKind());
        assertTrue(result.getContent().startsWith("Invalid input: "));
    }

    @Test
    void shouldPauseResumeAndRunReminder() {
        Reminder reminder = scheduler.create("standup", "0 9 * * MON-FRI", "Stand-up");
        String id = reminder.getId();

        assertEquals("Paused reminder " + id, run(Map.of(ACTION, "pause", "id", id)).getContent());
        assertTrue(scheduler.get(id).orElseThrow().isPaused());

        assertEquals("Resumed reminder " + id, run(Map.of(ACTION, "resume", "id", id)).getContent());
        assertFalse(scheduler.get(id).orElseThrow().isPaused());

        assertEquals("Reminder " + id + " fired: Stand-up", run(Map.of(ACTION, "run", "id", id)).getContent());
        assertEquals(1, scheduler.get(id).orElseThrow().getRunCount());
    }

    @Test
    void shouldListKnownIdsForUnknownReminder() {
        Reminder reminder = scheduler.create(null, "0 9 * * *", "ping");

        ToolResult result = run(Map.of(RESOURCE, "reminder", ACTION, "delete", "id", "missing"));

        assertTrue(result.isError());
        assertEquals("Unknown reminder: missing (known: " + reminder.getId() + ")", result.getContent());
    }

    @Test
    void shouldExposeBothResources() {
        assertEquals(List.of("memory", "reminder"), tool.getResources());
        assertFalse(tool.requiresApproval());
    }
}
