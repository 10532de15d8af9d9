package me.golemcore.toolgate.tools;

import me.golemcore.toolgate.domain.model.RequestContext;
import me.golemcore.toolgate.domain.model.ToolFailureKind;
import me.golemcore.toolgate.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DateTimeToolTest {

    private final DateTimeTool tool = new DateTimeTool(
            Clock.fixed(Instant.parse("2026-03-14T12:30:00Z"), ZoneOffset.UTC));

    @Test
    void shouldUseClockZoneByDefault() {
        ToolResult result = tool.execute(RequestContext.user(), Map.of()).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getContent().startsWith("2026-03-14 12:30:00"));
        Map<?, ?> data = (Map<?, ?>) result.getData();
        assertEquals("SATURDAY", data.get("dayOfWeek"));
        assertEquals(12, data.get("hour"));
    }

    @Test
    void shouldConvertToRequestedTimezone() {
        ToolResult result = tool.execute(RequestContext.user(), Map.of("timezone", "Asia/Tokyo")).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getContent().startsWith("2026-03-14 21:30:00"));
        assertEquals("Asia/Tokyo", ((Map<?, ?>) result.getData()).get("timezone"));
    }

    @Test
    void shouldRejectInvalidTimezone() {
        ToolResult result = tool.execute(RequestContext.user(), Map.of("timezone", "Mars/Olympus")).join();

        assertTrue(result.isError());
        assertEquals(ToolFailureKind.VALIDATION_FAILED, result.getFailureKind());
        assertEquals("Invalid timezone: Mars/Olympus", result.getContent());
    }

    @Test
    void shouldNotRequireApproval() {
        assertFalse(tool.requiresApproval());
        assertTrue(tool.isEnabled());
        assertEquals("datetime", tool.getToolName());
    }
}
