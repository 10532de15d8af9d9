package me.golemcore.toolgate.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.toolgate.domain.model.RequestContext;
import me.golemcore.toolgate.domain.model.ToolFailureKind;
import me.golemcore.toolgate.domain.model.ToolResult;
import me.golemcore.toolgate.infrastructure.config.ToolgateProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ShellToolTest {

    private static final String ACTION = "action";
    private static final String COMMAND = "command";
    private static final String EXEC = "exec";

    @TempDir
    Path tempDir;

    private ShellTool tool;

    @BeforeEach
    void setUp() {
        ToolgateProperties properties = new ToolgateProperties();
        properties.getTools().getShell().setWorkspace(tempDir.toString());
        properties.getTools().getShell().setDefaultTimeout(30);
        properties.getTools().getShell().setMaxTimeout(300);
        tool = new ShellTool(properties, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        tool.shutdown();
    }

    private ToolResult run(Map<String, Object> params) {
        return tool.execute(RequestContext.user(), params).join();
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldExecuteSimpleCommand() {
        ToolResult result = run(Map.of(ACTION, EXEC, COMMAND, "echo 'Hello, World!'"));

        assertTrue(result.isSuccess());
        assertTrue(result.getContent().contains("Hello, World!"));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldRunInWorkdir() throws Exception {
        Path subdir = Files.createDirectory(tempDir.resolve("subdir"));
        Files.writeString(subdir.resolve("test.txt"), "content");

        ToolResult result = run(Map.of(ACTION, EXEC, COMMAND, "ls", "workdir", "subdir"));

        assertTrue(result.isSuccess());
        assertTrue(result.getContent().contains("test.txt"));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldRejectWorkdirOutsideWorkspace() {
        ToolResult result = run(Map.of(ACTION, EXEC, COMMAND, "ls", "workdir", "../.."));

        assertTrue(result.isError());
        assertTrue(result.getContent().contains("within workspace"));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldTimeOut() {
        ToolResult result = run(Map.of(ACTION, EXEC, COMMAND, "sleep 10", "timeout", 1));

        assertTrue(result.isError());
        assertTrue(result.getContent().contains("timed out"));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldReportNonZeroExitCode() {
        ToolResult result = run(Map.of(ACTION, EXEC, COMMAND, "definitely-not-a-command-xyz"));

        assertTrue(result.isError());
        assertTrue(result.getContent().startsWith("Exit code: 127"));
        assertEquals(127, ((Map<?, ?>) result.getData()).get("exitCode"));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldNotLeakEnvironment() {
        ToolResult result = run(Map.of(ACTION, EXEC, COMMAND, "echo \"home=$HOME\""));

        assertTrue(result.getContent().contains("home=" + tempDir.toAbsolutePath().normalize()));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldRunBackgroundSessionAndPoll() throws Exception {
        ToolResult started = run(Map.of(ACTION, EXEC, COMMAND, "echo ready; sleep 5", "background", true));
        assertTrue(started.isSuccess());
        String sessionId = ((Map<?, ?>) started.getData()).get("sessionId").toString();

        ToolResult poll = null;
        for (int i = 0; i < 50; i++) {
            poll = run(Map.of("resource", "session", ACTION, "log", "session_id", sessionId));
            if (poll.getContent().contains("ready")) {
                break;
            }
            Thread.sleep(100);
        }
        assertNotNull(poll);
        assertTrue(poll.getContent().contains("ready"));

        ToolResult listed = run(Map.of("resource", "sessions", ACTION, "list"));
        assertTrue(listed.getContent().contains(sessionId));

        ToolResult killed = run(Map.of("resource", "session", ACTION, "kill", "session_id", sessionId));
        assertTrue(killed.isSuccess());
    }

    @Test
    void shouldReportUnknownSession() {
        ToolResult result = run(Map.of("resource", "session", ACTION, "poll", "session_id", "nope"));

        assertTrue(result.isError());
        assertTrue(result.getContent().startsWith("Unknown session: nope"));
    }

    @Test
    void shouldRequireSessionId() {
        ToolResult result = run(Map.of("resource", "session", ACTION, "poll"));

        assertEquals(ToolFailureKind.VALIDATION_FAILED, result.getFailureKind());
    }

    @Test
    void shouldRequireResourceForSharedAction() {
        ToolResult result = run(Map.of(ACTION, "kill", "pid", 1));

        assertEquals(ToolFailureKind.VALIDATION_FAILED, result.getFailureKind());
        assertTrue(result.getContent().contains("resource is required for action 'kill'"));
    }

    @Test
    void shouldDescribeCurrentProcess() {
        long pid = ProcessHandle.current().pid();

        ToolResult result = run(Map.of("resource", "process", ACTION, "info", "pid", pid));

        assertTrue(result.isSuccess());
        assertTrue(result.getContent().contains("pid: " + pid));
    }

    @Test
    void shouldExtractCommandOnlyForBash() {
        assertEquals(Optional.of("ls -la"), tool.extractCommand(Map.of(ACTION, EXEC, COMMAND, "ls -la")));
        assertEquals(Optional.of("ls"), tool.extractCommand(Map.of("resource", "sh", ACTION, EXEC, COMMAND, "ls")));
        assertTrue(tool.extractCommand(Map.of("resource", "process", ACTION, "list")).isEmpty());
        assertTrue(tool.extractCommand(Map.of(ACTION, "bogus", COMMAND, "ls")).isEmpty());
    }

    @Test
    void shouldAlwaysRequireApproval() {
        assertTrue(tool.requiresApproval());
        assertEquals("shell", tool.getToolName());
        assertEquals(List.of("bash", "process", "session"), tool.getResources());
    }

    @Test
    void shouldAppendHintForKnownErrors() {
        assertTrue(ShellTool.withHint("sh: foo: command not found").contains("Hint:"));
        assertEquals("all good", ShellTool.withHint("all good"));
    }
}
