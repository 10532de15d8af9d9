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
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolgate.domain.component.CommandToolComponent;
import me.golemcore.toolgate.domain.model.RequestContext;
import me.golemcore.toolgate.domain.model.ToolDefinition;
import me.golemcore.toolgate.domain.model.ToolFailureKind;
import me.golemcore.toolgate.domain.model.ToolResult;
import me.golemcore.toolgate.domain.strap.AbstractDomainTool;
import me.golemcore.toolgate.domain.strap.StrapAction;
import me.golemcore.toolgate.domain.strap.StrapDomain;
import me.golemcore.toolgate.domain.strap.StrapField;
import me.golemcore.toolgate.domain.strap.StrapRoute;
import me.golemcore.toolgate.domain.strap.StrapResource;
import me.golemcore.toolgate.domain.strap.StrapSchemaBuilder;
import me.golemcore.toolgate.domain.strap.StrapValidationException;
import me.golemcore.toolgate.infrastructure.config.ToolgateProperties;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Shell domain tool: command execution, process inspection and background
 * sessions.
 *
 * <p>
 * Resources:
 * <ul>
 * <li>{@code bash} - exec (foreground, or background when requested)
 * <li>{@code process} - list, kill, info
 * <li>{@code session} - list, poll, log, write, kill
 * </ul>
 *
 * <p>
 * Commands execute via /bin/sh -c (cmd.exe on Windows) in the workspace
 * directory with a sanitized environment. Approval and hard safety blocks are
 * applied by the registry before the tool runs; every call that is not a plain
 * command still requires approval.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code toolgate.tools.shell.workspace} - Working directory
 * <li>{@code toolgate.tools.shell.default-timeout} - Default timeout (seconds)
 * <li>{@code toolgate.tools.shell.max-timeout} - Max timeout (seconds)
 * </ul>
 */
@Component
@Slf4j
public class ShellTool extends AbstractDomainTool<ShellTool.Resource, ShellTool.Action>
        implements CommandToolComponent {

    public static final String NAME = "shell";

    private static final int MAX_OUTPUT_LENGTH = 100_000;

    private static final Set<String> ALLOWED_ENV_VARS = Set.of(
            "PATH", "LANG", "LC_ALL", "LC_CTYPE", "TERM", "TMPDIR",
            "TZ", "SHELL", "USER", "LOGNAME");

    private static final Map<String, String> ERROR_HINTS = Map.of(
            "permission denied", "Hint: the file or directory is not accessible; check the path or use the workspace.",
            "command not found", "Hint: the program is not installed or not on PATH; try `which <name>` first.",
            "no such file or directory", "Hint: the path does not exist; list the directory to find the right name.");

    public enum Resource implements StrapResource {
        BASH("bash", "run commands"), PROCESS("process", "inspect and stop OS processes"),
        SESSION("session", "background commands started with background=true");

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
        EXEC, LIST, KILL, INFO, POLL, LOG, WRITE;

        @Override
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private static final StrapDomain<Resource, Action> DOMAIN = StrapDomain
            .builder(NAME, Resource.class, Action.class)
            .resource(Resource.BASH, Action.EXEC)
            .resource(Resource.PROCESS, Action.LIST, Action.KILL, Action.INFO)
            .resource(Resource.SESSION, Action.LIST, Action.POLL, Action.LOG, Action.WRITE, Action.KILL)
            .alias("sh", Resource.BASH)
            .alias("command", Resource.BASH)
            .alias("processes", Resource.PROCESS)
            .alias("sessions", Resource.SESSION)
            .build();

    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final Path workspaceRoot;
    private final int defaultTimeout;
    private final int maxTimeout;
    private final ExecutorService executor;
    private final Map<String, ShellSession> sessions = new ConcurrentHashMap<>();

    public ShellTool(ToolgateProperties properties, ObjectMapper objectMapper) {
        super(DOMAIN);
        ToolgateProperties.ShellToolProperties config = properties.getTools().getShell();
        this.objectMapper = objectMapper;
        this.enabled = config.isEnabled();
        this.defaultTimeout = config.getDefaultTimeout();
        this.maxTimeout = config.getMaxTimeout();
        this.workspaceRoot = Paths.get(config.getWorkspace()).toAbsolutePath().normalize();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "shell-tool");
            t.setDaemon(true);
            return t;
        });

        try {
            Files.createDirectories(workspaceRoot);
            log.info("[Shell] Workspace: {}", workspaceRoot);
        } catch (IOException e) {
            log.error("[Shell] Failed to create workspace directory: {}", workspaceRoot, e);
        }
    }

    @PreDestroy
    public void shutdown() {
        sessions.values().forEach(ShellSession::kill);
        sessions.clear();
        executor.shutdownNow();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public boolean requiresApproval() {
        return true;
    }

    @Override
    protected ToolDefinition buildDefinition() {
        return StrapSchemaBuilder.definition(DOMAIN,
                "Shell operations in the workspace directory: run commands, manage background sessions "
                        + "and inspect processes.",
                List.of(
                        StrapField.builder().name("command").description("Shell command to execute")
                                .requiredFor("exec").build(),
                        StrapField.builder().name("timeout").type("integer")
                                .description("Timeout in seconds (max " + maxTimeout + ")")
                                .defaultValue(defaultTimeout).build(),
                        StrapField.string("workdir", "Working directory relative to workspace (optional)"),
                        StrapField.builder().name("background").type("boolean")
                                .description("Start the command as a background session").defaultValue(false)
                                .build(),
                        StrapField.builder().name("pid").type("integer").description("Process id")
                                .requiredFor("kill").requiredFor("info").build(),
                        StrapField.builder().name("session_id").description("Background session id")
                                .requiredFor("poll").requiredFor("log").requiredFor("write").build(),
                        StrapField.string("data", "Text written to the session's standard input")),
                List.of(
                        "shell(resource: \"bash\", action: \"exec\", command: \"ls -la\")",
                        "shell(action: \"exec\", command: \"npm run dev\", background: true)",
                        "shell(resource: \"session\", action: \"poll\", session_id: \"ab12cd34\")",
                        "shell(resource: \"process\", action: \"list\")"));
    }

    @Override
    public Optional<String> extractCommand(Map<String, Object> parameters) {
        try {
            StrapRoute<Resource, Action> route = resolve(parameters);
            if (route.resource() != Resource.BASH) {
                return Optional.empty();
            }
            return Optional.ofNullable(stringParam(parameters, "command")).filter(command -> !command.isBlank());
        } catch (StrapValidationException e) {
            return Optional.empty();
        }
    }

    @Override
    protected CompletableFuture<ToolResult> handle(RequestContext context, StrapRoute<Resource, Action> route,
            Map<String, Object> parameters) {
        ShellInput input;
        try {
            input = objectMapper.convertValue(parameters, ShellInput.class);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, "Invalid input: " + e.getMessage()));
        }
        return CompletableFuture.supplyAsync(() -> {
            try {
                return switch (route.resource()) {
                case BASH -> exec(input, route);
                case PROCESS -> process(input, route);
                case SESSION -> session(input, route);
                };
            } catch (StrapValidationException e) {
                return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, e.getMessage());
            }
        }, executor);
    }

    // ==================== BASH ====================

    private ToolResult exec(ShellInput input, StrapRoute<Resource, Action> route) throws StrapValidationException {
        if (input.getCommand() == null || input.getCommand().isBlank()) {
            throw new StrapValidationException("command is required for action '" + route.action().wireName() + "'");
        }
        String command = input.getCommand();
        log.info("[Shell] Executing: {}", truncate(command, 200));

        Path workDir;
        try {
            workDir = resolveWorkDir(input.getWorkdir());
        } catch (IOException e) {
            log.warn("[Shell] Invalid working directory {}: {}", input.getWorkdir(), e.getMessage());
            return ToolResult.failure("Invalid working directory: " + e.getMessage());
        }

        if (input.isBackground()) {
            return startSession(command, workDir);
        }

        int timeout = defaultTimeout;
        if (input.getTimeout() != null) {
            timeout = Math.max(1, Math.min(input.getTimeout(), maxTimeout));
        }
        return executeCommand(command, workDir, timeout);
    }

    private Path resolveWorkDir(String workdir) throws IOException {
        if (workdir == null || workdir.isBlank()) {
            return workspaceRoot;
        }
        Path workDir = workspaceRoot.resolve(workdir).normalize();
        if (!workDir.startsWith(workspaceRoot)) {
            throw new IOException("working directory must be within workspace");
        }
        if (!Files.isDirectory(workDir)) {
            throw new IOException("working directory does not exist: " + workdir);
        }
        // Follow symlinks to prevent symlink escape
        if (!workDir.toRealPath().startsWith(workspaceRoot.toRealPath())) {
            throw new IOException("working directory must be within workspace");
        }
        return workDir;
    }

    private ProcessBuilder processBuilder(String command, Path workDir) {
        ProcessBuilder pb = new ProcessBuilder();
        String os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            pb.command("cmd.exe", "/c", command);
        } else {
            pb.command("/bin/sh", "-c", command);
        }
        pb.directory(workDir.toFile());
        pb.redirectErrorStream(true);

        // Sanitize environment: only keep safe vars, block LD_PRELOAD etc.
        Map<String, String> env = pb.environment();
        env.keySet().retainAll(ALLOWED_ENV_VARS);
        env.put("HOME", workspaceRoot.toString());
        env.put("PWD", workDir.toString());
        return pb;
    }

    private ToolResult executeCommand(String command, Path workDir, int timeoutSeconds) {
        long startTime = System.currentTimeMillis();
        try {
            Process process = processBuilder(command, workDir).start();
            process.getOutputStream().close();

            Future<String> outputFuture = executor.submit(() -> {
                StringBuilder output = new StringBuilder();
                try (BufferedReader reader = new BufferedReader(
                        new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                    String line = reader.readLine();
                    while (line != null) {
                        if (output.length() < MAX_OUTPUT_LENGTH) {
                            output.append(line).append('\n');
                        }
                        line = reader.readLine();
                    }
                }
                return output.toString();
            });

            boolean completed = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            long duration = System.currentTimeMillis() - startTime;

            if (!completed) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                return ToolResult.failure("Command timed out after " + timeoutSeconds + " seconds");
            }

            String output;
            try {
                output = outputFuture.get(1, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                output = "[Output read timeout]";
            }

            int exitCode = process.exitValue();
            Map<String, Object> data = Map.of(
                    "exitCode", exitCode,
                    "duration", duration,
                    "command", command,
                    "workdir", workDir.toString());
            log.info("[Shell] Command finished: exitCode={}, duration={}ms", exitCode, duration);

            if (exitCode == 0) {
                return ToolResult.success(output.isEmpty() ? "(no output)" : output, data);
            }
            return ToolResult.builder()
                    .error(true)
                    .failureKind(ToolFailureKind.EXECUTION_FAILED)
                    .content(withHint("Exit code: " + exitCode + "\n" + output))
                    .data(data)
                    .build();
        } catch (IOException e) {
            return ToolResult.failure(withHint("Failed to execute command: " + e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(ToolFailureKind.CANCELLED, "Command execution interrupted");
        } catch (ExecutionException e) {
            return ToolResult.failure("Error reading output: " + e.getMessage());
        }
    }

    static String withHint(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        return ERROR_HINTS.entrySet().stream()
                .filter(entry -> lower.contains(entry.getKey()))
                .map(Map.Entry::getValue)
                .findFirst()
                .map(hint -> message + "\n" + hint)
                .orElse(message);
    }

    // ==================== SESSION ====================

    private ToolResult startSession(String command, Path workDir) {
        String id = UUID.randomUUID().toString().substring(0, 8);
        try {
            Process process = processBuilder(command, workDir).start();
            ShellSession session = new ShellSession(id, command, process, Instant.now(), MAX_OUTPUT_LENGTH);
            sessions.put(id, session);
            executor.execute(() -> pump(session));
            log.info("[Shell] Started background session {} (pid {})", id, process.pid());
            return ToolResult.success("Started background session " + id + " (pid " + process.pid() + ")",
                    Map.of("sessionId", id, "pid", process.pid()));
        } catch (IOException e) {
            return ToolResult.failure(withHint("Failed to start command: " + e.getMessage()));
        }
    }

    private void pump(ShellSession session) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(session.getProcess().getInputStream(), StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                session.append(line);
                line = reader.readLine();
            }
        } catch (IOException e) {
            session.append("[output stream closed: " + e.getMessage() + "]");
        }
    }

    private ToolResult session(ShellInput input, StrapRoute<Resource, Action> route)
            throws StrapValidationException {
        if (route.action() == Action.LIST) {
            if (sessions.isEmpty()) {
                return ToolResult.success("No background sessions");
            }
            return ToolResult.success(sessions.values().stream()
                    .sorted(Comparator.comparing(ShellSession::getStartedAt))
                    .map(s -> s.getId() + "  " + s.status() + "  " + truncate(s.getCommand(), 80))
                    .collect(Collectors.joining("\n")));
        }

        if (input.getSessionId() == null || input.getSessionId().isBlank()) {
            throw new StrapValidationException("session_id is required for action '" + route.action().wireName()
                    + "'");
        }
        ShellSession session = sessions.get(input.getSessionId());
        if (session == null) {
            return ToolResult.failure("Unknown session: " + input.getSessionId() + " (active: "
                    + String.join(", ", sessions.keySet()) + ")");
        }

        return switch (route.action()) {
        case POLL -> ToolResult.success("[" + session.status() + "]\n" + session.poll());
        case LOG -> ToolResult.success("[" + session.status() + "]\n" + session.log());
        case WRITE -> writeSession(session, input.getData());
        case KILL -> {
            session.kill();
            sessions.remove(session.getId());
            yield ToolResult.success("Killed session " + session.getId());
        }
        default -> throw new StrapValidationException("unsupported session action: " + route.action().wireName());
        };
    }

    private ToolResult writeSession(ShellSession session, String data) {
        if (!session.isRunning()) {
            return ToolResult.failure("Session " + session.getId() + " is not running");
        }
        try {
            session.write(data != null ? data : "");
            return ToolResult.success("Wrote " + (data != null ? data.length() : 0) + " characters to session "
                    + session.getId());
        } catch (IOException e) {
            return ToolResult.failure("Failed to write to session: " + e.getMessage());
        }
    }

    // ==================== PROCESS ====================

    private ToolResult process(ShellInput input, StrapRoute<Resource, Action> route) throws StrapValidationException {
        if (route.action() == Action.LIST) {
            String listing = ProcessHandle.allProcesses()
                    .limit(500)
                    .map(handle -> handle.pid() + "  " + handle.info().command().orElse("?"))
                    .collect(Collectors.joining("\n"));
            return ToolResult.success(listing);
        }

        if (input.getPid() == null) {
            throw new StrapValidationException("pid is required for action '" + route.action().wireName() + "'");
        }
        Optional<ProcessHandle> handle = ProcessHandle.of(input.getPid());
        if (handle.isEmpty()) {
            return ToolResult.failure("No such process: " + input.getPid());
        }

        if (route.action() == Action.KILL) {
            boolean requested = handle.get().destroy();
            return requested ? ToolResult.success("Sent termination signal to " + input.getPid())
                    : ToolResult.failure("Could not terminate process " + input.getPid());
        }

        ProcessHandle.Info info = handle.get().info();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("pid", input.getPid());
        data.put("command", info.command().orElse("?"));
        data.put("user", info.user().orElse("?"));
        data.put("cpu", info.totalCpuDuration().map(Duration::toMillis).map(ms -> ms + "ms").orElse("?"));
        data.put("alive", handle.get().isAlive());
        String text = data.entrySet().stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue())
                .collect(Collectors.joining("\n"));
        return ToolResult.success(text, data);
    }

    private static String truncate(String text, int maxLen) {
        if (text == null) {
            return "<null>";
        }
        if (text.length() <= maxLen) {
            return text;
        }
        return text.substring(0, maxLen) + "...";
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ShellInput {
        private String command;
        private Integer timeout;
        private String workdir;
        private boolean background;
        private Long pid;
        @JsonProperty("session_id")
        private String sessionId;
        private String data;
    }
}
