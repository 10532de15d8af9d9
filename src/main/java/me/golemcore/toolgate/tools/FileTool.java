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
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
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
import me.golemcore.toolgate.infrastructure.config.ToolgateProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File domain tool sandboxed to the workspace directory.
 *
 * <p>
 * Single resource {@code file} with actions read, write, edit, glob and grep.
 * Paths are resolved against the workspace; anything escaping it (including via
 * symlinks) is rejected.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code toolgate.tools.file.workspace} - Sandbox root
 * <li>{@code toolgate.tools.file.max-read-bytes} - Largest file read returns
 * </ul>
 */
@Component
@Slf4j
public class FileTool extends AbstractDomainTool<FileTool.Resource, FileTool.Action> {

    public static final String NAME = "file";

    private static final int MAX_GLOB_RESULTS = 1000;
    private static final int MAX_GREP_MATCHES = 500;

    public enum Resource implements StrapResource {
        FILE;

        @Override
        public String wireName() {
            return "file";
        }
    }

    public enum Action implements StrapAction {
        READ, WRITE, EDIT, GLOB, GREP;

        @Override
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private static final StrapDomain<Resource, Action> DOMAIN = StrapDomain
            .builder(NAME, Resource.class, Action.class)
            .resource(Resource.FILE, Action.READ, Action.WRITE, Action.EDIT, Action.GLOB, Action.GREP)
            .alias("files", Resource.FILE)
            .build();

    private final ObjectMapper objectMapper;
    private final Path workspaceRoot;
    private final boolean enabled;
    private final long maxReadBytes;

    public FileTool(ToolgateProperties properties, ObjectMapper objectMapper) {
        super(DOMAIN);
        ToolgateProperties.FileToolProperties config = properties.getTools().getFile();
        this.objectMapper = objectMapper;
        this.enabled = config.isEnabled();
        this.maxReadBytes = config.getMaxReadBytes();
        this.workspaceRoot = Paths.get(config.getWorkspace()).toAbsolutePath().normalize();
        try {
            Files.createDirectories(workspaceRoot);
        } catch (IOException e) {
            log.error("[File] Failed to create workspace directory: {}", workspaceRoot, e);
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    protected ToolDefinition buildDefinition() {
        return StrapSchemaBuilder.definition(DOMAIN,
                "Read, write, edit and search files in the workspace.",
                List.of(
                        StrapField.builder().name("path").description("File or directory path relative to workspace")
                                .requiredFor("read").requiredFor("write").requiredFor("edit").build(),
                        StrapField.string("content", "Content to write"),
                        StrapField.builder().name("old_string").description("Exact text to replace")
                                .requiredFor("edit").build(),
                        StrapField.builder().name("new_string").description("Replacement text")
                                .requiredFor("edit").build(),
                        StrapField.builder().name("replace_all").type("boolean")
                                .description("Replace every occurrence instead of exactly one").defaultValue(false)
                                .build(),
                        StrapField.builder().name("pattern").description("Glob pattern or regular expression")
                                .requiredFor("glob").requiredFor("grep").build(),
                        StrapField.string("include", "Glob restricting which files grep searches"),
                        StrapField.builder().name("offset").type("integer")
                                .description("First line to read (1-based)").build(),
                        StrapField.builder().name("limit").type("integer")
                                .description("Maximum number of lines to read").build()),
                List.of(
                        "file(action: \"read\", path: \"notes/todo.md\")",
                        "file(action: \"write\", path: \"out.txt\", content: \"hello\")",
                        "file(action: \"edit\", path: \"app.py\", old_string: \"foo\", new_string: \"bar\")",
                        "file(action: \"glob\", pattern: \"**/*.java\")",
                        "file(action: \"grep\", pattern: \"TODO\", include: \"*.java\")"));
    }

    @Override
    protected CompletableFuture<ToolResult> handle(RequestContext context, StrapRoute<Resource, Action> route,
            Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            FileInput input;
            try {
                input = objectMapper.convertValue(parameters, FileInput.class);
            } catch (IllegalArgumentException e) {
                return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, "Invalid input: " + e.getMessage());
            }
            try {
                return switch (route.action()) {
                case READ -> read(input);
                case WRITE -> write(input);
                case EDIT -> edit(input);
                case GLOB -> glob(input);
                case GREP -> grep(input);
                };
            } catch (IOException | UncheckedIOException e) {
                log.warn("[File] {} failed: {}", route.action().wireName(), e.getMessage());
                return ToolResult.failure(route.action().wireName() + " failed: " + e.getMessage());
            }
        });
    }

    private ToolResult read(FileInput input) throws IOException {
        Path path = requirePath(input.getPath());
        if (path == null) {
            return invalidPath(input.getPath());
        }
        if (!Files.isRegularFile(path)) {
            return ToolResult.failure("File not found: " + input.getPath());
        }
        if (Files.size(path) > maxReadBytes) {
            return ToolResult.failure("File too large: " + Files.size(path) + " bytes (max " + maxReadBytes + ")");
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (MalformedInputException e) {
            return ToolResult.failure("File is not UTF-8 text: " + input.getPath());
        }
        int from = input.getOffset() != null ? Math.max(1, input.getOffset()) : 1;
        int to = input.getLimit() != null ? Math.min(lines.size(), from - 1 + Math.max(0, input.getLimit()))
                : lines.size();
        if (from > lines.size()) {
            return ToolResult.success("");
        }
        return ToolResult.success(String.join("\n", lines.subList(from - 1, to)));
    }

    private ToolResult write(FileInput input) throws IOException {
        Path path = requirePath(input.getPath());
        if (path == null) {
            return invalidPath(input.getPath());
        }
        String content = input.getContent() != null ? input.getContent() : "";
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Files.writeString(path, content, StandardCharsets.UTF_8);
        log.info("[File] Wrote {} characters to {}", content.length(), relative(path));
        return ToolResult.success("Wrote " + content.length() + " characters to " + relative(path));
    }

    private ToolResult edit(FileInput input) throws IOException {
        Path path = requirePath(input.getPath());
        if (path == null) {
            return invalidPath(input.getPath());
        }
        if (input.getOldString() == null || input.getOldString().isEmpty() || input.getNewString() == null) {
            return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED,
                    "old_string and new_string are required for action 'edit'");
        }
        if (!Files.isRegularFile(path)) {
            return ToolResult.failure("File not found: " + input.getPath());
        }
        String text = Files.readString(path, StandardCharsets.UTF_8);
        int occurrences = countOccurrences(text, input.getOldString());
        if (occurrences == 0) {
            return ToolResult.failure("old_string not found in " + input.getPath());
        }
        if (occurrences > 1 && !input.isReplaceAll()) {
            return ToolResult.failure("old_string occurs " + occurrences
                    + " times; add more context or set replace_all");
        }
        String updated = input.isReplaceAll() ? text.replace(input.getOldString(), input.getNewString())
                : text.replaceFirst(Pattern.quote(input.getOldString()),
                        Matcher.quoteReplacement(input.getNewString()));
        Files.writeString(path, updated, StandardCharsets.UTF_8);
        return ToolResult.success("Replaced " + (input.isReplaceAll() ? occurrences : 1) + " occurrence(s) in "
                + relative(path));
    }

    private ToolResult glob(FileInput input) throws IOException {
        if (input.getPattern() == null || input.getPattern().isBlank()) {
            return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, "pattern is required for action 'glob'");
        }
        Path base = input.getPath() != null ? resolveSafePath(input.getPath()) : workspaceRoot;
        if (base == null || !Files.isDirectory(base)) {
            return invalidPath(input.getPath());
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + input.getPattern());
        List<String> matches;
        try (Stream<Path> files = Files.walk(base)) {
            matches = files.filter(Files::isRegularFile)
                    .filter(file -> matcher.matches(base.relativize(file)))
                    .limit(MAX_GLOB_RESULTS)
                    .map(this::relative)
                    .sorted()
                    .collect(Collectors.toList());
        }
        if (matches.isEmpty()) {
            return ToolResult.success("No files match " + input.getPattern());
        }
        return ToolResult.success(String.join("\n", matches), Map.of("count", matches.size()));
    }

    private ToolResult grep(FileInput input) throws IOException {
        if (input.getPattern() == null || input.getPattern().isBlank()) {
            return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, "pattern is required for action 'grep'");
        }
        Pattern regex;
        try {
            regex = Pattern.compile(input.getPattern());
        } catch (PatternSyntaxException e) {
            return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, "Invalid pattern: " + e.getDescription());
        }
        Path base = input.getPath() != null ? resolveSafePath(input.getPath()) : workspaceRoot;
        if (base == null || !Files.exists(base)) {
            return invalidPath(input.getPath());
        }
        PathMatcher include = input.getInclude() != null
                ? FileSystems.getDefault().getPathMatcher("glob:" + input.getInclude())
                : null;

        List<String> matches = new ArrayList<>();
        List<Path> candidates;
        try (Stream<Path> files = Files.walk(base)) {
            candidates = files.filter(Files::isRegularFile)
                    .filter(file -> include == null || include.matches(file.getFileName()))
                    .sorted()
                    .collect(Collectors.toList());
        }
        for (Path file : candidates) {
            if (matches.size() >= MAX_GREP_MATCHES || Files.size(file) > maxReadBytes) {
                continue;
            }
            List<String> lines;
            try {
                lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            } catch (MalformedInputException e) {
                log.trace("[File] Skipping binary file {}", file);
                continue;
            }
            for (int i = 0; i < lines.size() && matches.size() < MAX_GREP_MATCHES; i++) {
                if (regex.matcher(lines.get(i)).find()) {
                    matches.add(relative(file) + ":" + (i + 1) + ": " + lines.get(i));
                }
            }
        }
        if (matches.isEmpty()) {
            return ToolResult.success("No matches for " + input.getPattern());
        }
        return ToolResult.success(String.join("\n", matches), Map.of("count", matches.size()));
    }

    private Path requirePath(String path) {
        if (path == null || path.isBlank()) {
            return null;
        }
        return resolveSafePath(path);
    }

    private Path resolveSafePath(String pathStr) {
        try {
            // Normalize and resolve relative to workspace
            Path resolved = workspaceRoot.resolve(pathStr).normalize();

            // Ensure path is still within workspace (logical check)
            if (!resolved.startsWith(workspaceRoot)) {
                return null;
            }

            // Follow symlinks to prevent symlink escape attacks
            if (Files.exists(resolved)) {
                Path realPath = resolved.toRealPath();
                Path realWorkspace = workspaceRoot.toRealPath();
                if (!realPath.startsWith(realWorkspace)) {
                    log.warn("[File] Symlink escape blocked: {} -> {}", resolved, realPath);
                    return null;
                }
            }

            return resolved;
        } catch (InvalidPathException e) {
            return null;
        } catch (IOException e) {
            log.warn("[File] Failed to resolve real path: {}", pathStr);
            return null;
        }
    }

    private ToolResult invalidPath(String path) {
        return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED,
                "Invalid path: " + path + " (paths must stay within the workspace)");
    }

    private String relative(Path path) {
        return workspaceRoot.relativize(path).toString();
    }

    private static int countOccurrences(String text, String needle) {
        int count = 0;
        int index = text.indexOf(needle);
        while (index >= 0) {
            count++;
            index = text.indexOf(needle, index + needle.length());
        }
        return count;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class FileInput {
        private String path;
        private String content;
        @JsonProperty("old_string")
        private String oldString;
        @JsonProperty("new_string")
        private String newString;
        @JsonProperty("replace_all")
        private boolean replaceAll;
        private String pattern;
        private String include;
        private Integer offset;
        private Integer limit;
    }
}
