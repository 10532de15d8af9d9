package me.golemcore.toolgate.domain.service;

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
import me.golemcore.toolgate.domain.catalog.CapabilityCatalog;
import me.golemcore.toolgate.domain.component.CommandToolComponent;
import me.golemcore.toolgate.domain.component.ToolComponent;
import me.golemcore.toolgate.domain.model.Platform;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Unconditional hard limits on shell commands and file writes.
 *
 * <p>
 * No access level, approval or autonomous mode lifts these blocks: privilege
 * escalation (sudo, su), wiping the root filesystem, writing to block devices,
 * disk formatting and partitioning, fork bombs, and deleting or rewriting
 * protected system and credential paths. When in doubt the safeguard blocks.
 */
@Component
@Slf4j
public class CommandSafeguard {

    static final String FILE_TOOL = "file";

    private static final String HARD_LIMIT = "This is a hard safety limit that cannot be overridden.";

    private static final List<String> SEPARATORS = List.of(" | ", "| ", " && ", "&& ", " ; ", "; ", " || ", "|| ");

    private static final List<String[]> FORMAT_COMMANDS = List.of(
            new String[] { "mkfs", "cannot format filesystems" },
            new String[] { "fdisk", "cannot modify disk partition tables" },
            new String[] { "gdisk", "cannot modify GPT partition tables" },
            new String[] { "parted", "cannot modify disk partitions" },
            new String[] { "sfdisk", "cannot modify disk partition tables" },
            new String[] { "cfdisk", "cannot modify disk partition tables" },
            new String[] { "wipefs", "cannot wipe filesystem signatures" },
            new String[] { "sgdisk", "cannot modify GPT partition tables" },
            new String[] { "diskutil erasedisk", "cannot erase disks" },
            new String[] { "diskutil erasevolume", "cannot erase volumes" },
            new String[] { "diskutil partitiondisk", "cannot partition disks" },
            new String[] { "format ", "cannot format drives" });

    private static final List<String[]> UNIX_PROTECTED = List.of(
            new String[] { "/bin", "core system binaries" },
            new String[] { "/sbin", "core system admin binaries" },
            new String[] { "/usr/bin", "system binaries" },
            new String[] { "/usr/sbin", "system admin binaries" },
            new String[] { "/usr/lib", "system libraries" },
            new String[] { "/usr/libexec", "system executables" },
            new String[] { "/usr/share", "system shared data" },
            new String[] { "/etc", "system configuration" });

    private static final List<String[]> LINUX_PROTECTED = List.of(
            new String[] { "/boot", "boot loader and kernel" },
            new String[] { "/proc", "kernel process filesystem" },
            new String[] { "/sys", "kernel sysfs" },
            new String[] { "/dev", "device files" },
            new String[] { "/root", "root user home directory" },
            new String[] { "/var/lib/dpkg", "package manager database" },
            new String[] { "/var/lib/rpm", "package manager database" },
            new String[] { "/var/lib/apt", "package manager cache" });

    private static final List<String[]> DARWIN_PROTECTED = List.of(
            new String[] { "/System", "macOS system files" },
            new String[] { "/private/var/db", "macOS system databases" },
            new String[] { "/Library/LaunchDaemons", "system launch daemons" },
            new String[] { "/Library/LaunchAgents", "system launch agents" });

    private static final List<String[]> WINDOWS_PROTECTED = List.of(
            new String[] { "c:\\windows", "Windows system directory" },
            new String[] { "c:\\program files", "installed program files" },
            new String[] { "c:\\programdata", "system program data" },
            new String[] { "c:\\recovery", "Windows recovery partition" });

    private static final List<String[]> USER_PROTECTED = List.of(
            new String[] { ".ssh", "SSH keys and configuration" },
            new String[] { ".gnupg", "GPG keys and configuration" },
            new String[] { ".aws/credentials", "AWS credentials" },
            new String[] { ".aws/config", "AWS configuration" },
            new String[] { ".kube/config", "Kubernetes credentials" },
            new String[] { ".docker/config.json", "Docker registry credentials" });

    private final Platform platform;
    private final Path home;

    @Autowired
    public CommandSafeguard(CapabilityCatalog catalog) {
        this(catalog.platform(), Paths.get(System.getProperty("user.home")));
    }

    public CommandSafeguard(Platform platform, Path home) {
        this.platform = platform;
        this.home = home.toAbsolutePath().normalize();
    }

    /**
     * Checks a tool call. Returns the reason when it must be blocked.
     */
    public Optional<String> check(ToolComponent tool, Map<String, Object> parameters) {
        if (tool instanceof CommandToolComponent commandTool) {
            Optional<String> command = commandTool.extractCommand(parameters);
            if (command.isPresent()) {
                return checkCommand(command.get());
            }
        }
        if (FILE_TOOL.equals(tool.getToolName()) && parameters != null) {
            Object action = parameters.get("action");
            Object path = parameters.get("path");
            if (action != null && path != null) {
                return checkFileWrite(action.toString(), path.toString());
            }
        }
        return Optional.empty();
    }

    public Optional<String> checkCommand(String command) {
        if (command == null || command.isBlank()) {
            return Optional.empty();
        }
        String cmd = command.trim();
        String lower = cmd.toLowerCase(Locale.ROOT);

        if (hasPrefixCommand(lower, "sudo") || lower.contains("$(sudo ") || lower.contains("`sudo ")) {
            return block("sudo is not permitted. Commands must never run with elevated privileges. " + HARD_LIMIT
                    + " If you need root access, run the command manually in a terminal");
        }
        if (hasPrefixCommand(lower, "su") || "su".equals(lower)) {
            return block("su is not permitted. Commands must never run as another user. " + HARD_LIMIT);
        }
        String reason = destructiveReason(cmd, lower);
        if (reason != null) {
            return block(reason + ". " + HARD_LIMIT
                    + " If you need to perform this operation, do it manually in a terminal");
        }
        return Optional.empty();
    }

    public Optional<String> checkFileWrite(String action, String path) {
        String normalizedAction = action.trim().toLowerCase(Locale.ROOT);
        if ((!"write".equals(normalizedAction) && !"edit".equals(normalizedAction)) || path.isBlank()) {
            return Optional.empty();
        }
        Optional<Path> absolute = absolute(path);
        if (absolute.isEmpty()) {
            return Optional.empty();
        }
        String reason = protectedReason(absolute.get());
        if (reason == null) {
            reason = resolvedProtectedReason(absolute.get());
        }
        if (reason != null) {
            return block("cannot " + normalizedAction + " \"" + path + "\": " + reason + ". " + HARD_LIMIT
                    + " If you need to modify system files, do it manually in a terminal");
        }
        return Optional.empty();
    }

    private Optional<String> block(String reason) {
        String message = "BLOCKED: " + reason;
        log.warn("[Safeguard] {}", message);
        return Optional.of(message);
    }

    private static boolean hasPrefixCommand(String lower, String name) {
        if (lower.startsWith(name + " ") || lower.startsWith(name + "\t")) {
            return true;
        }
        return SEPARATORS.stream().anyMatch(separator -> lower.contains(separator + name + " "));
    }

    private String destructiveReason(String cmd, String lower) {
        if (isRootWipe(lower)) {
            return "cannot delete root filesystem, this would destroy the operating system";
        }
        if (lower.contains("dd ") && (lower.contains("of=/dev/") || lower.contains("of= /dev/"))) {
            return "cannot write to block devices with dd";
        }
        for (String[] format : FORMAT_COMMANDS) {
            if (lower.startsWith(format[0]) || lower.contains(" " + format[0])) {
                return format[1];
            }
        }
        if (cmd.contains(":(){ :|:& };:")) {
            return "fork bomb detected";
        }
        if ((lower.contains("> /dev/") || lower.contains(">/dev/")) && !writesToSafeDevice(lower)) {
            return "cannot write to device files";
        }
        if (lower.startsWith("rm ") || lower.startsWith("rm\t") || lower.contains(" rm ")) {
            String target = protectedTarget(cmd, false);
            if (target != null) {
                return "cannot delete " + target;
            }
        }
        if (lower.startsWith("chmod ") || lower.startsWith("chown ")) {
            String target = protectedTarget(cmd, true);
            if (target != null) {
                return "cannot modify permissions on " + target;
            }
        }
        return null;
    }

    static boolean isRootWipe(String lower) {
        for (String pattern : List.of("rm -rf --no-preserve-root /", "rm -rf /", "rm -fr /")) {
            int index = lower.indexOf(pattern);
            while (index >= 0) {
                String after = lower.substring(index + pattern.length());
                if (after.isEmpty() || after.startsWith("*") || " \n;&|".indexOf(after.charAt(0)) >= 0) {
                    return true;
                }
                index = lower.indexOf(pattern, index + 1);
            }
        }
        return false;
    }

    private static boolean writesToSafeDevice(String lower) {
        return List.of("/dev/null", "/dev/stdout", "/dev/stderr").stream()
                .anyMatch(device -> lower.contains("> " + device) || lower.contains(">" + device));
    }

    private String protectedTarget(String cmd, boolean skipModeArgument) {
        String[] parts = cmd.trim().split("\\s+");
        for (int i = 1; i < parts.length; i++) {
            String part = parts[i];
            if (part.startsWith("-")) {
                continue;
            }
            if (skipModeArgument && part.length() <= 5 && !part.contains("/")) {
                continue;
            }
            Optional<Path> absolute = absolute(part);
            if (absolute.isPresent()) {
                String reason = protectedReason(absolute.get());
                if (reason != null) {
                    return "\"" + part + "\": " + reason;
                }
            }
        }
        return null;
    }

    /**
     * Absolute form of an absolute or home-relative path. Relative paths resolve
     * inside the tool workspace and are left to its sandbox.
     */
    private Optional<Path> absolute(String path) {
        String expanded = path.startsWith("~/") ? home + path.substring(1) : path;
        try {
            Path candidate = Paths.get(expanded);
            if (!candidate.isAbsolute() && !isWindowsDrivePath(expanded)) {
                return Optional.empty();
            }
            return Optional.of(candidate.toAbsolutePath().normalize());
        } catch (InvalidPathException e) {
            log.debug("[Safeguard] Unparseable path {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean isWindowsDrivePath(String path) {
        return path.length() > 2 && Character.isLetter(path.charAt(0)) && path.charAt(1) == ':';
    }

    private String resolvedProtectedReason(Path absolute) {
        try {
            if (Files.exists(absolute)) {
                Path real = absolute.toRealPath();
                if (!real.equals(absolute)) {
                    return protectedReason(real);
                }
            }
        } catch (IOException e) {
            return "path could not be resolved (" + e.getMessage() + ")";
        }
        return null;
    }

    String protectedReason(Path absolute) {
        String path = absolute.toString();
        if (platform == Platform.WINDOWS) {
            String lower = path.toLowerCase(Locale.ROOT);
            for (String[] entry : WINDOWS_PROTECTED) {
                if (lower.equals(entry[0]) || lower.startsWith(entry[0] + "\\")) {
                    return entry[1];
                }
            }
        } else {
            if ("/".equals(path)) {
                return "this is the root filesystem";
            }
            String reason = matchPrefix(path, UNIX_PROTECTED);
            if (reason == null) {
                reason = matchPrefix(path, platform == Platform.DARWIN ? DARWIN_PROTECTED : LINUX_PROTECTED);
            }
            if (reason != null) {
                return reason;
            }
        }
        for (String[] entry : USER_PROTECTED) {
            Path protectedPath = home.resolve(entry[0]);
            if (absolute.startsWith(protectedPath)) {
                return entry[1];
            }
        }
        return null;
    }

    private static String matchPrefix(String path, List<String[]> entries) {
        for (String[] entry : entries) {
            if (path.equals(entry[0]) || path.startsWith(entry[0] + "/")) {
                return entry[1];
            }
        }
        return null;
    }
}
