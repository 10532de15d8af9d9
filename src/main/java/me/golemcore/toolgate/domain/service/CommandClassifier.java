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

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Classifies shell command lines as allowlisted (safe to run without asking)
 * or dangerous.
 *
 * <p>
 * A command matches the allowlist by exact text, by its first word, or by its
 * first two words ({@code git status --short} matches {@code git status}). A
 * command that chains or substitutes other commands never matches, since only
 * its first segment would have been checked.
 */
@Component
public class CommandClassifier {

    /**
     * Read-only commands that never need approval under the allowlist level.
     */
    public static final Set<String> SAFE_BINS = Set.of(
            "ls", "pwd", "cat", "head", "tail", "grep", "find", "which", "type",
            "jq", "cut", "sort", "uniq", "wc", "echo", "date", "env", "printenv",
            "git status", "git log", "git diff", "git branch", "git show",
            "go version", "node --version", "python --version");

    private static final List<String> DANGEROUS_PATTERNS = List.of(
            "rm -rf", "rm -r", "rmdir",
            "sudo", "su ",
            "chmod 777", "chown",
            "dd ", "mkfs",
            "> /dev/", ">/dev/",
            "curl | sh", "curl | bash", "wget | sh",
            "eval ", "exec ",
            ":(){ :|:& };:");

    private static final List<String> CHAINING_TOKENS = List.of(";", "&&", "||", "|", "`", "$(", "\n", ">", "<");

    public boolean isAllowlisted(String command, Set<String> allowlist) {
        if (command == null) {
            return false;
        }
        String trimmed = command.trim();
        if (trimmed.isEmpty() || isChained(trimmed) || isDangerous(trimmed)) {
            return false;
        }
        if (allowlist.contains(trimmed)) {
            return true;
        }
        String[] words = trimmed.split("\\s+");
        if (allowlist.contains(words[0])) {
            return true;
        }
        return words.length >= 2 && allowlist.contains(words[0] + " " + words[1]);
    }

    public boolean isDangerous(String command) {
        if (command == null) {
            return false;
        }
        String lower = command.toLowerCase(Locale.ROOT);
        return DANGEROUS_PATTERNS.stream().anyMatch(lower::contains);
    }

    private boolean isChained(String command) {
        return CHAINING_TOKENS.stream().anyMatch(command::contains);
    }
}
