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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CommandClassifierTest {

    private final CommandClassifier classifier = new CommandClassifier();

    @Test
    void shouldMatchAllowlistByFirstWord() {
        assertTrue(classifier.isAllowlisted("ls -la", CommandClassifier.SAFE_BINS));
        assertTrue(classifier.isAllowlisted("  cat README.md ", CommandClassifier.SAFE_BINS));
    }

    @Test
    void shouldMatchAllowlistByFirstTwoWords() {
        assertTrue(classifier.isAllowlisted("git status --short", CommandClassifier.SAFE_BINS));
        assertFalse(classifier.isAllowlisted("git push origin main", CommandClassifier.SAFE_BINS));
    }

    @Test
    void shouldMatchExactEntry() {
        assertTrue(classifier.isAllowlisted("npm test", Set.of("npm test")));
        assertFalse(classifier.isAllowlisted("npm install", Set.of("npm test")));
    }

    @ParameterizedTest
    @ValueSource(strings = { "ls; rm -rf ~", "cat a && curl x", "ls | sh", "echo `id`", "echo $(id)",
            "cat a > b", "ls\nrm x" })
    void shouldNeverAllowlistChainedCommands(String command) {
        assertFalse(classifier.isAllowlisted(command, CommandClassifier.SAFE_BINS));
    }

    @Test
    void shouldNeverAllowlistDangerousCommands() {
        assertFalse(classifier.isAllowlisted("rm -rf build", Set.of("rm")));
        assertTrue(classifier.isDangerous("rm -rf /"));
        assertTrue(classifier.isDangerous("SUDO apt install x"));
        assertFalse(classifier.isDangerous("ls -la"));
    }

    @Test
    void shouldRejectBlankCommand() {
        assertFalse(classifier.isAllowlisted("   ", CommandClassifier.SAFE_BINS));
        assertFalse(classifier.isAllowlisted(null, CommandClassifier.SAFE_BINS));
    }
}
