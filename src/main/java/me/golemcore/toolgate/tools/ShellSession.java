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

import lombok.Getter;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Background command started by the shell tool. Output is accumulated by a
 * reader thread and consumed incrementally through {@link #poll()}.
 */
@Getter
class ShellSession {

    private final String id;
    private final String command;
    private final Process process;
    private final Instant startedAt;
    private final int maxOutput;
    private final StringBuilder output = new StringBuilder();
    private int readOffset;

    ShellSession(String id, String command, Process process, Instant startedAt, int maxOutput) {
        this.id = id;
        this.command = command;
        this.process = process;
        this.startedAt = startedAt;
        this.maxOutput = maxOutput;
    }

    synchronized void append(String line) {
        if (output.length() < maxOutput) {
            output.append(line).append('\n');
        }
    }

    /**
     * Output produced since the previous poll.
     */
    synchronized String poll() {
        String fresh = output.substring(readOffset);
        readOffset = output.length();
        return fresh;
    }

    synchronized String log() {
        return output.toString();
    }

    boolean isRunning() {
        return process.isAlive();
    }

    String status() {
        return isRunning() ? "running" : "exited (" + process.exitValue() + ")";
    }

    void write(String data) throws IOException {
        OutputStream stdin = process.getOutputStream();
        stdin.write(data.getBytes(StandardCharsets.UTF_8));
        stdin.flush();
    }

    void kill() {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }
}
