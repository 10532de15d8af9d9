package me.golemcore.toolgate.adapter.outbound.scheduler;

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

import me.golemcore.toolgate.domain.model.Reminder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySchedulerAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-02T08:30:00Z");

    private InMemorySchedulerAdapter scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new InMemorySchedulerAdapter(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldComputeNextRunFromFiveFieldCron() {
        Reminder reminder = scheduler.create("standup", "0 9 * * *", "Daily standup");

        assertEquals(Instant.parse("2026-03-02T09:00:00Z"), reminder.getNextRunAt());
        assertEquals("standup", reminder.getName());
        assertEquals(8, reminder.getId().length());
    }

    @Test
    void shouldAcceptSixFieldCron() {
        Reminder reminder = scheduler.create(null, "30 0 10 * * *", "Stretch");

        assertEquals(Instant.parse("2026-03-02T10:00:30Z"), reminder.getNextRunAt());
        assertEquals("Stretch", reminder.getName());
    }

    @Test
    void shouldRejectInvalidCron() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.create("bad", "every day", "x"));
        assertThrows(IllegalArgumentException.class, () -> scheduler.create("bad", " ", "x"));
    }

    @Test
    void shouldPauseResumeAndRun() {
        Reminder reminder = scheduler.create("water", "0 12 * * *", "Drink water");

        Reminder paused = scheduler.setPaused(reminder.getId(), true).orElseThrow();
        assertTrue(paused.isPaused());
        assertNull(paused.getNextRunAt());

        Reminder resumed = scheduler.setPaused(reminder.getId(), false).orElseThrow();
        assertEquals(Instant.parse("2026-03-02T12:00:00Z"), resumed.getNextRunAt());

        Reminder fired = scheduler.runNow(reminder.getId()).orElseThrow();
        assertEquals(1, fired.getRunCount());
        assertEquals(NOW, fired.getLastRunAt());
    }

    @Test
    void shouldDeleteReminder() {
        Reminder reminder = scheduler.create("x", "0 12 * * *", "x");

        assertTrue(scheduler.delete(reminder.getId()));
        assertFalse(scheduler.delete(reminder.getId()));
        assertTrue(scheduler.list().isEmpty());
        assertTrue(scheduler.runNow(reminder.getId()).isEmpty());
    }
}
