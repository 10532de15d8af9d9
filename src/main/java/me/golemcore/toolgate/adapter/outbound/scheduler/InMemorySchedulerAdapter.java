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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolgate.domain.model.Reminder;
import me.golemcore.toolgate.port.outbound.SchedulerPort;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps reminder records in memory and computes their next run with Spring's
 * {@link CronExpression}. Firing reminders is the scheduling engine's job.
 */
@Component
@Slf4j
public class InMemorySchedulerAdapter implements SchedulerPort {

    private final Map<String, Reminder> reminders = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySchedulerAdapter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Reminder create(String name, String cronExpression, String message) {
        CronExpression cron = parse(cronExpression);
        Instant now = Instant.now(clock);
        Reminder reminder = Reminder.builder()
                .id(UUID.randomUUID().toString().substring(0, 8))
                .name(name != null && !name.isBlank() ? name : message)
                .cronExpression(cronExpression)
                .message(message)
                .createdAt(now)
                .nextRunAt(next(cron, now))
                .build();
        reminders.put(reminder.getId(), reminder);
        log.info("[Scheduler] Created reminder {} ({})", reminder.getId(), cronExpression);
        return reminder;
    }

    @Override
    public List<Reminder> list() {
        return reminders.values().stream()
                .sorted(Comparator.comparing(Reminder::getCreatedAt))
                .toList();
    }

    @Override
    public Optional<Reminder> get(String id) {
        return Optional.ofNullable(reminders.get(id));
    }

    @Override
    public boolean delete(String id) {
        return reminders.remove(id) != null;
    }

    @Override
    public Optional<Reminder> setPaused(String id, boolean paused) {
        return Optional.ofNullable(reminders.computeIfPresent(id, (key, reminder) -> {
            reminder.setPaused(paused);
            reminder.setNextRunAt(paused ? null : next(parse(reminder.getCronExpression()), Instant.now(clock)));
            return reminder;
        }));
    }

    @Override
    public Optional<Reminder> runNow(String id) {
        return Optional.ofNullable(reminders.computeIfPresent(id, (key, reminder) -> {
            reminder.setRunCount(reminder.getRunCount() + 1);
            reminder.setLastRunAt(Instant.now(clock));
            log.info("[Scheduler] Reminder {} fired manually: {}", id, reminder.getMessage());
            return reminder;
        }));
    }

    private static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression is required");
        }
        String trimmed = expression.trim();
        // Spring expects a seconds field; accept classic five-field crontab lines too
        String normalized = trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
        return CronExpression.parse(normalized);
    }

    private Instant next(CronExpression cron, Instant from) {
        ZoneId zone = clock.getZone();
        ZonedDateTime next = cron.next(ZonedDateTime.ofInstant(from, zone));
        return next != null ? next.toInstant() : null;
    }
}
