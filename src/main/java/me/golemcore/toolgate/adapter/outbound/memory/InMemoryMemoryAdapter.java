package me.golemcore.toolgate.adapter.outbound.memory;

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
import me.golemcore.toolgate.domain.model.MemoryEntry;
import me.golemcore.toolgate.port.outbound.MemoryPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local memory store. Entries are lost on restart.
 */
@Component
@Slf4j
public class InMemoryMemoryAdapter implements MemoryPort {

    private final Map<String, MemoryEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryMemoryAdapter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public MemoryEntry store(String key, String value, List<String> tags) {
        Instant now = Instant.now(clock);
        MemoryEntry entry = entries.compute(key, (k, existing) -> MemoryEntry.builder()
                .key(k)
                .value(value)
                .tags(tags != null ? new ArrayList<>(tags) : new ArrayList<>())
                .createdAt(existing != null ? existing.getCreatedAt() : now)
                .updatedAt(now)
                .build());
        log.debug("[Memory] Stored {}", key);
        return entry;
    }

    @Override
    public Optional<MemoryEntry> recall(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public List<MemoryEntry> search(String query, int limit) {
        String needle = query.toLowerCase(Locale.ROOT);
        return entries.values().stream()
                .filter(entry -> entry.getKey().toLowerCase(Locale.ROOT).contains(needle)
                        || entry.getValue().toLowerCase(Locale.ROOT).contains(needle)
                        || entry.getTags().stream().anyMatch(tag -> tag.toLowerCase(Locale.ROOT).contains(needle)))
                .sorted(Comparator.comparing(MemoryEntry::getUpdatedAt).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public List<MemoryEntry> list() {
        return entries.values().stream()
                .sorted(Comparator.comparing(MemoryEntry::getKey))
                .toList();
    }

    @Override
    public boolean delete(String key) {
        return entries.remove(key) != null;
    }
}
