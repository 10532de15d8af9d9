package me.golemcore.toolgate.port.outbound;

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

import me.golemcore.toolgate.domain.model.MemoryEntry;

import java.util.List;
import java.util.Optional;

/**
 * Storage for facts the agent keeps between turns.
 */
public interface MemoryPort {

    MemoryEntry store(String key, String value, List<String> tags);

    Optional<MemoryEntry> recall(String key);

    List<MemoryEntry> search(String query, int limit);

    List<MemoryEntry> list();

    boolean delete(String key);
}
