package me.golemcore.toolgate.domain.component;

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

import java.util.Map;
import java.util.Optional;

/**
 * Tool whose input carries a concrete command line. The registry hands the
 * command to the policy classifier and the safeguard.
 */
public interface CommandToolComponent extends ToolComponent {

    /**
     * Returns the command the call would run, or empty when the call does not
     * execute a command (e.g. listing processes).
     */
    Optional<String> extractCommand(Map<String, Object> parameters);
}
