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

import java.util.List;

/**
 * Tool addressed by a (resource, action) pair instead of a flat name.
 */
public interface DomainToolComponent extends ToolComponent {

    /**
     * Domain name, identical to the tool name.
     */
    String getDomain();

    /**
     * Resources in declaration order.
     */
    List<String> getResources();

    /**
     * Actions accepted for the resource, in declaration order. Unknown resources
     * yield an empty list.
     */
    List<String> getActionsFor(String resource);
}
