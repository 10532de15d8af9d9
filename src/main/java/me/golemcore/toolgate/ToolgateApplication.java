package me.golemcore.toolgate;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Toolgate.
 *
 * <p>
 * Toolgate owns the tool capability catalog and the dispatch pipeline every
 * agent tool call passes through: origin checks, approval, hard safeguards, the
 * serialized desktop lane and result truncation.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → REST controllers (tools, approvals, policy)
 * Domain Layer       → CapabilityCatalog, AccessPolicy, ToolRegistry, STRAP tools
 * Infrastructure     → approval broker, desktop lane, Playwright, memory, scheduler
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code toolgate.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ToolgateApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolgateApplication.class, args);
    }

}
