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

import me.golemcore.toolgate.domain.catalog.CapabilityCatalog;
import me.golemcore.toolgate.domain.catalog.CapabilityProvider;
import me.golemcore.toolgate.domain.model.Capability;
import me.golemcore.toolgate.domain.model.Platform;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Capabilities shipped with the application, in catalog order.
 */
@Component
public class BuiltinCapabilities implements CapabilityProvider {

    public static final String CATEGORY_FILES = "files";
    public static final String CATEGORY_AGENT = "agent";
    public static final String CATEGORY_CORE = "core";

    private final FileTool fileTool;
    private final ShellTool shellTool;
    private final AgentTool agentTool;
    private final BrowserTool browserTool;
    private final DateTimeTool dateTimeTool;

    public BuiltinCapabilities(FileTool fileTool, ShellTool shellTool, AgentTool agentTool, BrowserTool browserTool,
            DateTimeTool dateTimeTool) {
        this.fileTool = fileTool;
        this.shellTool = shellTool;
        this.agentTool = agentTool;
        this.browserTool = browserTool;
        this.dateTimeTool = dateTimeTool;
    }

    @Override
    public List<Capability> capabilities() {
        return List.of(
                Capability.builder().tool(fileTool).platform(Platform.ALL).category(CATEGORY_FILES).build(),
                Capability.builder().tool(shellTool)
                        .platform(Platform.DARWIN).platform(Platform.LINUX).platform(Platform.WINDOWS)
                        .category(CapabilityCatalog.CATEGORY_SYSTEM).build(),
                Capability.builder().tool(agentTool).platform(Platform.ALL).category(CATEGORY_AGENT).build(),
                Capability.builder().tool(browserTool)
                        .platform(Platform.DARWIN).platform(Platform.LINUX).platform(Platform.WINDOWS)
                        .category(CapabilityCatalog.CATEGORY_DESKTOP).requiresSetup(true).build(),
                Capability.builder().tool(dateTimeTool).platform(Platform.ALL).category(CATEGORY_CORE).build());
    }
}
