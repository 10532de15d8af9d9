package me.golemcore.toolgate.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.toolgate.adapter.inbound.web.dto.ToolDto;
import me.golemcore.toolgate.domain.catalog.CapabilityCatalog;
import me.golemcore.toolgate.domain.component.DomainToolComponent;
import me.golemcore.toolgate.domain.component.ToolComponent;
import me.golemcore.toolgate.domain.model.Capability;
import me.golemcore.toolgate.domain.service.ToolRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the registered tools.
 */
@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
public class ToolsController {

    private final ToolRegistry toolRegistry;
    private final CapabilityCatalog capabilityCatalog;

    @GetMapping
    public Mono<ResponseEntity<List<ToolDto>>> listTools() {
        List<ToolDto> tools = toolRegistry.names().stream()
                .flatMap(name -> toolRegistry.get(name).stream())
                .map(this::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(tools));
    }

    @GetMapping("/{name}")
    public Mono<ResponseEntity<ToolDto>> getTool(@PathVariable String name) {
        ToolComponent tool = toolRegistry.get(name)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Tool '" + name + "' not found"));
        return Mono.just(ResponseEntity.ok(toDto(tool)));
    }

    private ToolDto toDto(ToolComponent tool) {
        String name = tool.getToolName();
        return ToolDto.builder()
                .name(name)
                .description(tool.getDefinition().getDescription())
                .category(toolRegistry.categoryOf(name).orElse(null))
                .enabled(tool.isEnabled())
                .desktop(toolRegistry.isDesktopTool(name))
                .requiresApproval(tool.requiresApproval())
                .requiresSetup(capabilityCatalog.get(name).map(Capability::isRequiresSetup).orElse(false))
                .resources(tool instanceof DomainToolComponent domainTool ? resourcesOf(domainTool) : null)
                .inputSchema(tool.getDefinition().getInputSchema())
                .build();
    }

    private static Map<String, List<String>> resourcesOf(DomainToolComponent tool) {
        Map<String, List<String>> resources = new LinkedHashMap<>();
        tool.getResources().forEach(resource -> resources.put(resource, tool.getActionsFor(resource)));
        return resources;
    }
}
