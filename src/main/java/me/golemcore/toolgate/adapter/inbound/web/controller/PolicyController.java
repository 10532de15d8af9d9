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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolgate.adapter.inbound.web.dto.PolicyDto;
import me.golemcore.toolgate.adapter.inbound.web.dto.PolicyUpdateRequest;
import me.golemcore.toolgate.domain.model.AccessLevel;
import me.golemcore.toolgate.domain.model.AskMode;
import me.golemcore.toolgate.domain.model.PolicySnapshot;
import me.golemcore.toolgate.domain.service.AccessPolicy;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runtime access policy endpoints.
 */
@RestController
@RequestMapping("/api/policy")
@RequiredArgsConstructor
@Slf4j
public class PolicyController {

    private final AccessPolicy accessPolicy;

    @GetMapping
    public Mono<ResponseEntity<PolicyDto>> getPolicy() {
        return Mono.just(ResponseEntity.ok(toDto(accessPolicy.snapshot())));
    }

    @PutMapping
    public Mono<ResponseEntity<PolicyDto>> updatePolicy(@RequestBody PolicyUpdateRequest request) {
        AccessLevel level;
        AskMode askMode;
        try {
            level = request.getLevel() != null ? AccessLevel.parse(request.getLevel()) : null;
            askMode = request.getAskMode() != null ? AskMode.parse(request.getAskMode()) : null;
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        if (request.getAllowlistAdd() != null
                && request.getAllowlistAdd().stream().anyMatch(entry -> entry == null || entry.isBlank())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "allowlistAdd entries must not be blank");
        }
        if (level != null) {
            accessPolicy.setLevel(level);
        }
        if (askMode != null) {
            accessPolicy.setAskMode(askMode);
        }
        if (request.getAllowlistAdd() != null) {
            request.getAllowlistAdd().forEach(accessPolicy::addToAllowlist);
        }
        log.info("[Policy] Updated via API: level={}, askMode={}", accessPolicy.getLevel(),
                accessPolicy.getAskMode());
        return Mono.just(ResponseEntity.ok(toDto(accessPolicy.snapshot())));
    }

    private PolicyDto toDto(PolicySnapshot snapshot) {
        Map<String, List<String>> originDeny = new LinkedHashMap<>();
        snapshot.originDenyList().forEach((origin, tools) -> originDeny.put(origin.wireName(),
                tools.stream().sorted().toList()));
        return PolicyDto.builder()
                .level(wireName(snapshot.level()))
                .askMode(wireName(snapshot.askMode()))
                .allowlist(snapshot.allowlist().stream().sorted().toList())
                .originDeny(originDeny)
                .autonomous(snapshot.autonomous())
                .build();
    }

    private static String wireName(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
