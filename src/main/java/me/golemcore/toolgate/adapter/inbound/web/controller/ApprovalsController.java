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
import me.golemcore.toolgate.adapter.inbound.web.dto.ApprovalDecisionRequest;
import me.golemcore.toolgate.adapter.inbound.web.dto.ApprovalDto;
import me.golemcore.toolgate.adapter.outbound.approval.PendingApprovalBroker;
import me.golemcore.toolgate.domain.model.PendingApproval;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Pending approval queue: lets an operator approve or deny tool calls.
 */
@RestController
@RequestMapping("/api/approvals")
@RequiredArgsConstructor
@Slf4j
public class ApprovalsController {

    private final PendingApprovalBroker approvalBroker;

    @GetMapping
    public Mono<ResponseEntity<List<ApprovalDto>>> listPending() {
        List<ApprovalDto> pending = approvalBroker.listPending().stream()
                .map(this::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(pending));
    }

    @PostMapping("/{id}")
    public Mono<ResponseEntity<Map<String, Object>>> decide(@PathVariable String id,
            @RequestBody ApprovalDecisionRequest request) {
        if (request == null || request.getApproved() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "approved is required");
        }
        boolean approved = request.getApproved();
        if (!approvalBroker.resolve(id, approved)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Approval '" + id + "' not found");
        }
        log.info("[Approvals] {} {} via API", id, approved ? "approved" : "denied");
        return Mono.just(ResponseEntity.ok(Map.of("id", id, "approved", approved)));
    }

    private ApprovalDto toDto(PendingApproval approval) {
        return ApprovalDto.builder()
                .id(approval.id())
                .toolName(approval.toolName())
                .origin(approval.origin() != null ? approval.origin().wireName() : null)
                .sessionId(approval.sessionId())
                .description(approval.description())
                .input(approval.input())
                .createdAt(approval.createdAt())
                .build();
    }
}
