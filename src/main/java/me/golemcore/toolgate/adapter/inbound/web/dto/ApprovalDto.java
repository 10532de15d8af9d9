package me.golemcore.toolgate.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalDto {
    private String id;
    private String toolName;
    private String origin;
    private String sessionId;
    private String description;
    private Map<String, Object> input;
    private Instant createdAt;
}
