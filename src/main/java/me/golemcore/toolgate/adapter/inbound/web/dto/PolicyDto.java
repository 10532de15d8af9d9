package me.golemcore.toolgate.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyDto {
    private String level;
    private String askMode;
    private List<String> allowlist;
    private Map<String, List<String>> originDeny;
    private boolean autonomous;
}
