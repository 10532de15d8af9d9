package me.golemcore.toolgate.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial policy update. Null fields are left unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PolicyUpdateRequest {
    private String level;
    private String askMode;
    private List<String> allowlistAdd;
}
