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
public class ToolDto {
    private String name;
    private String description;
    private String category;
    private boolean enabled;
    private boolean desktop;
    private boolean requiresApproval;
    private boolean requiresSetup;
    /** Actions per resource for domain tools, null for flat tools. */
    private Map<String, List<String>> resources;
    private Map<String, Object> inputSchema;
}
