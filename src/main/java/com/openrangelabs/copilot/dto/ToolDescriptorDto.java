package com.openrangelabs.copilot.dto;

import com.openrangelabs.copilot.tool.AgentTool;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Catalog entry describing one agent tool.
 *
 * @author OpenRange Labs
 * @version 1.0
 */
@Value
@Builder
@Schema(description = "Agent tool catalog entry")
public class ToolDescriptorDto {

    @Schema(description = "Name used to invoke the tool", example = "query_vtiger_contact")
    String name;

    @Schema(description = "What the tool does",
            example = "Looks up a contact in the CRM by email and returns name, phone, lead score, status and last activity.")
    String description;

    @Schema(description = "Parameter names mapped to descriptions", example = "{\"email\": \"Email address of the contact\"}")
    Map<String, String> parameters;

    /**
     * Creates a descriptor from a registered tool.
     *
     * @param tool the tool
     * @return the descriptor
     */
    public static ToolDescriptorDto fromTool(AgentTool tool) {
        return ToolDescriptorDto.builder()
                .name(tool.getName())
                .description(tool.getDescription())
                .parameters(tool.getParameters())
                .build();
    }
}
