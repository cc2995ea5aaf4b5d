package com.privacygraph.main.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request for creating a directed relationship")
public class CreateRelationshipRequest {

    @NotBlank
    @Schema(description = "Source entity id")
    private String sourceId;

    @NotBlank
    @Schema(description = "Target entity id")
    private String targetId;

    @NotBlank
    @Schema(description = "Relationship type", example = "TRANSFERS_DATA_TO")
    private String relationshipType;

    @Schema(description = "Open property map, stored as JSON")
    private Map<String, Object> properties;
}
