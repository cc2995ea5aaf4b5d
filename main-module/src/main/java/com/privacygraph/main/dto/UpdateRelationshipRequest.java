package com.privacygraph.main.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Update of a relationship. The endpoints are used only by the pair-keyed endpoint.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Partial relationship update; omitted fields keep their value")
public class UpdateRelationshipRequest {

    @Schema(description = "Source entity id (pair-keyed update only)")
    private String sourceId;

    @Schema(description = "Target entity id (pair-keyed update only)")
    private String targetId;

    @Schema(description = "New relationship type", example = "SHARES_DATA_WITH")
    private String relationshipType;

    @Schema(description = "Replacement property map")
    private Map<String, Object> properties;
}
