package com.privacygraph.main.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Partial entity update; omitted fields keep their value, properties are replaced as a whole")
public class UpdateEntityRequest {

    @Schema(description = "New name", example = "Salesforce Sales Cloud")
    private String name;

    @Schema(description = "New description")
    private String description;

    @Schema(description = "Replacement property map")
    private Map<String, Object> properties;
}
