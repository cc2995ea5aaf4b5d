package com.privacygraph.main.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request for finding entities similar to a name and description")
public class SimilarityRequest {

    @NotBlank
    @Schema(description = "Name to match", example = "AWS RDS Database")
    private String name;

    @Schema(description = "Optional description to match")
    private String description;

    @Schema(description = "Maximum number of results, the configured default when omitted", example = "5")
    private Integer limit;
}
