package com.privacygraph.main.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Outcome of a create, update or delete")
public class OperationResponse {

    @Schema(description = "Id of the affected entity or relationship")
    private String id;

    @Schema(description = "Outcome", example = "UPDATED")
    private String outcome;
}
