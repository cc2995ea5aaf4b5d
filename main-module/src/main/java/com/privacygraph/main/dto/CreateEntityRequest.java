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
@Schema(description = "Request for creating an entity in one of the five collections")
public class CreateEntityRequest {

    @NotBlank
    @Schema(description = "Entity name", example = "Salesforce CRM")
    private String name;

    @Schema(description = "Optional free-text description", example = "Customer relationship management platform")
    private String description;

    @Schema(description = "Open property map, stored as JSON", example = "{\"hosting_location\": \"us-east-1\"}")
    private Map<String, Object> properties;

    @Schema(description = "Processing activities only: purpose of the processing", example = "Marketing")
    private String purpose;

    @Schema(description = "Processing activities only: legal basis of the processing", example = "Consent")
    private String legalBasis;

    @Schema(description = "Data elements only: kind of data", example = "Contact")
    private String dataType;
}
