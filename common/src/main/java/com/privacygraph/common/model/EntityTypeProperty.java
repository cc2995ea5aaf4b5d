package com.privacygraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Declared property of an entity type. Advisory unless ontology enforcement is switched on.
 */
public record EntityTypeProperty(
    @NotBlank
    @JsonProperty("typeId")
    String typeId,

    @JsonProperty("entityType")
    String entityType,

    @NotBlank
    @JsonProperty("propertyName")
    String propertyName,

    @JsonProperty("dataType")
    PropertyDataType dataType,

    @JsonProperty("required")
    boolean required,

    @JsonProperty("description")
    String description
) {
    @JsonCreator
    public EntityTypeProperty {
        if (propertyName == null || propertyName.isBlank()) {
            throw new IllegalArgumentException("Property name is required");
        }
        dataType = dataType == null ? PropertyDataType.STRING : dataType;
    }
}
