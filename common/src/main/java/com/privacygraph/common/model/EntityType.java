package com.privacygraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record EntityType(
    @NotBlank
    @JsonProperty("typeId")
    String typeId,

    @NotBlank
    @JsonProperty("name")
    String name,

    @JsonProperty("description")
    String description,

    @JsonProperty("collectionName")
    String collectionName,

    @JsonProperty("idColumn")
    String idColumn
) {
    @JsonCreator
    public EntityType {
        if (typeId == null || typeId.isBlank() || name == null || name.isBlank()) {
            throw new IllegalArgumentException("Entity type id and name are required");
        }
    }
}
