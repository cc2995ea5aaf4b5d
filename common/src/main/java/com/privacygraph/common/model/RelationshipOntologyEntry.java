package com.privacygraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Declares that a relationship type is valid from one entity type to another.
 */
public record RelationshipOntologyEntry(
    @JsonProperty("sourceTypeId")
    String sourceTypeId,

    @JsonProperty("sourceType")
    String sourceType,

    @JsonProperty("targetTypeId")
    String targetTypeId,

    @JsonProperty("targetType")
    String targetType,

    @JsonProperty("relationshipType")
    String relationshipType,

    @JsonProperty("description")
    String description
) {
    @JsonCreator
    public RelationshipOntologyEntry {
        if (relationshipType == null || relationshipType.isBlank()) {
            throw new IllegalArgumentException("Relationship type is required");
        }
    }

    public boolean matches(String source, String target, String type) {
        return sourceType != null && sourceType.equalsIgnoreCase(source)
                && targetType != null && targetType.equalsIgnoreCase(target)
                && relationshipType.equalsIgnoreCase(type);
    }
}
