package com.privacygraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

import java.time.Instant;
import java.util.Map;

/**
 * Directed, typed edge between two entity identifiers.
 * Endpoints are not checked against a collection; several edges may share the same ordered pair.
 */
public record RelationshipRecord(
    @NotBlank
    @JsonProperty("id")
    String id,

    @NotBlank
    @JsonProperty("sourceId")
    String sourceId,

    @NotBlank
    @JsonProperty("targetId")
    String targetId,

    @NotBlank
    @JsonProperty("relationshipType")
    String relationshipType,

    @JsonProperty("properties")
    Map<String, Object> properties,

    @JsonProperty("createdAt")
    Instant createdAt,

    @JsonProperty("updatedAt")
    Instant updatedAt
) {
    @JsonCreator
    public RelationshipRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Relationship id cannot be blank");
        }
        if (sourceId == null || sourceId.isBlank() || targetId == null || targetId.isBlank()) {
            throw new IllegalArgumentException("Relationship endpoints cannot be blank");
        }
        if (relationshipType == null || relationshipType.isBlank()) {
            throw new IllegalArgumentException("Relationship type cannot be blank");
        }
        properties = properties == null ? Map.of() : properties;
    }

    public static RelationshipRecord forNewRelationship(String id, String sourceId, String targetId,
                                                        String relationshipType, Map<String, Object> properties,
                                                        Instant now) {
        return new RelationshipRecord(id, sourceId, targetId, relationshipType, properties, now, now);
    }

    /**
     * Applies a partial update. Null arguments keep the current value.
     */
    public RelationshipRecord withChanges(String newType, Map<String, Object> newProperties, Instant now) {
        return new RelationshipRecord(
            id,
            sourceId,
            targetId,
            newType != null ? newType : relationshipType,
            newProperties != null ? newProperties : properties,
            createdAt,
            now
        );
    }

    public boolean touches(String entityId) {
        return sourceId.equals(entityId) || targetId.equals(entityId);
    }
}
