package com.privacygraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.Map;

/**
 * A typed node of the privacy data graph.
 * The embedding is kept apart from the record and is never exposed to callers.
 */
public record EntityRecord(
    @NotBlank
    @JsonProperty("id")
    String id,

    @NotNull
    @JsonProperty("collection")
    EntityCollection collection,

    @NotBlank
    @JsonProperty("name")
    String name,

    @JsonProperty("description")
    String description,

    @JsonProperty("properties")
    Map<String, Object> properties,

    @JsonProperty("version")
    long version,

    @JsonProperty("createdAt")
    Instant createdAt,

    @JsonProperty("updatedAt")
    Instant updatedAt
) {
    @JsonCreator
    public EntityRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Entity id cannot be blank");
        }
        if (collection == null) {
            throw new IllegalArgumentException("Entity collection cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Entity name cannot be blank");
        }
        properties = properties == null ? Map.of() : properties;
    }

    /**
     * Creates the first version of a new entity.
     */
    public static EntityRecord forNewEntity(String id, EntityCollection collection, String name,
                                            String description, Map<String, Object> properties, Instant now) {
        return new EntityRecord(id, collection, name, description, properties, 1L, now, now);
    }

    /**
     * Applies a partial update. Null arguments keep the current value.
     */
    public EntityRecord withChanges(String newName, String newDescription, Map<String, Object> newProperties, Instant now) {
        return new EntityRecord(
            id,
            collection,
            newName != null ? newName : name,
            newDescription != null ? newDescription : description,
            newProperties != null ? newProperties : properties,
            version + 1,
            createdAt,
            now
        );
    }

    public String typeName() {
        return collection.typeName();
    }
}
