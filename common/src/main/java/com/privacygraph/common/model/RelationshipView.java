package com.privacygraph.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Relationship as returned by listAll, optionally enriched with endpoint details.
 * Endpoint versions let callers notice that an entity changed after the listing was taken.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RelationshipView(
    @JsonProperty("id") String id,
    @JsonProperty("sourceId") String sourceId,
    @JsonProperty("targetId") String targetId,
    @JsonProperty("relationshipType") String relationshipType,
    @JsonProperty("properties") Map<String, Object> properties,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("updatedAt") Instant updatedAt,
    @JsonProperty("sourceName") String sourceName,
    @JsonProperty("sourceType") String sourceType,
    @JsonProperty("sourceVersion") Long sourceVersion,
    @JsonProperty("targetName") String targetName,
    @JsonProperty("targetType") String targetType,
    @JsonProperty("targetVersion") Long targetVersion
) {
    public static final String UNKNOWN = "Unknown";

    public static RelationshipView of(RelationshipRecord relationship) {
        return new RelationshipView(
            relationship.id(),
            relationship.sourceId(),
            relationship.targetId(),
            relationship.relationshipType(),
            relationship.properties(),
            relationship.createdAt(),
            relationship.updatedAt(),
            null, null, null,
            null, null, null
        );
    }

    /**
     * Enriches the edge with its endpoints. Missing endpoints are reported as "Unknown".
     */
    public static RelationshipView withEndpoints(RelationshipRecord relationship,
                                                 EntityRecord source,
                                                 EntityRecord target) {
        return new RelationshipView(
            relationship.id(),
            relationship.sourceId(),
            relationship.targetId(),
            relationship.relationshipType(),
            relationship.properties(),
            relationship.createdAt(),
            relationship.updatedAt(),
            source != null ? source.name() : UNKNOWN,
            source != null ? source.typeName() : UNKNOWN,
            source != null ? source.version() : null,
            target != null ? target.name() : UNKNOWN,
            target != null ? target.typeName() : UNKNOWN,
            target != null ? target.version() : null
        );
    }
}
