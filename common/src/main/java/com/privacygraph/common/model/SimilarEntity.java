package com.privacygraph.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Similarity search hit. Distance is cosine distance in [0, 2], lower is closer.
 */
public record SimilarEntity(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("distance") double distance
) {
}
