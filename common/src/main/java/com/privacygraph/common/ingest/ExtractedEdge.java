package com.privacygraph.common.ingest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Edge as returned by the extraction model, endpoints referenced by node name.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractedEdge(
    @JsonProperty("source") String source,
    @JsonProperty("target") String target,
    @JsonProperty("relationship_type") String relationshipType,
    @JsonProperty("properties") Map<String, Object> properties
) {
}
