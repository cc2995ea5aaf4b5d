package com.privacygraph.common.ingest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Node as returned by the extraction model. The id is the node name, used to resolve edges.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractedNode(
    @JsonProperty("id") String id,
    @JsonProperty("type") String type,
    @JsonProperty("description") String description,
    @JsonProperty("properties") Map<String, Object> properties
) {
}
