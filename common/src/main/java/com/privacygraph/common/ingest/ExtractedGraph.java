package com.privacygraph.common.ingest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractedGraph(
    @JsonProperty("nodes") List<ExtractedNode> nodes,
    @JsonProperty("relationships") List<ExtractedEdge> relationships
) {
    @JsonCreator
    public ExtractedGraph {
        // Модель иногда вставляет null в массивы
        nodes = nodes == null ? List.of() : nodes.stream().filter(Objects::nonNull).toList();
        relationships = relationships == null ? List.of() : relationships.stream().filter(Objects::nonNull).toList();
    }
}
