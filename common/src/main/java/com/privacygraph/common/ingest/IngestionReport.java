package com.privacygraph.common.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Summary of a document ingestion.
 * The found counts are what was actually persisted, the extracted counts what the model returned.
 */
public record IngestionReport(
    @JsonProperty("nodesFound") int nodesFound,
    @JsonProperty("relationshipsFound") int relationshipsFound,
    @JsonProperty("nodesExtracted") int nodesExtracted,
    @JsonProperty("relationshipsExtracted") int relationshipsExtracted,
    @JsonProperty("outcomes") List<IngestionOutcome> outcomes
) {
    public static IngestionReport from(ExtractedGraph graph, List<IngestionOutcome> outcomes) {
        int nodes = (int) outcomes.stream()
                .filter(o -> o.kind() == IngestionOutcome.Kind.NODE && o.isCreated())
                .count();
        int edges = (int) outcomes.stream()
                .filter(o -> o.kind() == IngestionOutcome.Kind.EDGE && o.isCreated())
                .count();
        return new IngestionReport(nodes, edges, graph.nodes().size(), graph.relationships().size(), List.copyOf(outcomes));
    }

    public List<IngestionOutcome> failures() {
        return outcomes.stream().filter(o -> !o.isCreated()).toList();
    }
}
