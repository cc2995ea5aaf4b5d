package com.privacygraph.main.service;

import com.privacygraph.common.ingest.ExtractedEdge;
import com.privacygraph.common.ingest.ExtractedGraph;
import com.privacygraph.common.ingest.ExtractedNode;
import com.privacygraph.common.ingest.IngestionOutcome;
import com.privacygraph.common.ingest.IngestionOutcome.Kind;
import com.privacygraph.common.ingest.IngestionOutcome.Status;
import com.privacygraph.common.ingest.IngestionReport;
import com.privacygraph.common.model.EntityCollection;
import com.privacygraph.main.exception.GraphExtractionException;
import com.privacygraph.main.extraction.GraphExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Document text to graph: extract with the chat model, create the nodes, then the edges between them.
 * Items that fail are skipped and reported; items already created are kept.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphIngestionService {

    private final GraphExtractor graphExtractor;
    private final EntityService entityService;
    private final RelationshipService relationshipService;
    private final EngineStatus engineStatus;

    /**
     * @throws GraphExtractionException when no graph can be extracted; nothing is written then
     */
    public IngestionReport ingest(String documentText) {
        engineStatus.requireReady();
        ExtractedGraph graph = graphExtractor.extract(documentText);

        List<IngestionOutcome> outcomes = new ArrayList<>();
        Map<String, String> idsByName = new HashMap<>();
        for (ExtractedNode node : graph.nodes()) {
            IngestionOutcome outcome = materializeNode(node);
            if (outcome.isCreated()) {
                idsByName.put(node.id(), outcome.createdId());
            }
            outcomes.add(outcome);
        }
        for (ExtractedEdge edge : graph.relationships()) {
            outcomes.add(materializeEdge(edge, idsByName));
        }

        IngestionReport report = IngestionReport.from(graph, outcomes);
        log.info("Ingested document: {}/{} nodes and {}/{} relationships created",
                report.nodesFound(), report.nodesExtracted(),
                report.relationshipsFound(), report.relationshipsExtracted());
        return report;
    }

    private IngestionOutcome materializeNode(ExtractedNode node) {
        String label = node.id() + " (" + node.type() + ")";
        Optional<EntityCollection> collection = EntityCollection.fromTypeName(node.type());
        if (collection.isEmpty()) {
            log.warn("Unknown entity type '{}' for node '{}', skipping", node.type(), node.id());
            return IngestionOutcome.skipped(Kind.NODE, label, Status.SKIPPED_UNKNOWN_TYPE,
                    "Unknown entity type: " + node.type());
        }
        if (node.id() == null || node.id().isBlank()) {
            log.warn("Node of type {} has no name, skipping", node.type());
            return IngestionOutcome.skipped(Kind.NODE, label, Status.FAILED, "Node has no name");
        }

        try {
            Optional<String> id = entityService.create(collection.get(), node.id(), node.description(), node.properties());
            if (id.isEmpty()) {
                log.warn("Could not create {} '{}', skipping", node.type(), node.id());
                return IngestionOutcome.skipped(Kind.NODE, label, Status.FAILED, "Entity could not be created");
            }
            return IngestionOutcome.created(Kind.NODE, label, id.get());
        } catch (RuntimeException e) {
            log.warn("Error creating {} '{}': {}", node.type(), node.id(), e.getMessage());
            return IngestionOutcome.skipped(Kind.NODE, label, Status.FAILED, e.getMessage());
        }
    }

    private IngestionOutcome materializeEdge(ExtractedEdge edge, Map<String, String> idsByName) {
        String label = edge.source() + " -[" + edge.relationshipType() + "]-> " + edge.target();
        String sourceId = edge.source() == null ? null : idsByName.get(edge.source());
        String targetId = edge.target() == null ? null : idsByName.get(edge.target());
        if (sourceId == null || targetId == null) {
            log.warn("Skipping relationship '{}' between '{}' and '{}': one or both entities not found",
                    edge.relationshipType(), edge.source(), edge.target());
            return IngestionOutcome.skipped(Kind.EDGE, label, Status.SKIPPED_UNRESOLVED_ENDPOINT,
                    "Endpoint not created in this document");
        }

        try {
            Optional<String> id = relationshipService.create(sourceId, targetId, edge.relationshipType(), edge.properties());
            if (id.isEmpty()) {
                log.warn("Could not create relationship {}, skipping", label);
                return IngestionOutcome.skipped(Kind.EDGE, label, Status.FAILED, "Relationship could not be created");
            }
            return IngestionOutcome.created(Kind.EDGE, label, id.get());
        } catch (RuntimeException e) {
            log.warn("Error creating relationship {}: {}", label, e.getMessage());
            return IngestionOutcome.skipped(Kind.EDGE, label, Status.FAILED, e.getMessage());
        }
    }
}
