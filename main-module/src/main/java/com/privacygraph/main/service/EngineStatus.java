package com.privacygraph.main.service;

import com.privacygraph.common.model.EntityCollection;
import com.privacygraph.main.config.PrivacyGraphProperties;
import com.privacygraph.main.exception.EngineNotReadyException;
import com.privacygraph.storage.kv.GraphStorage;
import com.privacygraph.storage.ontology.OntologySeeder;
import com.privacygraph.storage.service.EntityStorageService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Readiness of the engine: the storage is open, every vector index was restored, the catalog is seeded
 * and the models are configured.
 * Every engine operation checks it first, there is no partially working mode.
 */
@Component
@RequiredArgsConstructor
public class EngineStatus {

    private final GraphStorage storage;
    private final EntityStorageService entityStorage;
    private final OntologySeeder ontologySeeder;
    private final PrivacyGraphProperties properties;

    public boolean isReady() {
        return storage.isOpen()
                && entityStorage.indexFailures().isEmpty()
                && ontologySeeder.isSeeded()
                && properties.getAi().isConfigured();
    }

    public String describe() {
        if (!storage.isOpen()) {
            return "graph storage is not open";
        }
        Map<EntityCollection, String> indexFailures = entityStorage.indexFailures();
        if (!indexFailures.isEmpty()) {
            return "vector index could not be restored for " + indexFailures;
        }
        if (!ontologySeeder.isSeeded()) {
            return "ontology catalog is not seeded";
        }
        if (!properties.getAi().isConfigured()) {
            return "embedding and chat models are not configured";
        }
        return "ready";
    }

    public void requireReady() {
        if (!isReady()) {
            throw new EngineNotReadyException("Privacy graph engine is not ready: " + describe());
        }
    }
}
