package com.privacygraph.main.service;

import com.privacygraph.common.model.EntityCollection;
import com.privacygraph.common.model.SimilarEntity;
import com.privacygraph.main.config.PrivacyGraphProperties;
import com.privacygraph.main.embedding.EmbeddingProvider;
import com.privacygraph.main.exception.GraphOperationException;
import com.privacygraph.storage.kv.GraphStorageException;
import com.privacygraph.storage.service.EntityStorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Nearest entities of one collection to a (name, description) pair, by cosine distance.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SimilaritySearchService {

    private final EntityStorageService entityStorage;
    private final EmbeddingProvider embeddingProvider;
    private final EngineStatus engineStatus;
    private final PrivacyGraphProperties properties;

    /**
     * @return at most {@code limit} entities, closest first, distances in [0, 2]
     */
    public List<SimilarEntity> findSimilar(EntityCollection collection, String name, String description, int limit) {
        engineStatus.requireReady();
        int effectiveLimit = limit <= 0
                ? properties.getSimilarity().getDefaultLimit()
                : Math.min(limit, properties.getStore().getMaxListLimit());

        float[] query = embeddingProvider.embed(name, description);
        try {
            List<SimilarEntity> similar = entityStorage.findNearest(collection, query, effectiveLimit);
            log.debug("Found {} {} similar to '{}'", similar.size(), collection.collectionName(), name);
            return similar;
        } catch (GraphStorageException e) {
            throw new GraphOperationException("Failed to search " + collection.collectionName(), e);
        }
    }

    /**
     * Distance under which a candidate is usually taken for the same entity. Applying it is up to the caller.
     */
    public double nearDuplicateThreshold() {
        return properties.getSimilarity().getNearDuplicateThreshold();
    }
}
