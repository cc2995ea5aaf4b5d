package com.privacygraph.storage.ontology;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.privacygraph.common.model.EntityType;
import com.privacygraph.common.model.EntityTypeProperty;
import com.privacygraph.common.model.RelationshipOntologyEntry;
import com.privacygraph.storage.kv.GraphStorage;
import com.privacygraph.storage.kv.GraphStorageException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Загружает каталог типов сущностей и онтологию связей при старте.
 * Записи идут по естественным ключам, повторный запуск ничего не дублирует.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OntologySeeder {

    private final GraphStorage storage;

    @Value("${privacy-graph.ontology.seed-resource:ontology/seed.json}")
    private String seedResource = "ontology/seed.json";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private volatile boolean seeded;

    @PostConstruct
    public void init() {
        if (!storage.isOpen()) {
            log.warn("Graph storage is not open, skipping ontology seeding");
            return;
        }
        try {
            OntologySeed seed = readSeed();
            apply(seed);
            seeded = true;
            log.info("Ontology seeded from {}: {} entity types, {} properties, {} relationship types",
                    seedResource, seed.entityTypes().size(), seed.entityTypeProperties().size(),
                    seed.relationshipOntology().size());
        } catch (IOException | GraphStorageException e) {
            log.error("Failed to seed ontology from {}", seedResource, e);
        }
    }

    public boolean isSeeded() {
        return seeded;
    }

    OntologySeed readSeed() throws IOException {
        try (InputStream in = new ClassPathResource(seedResource).getInputStream()) {
            return objectMapper.readValue(in, OntologySeed.class);
        }
    }

    void apply(OntologySeed seed) throws GraphStorageException {
        for (EntityType entityType : seed.entityTypes()) {
            storage.putEntityType(entityType);
        }
        for (EntityTypeProperty property : seed.entityTypeProperties()) {
            storage.putEntityTypeProperty(property);
        }
        for (RelationshipOntologyEntry entry : seed.relationshipOntology()) {
            storage.putRelationshipOntologyEntry(entry);
        }
    }
}
