package com.privacygraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * The five typed entity collections of the privacy data graph.
 * Each collection maps to its own storage namespace and its own vector index.
 */
public enum EntityCollection {
    ASSETS("Assets", "Asset", "asset_id", "assets"),
    PROCESSING_ACTIVITIES("ProcessingActivities", "ProcessingActivity", "activity_id", "processing-activities"),
    DATA_ELEMENTS("DataElements", "DataElement", "element_id", "data-elements"),
    DATA_SUBJECT_TYPES("DataSubjectTypes", "DataSubjectType", "subject_id", "data-subject-types"),
    VENDORS("Vendors", "Vendor", "vendor_id", "vendors");

    private final String collectionName;
    private final String typeName;
    private final String idColumn;
    private final String pathSegment;

    EntityCollection(String collectionName, String typeName, String idColumn, String pathSegment) {
        this.collectionName = collectionName;
        this.typeName = typeName;
        this.idColumn = idColumn;
        this.pathSegment = pathSegment;
    }

    public String collectionName() {
        return collectionName;
    }

    /**
     * Entity type tag as used by the ontology catalog and the extraction contract.
     */
    @JsonValue
    public String typeName() {
        return typeName;
    }

    public String idColumn() {
        return idColumn;
    }

    public String pathSegment() {
        return pathSegment;
    }

    /**
     * Resolves an entity type tag ("Asset") to its collection.
     */
    public static Optional<EntityCollection> fromTypeName(String typeName) {
        if (typeName == null) {
            return Optional.empty();
        }
        String normalized = typeName.trim();
        for (EntityCollection collection : values()) {
            if (collection.typeName.equalsIgnoreCase(normalized)) {
                return Optional.of(collection);
            }
        }
        return Optional.empty();
    }

    /**
     * Lenient lookup accepting a type tag, a collection name, a URL path segment or the enum constant name.
     */
    public static Optional<EntityCollection> resolve(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim();
        for (EntityCollection collection : values()) {
            if (collection.typeName.equalsIgnoreCase(normalized)
                    || collection.collectionName.equalsIgnoreCase(normalized)
                    || collection.pathSegment.equalsIgnoreCase(normalized)
                    || collection.name().equalsIgnoreCase(normalized.replace('-', '_').toUpperCase(Locale.ROOT))) {
                return Optional.of(collection);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static EntityCollection fromJson(String value) {
        return resolve(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown entity collection: " + value));
    }
}
