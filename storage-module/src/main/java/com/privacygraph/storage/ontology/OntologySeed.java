package com.privacygraph.storage.ontology;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.privacygraph.common.model.EntityType;
import com.privacygraph.common.model.EntityTypeProperty;
import com.privacygraph.common.model.RelationshipOntologyEntry;

import java.util.List;

/** Содержимое ресурса с начальной онтологией */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OntologySeed(
    @JsonProperty("entityTypes") List<EntityType> entityTypes,
    @JsonProperty("entityTypeProperties") List<EntityTypeProperty> entityTypeProperties,
    @JsonProperty("relationshipOntology") List<RelationshipOntologyEntry> relationshipOntology
) {
    @JsonCreator
    public OntologySeed {
        entityTypes = entityTypes == null ? List.of() : entityTypes;
        entityTypeProperties = entityTypeProperties == null ? List.of() : entityTypeProperties;
        relationshipOntology = relationshipOntology == null ? List.of() : relationshipOntology;
    }
}
