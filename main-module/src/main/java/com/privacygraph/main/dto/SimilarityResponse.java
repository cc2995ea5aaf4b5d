package com.privacygraph.main.dto;

import com.privacygraph.common.model.SimilarEntity;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Similar entities of one collection, closest first")
public class SimilarityResponse {

    @Schema(description = "Collection that was searched", example = "Assets")
    private String collection;

    @Schema(description = "Distance below which a candidate is usually the same entity", example = "0.3")
    private double nearDuplicateThreshold;

    @Schema(description = "Matches ordered by cosine distance")
    private List<SimilarEntity> results;
}
