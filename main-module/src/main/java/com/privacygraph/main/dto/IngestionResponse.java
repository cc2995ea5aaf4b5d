package com.privacygraph.main.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.privacygraph.common.ingest.IngestionReport;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Result of a document ingestion")
public class IngestionResponse {

    @Schema(description = "Name of the uploaded file, absent for text ingestion")
    private String filename;

    @Schema(description = "Human readable summary", example = "Document ingested successfully")
    private String message;

    @Schema(description = "Created items and per-item outcomes")
    private IngestionReport report;
}
