package com.privacygraph.main.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Document to turn into graph entities and relationships")
public class IngestTextRequest {

    @NotBlank
    @Schema(description = "Document text", example = "Acme CRM stores Customer Email for Marketing.")
    private String text;
}
