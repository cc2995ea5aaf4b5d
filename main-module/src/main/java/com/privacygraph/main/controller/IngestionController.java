package com.privacygraph.main.controller;

import com.privacygraph.common.ingest.IngestionReport;
import com.privacygraph.main.dto.IngestTextRequest;
import com.privacygraph.main.dto.IngestionResponse;
import com.privacygraph.main.service.GraphIngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

@Slf4j
@RestController
@RequestMapping("/api/v1/ingest")
@RequiredArgsConstructor
@Tag(name = "Ingestion", description = "Turn documents into graph entities and relationships")
public class IngestionController {

    private final GraphIngestionService ingestionService;

    @PostMapping
    @Operation(summary = "Ingest document text")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Document ingested, see outcomes for skipped items"),
        @ApiResponse(responseCode = "400", description = "Blank text"),
        @ApiResponse(responseCode = "422", description = "No graph could be extracted, nothing was written")
    })
    public ResponseEntity<IngestionResponse> ingestText(@Valid @RequestBody IngestTextRequest request) {
        log.info("Received ingest request: text length={}", request.getText().length());
        IngestionReport report = ingestionService.ingest(request.getText());
        return ResponseEntity.ok(new IngestionResponse(null, "Document ingested successfully", report));
    }

    @PostMapping(value = "/file", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Ingest an uploaded UTF-8 text file")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Document ingested, see outcomes for skipped items"),
        @ApiResponse(responseCode = "400", description = "No file, empty file or not UTF-8 text"),
        @ApiResponse(responseCode = "422", description = "No graph could be extracted, nothing was written")
    })
    public ResponseEntity<IngestionResponse> ingestFile(@RequestPart("file") MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("No file selected for uploading");
        }
        log.info("Received ingest file request: filename={}, size={} bytes", file.getOriginalFilename(), file.getSize());
        String text = decodeUtf8(file.getBytes());
        IngestionReport report = ingestionService.ingest(text);
        return ResponseEntity.ok(new IngestionResponse(file.getOriginalFilename(), "Document ingested successfully", report));
    }

    private static String decodeUtf8(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("Uploaded file is not valid UTF-8 text", e);
        }
    }
}
