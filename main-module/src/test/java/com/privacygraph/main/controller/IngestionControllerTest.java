package com.privacygraph.main.controller;

import com.privacygraph.common.ingest.IngestionOutcome;
import com.privacygraph.common.ingest.IngestionReport;
import com.privacygraph.main.exception.GlobalExceptionHandler;
import com.privacygraph.main.exception.GraphExtractionException;
import com.privacygraph.main.service.GraphIngestionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class IngestionControllerTest {

    private static final String DOCUMENT = "Der Lohnlauf nutzt SAP für Gehälter.";

    @Mock
    private GraphIngestionService ingestionService;

    @InjectMocks
    private IngestionController ingestionController;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(ingestionController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Текст документа принимается, отчёт возвращается")
    void ingestText() throws Exception {
        when(ingestionService.ingest("Payroll uses SAP.")).thenReturn(report());

        mockMvc.perform(post("/api/v1/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Payroll uses SAP.\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Document ingested successfully"))
                .andExpect(jsonPath("$.report.nodesFound").value(1))
                .andExpect(jsonPath("$.filename").doesNotExist());
    }

    @Test
    @DisplayName("Файл декодируется как UTF-8")
    void ingestFile() throws Exception {
        when(ingestionService.ingest(DOCUMENT)).thenReturn(report());
        MockMultipartFile file = new MockMultipartFile("file", "payroll.txt", MediaType.TEXT_PLAIN_VALUE,
                DOCUMENT.getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/v1/ingest/file").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.filename").value("payroll.txt"));
    }

    @Test
    @DisplayName("Пустой файл даёт 400")
    void emptyFile() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "empty.txt", MediaType.TEXT_PLAIN_VALUE, new byte[0]);

        mockMvc.perform(multipart("/api/v1/ingest/file").file(file))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(ingestionService);
    }

    @Test
    @DisplayName("Файл не в UTF-8 отклоняется с 400 до обращения к модели")
    void invalidUtf8File() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "latin1.txt", MediaType.TEXT_PLAIN_VALUE,
                new byte[]{(byte) 0xC3, (byte) 0x28});

        mockMvc.perform(multipart("/api/v1/ingest/file").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Uploaded file is not valid UTF-8 text"));
        verifyNoInteractions(ingestionService);
    }

    @Test
    @DisplayName("Запрос без части file даёт 400")
    void missingFilePart() throws Exception {
        MockMultipartFile other = new MockMultipartFile("attachment", "payroll.txt", MediaType.TEXT_PLAIN_VALUE,
                DOCUMENT.getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/v1/ingest/file").file(other))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Bad Request"));
        verifyNoInteractions(ingestionService);
    }

    @Test
    @DisplayName("Неудачное извлечение даёт 422")
    void extractionFailure() throws Exception {
        when(ingestionService.ingest("gibberish")).thenThrow(new GraphExtractionException("Extraction model returned invalid JSON"));

        mockMvc.perform(post("/api/v1/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"gibberish\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.message").value("Extraction model returned invalid JSON"));
    }

    private static IngestionReport report() {
        IngestionOutcome created = IngestionOutcome.created(IngestionOutcome.Kind.NODE, "SAP (Asset)", "a1");
        return new IngestionReport(1, 0, 1, 0, List.of(created));
    }
}
