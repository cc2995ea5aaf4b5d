package com.privacygraph.main.controller;

import com.privacygraph.common.model.DeleteOutcome;
import com.privacygraph.common.model.EntityCollection;
import com.privacygraph.common.model.EntityRecord;
import com.privacygraph.common.model.SimilarEntity;
import com.privacygraph.common.model.UpdateOutcome;
import com.privacygraph.main.exception.EmbeddingException;
import com.privacygraph.main.exception.GlobalExceptionHandler;
import com.privacygraph.main.service.EntityService;
import com.privacygraph.main.service.SimilaritySearchService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class EntityControllerTest {

    @Mock
    private EntityService entityService;

    @Mock
    private SimilaritySearchService similaritySearchService;

    @InjectMocks
    private EntityController entityController;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(entityController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("POST создаёт сущность и возвращает 201 с ID")
    void createReturnsCreated() throws Exception {
        when(entityService.create(eq(EntityCollection.ASSETS), eq("CRM Platform"), eq("Customer records"), any()))
                .thenReturn(Optional.of("a1"));

        mockMvc.perform(post("/api/v1/entities/assets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"CRM Platform\",\"description\":\"Customer records\","
                                + "\"properties\":{\"hosting_location\":\"eu-west-1\"}}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("a1"))
                .andExpect(jsonPath("$.outcome").value("CREATED"));
    }

    @Test
    @DisplayName("Процесс обработки создаётся с целью и правовым основанием")
    void createProcessingActivityUsesConvenienceFields() throws Exception {
        when(entityService.createProcessingActivity("Payroll", null, "Salary payments", "Contract", null))
                .thenReturn(Optional.of("p1"));

        mockMvc.perform(post("/api/v1/entities/processing-activities")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Payroll\",\"purpose\":\"Salary payments\",\"legalBasis\":\"Contract\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("p1"));
    }

    @Test
    @DisplayName("Неудачное создание даёт 500 FAILED")
    void createFailureReturnsServerError() throws Exception {
        when(entityService.create(eq(EntityCollection.VENDORS), eq("Stripe"), isNull(), isNull()))
                .thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/entities/vendors")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Stripe\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.outcome").value("FAILED"));
    }

    @Test
    @DisplayName("Пустое имя и неизвестная коллекция дают 400")
    void badRequests() throws Exception {
        mockMvc.perform(post("/api/v1/entities/assets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"  \"}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/v1/entities/planets"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown entity collection: planets"));

        verifyNoInteractions(entityService);
    }

    @Test
    @DisplayName("GET возвращает сущность или 404")
    void getEntity() throws Exception {
        EntityRecord entity = EntityRecord.forNewEntity("a1", EntityCollection.ASSETS, "CRM Platform", null,
                Map.of("hosting_location", "eu-west-1"), Instant.parse("2024-05-01T10:00:00Z"));
        when(entityService.get(EntityCollection.ASSETS, "a1")).thenReturn(Optional.of(entity));
        when(entityService.get(EntityCollection.ASSETS, "missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/entities/assets/a1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("CRM Platform"))
                .andExpect(jsonPath("$.version").value(1))
                .andExpect(jsonPath("$.properties.hosting_location").value("eu-west-1"));

        mockMvc.perform(get("/api/v1/entities/assets/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Список передаёт лимит в сервис")
    void listPassesLimit() throws Exception {
        when(entityService.list(EntityCollection.DATA_ELEMENTS, 10)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/entities/data-elements").param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    @DisplayName("Битый JSON и нечисловой лимит дают 400, а не 500")
    void malformedInputIsClientError() throws Exception {
        mockMvc.perform(post("/api/v1/entities/assets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));

        mockMvc.perform(get("/api/v1/entities/assets").param("limit", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid value 'abc' for parameter limit"));

        verifyNoInteractions(entityService);
    }

    @Test
    @DisplayName("Результаты обновления и удаления отображаются в HTTP-статусы")
    void outcomesMapToStatuses() throws Exception {
        when(entityService.update(EntityCollection.ASSETS, "a1", "CRM", null, null)).thenReturn(UpdateOutcome.UPDATED);
        when(entityService.update(EntityCollection.ASSETS, "a2", "CRM", null, null)).thenReturn(UpdateOutcome.NOT_FOUND);
        when(entityService.delete(EntityCollection.ASSETS, "a3")).thenReturn(DeleteOutcome.FAILED);

        mockMvc.perform(put("/api/v1/entities/assets/a1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"CRM\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("UPDATED"));
        mockMvc.perform(put("/api/v1/entities/assets/a2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"CRM\"}"))
                .andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/v1/entities/assets/a3"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.outcome").value("FAILED"));
    }

    @Test
    @DisplayName("Поиск похожих возвращает результаты и порог")
    void findSimilar() throws Exception {
        when(similaritySearchService.findSimilar(EntityCollection.ASSETS, "AWS RDS", null, 3))
                .thenReturn(List.of(new SimilarEntity("a1", "AWS RDS Database", null, 0.12)));
        when(similaritySearchService.nearDuplicateThreshold()).thenReturn(0.3);

        mockMvc.perform(post("/api/v1/entities/assets/similar")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"AWS RDS\",\"limit\":3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.collection").value("Assets"))
                .andExpect(jsonPath("$.nearDuplicateThreshold").value(0.3))
                .andExpect(jsonPath("$.results[0].name").value("AWS RDS Database"))
                .andExpect(jsonPath("$.results[0].distance").value(0.12));
    }

    @Test
    @DisplayName("Недоступная модель эмбеддингов даёт 503")
    void embeddingUnavailable() throws Exception {
        when(similaritySearchService.findSimilar(EntityCollection.VENDORS, "Stripe", null, 0))
                .thenThrow(new EmbeddingException("connection refused"));

        mockMvc.perform(post("/api/v1/entities/vendors/similar")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Stripe\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.path").value("/api/v1/entities/vendors/similar"));
        verify(similaritySearchService).findSimilar(EntityCollection.VENDORS, "Stripe", null, 0);
    }
}
