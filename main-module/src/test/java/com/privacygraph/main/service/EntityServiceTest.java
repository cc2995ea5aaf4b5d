package com.privacygraph.main.service;

import com.privacygraph.common.model.DeleteOutcome;
import com.privacygraph.common.model.EntityCollection;
import com.privacygraph.common.model.EntityRecord;
import com.privacygraph.common.model.UpdateOutcome;
import com.privacygraph.common.serialization.PropertiesCodec;
import com.privacygraph.common.serialization.StoredEmbedding;
import com.privacygraph.main.config.PrivacyGraphProperties;
import com.privacygraph.main.embedding.EmbeddingProvider;
import com.privacygraph.main.exception.EmbeddingException;
import com.privacygraph.main.exception.EngineNotReadyException;
import com.privacygraph.storage.kv.CascadeDeletion;
import com.privacygraph.storage.kv.EntityChange;
import com.privacygraph.storage.kv.EntityUpdateFunction;
import com.privacygraph.storage.kv.GraphStorageException;
import com.privacygraph.storage.service.EntityStorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EntityServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private EntityStorageService entityStorage;

    @Mock
    private EmbeddingProvider embeddingProvider;

    @Mock
    private OntologyValidator ontologyValidator;

    @Mock
    private EngineStatus engineStatus;

    private PrivacyGraphProperties properties;
    private EntityService entityService;

    @BeforeEach
    void setUp() {
        properties = new PrivacyGraphProperties();
        entityService = new EntityService(entityStorage, embeddingProvider, new PropertiesCodec(), ontologyValidator,
                engineStatus, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Создание сохраняет запись и эмбеддинг первой версии")
    void createStoresRecordWithEmbedding() throws Exception {
        when(embeddingProvider.embed("Salesforce", "CRM")).thenReturn(new float[]{1f, 2f});

        Optional<String> id = entityService.create(EntityCollection.VENDORS, "Salesforce", "CRM", Map.of("dpa_signed", true));

        assertThat(id).isPresent();
        ArgumentCaptor<EntityRecord> record = ArgumentCaptor.forClass(EntityRecord.class);
        ArgumentCaptor<StoredEmbedding> embedding = ArgumentCaptor.forClass(StoredEmbedding.class);
        verify(entityStorage).create(record.capture(), embedding.capture());
        assertThat(record.getValue().id()).isEqualTo(id.get());
        assertThat(record.getValue().collection()).isEqualTo(EntityCollection.VENDORS);
        assertThat(record.getValue().createdAt()).isEqualTo(NOW);
        assertThat(record.getValue().properties()).containsEntry("dpa_signed", true);
        assertThat(embedding.getValue().entityVersion()).isEqualTo(1L);
        assertThat(embedding.getValue().vector()).containsExactly(1f, 2f);
    }

    @Test
    @DisplayName("Ошибка эмбеддинга: ничего не записано, пустой результат")
    void createWithoutEmbeddingWritesNothing() {
        when(embeddingProvider.embed("Salesforce", null)).thenThrow(new EmbeddingException("model down"));

        assertThat(entityService.create(EntityCollection.VENDORS, "Salesforce", null, null)).isEmpty();
        verifyNoInteractions(entityStorage);
    }

    @Test
    @DisplayName("Ошибка хранилища при создании даёт пустой результат")
    void createStorageFailureIsEmpty() throws Exception {
        when(embeddingProvider.embed(any(), any())).thenReturn(new float[]{1f});
        doThrow(new GraphStorageException("disk full")).when(entityStorage).create(any(), any());

        assertThat(entityService.create(EntityCollection.ASSETS, "CRM", null, null)).isEmpty();
    }

    @Test
    @DisplayName("Пустое имя отклоняется до вызова модели")
    void blankNameIsRejected() {
        assertThatThrownBy(() -> entityService.create(EntityCollection.ASSETS, " ", null, null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(embeddingProvider, entityStorage);
    }

    @Test
    @DisplayName("Поля purpose и legalBasis попадают в свойства процесса")
    void processingActivityConvenienceFields() throws Exception {
        when(embeddingProvider.embed(any(), any())).thenReturn(new float[]{1f});

        entityService.createProcessingActivity("Newsletter", null, "Marketing", "Consent", Map.of("owner", "CMO"));

        ArgumentCaptor<EntityRecord> record = ArgumentCaptor.forClass(EntityRecord.class);
        verify(entityStorage).create(record.capture(), any());
        assertThat(record.getValue().collection()).isEqualTo(EntityCollection.PROCESSING_ACTIVITIES);
        assertThat(record.getValue().properties())
                .containsEntry("purpose", "Marketing")
                .containsEntry("legal_basis", "Consent")
                .containsEntry("owner", "CMO");
    }

    @Test
    @DisplayName("Поле dataType элемента данных становится data_type, пустое пропускается")
    void dataElementConvenienceField() throws Exception {
        when(embeddingProvider.embed(any(), any())).thenReturn(new float[]{1f});

        entityService.createDataElement("Email", null, "Contact", null);
        entityService.createDataElement("Phone", null, null, null);

        ArgumentCaptor<EntityRecord> record = ArgumentCaptor.forClass(EntityRecord.class);
        verify(entityStorage, times(2)).create(record.capture(), any());
        assertThat(record.getAllValues().get(0).properties()).containsEntry("data_type", "Contact");
        assertThat(record.getAllValues().get(1).properties()).doesNotContainKey("data_type");
    }

    @Test
    @DisplayName("Обновление без полей - успешный no-op без чтения")
    void updateWithoutFieldsIsNoOp() throws Exception {
        assertThat(entityService.update(EntityCollection.ASSETS, "a1", null, null, null)).isEqualTo(UpdateOutcome.UPDATED);
        verifyNoInteractions(entityStorage, embeddingProvider);
    }

    @Test
    @DisplayName("Смена имени пересчитывает эмбеддинг из нового имени и текущего описания")
    void nameUpdateRecomputesEmbeddingFromMergedPair() throws Exception {
        EntityRecord current = EntityRecord.forNewEntity("a1", EntityCollection.ASSETS, "Old", "Stored description",
                Map.of(), NOW.minusSeconds(60));
        when(entityStorage.update(eq(EntityCollection.ASSETS), eq("a1"), any())).thenAnswer(invocation -> {
            EntityUpdateFunction function = invocation.getArgument(2);
            return Optional.of(function.apply(current));
        });
        when(embeddingProvider.embed("New", "Stored description")).thenReturn(new float[]{3f});

        assertThat(entityService.update(EntityCollection.ASSETS, "a1", "New", null, null)).isEqualTo(UpdateOutcome.UPDATED);

        ArgumentCaptor<EntityUpdateFunction> function = ArgumentCaptor.forClass(EntityUpdateFunction.class);
        verify(entityStorage).update(eq(EntityCollection.ASSETS), eq("a1"), function.capture());
        EntityChange change = function.getValue().apply(current);
        assertThat(change.record().name()).isEqualTo("New");
        assertThat(change.record().version()).isEqualTo(2L);
        assertThat(change.record().updatedAt()).isEqualTo(NOW);
        assertThat(change.embedding().entityVersion()).isEqualTo(2L);
        assertThat(change.embedding().vector()).containsExactly(3f);
    }

    @Test
    @DisplayName("Смена только свойств не трогает эмбеддинг")
    void propertiesUpdateKeepsEmbedding() throws Exception {
        EntityRecord current = EntityRecord.forNewEntity("a1", EntityCollection.ASSETS, "CRM", null, Map.of(), NOW);
        ArgumentCaptor<EntityUpdateFunction> function = ArgumentCaptor.forClass(EntityUpdateFunction.class);
        when(entityStorage.update(eq(EntityCollection.ASSETS), eq("a1"), function.capture()))
                .thenReturn(Optional.of(EntityChange.of(current)));

        entityService.update(EntityCollection.ASSETS, "a1", null, null, Map.of("tier", 1));

        EntityChange change = function.getValue().apply(current);
        assertThat(change.embeddingChanged()).isFalse();
        assertThat(change.record().properties()).containsEntry("tier", 1);
        verifyNoInteractions(embeddingProvider);
    }

    @Test
    @DisplayName("Исходы обновления: не найдено и сбой")
    void updateOutcomes() throws Exception {
        when(entityStorage.update(eq(EntityCollection.ASSETS), eq("missing"), any())).thenReturn(Optional.empty());
        when(entityStorage.update(eq(EntityCollection.ASSETS), eq("broken"), any()))
                .thenThrow(new GraphStorageException("conflict"));

        assertThat(entityService.update(EntityCollection.ASSETS, "missing", "X", null, null)).isEqualTo(UpdateOutcome.NOT_FOUND);
        assertThat(entityService.update(EntityCollection.ASSETS, "broken", "X", null, null)).isEqualTo(UpdateOutcome.FAILED);
    }

    @Test
    @DisplayName("Исходы удаления")
    void deleteOutcomes() throws Exception {
        EntityRecord entity = EntityRecord.forNewEntity("a1", EntityCollection.ASSETS, "CRM", null, Map.of(), NOW);
        when(entityStorage.delete(EntityCollection.ASSETS, "a1")).thenReturn(Optional.of(new CascadeDeletion(entity, List.of("r1"))));
        when(entityStorage.delete(EntityCollection.ASSETS, "missing")).thenReturn(Optional.empty());
        when(entityStorage.delete(EntityCollection.ASSETS, "broken")).thenThrow(new GraphStorageException("io"));

        assertThat(entityService.delete(EntityCollection.ASSETS, "a1")).isEqualTo(DeleteOutcome.DELETED);
        assertThat(entityService.delete(EntityCollection.ASSETS, "missing")).isEqualTo(DeleteOutcome.NOT_FOUND);
        assertThat(entityService.delete(EntityCollection.ASSETS, "broken")).isEqualTo(DeleteOutcome.FAILED);
    }

    @Test
    @DisplayName("Лимит списка: по умолчанию 100, не больше максимума")
    void listLimitDefaultsAndCap() throws Exception {
        when(entityStorage.list(eq(EntityCollection.ASSETS), anyInt())).thenReturn(List.of());

        entityService.list(EntityCollection.ASSETS, 0);
        entityService.list(EntityCollection.ASSETS, 5000);
        entityService.list(EntityCollection.ASSETS, 7);

        verify(entityStorage).list(EntityCollection.ASSETS, 100);
        verify(entityStorage).list(EntityCollection.ASSETS, 1000);
        verify(entityStorage).list(EntityCollection.ASSETS, 7);
    }

    @Test
    @DisplayName("Неготовый движок отвечает исключением и ничего не делает")
    void notReadyEngineRejectsOperations() {
        doThrow(new EngineNotReadyException("storage closed")).when(engineStatus).requireReady();

        assertThatThrownBy(() -> entityService.create(EntityCollection.ASSETS, "CRM", null, null))
                .isInstanceOf(EngineNotReadyException.class);
        assertThatThrownBy(() -> entityService.list(EntityCollection.ASSETS, 10))
                .isInstanceOf(EngineNotReadyException.class);
        verifyNoInteractions(entityStorage, embeddingProvider);
        verify(ontologyValidator, never()).validateEntity(any(), any());
    }
}
