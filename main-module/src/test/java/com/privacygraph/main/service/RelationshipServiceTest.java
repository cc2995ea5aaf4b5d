package com.privacygraph.main.service;

import com.privacygraph.common.model.DeleteOutcome;
import com.privacygraph.common.model.RelationshipRecord;
import com.privacygraph.common.model.UpdateOutcome;
import com.privacygraph.common.serialization.PropertiesCodec;
import com.privacygraph.main.config.PrivacyGraphProperties;
import com.privacygraph.main.exception.OntologyViolationException;
import com.privacygraph.storage.kv.GraphStorage;
import com.privacygraph.storage.kv.GraphStorageException;
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
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RelationshipServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private GraphStorage storage;

    @Mock
    private OntologyValidator ontologyValidator;

    @Mock
    private EngineStatus engineStatus;

    private RelationshipService relationshipService;

    @BeforeEach
    void setUp() {
        relationshipService = new RelationshipService(storage, new PropertiesCodec(), ontologyValidator, engineStatus,
                new PrivacyGraphProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Создание связи записывает её с меткой времени")
    void createInsertsNewRelationship() throws Exception {
        Optional<String> id = relationshipService.create("a1", "v1", "TRANSFERS_DATA_TO", Map.of("frequency", "daily"));

        assertThat(id).isPresent();
        ArgumentCaptor<RelationshipRecord> captor = ArgumentCaptor.forClass(RelationshipRecord.class);
        verify(storage).insertRelationship(captor.capture());
        RelationshipRecord inserted = captor.getValue();
        assertThat(inserted.id()).isEqualTo(id.get());
        assertThat(inserted.sourceId()).isEqualTo("a1");
        assertThat(inserted.targetId()).isEqualTo("v1");
        assertThat(inserted.createdAt()).isEqualTo(NOW);
        assertThat(inserted.properties()).containsEntry("frequency", "daily");
    }

    @Test
    @DisplayName("Ошибка записи связи: пустой результат")
    void createFailureIsEmpty() throws Exception {
        doThrow(new GraphStorageException("conflict")).when(storage).insertRelationship(any());

        assertThat(relationshipService.create("a1", "v1", "USES", null)).isEmpty();
    }

    @Test
    @DisplayName("Пустой тип связи отклоняется до записи")
    void createRejectsBlankType() {
        assertThatThrownBy(() -> relationshipService.create("a1", "v1", " ", null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(storage);
    }

    @Test
    @DisplayName("Нарушение онтологии не доходит до хранилища")
    void ontologyViolationPreventsWrite() {
        doThrow(new OntologyViolationException(List.of("USES is not declared")))
                .when(ontologyValidator).validateRelationship("a1", "v1", "USES");

        assertThatThrownBy(() -> relationshipService.create("a1", "v1", "USES", null))
                .isInstanceOf(OntologyViolationException.class);
        verifyNoInteractions(storage);
    }

    @Test
    @DisplayName("Пустые фильтры и лимит по умолчанию")
    void getPassesFiltersAndEffectiveLimit() throws Exception {
        when(storage.findRelationships("a1", null, 100)).thenReturn(List.of());

        assertThat(relationshipService.get("a1", "", 0)).isEmpty();
    }

    @Test
    @DisplayName("Обновление пары меняет тип и время, но не дату создания")
    void pairUpdateAppliesChangesToOldest() throws Exception {
        RelationshipRecord oldest = RelationshipRecord.forNewRelationship("r1", "a1", "v1", "USES", Map.of(), NOW.minusSeconds(10));
        ArgumentCaptor<UnaryOperator<RelationshipRecord>> change = ArgumentCaptor.forClass(UnaryOperator.class);
        when(storage.updateFirstRelationshipBetween(eq("a1"), eq("v1"), change.capture()))
                .thenReturn(Optional.of(oldest));

        assertThat(relationshipService.update("a1", "v1", "SENDS_TO", null)).isEqualTo(UpdateOutcome.UPDATED);

        RelationshipRecord updated = change.getValue().apply(oldest);
        assertThat(updated.relationshipType()).isEqualTo("SENDS_TO");
        assertThat(updated.updatedAt()).isEqualTo(NOW);
        assertThat(updated.createdAt()).isEqualTo(oldest.createdAt());
    }

    @Test
    @DisplayName("Результаты обновления: нет связи, ошибка, пустое обновление")
    void updateOutcomes() throws Exception {
        when(storage.updateFirstRelationshipBetween(eq("a1"), eq("v1"), any())).thenReturn(Optional.empty());
        when(storage.updateRelationship(eq("r9"), any())).thenThrow(new GraphStorageException("io"));

        assertThat(relationshipService.update("a1", "v1", "X", null)).isEqualTo(UpdateOutcome.NOT_FOUND);
        assertThat(relationshipService.updateById("r9", null, Map.of())).isEqualTo(UpdateOutcome.FAILED);
        assertThat(relationshipService.updateById("r9", null, null)).isEqualTo(UpdateOutcome.UPDATED);
    }

    @Test
    @DisplayName("Результаты удаления по паре и по ID")
    void deleteOutcomes() throws Exception {
        RelationshipRecord relationship = RelationshipRecord.forNewRelationship("r1", "a1", "v1", "USES", Map.of(), NOW);
        when(storage.deleteFirstRelationshipBetween("a1", "v1")).thenReturn(Optional.of(relationship));
        when(storage.deleteFirstRelationshipBetween("a1", "x")).thenReturn(Optional.empty());
        when(storage.deleteRelationship("r1")).thenThrow(new GraphStorageException("io"));

        assertThat(relationshipService.delete("a1", "v1")).isEqualTo(DeleteOutcome.DELETED);
        assertThat(relationshipService.delete("a1", "x")).isEqualTo(DeleteOutcome.NOT_FOUND);
        assertThat(relationshipService.deleteById("r1")).isEqualTo(DeleteOutcome.FAILED);
    }

    @Test
    @DisplayName("Лимит списка связей ограничен сверху")
    void listAllCapsLimit() throws Exception {
        when(storage.listRelationships(1000, true)).thenReturn(List.of());

        assertThat(relationshipService.listAll(1_000_000, true)).isEmpty();
    }
}
