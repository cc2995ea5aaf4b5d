package com.privacygraph.main.service;

import com.privacygraph.common.model.EntityCollection;
import com.privacygraph.main.config.PrivacyGraphProperties;
import com.privacygraph.main.exception.EngineNotReadyException;
import com.privacygraph.storage.kv.GraphStorage;
import com.privacygraph.storage.ontology.OntologySeeder;
import com.privacygraph.storage.service.EntityStorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EngineStatusTest {

    @Mock
    private GraphStorage storage;

    @Mock
    private EntityStorageService entityStorage;

    @Mock
    private OntologySeeder ontologySeeder;

    private EngineStatus engineStatus;

    @BeforeEach
    void setUp() {
        engineStatus = new EngineStatus(storage, entityStorage, ontologySeeder, new PrivacyGraphProperties());
        lenient().when(storage.isOpen()).thenReturn(true);
        lenient().when(ontologySeeder.isSeeded()).thenReturn(true);
    }

    @Test
    @DisplayName("Всё поднято: движок готов")
    void ready() {
        when(entityStorage.indexFailures()).thenReturn(Map.of());

        assertThat(engineStatus.isReady()).isTrue();
        assertThat(engineStatus.describe()).isEqualTo("ready");
        assertThatCode(engineStatus::requireReady).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Невосстановленный индекс делает движок неготовым")
    void indexFailureMeansNotReady() {
        when(entityStorage.indexFailures()).thenReturn(Map.of(EntityCollection.ASSETS,
                "Vector dimension mismatch for ASSETS. Expected: 3, got: 4"));

        assertThat(engineStatus.isReady()).isFalse();
        assertThat(engineStatus.describe()).contains("vector index").contains("ASSETS");
        assertThatThrownBy(engineStatus::requireReady).isInstanceOf(EngineNotReadyException.class);
    }

    @Test
    @DisplayName("Закрытое хранилище: движок не готов")
    void closedStorage() {
        when(storage.isOpen()).thenReturn(false);

        assertThat(engineStatus.isReady()).isFalse();
        assertThat(engineStatus.describe()).isEqualTo("graph storage is not open");
    }
}
