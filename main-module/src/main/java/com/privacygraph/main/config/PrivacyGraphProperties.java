package com.privacygraph.main.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties of the privacy graph engine.
 * Storage, index and seed keys live under the same prefix but are read with {@code @Value} by the storage components.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "privacy-graph")
public class PrivacyGraphProperties {

    @Valid
    @NotNull
    private Ai ai = new Ai();

    @Valid
    @NotNull
    private Ontology ontology = new Ontology();

    @Valid
    @NotNull
    private Similarity similarity = new Similarity();

    @Valid
    @NotNull
    private Store store = new Store();

    @Data
    public static class Ai {
        /**
         * Base URL of the Ollama server serving both models.
         */
        private String baseUrl = "http://localhost:11434";

        private String embeddingModel = "nomic-embed-text";

        private String chatModel = "llama3.1";

        @NotNull
        private Duration timeout = Duration.ofSeconds(60);

        private int maxRetries = 2;

        public boolean isConfigured() {
            return notBlank(baseUrl) && notBlank(embeddingModel) && notBlank(chatModel);
        }

        private static boolean notBlank(String value) {
            return value != null && !value.isBlank();
        }
    }

    @Data
    public static class Ontology {
        /**
         * Reject entities and relationships that do not fit the catalog. Off by default.
         */
        private boolean enforce = false;
    }

    @Data
    public static class Similarity {
        /**
         * Distance below which callers usually treat a candidate as the same entity.
         * Reported with search results, never applied by the engine.
         */
        private double nearDuplicateThreshold = 0.3;

        @Min(1)
        private int defaultLimit = 5;
    }

    @Data
    public static class Store {
        @Min(1)
        private int defaultListLimit = 100;

        @Min(1)
        private int maxListLimit = 1000;

        /**
         * Limit applied when the caller passes none (or a non-positive one), capped by maxListLimit.
         */
        public int effectiveLimit(int requested) {
            int limit = requested <= 0 ? defaultListLimit : requested;
            return Math.min(limit, maxListLimit);
        }
    }
}
