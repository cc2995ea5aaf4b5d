package com.privacygraph.main.embedding;

import com.privacygraph.main.exception.EmbeddingException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns an entity's name and description into its embedding vector.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmbeddingProvider {

    private final EmbeddingModel embeddingModel;

    /**
     * Text the embedding is computed from: the name alone when there is no description,
     * otherwise {@code name + ": " + description}.
     */
    public static String embeddingText(String name, String description) {
        if (description == null || description.isBlank()) {
            return name;
        }
        return name + ": " + description;
    }

    public float[] embed(String name, String description) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Name is required to compute an embedding");
        }
        String text = embeddingText(name, description);
        try {
            Response<Embedding> response = embeddingModel.embed(text);
            Embedding embedding = response != null ? response.content() : null;
            if (embedding == null || embedding.vector() == null || embedding.vector().length == 0) {
                throw new EmbeddingException("Embedding model returned no vector for '" + name + "'");
            }
            log.debug("Computed embedding of dimension {} for '{}'", embedding.dimension(), name);
            return embedding.vector();
        } catch (EmbeddingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EmbeddingException("Failed to compute embedding for '" + name + "'", e);
        }
    }
}
