package eu.virtualparadox.pdfrag.rag.embed;

import lombok.RequiredArgsConstructor;
import org.springframework.ai.embedding.EmbeddingModel;

/**
 * Delegates to a Spring AI {@link EmbeddingModel} (Ollama {@code nomic-embed-text} by default).
 */
@RequiredArgsConstructor
public final class SpringAiEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingModel embeddingModel;
    private final String modelName;

    @Override
    public float[] embed(final String text) {
        return embeddingModel.embed(text);
    }

    @Override
    public String modelName() {
        return modelName;
    }
}
