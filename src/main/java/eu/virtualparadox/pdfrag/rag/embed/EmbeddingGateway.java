package eu.virtualparadox.pdfrag.rag.embed;

import eu.virtualparadox.pdfrag.application.config.EmbeddingProperties;
import eu.virtualparadox.pdfrag.application.executor.BoundedCallExecutor;
import eu.virtualparadox.pdfrag.exception.BackendCallException;
import eu.virtualparadox.pdfrag.exception.BackendUnavailableException;
import eu.virtualparadox.pdfrag.exception.DocumentInputException;
import eu.virtualparadox.pdfrag.rag.index.VectorRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Front door to the embedding provider.
 * <p>
 * Every provider call is bounded by {@code pdfrag.embedding.timeout}. A failing item (provider
 * error, timeout, wrong dimension) never fails the batch: it is replaced by an all-zero vector
 * and reported in {@link EmbeddingBatch#unembeddableIndexes()}. Queries are stricter and fail
 * with {@link BackendUnavailableException} instead of degrading.
 * </p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EmbeddingGateway {

    private static final String CHECK_TEXT = "embedding availability check";

    private final EmbeddingProvider provider;
    private final EmbeddingProperties properties;
    private final BoundedCallExecutor backendCallExecutor;

    /**
     * Embeds texts one by one, preserving order.
     *
     * @param texts texts to embed
     * @return one vector per text
     */
    public EmbeddingBatch embed(final List<String> texts) {
        final List<float[]> vectors = new ArrayList<>(texts.size());
        final List<Integer> unembeddable = new ArrayList<>();

        for (int i = 0; i < texts.size(); i++) {
            try {
                vectors.add(embedOne(texts.get(i)));
            } catch (BackendCallException | RuntimeException e) {
                log.warn("Embedding failed for item {} of {}, substituting a zero vector: {}", i, texts.size(), e.getMessage());
                vectors.add(new float[properties.getDimension()]);
                unembeddable.add(i);
            }
        }
        return new EmbeddingBatch(vectors, unembeddable);
    }

    /**
     * Embeds a query.
     *
     * @param text query text (non-blank)
     * @return query vector
     * @throws DocumentInputException if the query is blank
     * @throws BackendUnavailableException if the provider cannot embed the query
     */
    public float[] embedQuery(final String text) {
        if (text == null || text.isBlank()) {
            throw new DocumentInputException("Query must not be blank");
        }
        try {
            return embedOne(text);
        } catch (BackendCallException | RuntimeException e) {
            throw new BackendUnavailableException("Unable to embed query with " + provider.modelName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks the provider by embedding a short text.
     *
     * @return {@code true} if the provider returned a usable vector in time
     */
    public boolean isAvailable() {
        try {
            embedOne(CHECK_TEXT);
            return true;
        } catch (BackendCallException | RuntimeException e) {
            log.warn("Embedding provider {} is not available: {}", provider.modelName(), e.getMessage());
            return false;
        }
    }

    public String modelName() {
        return provider.modelName();
    }

    public int dimension() {
        return properties.getDimension();
    }

    private float[] embedOne(final String text) throws BackendCallException {
        final float[] vector = backendCallExecutor.call(
                "Embedding with " + provider.modelName(),
                () -> provider.embed(text),
                properties.getTimeout());

        if (vector == null || vector.length != properties.getDimension()) {
            throw new IllegalStateException("Provider returned " + (vector == null ? "no vector" : vector.length + " dimensions")
                    + ", expected " + properties.getDimension());
        }
        if (VectorRecord.isZero(vector)) {
            throw new IllegalStateException("Provider returned an all-zero vector");
        }
        return vector;
    }
}
