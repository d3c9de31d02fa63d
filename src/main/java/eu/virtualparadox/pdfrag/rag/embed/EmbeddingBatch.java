package eu.virtualparadox.pdfrag.rag.embed;

import java.util.List;

/**
 * Result of embedding a batch of texts.
 *
 * @param vectors             one vector per input text, in input order; all-zero for unembeddable items
 * @param unembeddableIndexes input positions whose embedding failed
 */
public record EmbeddingBatch(List<float[]> vectors, List<Integer> unembeddableIndexes) {

    public EmbeddingBatch {
        vectors = List.copyOf(vectors);
        unembeddableIndexes = List.copyOf(unembeddableIndexes);
    }

    public boolean isDegraded() {
        return !unembeddableIndexes.isEmpty();
    }

    public boolean isUnembeddable(final int index) {
        return unembeddableIndexes.contains(index);
    }
}
