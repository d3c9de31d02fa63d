package eu.virtualparadox.pdfrag.rag.index;

import eu.virtualparadox.pdfrag.ingest.model.ChunkMetadata;

import java.util.Map;

/**
 * Exact match on one metadata key.
 *
 * @param key   metadata key
 * @param value required value
 */
public record MetadataPredicate(String key, String value) {

    public MetadataPredicate {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
    }

    public static MetadataPredicate sourceEquals(final String sourceIdentity) {
        return new MetadataPredicate(ChunkMetadata.KEY_SOURCE, sourceIdentity);
    }

    public boolean matches(final Map<String, String> metadata) {
        return value.equals(metadata.get(key));
    }
}
