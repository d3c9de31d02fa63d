package eu.virtualparadox.pdfrag.rag.index;

import eu.virtualparadox.pdfrag.ingest.model.ChunkMetadata;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A stored chunk: id, embedding, original text and a copy of the chunk metadata.
 *
 * @param chunkId  unique chunk identifier
 * @param vector   embedding of fixed dimension
 * @param text     chunk text
 * @param metadata string metadata, always containing {@link ChunkMetadata#KEY_SOURCE}
 */
public record VectorRecord(String chunkId, float[] vector, String text, Map<String, String> metadata) {

    /** Longest exact-match term in UTF-8 bytes; ids and metadata values are indexed as single terms. */
    public static final int MAX_TERM_BYTES = 32766;

    public VectorRecord {
        metadata = Map.copyOf(metadata);
    }

    public String sourceIdentity() {
        return metadata.get(ChunkMetadata.KEY_SOURCE);
    }

    /**
     * @return {@code true} if the embedding is all zeros, i.e. the embedding provider failed for this chunk
     */
    public boolean isUnembeddable() {
        return isZero(vector);
    }

    public static boolean isZero(final float[] vector) {
        if (vector == null) {
            return true;
        }
        for (final float v : vector) {
            if (v != 0.0f) {
                return false;
            }
        }
        return true;
    }

    /**
     * Validates a batch before anything is written, so a rejected batch leaves the index untouched.
     *
     * @param records   batch to validate
     * @param dimension required vector dimension
     * @throws IllegalArgumentException on missing fields, duplicate ids, dimension mismatch, non-finite
     *                                  vector components or ids and metadata values longer than
     *                                  {@link #MAX_TERM_BYTES}
     */
    public static void validateBatch(final List<VectorRecord> records, final int dimension) {
        if (records == null) {
            throw new IllegalArgumentException("records must not be null");
        }
        final Set<String> ids = new HashSet<>();
        for (final VectorRecord record : records) {
            if (record == null) {
                throw new IllegalArgumentException("records must not contain null");
            }
            if (record.chunkId() == null || record.chunkId().isBlank()) {
                throw new IllegalArgumentException("chunkId must not be blank");
            }
            if (!ids.add(record.chunkId())) {
                throw new IllegalArgumentException("Duplicate chunkId in batch: " + record.chunkId());
            }
            if (record.sourceIdentity() == null || record.sourceIdentity().isBlank()) {
                throw new IllegalArgumentException("Record " + record.chunkId() + " has no source identity");
            }
            if (record.vector() == null || record.vector().length != dimension) {
                throw new IllegalArgumentException(
                        "Vector dimension mismatch for " + record.chunkId() + ". Expected=" + dimension +
                                ", actual=" + (record.vector() == null ? "null" : record.vector().length) +
                                " (reindex into a fresh index if you changed the embedder)");
            }
            for (final float v : record.vector()) {
                if (!Float.isFinite(v)) {
                    throw new IllegalArgumentException("Vector of " + record.chunkId() + " has a non-finite component");
                }
            }
            requireTermLength(record.chunkId(), "chunkId " + abbreviate(record.chunkId()));
            for (final Map.Entry<String, String> entry : record.metadata().entrySet()) {
                requireTermLength(entry.getKey(), "Metadata key of " + record.chunkId());
                requireTermLength(entry.getValue(), "Metadata value " + entry.getKey() + " of " + record.chunkId());
            }
        }
    }

    private static void requireTermLength(final String value, final String what) {
        final int bytes = value.getBytes(StandardCharsets.UTF_8).length;
        if (bytes > MAX_TERM_BYTES) {
            throw new IllegalArgumentException(what + " is " + bytes + " bytes, limit is " + MAX_TERM_BYTES);
        }
    }

    private static String abbreviate(final String value) {
        return value.length() <= 40 ? value : value.substring(0, 40) + "...";
    }
}
