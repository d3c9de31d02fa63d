package eu.virtualparadox.pdfrag.rag.index;

import eu.virtualparadox.pdfrag.ingest.model.ChunkMetadata;

public final class LuceneFields {
    public static final String FIELD_CHUNK_ID = "chunkId";
    public static final String FIELD_TEXT = "text";
    public static final String FIELD_VECTOR = "vector";
    public static final String FIELD_VECTOR_DATA = "vectorData";
    public static final String META_PREFIX = "meta.";
    public static final String FIELD_SOURCE = META_PREFIX + ChunkMetadata.KEY_SOURCE;

    private LuceneFields() {
        // prevent instantiation
    }

    public static String metadataField(final String key) {
        return META_PREFIX + key;
    }
}
