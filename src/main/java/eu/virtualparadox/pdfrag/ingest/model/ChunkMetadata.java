package eu.virtualparadox.pdfrag.ingest.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Descriptive metadata carried by every chunk and copied verbatim into its vector record.
 *
 * @param sourceIdentity identity of the source document (its filename)
 * @param ordinal        zero-based position of the chunk within the document
 * @param charCount      number of characters of the chunk content
 * @param wordCount      number of whitespace separated words of the chunk content
 * @param createdAt      creation time of the chunk
 */
public record ChunkMetadata(String sourceIdentity,
                            int ordinal,
                            int charCount,
                            int wordCount,
                            Instant createdAt) {

    public static final String KEY_SOURCE = "source";
    public static final String KEY_ORDINAL = "chunk_index";
    public static final String KEY_CHAR_COUNT = "char_count";
    public static final String KEY_WORD_COUNT = "word_count";
    public static final String KEY_CREATED_AT = "created_at";

    /**
     * Flattens the metadata into the string map stored alongside vectors.
     *
     * @return insertion ordered key/value map
     */
    public Map<String, String> toMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        map.put(KEY_SOURCE, sourceIdentity);
        map.put(KEY_ORDINAL, Integer.toString(ordinal));
        map.put(KEY_CHAR_COUNT, Integer.toString(charCount));
        map.put(KEY_WORD_COUNT, Integer.toString(wordCount));
        map.put(KEY_CREATED_AT, createdAt.toString());
        return map;
    }
}
