package eu.virtualparadox.pdfrag.ingest.chunker;

import eu.virtualparadox.pdfrag.ingest.model.TextChunk;

import java.util.List;

/**
 * Size summary of the chunks of one document.
 */
public record ChunkStatistics(int totalChunks,
                              double averageTokens,
                              int minTokens,
                              int maxTokens,
                              long totalTokens,
                              double averageCharacters,
                              long totalCharacters) {

    public static final ChunkStatistics EMPTY = new ChunkStatistics(0, 0.0, 0, 0, 0L, 0.0, 0L);

    public static ChunkStatistics of(final List<TextChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return EMPTY;
        }

        int min = Integer.MAX_VALUE;
        int max = 0;
        long tokens = 0;
        long characters = 0;
        for (final TextChunk chunk : chunks) {
            min = Math.min(min, chunk.tokenCount());
            max = Math.max(max, chunk.tokenCount());
            tokens += chunk.tokenCount();
            characters += chunk.content().length();
        }

        final int count = chunks.size();
        return new ChunkStatistics(count,
                (double) tokens / count,
                min,
                max,
                tokens,
                (double) characters / count,
                characters);
    }
}
