package eu.virtualparadox.pdfrag.ingest.chunker;

import eu.virtualparadox.pdfrag.ingest.token.TokenCounter;

import java.util.Arrays;

/**
 * Word windows of at most {@code targetTokens} tokens, ignoring sentence boundaries.
 * Consecutive windows share trailing words worth at most {@code overlapTokens} tokens; every
 * window advances by at least one word.
 */
final class FixedSizeChunkIterator extends AbstractChunkIterator {

    private final String[] words;
    private final int[] wordTokens;
    private final ChunkSizing sizing;
    private int start;

    FixedSizeChunkIterator(final String text, final ChunkSizing sizing, final TokenCounter tokenCounter) {
        final String stripped = text.strip();
        this.words = stripped.isEmpty() ? new String[0] : stripped.split("\\s+");
        this.wordTokens = new int[words.length];
        for (int i = 0; i < words.length; i++) {
            wordTokens[i] = tokenCounter.count(words[i]);
        }
        this.sizing = sizing;
    }

    @Override
    protected String computeNext() {
        if (start >= words.length) {
            return null;
        }

        int end = start;
        int tokens = 0;
        while (end < words.length && (end == start || tokens + wordTokens[end] <= sizing.targetTokens())) {
            tokens += wordTokens[end];
            end++;
        }
        final String chunk = String.join(" ", Arrays.copyOfRange(words, start, end));

        if (end >= words.length) {
            start = words.length;
            return chunk;
        }

        int next = end;
        int overlap = 0;
        while (next - 1 > start && overlap + wordTokens[next - 1] <= sizing.overlapTokens()) {
            overlap += wordTokens[next - 1];
            next--;
        }
        start = next;
        return chunk;
    }
}
