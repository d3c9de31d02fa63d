package eu.virtualparadox.pdfrag.ingest.chunker;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Greedy sentence packing with a sentence-level suffix overlap.
 *
 * <h2>Packing</h2>
 * Sentences are appended to a running buffer. When the next sentence would push the buffer
 * over {@code targetTokens} and the buffer already holds at least {@code minTokens}, the buffer
 * is emitted as a chunk. A sentence longer than the target is never split.
 * <p>
 * Chunks stay within {@code targetTokens} with one exception: a buffer below {@code minTokens}
 * always takes the next sentence. When that sentence is large, the chunk holds the short buffer
 * followed by it and exceeds the target. Such a chunk always ends with the sentence that did not
 * fit, and everything before that sentence is below {@code minTokens}.
 *
 * <h2>Overlap</h2>
 * The next buffer is seeded with the trailing sentences of the emitted chunk whose combined size
 * is {@code <= overlapTokens}, taken from the end backward. The first sentence of a chunk is never
 * part of the overlap, and leading overlap sentences are dropped while overlap plus the incoming
 * sentence would exceed the target.
 *
 * <h2>Final flush</h2>
 * Whatever remains at the end of the input is emitted even when below {@code minTokens}.
 */
final class SemanticChunkIterator extends AbstractChunkIterator {

    private static final String SENTENCE_SEPARATOR = " ";

    private final Iterator<Sentence> sentences;
    private final ChunkSizing sizing;

    private final List<Sentence> buffer = new ArrayList<>();
    private int bufferTokens;

    SemanticChunkIterator(final Iterator<Sentence> sentences, final ChunkSizing sizing) {
        this.sentences = sentences;
        this.sizing = sizing;
    }

    @Override
    protected String computeNext() {
        while (sentences.hasNext()) {
            final Sentence sentence = sentences.next();
            if (!buffer.isEmpty()
                    && bufferTokens + sentence.tokens() > sizing.targetTokens()
                    && bufferTokens >= sizing.minTokens()) {
                final String chunk = join(buffer);
                final List<Sentence> seed = overlapSeed(sentence.tokens());
                resetBuffer();
                seed.forEach(this::append);
                append(sentence);
                return chunk;
            }
            append(sentence);
        }

        if (buffer.isEmpty()) {
            return null;
        }
        final String last = join(buffer);
        resetBuffer();
        return last;
    }

    private List<Sentence> overlapSeed(final int incomingTokens) {
        if (sizing.overlapTokens() == 0 || buffer.size() <= 1) {
            return List.of();
        }

        final Deque<Sentence> seed = new ArrayDeque<>();
        int seedTokens = 0;
        for (int i = buffer.size() - 1; i >= 1; i--) {
            final Sentence candidate = buffer.get(i);
            if (seedTokens + candidate.tokens() > sizing.overlapTokens()) {
                break;
            }
            seed.addFirst(candidate);
            seedTokens += candidate.tokens();
        }

        while (!seed.isEmpty() && seedTokens + incomingTokens > sizing.targetTokens()) {
            seedTokens -= seed.removeFirst().tokens();
        }
        return new ArrayList<>(seed);
    }

    private void append(final Sentence sentence) {
        buffer.add(sentence);
        bufferTokens += sentence.tokens();
    }

    private void resetBuffer() {
        buffer.clear();
        bufferTokens = 0;
    }

    private static String join(final List<Sentence> sentences) {
        final StringBuilder sb = new StringBuilder();
        for (final Sentence s : sentences) {
            if (!sb.isEmpty()) {
                sb.append(SENTENCE_SEPARATOR);
            }
            sb.append(s.text());
        }
        return sb.toString();
    }
}
