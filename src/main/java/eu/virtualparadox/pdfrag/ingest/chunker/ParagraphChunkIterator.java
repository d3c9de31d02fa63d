package eu.virtualparadox.pdfrag.ingest.chunker;

import eu.virtualparadox.pdfrag.ingest.token.TokenCounter;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

/**
 * Packs blank-line separated paragraphs up to the target size.
 * <p>
 * A paragraph that alone exceeds the target is chunked sentence by sentence with
 * {@link SemanticChunkIterator}. A pending buffer still below {@code minTokens} is carried into
 * that sentence chunking rather than emitted on its own.
 * </p>
 */
final class ParagraphChunkIterator extends AbstractChunkIterator {

    private static final String PARAGRAPH_SEPARATOR = "\n\n";

    private final List<String> paragraphs;
    private final ChunkSizing sizing;
    private final TokenCounter tokenCounter;
    private final Function<String, Iterator<String>> sentenceChunker;

    private int index;
    private final StringBuilder current = new StringBuilder();
    private int currentTokens;
    private Iterator<String> oversized;

    /**
     * @param text            normalized text
     * @param sizing          token budget
     * @param tokenCounter    counter used for paragraph sizes
     * @param sentenceChunker sentence-level chunking applied to oversized paragraphs
     */
    ParagraphChunkIterator(final String text,
                           final ChunkSizing sizing,
                           final TokenCounter tokenCounter,
                           final Function<String, Iterator<String>> sentenceChunker) {
        this.paragraphs = Arrays.stream(text.split("\\n\\s*\\n"))
                .map(String::strip)
                .filter(p -> !p.isEmpty())
                .toList();
        this.sizing = sizing;
        this.tokenCounter = tokenCounter;
        this.sentenceChunker = sentenceChunker;
    }

    @Override
    protected String computeNext() {
        while (true) {
            if (oversized != null) {
                if (oversized.hasNext()) {
                    return oversized.next();
                }
                oversized = null;
            }
            if (index >= paragraphs.size()) {
                break;
            }

            final String paragraph = paragraphs.get(index++);
            final int paragraphTokens = tokenCounter.count(paragraph);

            if (paragraphTokens > sizing.targetTokens()) {
                if (current.isEmpty()) {
                    oversized = sentenceChunker.apply(paragraph);
                } else if (currentTokens >= sizing.minTokens()) {
                    final String chunk = drainCurrent();
                    oversized = sentenceChunker.apply(paragraph);
                    return chunk;
                } else {
                    final String carried = drainCurrent();
                    oversized = sentenceChunker.apply(carried + PARAGRAPH_SEPARATOR + paragraph);
                }
                continue;
            }

            if (!current.isEmpty()
                    && currentTokens + paragraphTokens > sizing.targetTokens()
                    && currentTokens >= sizing.minTokens()) {
                final String chunk = drainCurrent();
                append(paragraph, paragraphTokens);
                return chunk;
            }
            append(paragraph, paragraphTokens);
        }

        if (current.isEmpty()) {
            return null;
        }
        return drainCurrent();
    }

    private void append(final String paragraph, final int tokens) {
        if (!current.isEmpty()) {
            current.append(PARAGRAPH_SEPARATOR);
        }
        current.append(paragraph);
        currentTokens += tokens;
    }

    private String drainCurrent() {
        final String content = current.toString();
        current.setLength(0);
        currentTokens = 0;
        return content;
    }
}
