package eu.virtualparadox.pdfrag.ingest.chunker;

import eu.virtualparadox.pdfrag.application.config.ChunkingProperties;
import eu.virtualparadox.pdfrag.ingest.token.TokenCounter;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collections;
import java.util.Iterator;
import java.util.function.Function;

/**
 * Token-aware text {@code Chunker} turning normalized document text into retrieval units.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Semantic</strong> (default): sentences are packed greedily up to a token target;
 *       a chunk is closed only once it reaches the minimum size, and the next chunk starts with an
 *       overlap made of whole trailing sentences of the previous one. Sentences are never split.</li>
 *   <li><strong>Paragraph</strong>: blank-line paragraphs are packed the same way; a paragraph
 *       larger than the target is chunked by sentences.</li>
 *   <li><strong>Fixed</strong>: plain word windows with a word overlap.</li>
 * </ul>
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * This component is stateless after construction and thus thread-safe. The returned
 * {@link ChunkSequence} is lazy and restartable; identical text and sizing always produce
 * identical boundaries and chunk ids.
 */
@Component
public class Chunker {

    private final TokenCounter tokenCounter;
    private final ChunkingProperties properties;
    private final Clock clock;
    private final SentenceSplitter sentenceSplitter;
    private final ChunkSizing defaultSizing;

    /**
     * Constructs a {@code Chunker}.
     *
     * @param tokenCounter token counter used for every size decision
     * @param properties   default strategy and sizes
     * @param clock        source of chunk creation times
     * @throws IllegalArgumentException if the configured sizes are inconsistent
     */
    public Chunker(final TokenCounter tokenCounter,
                   final ChunkingProperties properties,
                   final Clock clock) {
        this.tokenCounter = tokenCounter;
        this.properties = properties;
        this.clock = clock;
        this.sentenceSplitter = new SentenceSplitter(properties.getMinSentenceChars());
        this.defaultSizing = new ChunkSizing(
                properties.getTargetTokens(),
                properties.getOverlapTokens(),
                properties.getMinTokens());
    }

    /**
     * Chunks with the configured strategy and sizes.
     *
     * @param text           normalized text (non-null)
     * @param sourceIdentity document identity (non-blank)
     * @return lazy chunk sequence
     */
    public ChunkSequence segment(final String text, final String sourceIdentity) {
        return segment(properties.getStrategy(), text, sourceIdentity, defaultSizing);
    }

    /**
     * Semantic chunking with explicit sizes.
     *
     * @param text            normalized text (non-null)
     * @param sourceIdentity  document identity (non-blank)
     * @param targetTokenSize size above which a chunk is closed
     * @param overlapTokens   maximum overlap carried into the next chunk
     * @param minTokenSize    minimum size of every chunk but the last
     * @return lazy chunk sequence
     */
    public ChunkSequence segment(final String text,
                                 final String sourceIdentity,
                                 final int targetTokenSize,
                                 final int overlapTokens,
                                 final int minTokenSize) {
        return segment(EChunkingStrategy.SEMANTIC, text, sourceIdentity,
                new ChunkSizing(targetTokenSize, overlapTokens, minTokenSize));
    }

    /**
     * @param strategy       chunking strategy
     * @param text           normalized text (non-null, may be blank)
     * @param sourceIdentity document identity (non-blank)
     * @param sizing         token budget
     * @return lazy chunk sequence, empty for blank text
     * @throws IllegalArgumentException if inputs are invalid
     */
    public ChunkSequence segment(final EChunkingStrategy strategy,
                                 final String text,
                                 final String sourceIdentity,
                                 final ChunkSizing sizing) {
        validateInputs(strategy, text, sourceIdentity, sizing);

        if (text.isBlank()) {
            return new ChunkSequence(sourceIdentity, Collections::emptyIterator, tokenCounter, clock.instant());
        }

        final Function<String, Iterator<String>> semantic = t -> new SemanticChunkIterator(sentences(t), sizing);
        return switch (strategy) {
            case SEMANTIC -> new ChunkSequence(sourceIdentity,
                    () -> semantic.apply(text), tokenCounter, clock.instant());
            case PARAGRAPH -> new ChunkSequence(sourceIdentity,
                    () -> new ParagraphChunkIterator(text, sizing, tokenCounter, semantic), tokenCounter, clock.instant());
            case FIXED -> new ChunkSequence(sourceIdentity,
                    () -> new FixedSizeChunkIterator(text, sizing, tokenCounter), tokenCounter, clock.instant());
        };
    }

    public ChunkSizing defaultSizing() {
        return defaultSizing;
    }

    public EChunkingStrategy defaultStrategy() {
        return properties.getStrategy();
    }

    public String tokenizerName() {
        return tokenCounter.name();
    }

    private Iterator<Sentence> sentences(final String text) {
        final Iterator<String> raw = sentenceSplitter.iterate(text);
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return raw.hasNext();
            }

            @Override
            public Sentence next() {
                final String sentence = raw.next();
                return new Sentence(sentence, tokenCounter.count(sentence));
            }
        };
    }

    private static void validateInputs(final EChunkingStrategy strategy,
                                       final String text,
                                       final String sourceIdentity,
                                       final ChunkSizing sizing) {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (sourceIdentity == null || sourceIdentity.isBlank()) {
            throw new IllegalArgumentException("sourceIdentity cannot be null or blank");
        }
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        if (sizing == null) {
            throw new IllegalArgumentException("sizing cannot be null");
        }
    }
}
