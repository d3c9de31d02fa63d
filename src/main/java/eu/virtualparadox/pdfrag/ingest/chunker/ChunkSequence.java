package eu.virtualparadox.pdfrag.ingest.chunker;

import eu.virtualparadox.pdfrag.ingest.model.ChunkMetadata;
import eu.virtualparadox.pdfrag.ingest.model.TextChunk;
import eu.virtualparadox.pdfrag.ingest.token.TokenCounter;

import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, finite and restartable sequence of chunks of one document.
 * <p>
 * Every call to {@link #iterator()} re-runs the chunking from the start of the text; nothing is
 * computed before iteration and iteration has no side effects. All chunks of a sequence share
 * the same creation time, so repeated iterations yield equal chunks.
 * </p>
 */
public final class ChunkSequence implements Iterable<TextChunk> {

    private final String sourceIdentity;
    private final Supplier<Iterator<String>> contents;
    private final TokenCounter tokenCounter;
    private final Instant createdAt;

    ChunkSequence(final String sourceIdentity,
                  final Supplier<Iterator<String>> contents,
                  final TokenCounter tokenCounter,
                  final Instant createdAt) {
        this.sourceIdentity = sourceIdentity;
        this.contents = contents;
        this.tokenCounter = tokenCounter;
        this.createdAt = createdAt;
    }

    @Override
    public Iterator<TextChunk> iterator() {
        final Iterator<String> source = contents.get();
        return new Iterator<>() {
            private int ordinal;

            @Override
            public boolean hasNext() {
                return source.hasNext();
            }

            @Override
            public TextChunk next() {
                return toChunk(source.next(), ordinal++);
            }
        };
    }

    public Stream<TextChunk> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public List<TextChunk> toList() {
        return stream().toList();
    }

    public String sourceIdentity() {
        return sourceIdentity;
    }

    private TextChunk toChunk(final String content, final int ordinal) {
        final ChunkMetadata metadata = new ChunkMetadata(
                sourceIdentity,
                ordinal,
                content.length(),
                wordCount(content),
                createdAt
        );
        return new TextChunk(TextChunk.idOf(sourceIdentity, ordinal), content, metadata, tokenCounter.count(content));
    }

    private static int wordCount(final String content) {
        final String stripped = content.strip();
        return stripped.isEmpty() ? 0 : stripped.split("\\s+").length;
    }
}
