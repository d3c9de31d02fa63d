package eu.virtualparadox.pdfrag.ingest.chunker;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Pull-based iterator over chunk contents. Subclasses compute one chunk per call and return
 * {@code null} once the input is exhausted.
 */
abstract class AbstractChunkIterator implements Iterator<String> {

    private String next;
    private boolean exhausted;

    /**
     * @return the next chunk content, or {@code null} when no content is left
     */
    protected abstract String computeNext();

    @Override
    public final boolean hasNext() {
        if (next == null && !exhausted) {
            next = computeNext();
            exhausted = next == null;
        }
        return next != null;
    }

    @Override
    public final String next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        final String content = next;
        next = null;
        return content;
    }
}
