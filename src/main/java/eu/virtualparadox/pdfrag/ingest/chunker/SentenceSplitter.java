package eu.virtualparadox.pdfrag.ingest.chunker;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lazily splits text into sentences.
 *
 * <h2>Boundary rule</h2>
 * <ul>
 *   <li>{@code .}, {@code !} or {@code ?} followed by whitespace and an uppercase letter or a quote,
 *       unless the text right before the boundary ends with a known abbreviation
 *       (e.g. {@code Dr.}, {@code Inc.}, months, weekdays);</li>
 *   <li>the CJK terminators {@code 。！？}, with or without following whitespace;</li>
 *   <li>a paragraph break (blank line).</li>
 * </ul>
 * Sentences are trimmed; fragments shorter than {@code minSentenceChars} (page numbers, stray
 * headers) are dropped.
 */
final class SentenceSplitter {

    /**
     * <pre>
     *     (?&lt;=[.!?])(?![.!?])\s+(?=[\p{Lu}"'])   # Latin terminator, whitespace, capital or quote
     *     | (?&lt;=[。！？])(?![。！？])\s*              # CJK terminator
     *     | \n{2,}                                  # paragraph break
     * </pre>
     */
    private static final Pattern SENTENCE_SPLIT = Pattern.compile(
            "(?<=[.!?])(?![.!?])\\s+(?=[\\p{Lu}\"'])" +
                    "|(?<=[\\u3002\\uFF01\\uFF1F])(?![\\u3002\\uFF01\\uFF1F])\\s*" +
                    "|\\n{2,}"
    );

    /**
     * Matches if the text immediately before a split candidate ends with a known abbreviation
     * token followed by a period. Checked on a short window before the boundary.
     */
    private static final Pattern ABBREVIATION_PATTERN = Pattern.compile(
            "\\b(?:Dr|Mr|Mrs|Ms|Prof|Sr|Jr|Inc|Ltd|Corp|Co|St|Ave|Blvd|Rd|etc|vs|eg|ie|cf|ca|approx|Fig|No|Vol|Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec|Mon|Tue|Wed|Thu|Fri|Sat|Sun|U\\.S\\.A|U\\.K|U\\.N)\\.$"
    );

    private static final int ABBREVIATION_WINDOW = 20;

    private final int minSentenceChars;

    SentenceSplitter(final int minSentenceChars) {
        if (minSentenceChars < 0) {
            throw new IllegalArgumentException("minSentenceChars must be non-negative");
        }
        this.minSentenceChars = minSentenceChars;
    }

    /**
     * @param text source text
     * @return all sentences of {@code text} in order
     */
    List<String> split(final String text) {
        final List<String> sentences = new ArrayList<>();
        iterate(text).forEachRemaining(sentences::add);
        return sentences;
    }

    /**
     * @param text source text
     * @return a lazy iterator over the sentences of {@code text}
     */
    Iterator<String> iterate(final String text) {
        return new SentenceIterator(text);
    }

    private final class SentenceIterator implements Iterator<String> {

        private final String text;
        private final Matcher matcher;
        private int lastEnd;
        private boolean exhausted;
        private String next;

        private SentenceIterator(final String text) {
            this.text = text;
            this.matcher = SENTENCE_SPLIT.matcher(text);
        }

        @Override
        public boolean hasNext() {
            if (next == null && !exhausted) {
                next = advance();
                exhausted = next == null;
            }
            return next != null;
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            final String sentence = next;
            next = null;
            return sentence;
        }

        private String advance() {
            while (matcher.find()) {
                final int splitPoint = matcher.start();
                if (isAbbreviation(splitPoint)) {
                    continue;
                }
                final String candidate = text.substring(lastEnd, splitPoint).strip();
                lastEnd = matcher.end();
                if (accept(candidate)) {
                    return candidate;
                }
            }
            if (lastEnd < text.length()) {
                final String candidate = text.substring(lastEnd).strip();
                lastEnd = text.length();
                if (accept(candidate)) {
                    return candidate;
                }
            }
            return null;
        }

        private boolean isAbbreviation(final int splitPoint) {
            final String beforeSplit = text.substring(Math.max(0, splitPoint - ABBREVIATION_WINDOW), splitPoint).trim();
            return ABBREVIATION_PATTERN.matcher(beforeSplit).find();
        }

        private boolean accept(final String candidate) {
            return !candidate.isEmpty() && candidate.length() >= minSentenceChars;
        }
    }
}
