package eu.virtualparadox.pdfrag.ingest.token;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.standard.StandardAnalyzer;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Counts the tokens emitted by Lucene's {@code StandardTokenizer} (Unicode word segmentation,
 * one token per CJK ideograph). No stop words are removed, so counts are additive across
 * whitespace-joined sentences.
 */
public final class LuceneTokenCounter implements TokenCounter, AutoCloseable {

    private static final String FIELD = "text";

    private final Analyzer analyzer = new StandardAnalyzer(CharArraySet.EMPTY_SET);

    @Override
    public int count(final String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int tokens = 0;
        try (TokenStream stream = analyzer.tokenStream(FIELD, text)) {
            stream.reset();
            while (stream.incrementToken()) {
                tokens++;
            }
            stream.end();
        } catch (IOException e) {
            // reading from a String never fails, keep the signature unchecked
            throw new UncheckedIOException("Unable to tokenize text", e);
        }
        return tokens;
    }

    @Override
    public String name() {
        return "lucene-standard";
    }

    @Override
    public void close() {
        analyzer.close();
    }
}
