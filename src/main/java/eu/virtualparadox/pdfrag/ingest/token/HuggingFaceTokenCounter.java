package eu.virtualparadox.pdfrag.ingest.token;

import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Counts model-exact tokens with a HuggingFace {@code tokenizer.json}, without special tokens
 * and without truncation.
 */
@Slf4j
public final class HuggingFaceTokenCounter implements TokenCounter, AutoCloseable {

    private final HuggingFaceTokenizer tokenizer;
    private final String name;

    private HuggingFaceTokenCounter(final HuggingFaceTokenizer tokenizer, final String name) {
        this.tokenizer = tokenizer;
        this.name = name;
    }

    /**
     * Loads the tokenizer definition.
     *
     * @param tokenizerPath path to a {@code tokenizer.json}
     * @return a ready counter
     * @throws IOException if the tokenizer cannot be loaded
     */
    public static HuggingFaceTokenCounter load(final Path tokenizerPath) throws IOException {
        final HuggingFaceTokenizer tokenizer = HuggingFaceTokenizer.builder()
                .optTokenizerPath(tokenizerPath)
                .optAddSpecialTokens(false)
                .optTruncation(false)
                .build();
        log.info("Loaded tokenizer for chunk sizing: {}", tokenizerPath);
        return new HuggingFaceTokenCounter(tokenizer, "hf:" + tokenizerPath.getFileName());
    }

    @Override
    public int count(final String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return tokenizer.encode(text).getIds().length;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void close() {
        tokenizer.close();
    }
}
