package eu.virtualparadox.pdfrag.application.config;

import eu.virtualparadox.pdfrag.ingest.token.HuggingFaceTokenCounter;
import eu.virtualparadox.pdfrag.ingest.token.LuceneTokenCounter;
import eu.virtualparadox.pdfrag.ingest.token.TokenCounter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Configuration
public class ChunkingConfig {

    /**
     * Model-exact counting when a tokenizer is configured, Lucene word segmentation otherwise.
     */
    @Bean
    public TokenCounter tokenCounter(final ChunkingProperties properties) throws IOException {
        if (properties.getTokenizerPath() != null) {
            return HuggingFaceTokenCounter.load(properties.getTokenizerPath());
        }
        return new LuceneTokenCounter();
    }
}
