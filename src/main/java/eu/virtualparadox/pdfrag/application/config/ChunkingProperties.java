package eu.virtualparadox.pdfrag.application.config;

import eu.virtualparadox.pdfrag.ingest.chunker.EChunkingStrategy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Chunk sizing, all sizes expressed in tokens of the configured {@code TokenCounter}.
 */
@Configuration
@ConfigurationProperties(prefix = "pdfrag.chunking")
@Getter @Setter
public class ChunkingProperties {

    private EChunkingStrategy strategy = EChunkingStrategy.SEMANTIC;
    private int targetTokens = 512;
    private int overlapTokens = 50;
    private int minTokens = 100;

    /** Sentence fragments shorter than this are treated as extraction noise and dropped. */
    private int minSentenceChars = 10;

    /** Optional {@code tokenizer.json}; when set, tokens are counted with the model's own tokenizer. */
    private Path tokenizerPath;
}
