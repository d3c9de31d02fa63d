package eu.virtualparadox.pdfrag.application.config;

import eu.virtualparadox.pdfrag.rag.index.EIndexBackend;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "pdfrag.index")
@Getter @Setter
public class IndexProperties {

    private EIndexBackend backend = EIndexBackend.LUCENE;

    /** Number of chunks embedded and written per sequential ingestion batch. */
    private int batchSize = 5;

    /** Upper bound for a single vector backend call. */
    private Duration timeout = Duration.ofSeconds(60);
}
