package eu.virtualparadox.pdfrag.application.config;

import eu.virtualparadox.pdfrag.rag.embed.EEmbeddingProvider;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "pdfrag.embedding")
@Getter @Setter
public class EmbeddingProperties {

    private EEmbeddingProvider provider = EEmbeddingProvider.SPRING_AI;
    private String modelName = "nomic-embed-text";
    private int dimension = 768;

    /** Upper bound for a single provider call. */
    private Duration timeout = Duration.ofSeconds(30);
}
