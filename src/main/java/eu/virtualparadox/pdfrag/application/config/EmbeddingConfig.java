package eu.virtualparadox.pdfrag.application.config;

import eu.virtualparadox.pdfrag.rag.embed.EmbeddingProvider;
import eu.virtualparadox.pdfrag.rag.embed.OnnxEmbeddingProvider;
import eu.virtualparadox.pdfrag.rag.embed.SpringAiEmbeddingProvider;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the {@link EmbeddingProvider} from {@code pdfrag.embedding.provider}.
 */
@Configuration
public class EmbeddingConfig {

    @Bean
    @ConditionalOnProperty(prefix = "pdfrag.embedding", name = "provider", havingValue = "spring_ai", matchIfMissing = true)
    public EmbeddingProvider springAiEmbeddingProvider(final EmbeddingModel embeddingModel,
                                                       final EmbeddingProperties properties) {
        return new SpringAiEmbeddingProvider(embeddingModel, properties.getModelName());
    }

    @Bean
    @ConditionalOnProperty(prefix = "pdfrag.embedding", name = "provider", havingValue = "onnx")
    public EmbeddingProvider onnxEmbeddingProvider(final ApplicationConfig config,
                                                   final EmbeddingProperties properties) {
        return new OnnxEmbeddingProvider(config.getModels().resolve("retriever"), properties.getModelName());
    }
}
