package eu.virtualparadox.pdfrag.application.config;

import eu.virtualparadox.pdfrag.rag.retriever.SimilarityConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RetrievalConfig {

    @Bean
    public SimilarityConverter similarityConverter(final RetrievalProperties properties) {
        return properties.getScoreConversion();
    }
}
