package eu.virtualparadox.pdfrag.application.config;

import eu.virtualparadox.pdfrag.rag.retriever.EScoreConversion;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "pdfrag.retrieval")
@Getter @Setter
public class RetrievalProperties {

    private int topK = 5;

    /** Hard floor on the converted similarity; results below it are never returned. */
    private double similarityThreshold = 0.001;

    private boolean rerankingEnabled = true;
    private EScoreConversion scoreConversion = EScoreConversion.INVERSE_DISTANCE;
}
