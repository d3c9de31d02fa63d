package eu.virtualparadox.pdfrag.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "pdfrag.ingestion")
@Getter @Setter
public class IngestionProperties {

    /** Condense the extracted text with the chat model before chunking. */
    private boolean summarize = false;

    /** Largest piece of text sent to the chat model in one summarization call. */
    private int summaryInputChars = 6000;

    /** Summaries shorter than this are discarded and the original piece is kept. */
    private int minSummaryChars = 20;
}
