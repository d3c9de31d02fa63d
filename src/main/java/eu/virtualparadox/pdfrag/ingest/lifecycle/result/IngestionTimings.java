package eu.virtualparadox.pdfrag.ingest.lifecycle.result;

import java.time.Duration;

/**
 * Wall-clock durations of the ingestion stages. Stages not reached or skipped are {@link Duration#ZERO}.
 */
public record IngestionTimings(Duration extraction,
                               Duration summarization,
                               Duration chunking,
                               Duration embeddingAndIndexing,
                               Duration total) {

    public static final IngestionTimings NONE =
            new IngestionTimings(Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO);
}
