package eu.virtualparadox.pdfrag.ingest.lifecycle.result;

import eu.virtualparadox.pdfrag.ingest.chunker.ChunkStatistics;
import lombok.Builder;

import java.util.List;

/**
 * Outcome of ingesting one document.
 * <p>
 * A failed result keeps the progress made before the failure: batches already written are not
 * rolled back, so {@code chunkCount} may be non-zero when {@code success} is {@code false}.
 *
 * @param identity          document identity
 * @param success           {@code true} if every batch was written and the document is registered
 * @param stage             {@link EIngestionStage#COMPLETED} or the stage that failed
 * @param chunkCount        number of records written to the vector index
 * @param totalChunks       number of chunks produced by the chunker
 * @param charCount         number of normalized characters
 * @param summarized        {@code true} if the chat model condensed at least part of the text before chunking
 * @param pageCount         number of pages with text
 * @param statistics        chunk size summary
 * @param skippedChunkIds   chunks that could not be embedded
 * @param warnings          non-fatal problems, e.g. a derived artifact that could not be written
 * @param error             failure message, {@code null} on success
 * @param timings           per-stage durations
 */
@Builder(toBuilder = true)
public record IngestionResult(String identity,
                              boolean success,
                              EIngestionStage stage,
                              int chunkCount,
                              int totalChunks,
                              long charCount,
                              boolean summarized,
                              int pageCount,
                              ChunkStatistics statistics,
                              List<String> skippedChunkIds,
                              List<String> warnings,
                              String error,
                              IngestionTimings timings) {

    public IngestionResult {
        skippedChunkIds = skippedChunkIds == null ? List.of() : List.copyOf(skippedChunkIds);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        statistics = statistics == null ? ChunkStatistics.EMPTY : statistics;
        timings = timings == null ? IngestionTimings.NONE : timings;
    }
}
