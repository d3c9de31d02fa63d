package eu.virtualparadox.pdfrag.catalog.entity;

import eu.virtualparadox.pdfrag.catalog.EStorageStatus;
import eu.virtualparadox.pdfrag.ingest.chunker.ChunkStatistics;
import eu.virtualparadox.pdfrag.ingest.chunker.EChunkingStrategy;
import lombok.Builder;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * Registry entry of one document. Entries are immutable and replaced wholesale.
 *
 * @param identity          document identity (filename)
 * @param originalPath      path of the backing file at processing time
 * @param processedAt       time the document was processed or discovered
 * @param processingTime    ingestion duration, {@code null} for entries rebuilt from a scan
 * @param pageCount         number of pages, {@code 0} if unknown
 * @param characterCount    number of extracted characters, file size estimate for scanned entries
 * @param chunkCount        number of records stored in the vector index
 * @param chunkStatistics   chunk size summary, {@code null} for scanned entries
 * @param chunkingStrategy  strategy used for chunking, {@code null} for scanned entries
 * @param storageStatus     storage status of the backing file
 * @param discoveredByScan  {@code true} if created by a filesystem scan rather than by ingestion
 */
@Builder(toBuilder = true)
public record DocumentEntry(String identity,
                            Path originalPath,
                            Instant processedAt,
                            Duration processingTime,
                            int pageCount,
                            long characterCount,
                            int chunkCount,
                            ChunkStatistics chunkStatistics,
                            EChunkingStrategy chunkingStrategy,
                            EStorageStatus storageStatus,
                            boolean discoveredByScan) {
}
