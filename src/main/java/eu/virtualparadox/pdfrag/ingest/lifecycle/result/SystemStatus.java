package eu.virtualparadox.pdfrag.ingest.lifecycle.result;

import eu.virtualparadox.pdfrag.ingest.chunker.EChunkingStrategy;
import eu.virtualparadox.pdfrag.rag.index.IndexStats;
import lombok.Builder;

/**
 * Point-in-time summary of the system and its active configuration.
 *
 * @param documentCount     number of registered documents
 * @param indexStats        vector index statistics, {@code null} if the index could not be read
 * @param embeddingAvailable whether the embedding provider answered a test embedding
 * @param chunkingStrategy  active chunking strategy
 * @param targetTokens      active chunk target size
 * @param overlapTokens     active overlap
 * @param tokenizer         name of the token counter
 * @param topK              default number of retrieved chunks
 * @param similarityThreshold active similarity floor
 * @param rerankingEnabled  whether lexical reranking is on
 */
@Builder
public record SystemStatus(int documentCount,
                           IndexStats indexStats,
                           boolean embeddingAvailable,
                           EChunkingStrategy chunkingStrategy,
                           int targetTokens,
                           int overlapTokens,
                           String tokenizer,
                           int topK,
                           double similarityThreshold,
                           boolean rerankingEnabled) {
}
