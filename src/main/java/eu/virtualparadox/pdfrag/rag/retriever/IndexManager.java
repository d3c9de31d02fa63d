package eu.virtualparadox.pdfrag.rag.retriever;

import eu.virtualparadox.pdfrag.application.config.IndexProperties;
import eu.virtualparadox.pdfrag.application.config.RetrievalProperties;
import eu.virtualparadox.pdfrag.application.executor.BoundedCallExecutor;
import eu.virtualparadox.pdfrag.exception.DocumentInputException;
import eu.virtualparadox.pdfrag.ingest.model.ChunkMetadata;
import eu.virtualparadox.pdfrag.ingest.model.TextChunk;
import eu.virtualparadox.pdfrag.rag.embed.EmbeddingBatch;
import eu.virtualparadox.pdfrag.rag.embed.EmbeddingGateway;
import eu.virtualparadox.pdfrag.rag.index.DeletionReport;
import eu.virtualparadox.pdfrag.rag.index.IndexStats;
import eu.virtualparadox.pdfrag.rag.index.MetadataPredicate;
import eu.virtualparadox.pdfrag.rag.index.ScoredRecord;
import eu.virtualparadox.pdfrag.rag.index.VectorIndex;
import eu.virtualparadox.pdfrag.rag.index.VectorRecord;
import eu.virtualparadox.pdfrag.rag.rerank.RerankService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Single entry point to the vector index.
 * <p>
 * Steps of a search:
 * <ol>
 *   <li>Embed the query using {@link EmbeddingGateway}</li>
 *   <li>Run a k-NN search on the configured {@link VectorIndex}</li>
 *   <li>Convert distances with the {@link SimilarityConverter} and drop everything below
 *       {@code pdfrag.retrieval.similarity-threshold}</li>
 *   <li>Optionally rerank the surviving results with the {@link RerankService}</li>
 * </ol>
 * An empty result is a regular "no relevant context" outcome. Every backend call is bounded by
 * {@code pdfrag.index.timeout}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IndexManager {

    private final VectorIndex vectorIndex;
    private final EmbeddingGateway embeddingGateway;
    private final RerankService rerankService;
    private final SimilarityConverter similarityConverter;
    private final RetrievalProperties retrievalProperties;
    private final IndexProperties indexProperties;
    private final BoundedCallExecutor backendCallExecutor;

    /**
     * Embeds and stores one batch of chunks. Chunks that cannot be embedded are skipped and reported.
     *
     * @param chunks chunks of one batch
     * @return number of stored records and skipped chunk ids
     * @throws IOException if the vector backend write fails or times out
     */
    public IndexingOutcome add(final List<TextChunk> chunks) throws IOException {
        if (chunks.isEmpty()) {
            return new IndexingOutcome(0, List.of());
        }

        final EmbeddingBatch embeddings = embeddingGateway.embed(chunks.stream().map(TextChunk::content).toList());

        final List<VectorRecord> records = new ArrayList<>(chunks.size());
        final List<String> skipped = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            final TextChunk chunk = chunks.get(i);
            if (embeddings.isUnembeddable(i)) {
                skipped.add(chunk.chunkId());
                continue;
            }
            records.add(new VectorRecord(chunk.chunkId(), embeddings.vectors().get(i), chunk.content(), chunk.metadata().toMap()));
        }

        if (!records.isEmpty()) {
            backendCallExecutor.call("Vector write of " + records.size() + " records", () -> {
                vectorIndex.add(records);
                return null;
            }, indexProperties.getTimeout());
        }
        if (!skipped.isEmpty()) {
            log.warn("Skipped {} unembeddable chunks: {}", skipped.size(), skipped);
        }
        return new IndexingOutcome(records.size(), skipped);
    }

    /**
     * Searches with the configured {@code top-k}.
     */
    public List<RetrievedChunk> search(final String query) throws IOException {
        return search(query, retrievalProperties.getTopK());
    }

    /**
     * @param query question text (non-blank)
     * @param k     maximum number of results (must be {@code > 0})
     * @return filtered and optionally reranked results, best first; possibly empty
     * @throws DocumentInputException for a blank query or a non-positive {@code k}
     * @throws IOException if the vector backend fails or times out
     */
    public List<RetrievedChunk> search(final String query, final int k) throws IOException {
        if (query == null || query.isBlank()) {
            throw new DocumentInputException("Query must not be blank");
        }
        requirePositive(k);
        final float[] vector = embeddingGateway.embedQuery(query);
        return searchByVector(query, vector, k);
    }

    /**
     * Searches with a caller supplied vector.
     *
     * @param query  query text used for reranking, may be {@code null} to skip reranking
     * @param vector query vector
     * @param k      maximum number of results (must be {@code > 0})
     * @return filtered and optionally reranked results, best first; possibly empty
     * @throws IOException if the vector backend fails or times out
     */
    public List<RetrievedChunk> searchByVector(final String query, final float[] vector, final int k) throws IOException {
        requirePositive(k);

        final List<ScoredRecord> hits = backendCallExecutor.call(
                "Vector search", () -> vectorIndex.search(vector, k), indexProperties.getTimeout());

        final double threshold = retrievalProperties.getSimilarityThreshold();
        final List<RetrievedChunk> kept = new ArrayList<>(hits.size());
        for (final ScoredRecord hit : hits) {
            final VectorRecord record = hit.record();
            if (record.isUnembeddable()) {
                continue;
            }
            final double similarity = similarityConverter.toSimilarity(hit.rawDistance());
            if (Double.isNaN(similarity) || similarity < threshold) {
                log.debug("Dropped {} (distance {}, similarity {} < {})", record.chunkId(), hit.rawDistance(), similarity, threshold);
                continue;
            }
            kept.add(new RetrievedChunk(
                    record.chunkId(),
                    record.text(),
                    record.sourceIdentity(),
                    ordinalOf(record),
                    hit.rawDistance(),
                    similarity,
                    similarity));
        }

        log.debug("Search returned {} hits, {} above threshold {}", hits.size(), kept.size(), threshold);
        if (kept.isEmpty() || query == null || !retrievalProperties.isRerankingEnabled()) {
            return kept;
        }
        return rerankService.rerank(query, kept);
    }

    public DeletionReport deleteSource(final String sourceIdentity) throws IOException {
        return backendCallExecutor.call("Vector delete of " + sourceIdentity,
                () -> vectorIndex.deleteByPredicate(MetadataPredicate.sourceEquals(sourceIdentity)),
                indexProperties.getTimeout());
    }

    public long countSource(final String sourceIdentity) throws IOException {
        return backendCallExecutor.call("Vector count of " + sourceIdentity,
                () -> vectorIndex.count(MetadataPredicate.sourceEquals(sourceIdentity)),
                indexProperties.getTimeout());
    }

    public Set<String> sourceIdentities() throws IOException {
        return backendCallExecutor.call("Vector source listing",
                vectorIndex::sourceIdentities,
                indexProperties.getTimeout());
    }

    public IndexStats stats() throws IOException {
        return backendCallExecutor.call("Vector stats", vectorIndex::stats, indexProperties.getTimeout());
    }

    public void clear() throws IOException {
        backendCallExecutor.call("Vector clear", () -> {
            vectorIndex.clear();
            return null;
        }, indexProperties.getTimeout());
    }

    public boolean isEmbeddingAvailable() {
        return embeddingGateway.isAvailable();
    }

    private static void requirePositive(final int k) {
        if (k <= 0) {
            throw new DocumentInputException("k must be > 0, was " + k);
        }
    }

    private static int ordinalOf(final VectorRecord record) {
        final String ordinal = record.metadata().get(ChunkMetadata.KEY_ORDINAL);
        if (ordinal == null) {
            return -1;
        }
        try {
            return Integer.parseInt(ordinal);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
