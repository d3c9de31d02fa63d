package eu.virtualparadox.pdfrag.rag.rerank;

import eu.virtualparadox.pdfrag.rag.retriever.RetrievedChunk;

import java.util.List;

/**
 * Service interface for re-ranking retrieved chunks.
 * <p>
 * A re-ranker assigns a refined relevance score to each candidate based on the query and the
 * chunk content. It only reorders; it never adds or removes candidates.
 */
public interface RerankService {

    /**
     * @param query      the user query string
     * @param candidates the filtered retrieval results
     * @return a new list with the same candidates, re-scored and ordered best-first
     */
    List<RetrievedChunk> rerank(String query, List<RetrievedChunk> candidates);
}
