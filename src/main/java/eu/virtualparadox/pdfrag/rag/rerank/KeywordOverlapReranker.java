package eu.virtualparadox.pdfrag.rag.rerank;

import eu.virtualparadox.pdfrag.rag.retriever.RetrievedChunk;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lexical reranker blending vector similarity with keyword overlap:
 * <pre>
 *     score = 0.7 * similarity + 0.3 * overlap
 * </pre>
 * where {@code overlap} is the fraction of the query's distinct lowercase whitespace tokens that
 * also occur as whitespace tokens of the chunk.
 */
@Service
public final class KeywordOverlapReranker implements RerankService {

    static final double SIMILARITY_WEIGHT = 0.7;
    static final double KEYWORD_WEIGHT = 0.3;

    @Override
    public List<RetrievedChunk> rerank(final String query, final List<RetrievedChunk> candidates) {
        final Set<String> queryTokens = tokens(query);

        final List<RetrievedChunk> reranked = new ArrayList<>(candidates.size());
        for (final RetrievedChunk candidate : candidates) {
            final double overlap = keywordOverlap(queryTokens, candidate.chunkText());
            reranked.add(candidate.withScore(SIMILARITY_WEIGHT * candidate.similarity() + KEYWORD_WEIGHT * overlap));
        }

        reranked.sort(Comparator.comparingDouble(RetrievedChunk::score).reversed());
        return reranked;
    }

    static double keywordOverlap(final Set<String> queryTokens, final String chunkText) {
        if (queryTokens.isEmpty()) {
            return 0.0;
        }
        final Set<String> chunkTokens = tokens(chunkText);
        final long hits = queryTokens.stream().filter(chunkTokens::contains).count();
        return (double) hits / queryTokens.size();
    }

    static Set<String> tokens(final String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).strip().split("\\s+"))
                .collect(Collectors.toSet());
    }
}
