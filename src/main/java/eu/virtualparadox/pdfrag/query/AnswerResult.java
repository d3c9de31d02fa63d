package eu.virtualparadox.pdfrag.query;

import java.time.Duration;
import java.util.List;

/**
 * @param answer        generated or fixed answer text
 * @param sources       chunks the answer is based on, best first
 * @param contextLength number of characters handed to the model, {@code 0} if none
 * @param queryTime     wall-clock duration of retrieval and generation
 */
public record AnswerResult(String answer, List<SourceReference> sources, int contextLength, Duration queryTime) {

    public AnswerResult {
        sources = List.copyOf(sources);
    }

    public int chunksUsed() {
        return sources.size();
    }

    public boolean hasContext() {
        return !sources.isEmpty();
    }
}
