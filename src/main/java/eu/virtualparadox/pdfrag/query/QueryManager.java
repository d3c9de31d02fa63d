package eu.virtualparadox.pdfrag.query;

import eu.virtualparadox.pdfrag.application.config.RetrievalProperties;
import eu.virtualparadox.pdfrag.exception.DocumentInputException;
import eu.virtualparadox.pdfrag.rag.answer.AnswerService;
import eu.virtualparadox.pdfrag.rag.retriever.IndexManager;
import eu.virtualparadox.pdfrag.rag.retriever.RetrievedChunk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Question answering on top of {@link IndexManager}: retrieve, then generate.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QueryManager {

    public static final String NO_RELEVANT_INFORMATION =
            "Sorry, I could not find relevant information in the documents to answer your question.";

    private final IndexManager indexManager;
    private final AnswerService answerService;
    private final RetrievalProperties retrievalProperties;

    /**
     * Retrieval only.
     *
     * @param question question text (non-blank)
     * @param topK     maximum number of chunks (must be {@code > 0})
     * @return chunks above the similarity threshold, best first
     * @throws DocumentInputException for a blank question or a non-positive {@code topK}
     * @throws IOException if the vector backend fails
     */
    public List<RetrievedChunk> retrieve(final String question, final int topK) throws IOException {
        return indexManager.search(question, topK);
    }

    public AnswerResult ask(final String question) throws IOException {
        return ask(question, retrievalProperties.getTopK());
    }

    /**
     * Retrieves context and generates an answer. Without relevant context the model is not called
     * and {@link #NO_RELEVANT_INFORMATION} is returned.
     *
     * @throws DocumentInputException for a blank question or a non-positive {@code topK}
     * @throws IOException if the vector backend fails
     */
    public AnswerResult ask(final String question, final int topK) throws IOException {
        final long start = System.nanoTime();
        log.info("Processing query: {}", question);

        final List<RetrievedChunk> chunks = retrieve(question, topK);
        if (chunks.isEmpty()) {
            log.info("No relevant context for query");
            return new AnswerResult(NO_RELEVANT_INFORMATION, List.of(), 0, since(start));
        }
        printDebugRetrieved(chunks);

        final String context = AnswerService.buildContext(chunks);
        final String answer = answerService.answer(question, context);
        final Duration elapsed = since(start);
        log.info("Query processed in {} ms using {} chunks", elapsed.toMillis(), chunks.size());

        return new AnswerResult(answer,
                chunks.stream().map(SourceReference::of).toList(),
                context.length(),
                elapsed);
    }

    private void printDebugRetrieved(final List<RetrievedChunk> chunks) {
        if (!log.isDebugEnabled()) {
            return;
        }
        final StringBuilder sb = new StringBuilder();
        for (final RetrievedChunk c : chunks) {
            sb.append(" - [").append(c.score()).append("] ").append(c.chunkId()).append("\n");
        }
        log.debug("Retrieved chunks:\n{}", sb);
    }

    private static Duration since(final long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
