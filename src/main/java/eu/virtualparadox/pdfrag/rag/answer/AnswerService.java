package eu.virtualparadox.pdfrag.rag.answer;

import eu.virtualparadox.pdfrag.rag.retriever.RetrievedChunk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Generates an answer grounded in retrieved chunks using the configured {@link ChatModel}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnswerService {

    public static final String NO_ANSWER =
            "Sorry, I could not generate an answer from the retrieved information. Please try rephrasing your question.";

    private static final String INSTRUCTIONS = String.join("\n",
            "Answer the user's question based on the related document content below. Make sure the answer is accurate and grounded.",
            "Important instructions:",
            "- Do not mention which model or assistant you are.",
            "- Do not describe technical details or backend configuration.",
            "- Answer the question directly, focusing on the document content.",
            "- Use a natural, professional tone.",
            "- Answer in the language of the question; proper nouns may stay in their original form.",
            "- If the documents do not contain the answer, say: \"I could not find relevant information in the uploaded documents, please ask again.\""
    );

    private final ChatModel chatModel;

    /**
     * Joins the chunk texts with blank lines, the context handed to the model.
     */
    public static String buildContext(final List<RetrievedChunk> chunks) {
        return chunks.stream().map(RetrievedChunk::chunkText).collect(Collectors.joining("\n\n"));
    }

    /**
     * @param question the user question
     * @param context  joined chunk texts
     * @return generated answer, or {@link #NO_ANSWER} if the model returned nothing
     */
    public String answer(final String question, final String context) {
        final String user = "Related documents:\n" + context + "\n\nUser question: " + question + "\n\nAnswer:";

        final Prompt prompt = new Prompt(
                new SystemMessage(INSTRUCTIONS),
                new UserMessage(user)
        );

        log.debug("Prompt context of {} characters for question: {}", context.length(), question);

        final String generatedAnswer = chatModel.call(prompt)
                .getResult()
                .getOutput()
                .getText();

        if (generatedAnswer == null || generatedAnswer.isBlank()) {
            log.warn("Chat model returned an empty answer");
            return NO_ANSWER;
        }
        return generatedAnswer.strip();
    }
}
