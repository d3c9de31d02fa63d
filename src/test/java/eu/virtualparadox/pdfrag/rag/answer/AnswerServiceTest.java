package eu.virtualparadox.pdfrag.rag.answer;

import eu.virtualparadox.pdfrag.rag.retriever.RetrievedChunk;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AnswerServiceTest {

    private final ChatModel chatModel = mock(ChatModel.class);
    private final AnswerService answerService = new AnswerService(chatModel);

    // ---------- Helpers ----------

    private void reply(final String text) {
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage(text)))));
    }

    // ---------- Tests ----------

    @Test
    @DisplayName("The prompt carries the context and the question, the answer is stripped")
    void testAnswer() {
        reply("  The bridge was rebuilt in spring.  \n");

        final String answer = answerService.answer("When was the bridge rebuilt?", "The bridge was rebuilt in spring.");

        assertEquals("The bridge was rebuilt in spring.", answer);
        final ArgumentCaptor<Prompt> prompt = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(prompt.capture());
        assertThat(prompt.getValue().getInstructions()).hasSize(2);
        assertThat(prompt.getValue().getContents())
                .contains("Related documents:\nThe bridge was rebuilt in spring.")
                .contains("User question: When was the bridge rebuilt?");
    }

    @Test
    @DisplayName("An empty model answer is replaced by a fixed message")
    void testBlankAnswer() {
        reply("   ");

        assertEquals(AnswerService.NO_ANSWER, answerService.answer("question", "context"));
    }

    @Test
    @DisplayName("Context joins chunk texts with blank lines")
    void testBuildContext() {
        final List<RetrievedChunk> chunks = List.of(
                new RetrievedChunk("a_00000", "First.", "a.pdf", 0, 0.1, 0.9, 0.9),
                new RetrievedChunk("b_00003", "Second.", "b.pdf", 3, 0.2, 0.8, 0.8));

        assertEquals("First.\n\nSecond.", AnswerService.buildContext(chunks));
        assertEquals("", AnswerService.buildContext(List.of()));
    }
}
