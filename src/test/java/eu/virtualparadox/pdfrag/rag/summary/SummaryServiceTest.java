package eu.virtualparadox.pdfrag.rag.summary;

import eu.virtualparadox.pdfrag.application.config.IngestionProperties;
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
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SummaryServiceTest {

    private final ChatModel chatModel = mock(ChatModel.class);
    private final IngestionProperties properties = new IngestionProperties();
    private final SummaryService summaryService = new SummaryService(chatModel, properties);

    // ---------- Helpers ----------

    private static ChatResponse response(final String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    private static String paragraph(final char letter, final int length) {
        return String.valueOf(letter).repeat(length);
    }

    // ---------- Splitting ----------

    @Test
    @DisplayName("Short text is one piece, longer text is packed by paragraph")
    void testPieces() {
        assertEquals(List.of("short text"), SummaryService.pieces("short text", 100));
        assertTrue(SummaryService.pieces("  ", 100).isEmpty());

        final String text = String.join("\n\n", paragraph('a', 40), paragraph('b', 40), paragraph('c', 40));
        assertEquals(List.of(paragraph('a', 40) + "\n\n" + paragraph('b', 40), paragraph('c', 40)),
                SummaryService.pieces(text, 90));
    }

    @Test
    @DisplayName("An oversized paragraph is cut at whitespace")
    void testOversizedParagraph() {
        final String words = "one two three four five six seven eight nine ten";

        final List<String> pieces = SummaryService.pieces(words + "\n\nshort", 20);

        assertThat(pieces).hasSizeGreaterThan(2).allMatch(p -> p.length() <= 20);
        assertEquals(words + " short", String.join(" ", pieces).replace("\n\n", " "));
    }

    // ---------- Summarizing ----------

    @Test
    @DisplayName("Each piece is condensed by the model and the results are joined")
    void testSummarize() {
        properties.setSummaryInputChars(90);
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(response("  The first two paragraphs, condensed.  "))
                .thenReturn(response("The third paragraph, condensed."));
        final String text = String.join("\n\n", paragraph('a', 40), paragraph('b', 40), paragraph('c', 40));

        final TextSummary summary = summaryService.summarize(text);

        assertEquals("The first two paragraphs, condensed.\n\nThe third paragraph, condensed.", summary.text());
        assertEquals(2, summary.pieces());
        assertEquals(2, summary.condensedPieces());
        assertEquals(text.length(), summary.originalChars());
        assertTrue(summary.isCondensed());

        final ArgumentCaptor<Prompt> prompt = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel, times(2)).call(prompt.capture());
        assertThat(prompt.getAllValues().get(1).getContents()).contains("Original text:\n" + paragraph('c', 40));
    }

    @Test
    @DisplayName("A failing or too short answer keeps the original piece")
    void testUnusableAnswersKeepOriginal() {
        properties.setSummaryInputChars(90);
        when(chatModel.call(any(Prompt.class)))
                .thenThrow(new IllegalStateException("model offline"))
                .thenReturn(response("too short"));
        final String text = String.join("\n\n", paragraph('a', 40), paragraph('b', 40), paragraph('c', 40));

        final TextSummary summary = summaryService.summarize(text);

        assertEquals(text, summary.text());
        assertEquals(0, summary.condensedPieces());
        assertFalse(summary.isCondensed());
        assertEquals(1.0, summary.compressionRatio(), 1e-9);
    }
}
