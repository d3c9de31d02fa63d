package eu.virtualparadox.pdfrag.query;

import eu.virtualparadox.pdfrag.exception.DocumentInputException;
import eu.virtualparadox.pdfrag.rag.answer.AnswerService;
import eu.virtualparadox.pdfrag.rag.retriever.RetrievedChunk;
import eu.virtualparadox.pdfrag.support.PdfRagFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QueryManagerTest {

    @TempDir
    Path root;

    private final ChatModel chatModel = mock(ChatModel.class);
    private PdfRagFixture fixture;
    private QueryManager queryManager;

    @BeforeEach
    void setUp() throws IOException {
        fixture = PdfRagFixture.create(root);
        queryManager = new QueryManager(fixture.indexManager, new AnswerService(chatModel), fixture.retrievalProperties);
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage("The dragon guarded the bridge.")))));
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    @DisplayName("A question over indexed documents is answered with its sources")
    void testAsk() throws IOException {
        assertTrue(fixture.lifecycleManager.ingest(fixture.writeSampleDocument("dragons.pdf", 42)).success());

        final AnswerResult result = queryManager.ask("Who guarded the ancient bridge?");

        assertEquals("The dragon guarded the bridge.", result.answer());
        assertTrue(result.hasContext());
        assertThat(result.chunksUsed()).isBetween(1, fixture.retrievalProperties.getTopK());
        assertThat(result.contextLength()).isPositive();
        assertThat(result.sources()).allSatisfy(source -> {
            assertEquals("dragons.pdf", source.sourceIdentity());
            assertThat(source.preview().length()).isLessThanOrEqualTo(SourceReference.PREVIEW_LENGTH + 3);
        });
        assertNotNull(result.queryTime());
        verify(chatModel).call(any(Prompt.class));
    }

    @Test
    @DisplayName("Without relevant context the model is never called")
    void testNoContext() throws IOException {
        fixture.retrievalProperties.setSimilarityThreshold(0.3);

        final AnswerResult result = queryManager.ask("Anything about dragons?");

        assertEquals(QueryManager.NO_RELEVANT_INFORMATION, result.answer());
        assertFalse(result.hasContext());
        assertEquals(0, result.contextLength());
        verify(chatModel, never()).call(any(Prompt.class));
    }

    @Test
    @DisplayName("Retrieval honours the requested number of chunks")
    void testRetrieve() throws IOException {
        fixture.lifecycleManager.ingest(fixture.writeSampleDocument("a.pdf", 1));
        fixture.lifecycleManager.ingest(fixture.writeSampleDocument("b.pdf", 2));

        final List<RetrievedChunk> chunks = queryManager.retrieve("the harvest ledgers", 2);

        assertThat(chunks).hasSizeLessThanOrEqualTo(2).isNotEmpty();
    }

    @Test
    @DisplayName("Blank questions and non-positive k are rejected")
    void testInvalidQuestion() {
        assertThrows(DocumentInputException.class, () -> queryManager.ask(" "));
        assertThrows(DocumentInputException.class, () -> queryManager.ask("question", 0));
        verify(chatModel, never()).call(any(Prompt.class));
    }

    @Test
    @DisplayName("Source previews are cut to a fixed length")
    void testSourcePreview() {
        final String longText = "x".repeat(250);
        final SourceReference reference = SourceReference.of(new RetrievedChunk("a_00001", longText, "a.pdf", 1, 0.5, 0.6, 0.6));

        assertEquals("x".repeat(100) + "...", reference.preview());
        assertEquals(1, reference.ordinal());
        assertEquals("short", SourceReference.of(new RetrievedChunk("a_00002", "short", "a.pdf", 2, 0.5, 0.6, 0.6)).preview());
    }
}
