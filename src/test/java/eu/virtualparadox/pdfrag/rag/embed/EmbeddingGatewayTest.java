package eu.virtualparadox.pdfrag.rag.embed;

import eu.virtualparadox.pdfrag.application.config.EmbeddingProperties;
import eu.virtualparadox.pdfrag.application.executor.BoundedCallExecutor;
import eu.virtualparadox.pdfrag.exception.BackendUnavailableException;
import eu.virtualparadox.pdfrag.exception.DocumentInputException;
import eu.virtualparadox.pdfrag.support.HashingEmbeddingProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class EmbeddingGatewayTest {

    private final HashingEmbeddingProvider provider = new HashingEmbeddingProvider();
    private final EmbeddingProperties properties = new EmbeddingProperties();
    private BoundedCallExecutor executor;
    private EmbeddingGateway gateway;

    @BeforeEach
    void setUp() {
        properties.setDimension(HashingEmbeddingProvider.DIMENSION);
        properties.setModelName(HashingEmbeddingProvider.MODEL);
        properties.setTimeout(Duration.ofSeconds(5));
        executor = BoundedCallExecutor.create("embed-test-", 2);
        gateway = new EmbeddingGateway(provider, properties, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    // ---------- Helpers ----------

    private static boolean isZero(final float[] vector) {
        for (final float v : vector) {
            if (v != 0f) {
                return false;
            }
        }
        return true;
    }

    // ---------- Tests ----------

    @Test
    @DisplayName("A healthy batch is embedded in input order")
    void testEmbedBatch() {
        final List<String> texts = List.of("the dragon slept", "a quiet harbour", "the copper mines");

        final EmbeddingBatch batch = gateway.embed(texts);

        assertFalse(batch.isDegraded());
        assertEquals(3, batch.vectors().size());
        for (int i = 0; i < texts.size(); i++) {
            assertArrayEquals(HashingEmbeddingProvider.vectorOf(texts.get(i)), batch.vectors().get(i));
        }
    }

    @Test
    @DisplayName("A failing item becomes a zero vector without failing the batch")
    void testFailingItemIsIsolated() {
        provider.failWhen(text -> text.contains("poison"));

        final EmbeddingBatch batch = gateway.embed(List.of("first text", "poison pill", "third text"));

        assertTrue(batch.isDegraded());
        assertThat(batch.unembeddableIndexes()).containsExactly(1);
        assertTrue(batch.isUnembeddable(1));
        assertTrue(isZero(batch.vectors().get(1)));
        assertEquals(HashingEmbeddingProvider.DIMENSION, batch.vectors().get(1).length);
        assertFalse(isZero(batch.vectors().get(0)));
        assertFalse(isZero(batch.vectors().get(2)));
    }

    @Test
    @DisplayName("A call exceeding the timeout is treated as a failed item")
    void testTimeout() {
        properties.setTimeout(Duration.ofMillis(50));
        provider.delay(500);

        final EmbeddingBatch batch = gateway.embed(List.of("slow text"));

        assertThat(batch.unembeddableIndexes()).containsExactly(0);
        assertTrue(isZero(batch.vectors().get(0)));
    }

    @Test
    @DisplayName("A vector of the wrong dimension is rejected per item")
    void testDimensionMismatch() {
        properties.setDimension(8);

        final EmbeddingBatch batch = gateway.embed(List.of("some text"));

        assertThat(batch.unembeddableIndexes()).containsExactly(0);
        assertEquals(8, batch.vectors().get(0).length);
    }

    @Test
    @DisplayName("Query embedding rejects blank input and fails loudly when the provider is down")
    void testEmbedQuery() {
        assertArrayEquals(HashingEmbeddingProvider.vectorOf("dragons"), gateway.embedQuery("dragons"));

        assertThrows(DocumentInputException.class, () -> gateway.embedQuery("  "));
        assertThrows(DocumentInputException.class, () -> gateway.embedQuery(null));

        provider.failAll();
        assertThrows(BackendUnavailableException.class, () -> gateway.embedQuery("dragons"));
    }

    @Test
    @DisplayName("Availability follows the provider")
    void testAvailability() {
        assertTrue(gateway.isAvailable());

        provider.failAll();
        assertFalse(gateway.isAvailable());

        provider.recover();
        assertTrue(gateway.isAvailable());
        assertEquals(HashingEmbeddingProvider.MODEL, gateway.modelName());
        assertEquals(HashingEmbeddingProvider.DIMENSION, gateway.dimension());
    }
}
