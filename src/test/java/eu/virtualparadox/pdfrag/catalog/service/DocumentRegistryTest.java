package eu.virtualparadox.pdfrag.catalog.service;

import eu.virtualparadox.pdfrag.catalog.EStorageStatus;
import eu.virtualparadox.pdfrag.catalog.entity.DocumentEntry;
import eu.virtualparadox.pdfrag.ingest.lifecycle.result.IngestionResult;
import eu.virtualparadox.pdfrag.support.PdfRagFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DocumentRegistryTest {

    @TempDir
    Path root;

    private PdfRagFixture fixture;
    private DocumentRegistry registry;

    @BeforeEach
    void setUp() throws IOException {
        fixture = PdfRagFixture.create(root);
        registry = fixture.registry;
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    // ---------- Helpers ----------

    /**
     * Ingests a sample document, then forgets it so only the file and the vectors remain.
     */
    private IngestionResult ingestAndForget(final String filename, final long seed) throws IOException {
        final IngestionResult result = fixture.lifecycleManager.ingest(fixture.writeSampleDocument(filename, seed));
        assertTrue(result.success(), result.error());
        registry.clear();
        return result;
    }

    // ---------- Tests ----------

    @Test
    @DisplayName("Ingestion registers a complete entry")
    void testIngestedEntry() throws IOException {
        final IngestionResult result = fixture.lifecycleManager.ingest(fixture.writeSampleDocument("a.pdf", 1));

        final DocumentEntry entry = registry.cached("a.pdf").orElseThrow();
        assertEquals(result.chunkCount(), entry.chunkCount());
        assertEquals(3, entry.pageCount());
        assertEquals(PdfRagFixture.NOW, entry.processedAt());
        assertEquals(EStorageStatus.PERMANENT, entry.storageStatus());
        assertFalse(entry.discoveredByScan());
        assertNotNull(entry.chunkStatistics());
    }

    @Test
    @DisplayName("A lookup miss is loaded from the file and the vector index")
    void testReadThrough() throws IOException {
        final IngestionResult result = ingestAndForget("a.pdf", 1);
        assertTrue(registry.cached("a.pdf").isEmpty());

        final DocumentEntry entry = registry.find("a.pdf").orElseThrow();

        assertTrue(entry.discoveredByScan());
        assertEquals(result.chunkCount(), entry.chunkCount());
        assertEquals(Files.size(fixture.storage.conventionalPath("a.pdf")), entry.characterCount());
        assertEquals(0, entry.pageCount());
        assertTrue(registry.cached("a.pdf").isPresent());
    }

    @Test
    @DisplayName("A file without vectors or vectors without a file are not loaded")
    void testNoEntryWithoutBothStores() throws IOException {
        fixture.writeSampleDocument("unindexed.pdf", 2);
        ingestAndForget("gone.pdf", 3);
        Files.delete(fixture.storage.conventionalPath("gone.pdf"));

        assertTrue(registry.find("unindexed.pdf").isEmpty());
        assertTrue(registry.find("gone.pdf").isEmpty());
        assertTrue(registry.find("never-seen.pdf").isEmpty());
        assertEquals(0, registry.size());
    }

    @Test
    @DisplayName("Listing discovers existing documents and returns them sorted")
    void testListDiscovers() throws IOException {
        ingestAndForget("b.pdf", 1);
        ingestAndForget("a.pdf", 2);
        fixture.writeSampleDocument("c.pdf", 3);

        assertThat(registry.list()).extracting(DocumentEntry::identity).containsExactly("a.pdf", "b.pdf");
        assertEquals(Set.of("a.pdf", "b.pdf"), registry.identities());
    }

    @Test
    @DisplayName("Rebuild replaces the cache with what the stores hold")
    void testRebuild() throws IOException {
        ingestAndForget("a.pdf", 1);
        registry.put(DocumentEntry.builder().identity("stale.pdf").build());

        assertEquals(1, registry.rebuild());
        assertEquals(Set.of("a.pdf"), registry.identities());
    }

    @Test
    @DisplayName("Remove and clear only touch the cache")
    void testRemoveAndClear() throws IOException {
        fixture.lifecycleManager.ingest(fixture.writeSampleDocument("a.pdf", 1));

        assertTrue(registry.remove("a.pdf").isPresent());
        assertTrue(registry.remove("a.pdf").isEmpty());
        assertTrue(fixture.indexManager.countSource("a.pdf") > 0);

        registry.put(DocumentEntry.builder().identity("x.pdf").build());
        registry.clear();
        assertEquals(0, registry.size());
    }
}
