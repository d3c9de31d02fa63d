package eu.virtualparadox.pdfrag.rag.index;

import eu.virtualparadox.pdfrag.ingest.model.ChunkMetadata;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LuceneVectorIndexTest {

    private static final int DIMENSION = 4;

    private Directory directory;
    private IndexWriter writer;
    private SearcherManager searcherManager;
    private LuceneVectorIndex index;

    @BeforeEach
    void setUp() throws IOException {
        directory = new ByteBuffersDirectory();
        open(directory);
    }

    @AfterEach
    void tearDown() throws IOException {
        close();
    }

    // ---------- Helpers ----------

    private void open(final Directory dir) throws IOException {
        open(dir, new StandardAnalyzer());
    }

    private void open(final Directory dir, final Analyzer analyzer) throws IOException {
        directory = dir;
        writer = new IndexWriter(dir, new IndexWriterConfig(analyzer)
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND));
        searcherManager = new SearcherManager(writer, null);
        index = new LuceneVectorIndex(writer, searcherManager, DIMENSION, "test-model");
    }

    private void close() throws IOException {
        searcherManager.close();
        writer.close();
        directory.close();
    }

    private static VectorRecord record(final String source, final int ordinal, final float... vector) {
        return new VectorRecord(source + "_" + ordinal, vector, "text of " + source + " " + ordinal,
                Map.of(ChunkMetadata.KEY_SOURCE, source, ChunkMetadata.KEY_ORDINAL, Integer.toString(ordinal)));
    }

    /**
     * Analyzer that fails while indexing any text containing {@code marker}, after validation has passed.
     */
    private static Analyzer failingOn(final String marker) {
        return new Analyzer() {
            @Override
            protected TokenStreamComponents createComponents(final String fieldName) {
                final StandardTokenizer source = new StandardTokenizer();
                final TokenStream sink = new TokenFilter(source) {
                    private final CharTermAttribute term = addAttribute(CharTermAttribute.class);

                    @Override
                    public boolean incrementToken() throws IOException {
                        if (!input.incrementToken()) {
                            return false;
                        }
                        if (marker.contentEquals(term)) {
                            throw new IllegalStateException("Cannot analyze " + marker);
                        }
                        return true;
                    }
                };
                return new TokenStreamComponents(source, sink);
            }
        };
    }

    private static VectorRecord withText(final VectorRecord record, final String text) {
        return new VectorRecord(record.chunkId(), record.vector(), text, record.metadata());
    }

    // ---------- Tests ----------

    @Test
    @DisplayName("Search returns records intact with squared Euclidean distances")
    void testSearchRoundTrip() throws IOException {
        index.add(List.of(
                record("a.pdf", 0, 1, 0, 0, 0),
                record("a.pdf", 1, 0, 1, 0, 0),
                record("b.pdf", 0, 0.9f, 0.1f, 0, 0)));

        final List<ScoredRecord> hits = index.search(new float[]{1, 0, 0, 0}, 2);

        assertEquals(2, hits.size());
        final VectorRecord best = hits.get(0).record();
        assertEquals("a.pdf_0", best.chunkId());
        assertEquals("text of a.pdf 0", best.text());
        assertEquals("a.pdf", best.sourceIdentity());
        assertEquals("0", best.metadata().get(ChunkMetadata.KEY_ORDINAL));
        assertArrayEquals(new float[]{1, 0, 0, 0}, best.vector());
        assertEquals(0.0, hits.get(0).rawDistance(), 1e-4);

        assertEquals("b.pdf_0", hits.get(1).record().chunkId());
        assertEquals(0.02, hits.get(1).rawDistance(), 1e-4);
    }

    @Test
    @DisplayName("Empty index returns an empty result")
    void testEmptySearch() throws IOException {
        assertTrue(index.search(new float[]{1, 0, 0, 0}, 5).isEmpty());
    }

    @Test
    @DisplayName("Adding an existing chunk id overwrites the record")
    void testOverwrite() throws IOException {
        index.add(List.of(record("a.pdf", 0, 1, 0, 0, 0)));
        index.add(List.of(record("a.pdf", 0, 0, 0, 1, 0)));

        assertEquals(1, index.stats().count());
        assertArrayEquals(new float[]{0, 0, 1, 0}, index.search(new float[]{0, 0, 1, 0}, 1).get(0).record().vector());
    }

    @Test
    @DisplayName("Delete by source removes only that source and reports the match count")
    void testDeleteByPredicate() throws IOException {
        index.add(List.of(
                record("a.pdf", 0, 1, 0, 0, 0),
                record("a.pdf", 1, 0, 1, 0, 0),
                record("b.pdf", 0, 0, 0, 1, 0)));

        final DeletionReport report = index.deleteByPredicate(MetadataPredicate.sourceEquals("a.pdf"));

        assertEquals(2, report.matched());
        assertTrue(report.isComplete());
        assertEquals(0, index.count(MetadataPredicate.sourceEquals("a.pdf")));
        assertEquals(1, index.count(MetadataPredicate.sourceEquals("b.pdf")));
        assertEquals(Set.of("b.pdf"), index.sourceIdentities());
        assertEquals(1, index.search(new float[]{1, 0, 0, 0}, 5).size());
    }

    @Test
    @DisplayName("Deleting an unknown source matches nothing")
    void testDeleteUnknown() throws IOException {
        index.add(List.of(record("a.pdf", 0, 1, 0, 0, 0)));

        final DeletionReport report = index.deleteByPredicate(MetadataPredicate.sourceEquals("missing.pdf"));

        assertEquals(0, report.matched());
        assertEquals(1, index.stats().count());
    }

    @Test
    @DisplayName("An invalid batch is rejected before anything is written")
    void testInvalidBatchWritesNothing() throws IOException {
        final List<VectorRecord> batch = List.of(
                record("a.pdf", 0, 1, 0, 0, 0),
                record("a.pdf", 1, 1, 0, 0));

        assertThrows(IllegalArgumentException.class, () -> index.add(batch));
        assertEquals(0, index.stats().count());
    }

    @Test
    @DisplayName("A batch with an oversized metadata value is rejected and earlier records stay intact")
    void testOversizedTermLeavesPriorRecords() throws IOException {
        index.add(List.of(record("a.pdf", 0, 1, 0, 0, 0)));
        final VectorRecord oversized = new VectorRecord("b.pdf_0", new float[]{0, 1, 0, 0}, "b",
                Map.of(ChunkMetadata.KEY_SOURCE, "b.pdf", "note", "x".repeat(40_000)));

        assertThrows(IllegalArgumentException.class, () -> index.add(List.of(
                withText(record("a.pdf", 0, 0, 0, 1, 0), "replacement"), oversized)));
        index.add(List.of(record("c.pdf", 0, 0, 0, 0, 1)));

        assertEquals(1, index.count(MetadataPredicate.sourceEquals("a.pdf")));
        assertEquals(0, index.count(MetadataPredicate.sourceEquals("b.pdf")));
        final VectorRecord kept = index.search(new float[]{1, 0, 0, 0}, 1).get(0).record();
        assertEquals("text of a.pdf 0", kept.text());
        assertArrayEquals(new float[]{1, 0, 0, 0}, kept.vector());
    }

    @Test
    @DisplayName("A batch Lucene rejects while indexing restores the records it overwrote")
    void testFailedBatchRestoresOverwrittenRecords() throws IOException {
        close();
        open(new ByteBuffersDirectory(), failingOn("explode"));
        index.add(List.of(record("a.pdf", 0, 1, 0, 0, 0), record("a.pdf", 1, 0, 1, 0, 0)));

        assertThrows(RuntimeException.class, () -> index.add(List.of(
                withText(record("a.pdf", 0, 0, 0, 1, 0), "replacement"),
                withText(record("b.pdf", 0, 0, 0, 0, 1), "this one will explode"))));
        index.add(List.of(record("c.pdf", 0, 0, 0, 1, 1)));

        assertEquals(2, index.count(MetadataPredicate.sourceEquals("a.pdf")));
        assertEquals(0, index.count(MetadataPredicate.sourceEquals("b.pdf")));
        assertEquals(3, index.stats().count());
        final VectorRecord restored = index.search(new float[]{1, 0, 0, 0}, 1).get(0).record();
        assertEquals("a.pdf_0", restored.chunkId());
        assertEquals("text of a.pdf 0", restored.text());
        assertEquals("0", restored.metadata().get(ChunkMetadata.KEY_ORDINAL));
        assertArrayEquals(new float[]{1, 0, 0, 0}, restored.vector());
    }

    @Test
    @DisplayName("Search rejects a non-positive k and a wrong query dimension")
    void testSearchValidation() {
        assertThrows(IllegalArgumentException.class, () -> index.search(new float[]{1, 0, 0, 0}, 0));
        assertThrows(IllegalArgumentException.class, () -> index.search(new float[]{1, 0}, 3));
    }

    @Test
    @DisplayName("Stats, source listing and clear")
    void testStatsAndClear() throws IOException {
        index.add(List.of(record("a.pdf", 0, 1, 0, 0, 0), record("b.pdf", 0, 0, 1, 0, 0)));

        final IndexStats stats = index.stats();
        assertEquals(2, stats.count());
        assertEquals(EIndexBackend.LUCENE, stats.backend());
        assertEquals(DIMENSION, stats.dimension());
        assertEquals(Set.of("a.pdf", "b.pdf"), index.sourceIdentities());

        index.clear();
        assertEquals(0, index.stats().count());
        assertTrue(index.sourceIdentities().isEmpty());
        assertTrue(index.search(new float[]{1, 0, 0, 0}, 3).isEmpty());
    }

    @Test
    @DisplayName("Records survive closing and reopening the collection")
    void testPersistence(@TempDir final Path dir) throws IOException {
        close();
        open(FSDirectory.open(dir));
        index.add(List.of(record("a.pdf", 0, 1, 0, 0, 0), record("a.pdf", 1, 0, 1, 0, 0)));

        close();
        open(FSDirectory.open(dir));

        assertEquals(2, index.stats().count());
        assertEquals(Set.of("a.pdf"), index.sourceIdentities());
        assertEquals("a.pdf_1", index.search(new float[]{0, 1, 0, 0}, 1).get(0).record().chunkId());
    }
}
