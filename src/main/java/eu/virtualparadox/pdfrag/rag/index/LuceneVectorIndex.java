package eu.virtualparadox.pdfrag.rag.index;

import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.Terms;
import org.apache.lucene.index.TermsEnum;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.util.BytesRef;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

import static eu.virtualparadox.pdfrag.rag.index.LuceneFields.*;

/**
 * Lucene-backed implementation of {@link VectorIndex} using the HNSW k-NN graph.
 * <p>
 * Each record is stored as one Lucene {@link Document}:
 * <ul>
 *   <li>{@code chunkId} – {@link StringField}: unique chunk identifier, used for overwrites</li>
 *   <li>{@code text} – {@link TextField}: full chunk text, stored for retrieval</li>
 *   <li>{@code vector} – {@link KnnFloatVectorField}: dense vector, Euclidean similarity</li>
 *   <li>{@code vectorData} – {@link StoredField}: raw vector bytes, to return records intact</li>
 *   <li>{@code meta.*} – {@link StringField}: one field per metadata key, exact-match deletable</li>
 * </ul>
 *
 * <p><b>Distances:</b> Lucene scores Euclidean matches as {@code 1 / (1 + d²)}; the squared
 * distance is recovered from the score so both backends report the same raw distance.</p>
 *
 * <p><b>Atomicity:</b> every mutation is applied and committed under one lock, so a concurrent
 * commit can never publish half of a batch.</p>
 */
@Slf4j
public final class LuceneVectorIndex implements VectorIndex {

    private final IndexWriter writer;
    private final SearcherManager searcherManager;
    private final int dimension;
    private final String embeddingModel;
    private final ReentrantLock mutationLock = new ReentrantLock();

    public LuceneVectorIndex(final IndexWriter writer,
                             final SearcherManager searcherManager,
                             final int dimension,
                             final String embeddingModel) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Vector dimension must be > 0");
        }
        this.writer = writer;
        this.searcherManager = searcherManager;
        this.dimension = dimension;
        this.embeddingModel = embeddingModel;
    }

    /**
     * Adds or replaces records.
     * <ol>
     *   <li>Validate the whole batch</li>
     *   <li>Delete any existing documents with the same chunk ids</li>
     *   <li>Add the batch as one block, commit and refresh the searcher</li>
     * </ol>
     * The block is added atomically. If Lucene still rejects it after validation, the overwritten
     * documents are re-added and committed before the lock is released, so the collection keeps its
     * previous content.
     */
    @Override
    public void add(final List<VectorRecord> records) throws IOException {
        VectorRecord.validateBatch(records, dimension);
        if (records.isEmpty()) {
            return;
        }

        final Term[] ids = new Term[records.size()];
        final List<Document> documents = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            final VectorRecord record = records.get(i);
            ids[i] = new Term(FIELD_CHUNK_ID, record.chunkId());
            documents.add(buildLuceneDocument(record));
        }

        mutationLock.lock();
        try {
            final List<Document> overwritten = existingDocuments(ids);
            writer.deleteDocuments(ids);
            try {
                writer.addDocuments(documents);
            } catch (IOException | RuntimeException e) {
                restore(overwritten, e);
                throw e;
            }
            writer.commit();
        } finally {
            mutationLock.unlock();
        }
        searcherManager.maybeRefreshBlocking();
    }

    @Override
    public List<ScoredRecord> search(final float[] queryVector, final int k) throws IOException {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be > 0");
        }
        if (queryVector == null || queryVector.length != dimension) {
            throw new IllegalArgumentException("Query vector must have dimension " + dimension);
        }

        final IndexSearcher searcher = searcherManager.acquire();
        try {
            if (searcher.getIndexReader().numDocs() == 0) {
                return List.of();
            }

            final TopDocs topDocs = searcher.search(new KnnFloatVectorQuery(FIELD_VECTOR, queryVector, k), k);
            final StoredFields storedFields = searcher.storedFields();

            final List<ScoredRecord> results = new ArrayList<>(topDocs.scoreDocs.length);
            for (final ScoreDoc sd : topDocs.scoreDocs) {
                final Document doc = storedFields.document(sd.doc);
                results.add(new ScoredRecord(toRecord(doc), squaredDistanceOf(sd.score)));
            }
            return results;
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Override
    public DeletionReport deleteByPredicate(final MetadataPredicate predicate) throws IOException {
        final Term term = new Term(metadataField(predicate.key()), predicate.value());

        final List<String> matched;
        mutationLock.lock();
        try {
            matched = chunkIds(new TermQuery(term));
            if (matched.isEmpty()) {
                return DeletionReport.complete(0);
            }
            writer.deleteDocuments(term);
            writer.commit();
        } finally {
            mutationLock.unlock();
        }
        searcherManager.maybeRefreshBlocking();

        final List<String> remaining = chunkIds(new TermQuery(term));
        remaining.retainAll(matched);
        if (!remaining.isEmpty()) {
            log.warn("{} of {} records matching {} are still present after deletion", remaining.size(), matched.size(), predicate);
        }
        return new DeletionReport(matched.size(), remaining);
    }

    @Override
    public long count(final MetadataPredicate predicate) throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            return searcher.count(new TermQuery(new Term(metadataField(predicate.key()), predicate.value())));
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Enumerates the indexed source terms of every segment and keeps those with at least one live document.
     */
    @Override
    public Set<String> sourceIdentities() throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final Set<String> candidates = new TreeSet<>();
            for (final LeafReaderContext leaf : searcher.getIndexReader().leaves()) {
                final Terms terms = leaf.reader().terms(FIELD_SOURCE);
                if (terms == null) {
                    continue;
                }
                final TermsEnum termsEnum = terms.iterator();
                BytesRef term;
                while ((term = termsEnum.next()) != null) {
                    candidates.add(term.utf8ToString());
                }
            }

            final Set<String> live = new TreeSet<>();
            for (final String candidate : candidates) {
                if (searcher.count(new TermQuery(new Term(FIELD_SOURCE, candidate))) > 0) {
                    live.add(candidate);
                }
            }
            return live;
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Override
    public IndexStats stats() throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            return new IndexStats(searcher.getIndexReader().numDocs(), backend(), embeddingModel, dimension);
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Override
    public void clear() throws IOException {
        mutationLock.lock();
        try {
            writer.deleteAll();
            writer.commit();
        } finally {
            mutationLock.unlock();
        }
        searcherManager.maybeRefreshBlocking();
    }

    @Override
    public EIndexBackend backend() {
        return EIndexBackend.LUCENE;
    }

    /**
     * Reads the current documents of the given chunk ids, rebuilt so they can be indexed again.
     * Must be called under {@link #mutationLock}.
     */
    private List<Document> existingDocuments(final Term[] ids) throws IOException {
        searcherManager.maybeRefreshBlocking();
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final List<Document> documents = new ArrayList<>();
            final StoredFields storedFields = searcher.storedFields();
            for (final Term id : ids) {
                for (final ScoreDoc sd : searcher.search(new TermQuery(id), 1).scoreDocs) {
                    documents.add(buildLuceneDocument(toRecord(storedFields.document(sd.doc))));
                }
            }
            return documents;
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Re-adds documents whose ids were deleted for a batch that then failed. Deletes buffered by
     * the writer only apply to documents added before them, so the restored copies survive.
     */
    private void restore(final List<Document> overwritten, final Exception cause) {
        try {
            writer.addDocuments(overwritten);
            writer.commit();
            if (!overwritten.isEmpty()) {
                log.warn("Batch rejected by Lucene, restored {} overwritten records", overwritten.size());
            }
        } catch (IOException | RuntimeException e) {
            log.error("Could not restore {} overwritten records", overwritten.size(), e);
            cause.addSuppressed(e);
        }
    }

    private List<String> chunkIds(final Query query) throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final int hits = searcher.count(query);
            final List<String> ids = new ArrayList<>(hits);
            if (hits == 0) {
                return ids;
            }
            final TopDocs topDocs = searcher.search(query, hits);
            final StoredFields storedFields = searcher.storedFields();
            for (final ScoreDoc sd : topDocs.scoreDocs) {
                ids.add(storedFields.document(sd.doc).get(FIELD_CHUNK_ID));
            }
            return ids;
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Builds a Lucene {@link Document} for a single record.
     *
     * @param record record to store
     * @return a fully populated Lucene document
     */
    private static Document buildLuceneDocument(final VectorRecord record) {
        final Document d = new Document();

        d.add(new StringField(FIELD_CHUNK_ID, record.chunkId(), Field.Store.YES));
        d.add(new TextField(FIELD_TEXT, record.text() == null ? "" : record.text(), Field.Store.YES));

        d.add(new KnnFloatVectorField(FIELD_VECTOR, record.vector()));
        d.add(new StoredField(FIELD_VECTOR_DATA, toBytes(record.vector())));

        for (final Map.Entry<String, String> entry : record.metadata().entrySet()) {
            d.add(new StringField(metadataField(entry.getKey()), entry.getValue(), Field.Store.YES));
        }
        return d;
    }

    private static VectorRecord toRecord(final Document doc) {
        final Map<String, String> metadata = new LinkedHashMap<>();
        for (final IndexableField field : doc.getFields()) {
            if (field.name().startsWith(META_PREFIX)) {
                metadata.put(field.name().substring(META_PREFIX.length()), field.stringValue());
            }
        }
        return new VectorRecord(
                doc.get(FIELD_CHUNK_ID),
                toFloats(doc.getBinaryValue(FIELD_VECTOR_DATA)),
                doc.get(FIELD_TEXT),
                metadata);
    }

    /**
     * Inverts Lucene's Euclidean score {@code 1 / (1 + d²)}.
     */
    private static double squaredDistanceOf(final float score) {
        if (score <= 0.0f) {
            return Double.POSITIVE_INFINITY;
        }
        return Math.max(0.0, 1.0 / score - 1.0);
    }

    private static byte[] toBytes(final float[] vector) {
        final ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buffer.asFloatBuffer().put(vector);
        return buffer.array();
    }

    private static float[] toFloats(final BytesRef bytes) {
        if (bytes == null) {
            return new float[0];
        }
        final float[] vector = new float[bytes.length / Float.BYTES];
        ByteBuffer.wrap(bytes.bytes, bytes.offset, bytes.length)
                .order(ByteOrder.LITTLE_ENDIAN)
                .asFloatBuffer()
                .get(vector);
        return vector;
    }
}
