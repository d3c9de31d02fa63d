package eu.virtualparadox.pdfrag.rag.index;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Exact brute-force index kept in the JVM heap.
 * <p>
 * Distances are squared Euclidean. Writes take the write lock for the whole batch, so a batch
 * or a delete is applied completely or not at all from the point of view of readers.
 * </p>
 */
@Slf4j
public final class InMemoryVectorIndex implements VectorIndex {

    private final int dimension;
    private final String embeddingModel;

    private final Map<String, VectorRecord> records = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public InMemoryVectorIndex(final int dimension, final String embeddingModel) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Vector dimension must be > 0");
        }
        this.dimension = dimension;
        this.embeddingModel = embeddingModel;
    }

    @Override
    public void add(final List<VectorRecord> batch) {
        VectorRecord.validateBatch(batch, dimension);

        lock.writeLock().lock();
        try {
            for (final VectorRecord record : batch) {
                records.put(record.chunkId(), record);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Added {} records", batch.size());
    }

    @Override
    public List<ScoredRecord> search(final float[] queryVector, final int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be > 0");
        }
        if (queryVector == null || queryVector.length != dimension) {
            throw new IllegalArgumentException("Query vector must have dimension " + dimension);
        }

        final List<ScoredRecord> scored;
        lock.readLock().lock();
        try {
            scored = new ArrayList<>(records.size());
            for (final VectorRecord record : records.values()) {
                scored.add(new ScoredRecord(record, squaredDistance(queryVector, record.vector())));
            }
        } finally {
            lock.readLock().unlock();
        }

        scored.sort(Comparator.comparingDouble(ScoredRecord::rawDistance));
        return scored.size() <= k ? scored : new ArrayList<>(scored.subList(0, k));
    }

    @Override
    public DeletionReport deleteByPredicate(final MetadataPredicate predicate) {
        int matched = 0;
        lock.writeLock().lock();
        try {
            final Iterator<VectorRecord> it = records.values().iterator();
            while (it.hasNext()) {
                if (predicate.matches(it.next().metadata())) {
                    it.remove();
                    matched++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return DeletionReport.complete(matched);
    }

    @Override
    public long count(final MetadataPredicate predicate) {
        lock.readLock().lock();
        try {
            return records.values().stream()
                    .filter(r -> predicate.matches(r.metadata()))
                    .count();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Set<String> sourceIdentities() {
        lock.readLock().lock();
        try {
            final Set<String> sources = new TreeSet<>();
            for (final VectorRecord record : records.values()) {
                sources.add(record.sourceIdentity());
            }
            return sources;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public IndexStats stats() {
        lock.readLock().lock();
        try {
            return new IndexStats(records.size(), backend(), embeddingModel, dimension);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            records.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public EIndexBackend backend() {
        return EIndexBackend.IN_MEMORY;
    }

    private static double squaredDistance(final float[] a, final float[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            final double d = a[i] - b[i];
            sum += d * d;
        }
        return sum;
    }
}
