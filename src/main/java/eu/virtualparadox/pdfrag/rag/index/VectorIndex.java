package eu.virtualparadox.pdfrag.rag.index;

import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * Storage of chunk vectors with similarity search.
 * <p>
 * Implementations are selected by configuration ({@code pdfrag.index.backend}) and must tolerate
 * concurrent add, delete and search calls.
 * </p>
 */
public interface VectorIndex {

    /**
     * Adds records, overwriting any record with the same chunk id. The whole batch is validated
     * before anything is written; a failing batch leaves previously added records intact.
     *
     * @param records records to add
     * @throws IOException if the backend write fails
     * @throws IllegalArgumentException if the batch is invalid (e.g. dimension mismatch)
     */
    void add(List<VectorRecord> records) throws IOException;

    /**
     * @param queryVector query embedding
     * @param k           maximum number of results (must be {@code > 0})
     * @return up to {@code k} records ordered best-first; empty on an empty index
     * @throws IOException if the backend read fails
     */
    List<ScoredRecord> search(float[] queryVector, int k) throws IOException;

    /**
     * Deletes every record matching {@code predicate}.
     *
     * @return how many records matched and which of them are still present
     * @throws IOException if the backend write fails
     */
    DeletionReport deleteByPredicate(MetadataPredicate predicate) throws IOException;

    /**
     * @return number of records matching {@code predicate}
     * @throws IOException if the backend read fails
     */
    long count(MetadataPredicate predicate) throws IOException;

    /**
     * @return distinct source identities that still have at least one record
     * @throws IOException if the backend read fails
     */
    Set<String> sourceIdentities() throws IOException;

    /**
     * @throws IOException if the backend read fails
     */
    IndexStats stats() throws IOException;

    /**
     * Unconditionally removes every record.
     *
     * @throws IOException if the backend write fails
     */
    void clear() throws IOException;

    EIndexBackend backend();
}
