package eu.virtualparadox.pdfrag.ingest.lifecycle.consistency;

/**
 * Disjoint divergence categories between filesystem, registry and vector index.
 * Each identity falls into at most one of them.
 */
public enum EConsistencyIssue {

    /** No backing file, but records in the vector index. */
    ORPHANED_VECTORS,

    /** No backing file and no records, but a registry entry. */
    RECORDS_WITHOUT_FILES,

    /** A backing file without records in the vector index. */
    MISSING_VECTORS,

    /** A backing file with records, but no registry entry. */
    FILES_WITHOUT_RECORDS
}
