package eu.virtualparadox.pdfrag.ingest.lifecycle.result;

/**
 * The independently failing stores a document lives in, in deletion order.
 */
public enum EStore {
    VECTOR_INDEX,
    FILESYSTEM,
    DERIVED_ARTIFACTS,
    REGISTRY
}
