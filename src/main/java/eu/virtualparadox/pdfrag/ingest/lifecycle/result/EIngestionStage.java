package eu.virtualparadox.pdfrag.ingest.lifecycle.result;

/**
 * Stage an ingestion reached or failed in.
 */
public enum EIngestionStage {
    VALIDATION,
    EXTRACTION,
    CHUNKING,
    EMBEDDING,
    INDEXING,
    REGISTRATION,
    COMPLETED
}
