package eu.virtualparadox.pdfrag.ingest.lifecycle.result;

public enum EOutcome {
    REMOVED,
    NOTHING_TO_REMOVE,

    /** Some items were removed, others remain. The store changed and failed. */
    PARTIAL,
    FAILED
}
