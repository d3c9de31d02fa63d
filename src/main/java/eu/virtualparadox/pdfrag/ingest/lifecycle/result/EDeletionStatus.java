package eu.virtualparadox.pdfrag.ingest.lifecycle.result;

public enum EDeletionStatus {

    /** At least one store changed and none failed. */
    FULLY_REMOVED,

    /** At least one store changed and at least one failed. */
    PARTIALLY_REMOVED,

    /** No store held anything for the identity. */
    NOTHING_TO_REMOVE,

    /** Nothing changed and at least one store failed. */
    FAILED,

    /** Non-forced deletion of an identity the registry does not know. No store was touched. */
    NOT_REGISTERED
}
