package eu.virtualparadox.pdfrag.catalog;

public enum EStorageStatus {

    /** The backing PDF is kept in the documents directory. */
    PERMANENT
}
