package eu.virtualparadox.pdfrag.rag.index;

public enum EIndexBackend {

    /** Brute-force index living in the JVM heap, lost on restart. */
    IN_MEMORY,

    /** Persistent Lucene HNSW collection under {@code pdfrag.index}. */
    LUCENE
}
