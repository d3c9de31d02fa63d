package eu.virtualparadox.pdfrag.ingest.chunker;

public enum EChunkingStrategy {

    /** Sentences packed up to the target size, with a sentence-level suffix overlap. */
    SEMANTIC,

    /** Blank-line separated paragraphs packed up to the target size; oversized paragraphs fall back to sentences. */
    PARAGRAPH,

    /** Word windows of the target size, ignoring sentence boundaries. */
    FIXED
}
