package eu.virtualparadox.pdfrag.ingest.chunker;

/**
 * A sentence and its token count, measured once.
 */
record Sentence(String text, int tokens) {
}
