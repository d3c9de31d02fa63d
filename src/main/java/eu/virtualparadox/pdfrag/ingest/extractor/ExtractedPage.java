package eu.virtualparadox.pdfrag.ingest.extractor;

/**
 * @param pageNumber 1-based page number in the source file
 * @param text       raw page text
 */
public record ExtractedPage(int pageNumber, String text) {
}
