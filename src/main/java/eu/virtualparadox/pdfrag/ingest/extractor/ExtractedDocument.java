package eu.virtualparadox.pdfrag.ingest.extractor;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered pages of raw text extracted from one file.
 *
 * @param source     extracted file
 * @param pageCount  number of pages of the file, including blank ones
 * @param pages      non-blank pages in page order
 */
public record ExtractedDocument(Path source, int pageCount, List<ExtractedPage> pages) {

    private static final String PAGE_SEPARATOR = "\n\n";

    public ExtractedDocument {
        pages = List.copyOf(pages);
    }

    /**
     * @return page texts joined with a blank line, so page breaks read as paragraph breaks
     */
    public String joinedText() {
        return pages.stream()
                .map(ExtractedPage::text)
                .collect(Collectors.joining(PAGE_SEPARATOR));
    }

    public boolean isBlank() {
        return pages.stream().allMatch(p -> p.text() == null || p.text().isBlank());
    }
}
