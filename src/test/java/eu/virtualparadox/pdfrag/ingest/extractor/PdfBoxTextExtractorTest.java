package eu.virtualparadox.pdfrag.ingest.extractor;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Extraction from PDFs generated on the fly with PDFBox.
 */
class PdfBoxTextExtractorTest {

    @TempDir
    Path dir;

    private final PdfBoxTextExtractor extractor = new PdfBoxTextExtractor();

    // ---------- Helpers ----------

    /**
     * Writes one page per entry; a {@code null} entry produces a blank page.
     */
    private Path pdf(final String name, final List<String> pages) throws IOException {
        final Path file = dir.resolve(name);
        try (PDDocument document = new PDDocument()) {
            for (final String text : pages) {
                final PDPage page = new PDPage();
                document.addPage(page);
                if (text == null) {
                    continue;
                }
                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    content.beginText();
                    content.setFont(PDType1Font.HELVETICA, 12);
                    content.newLineAtOffset(72, 700);
                    content.showText(text);
                    content.endText();
                }
            }
            document.save(file.toFile());
        }
        return file;
    }

    // ---------- Tests ----------

    @Test
    @DisplayName("Pages are extracted in order, blank pages are counted but skipped")
    void testExtractPages() throws IOException {
        final Path file = pdf("dragons.pdf", Arrays.asList(
                "The dragon guarded the ancient bridge.",
                null,
                "The council met at dawn."));

        final ExtractedDocument document = extractor.extract(file);

        assertEquals(file, document.source());
        assertEquals(3, document.pageCount());
        assertEquals(2, document.pages().size());
        assertEquals(1, document.pages().get(0).pageNumber());
        assertEquals(3, document.pages().get(1).pageNumber());
        assertTrue(document.pages().get(0).text().contains("The dragon guarded the ancient bridge."));
        assertTrue(document.joinedText().contains("\n\n"));
        assertFalse(document.isBlank());
    }

    @Test
    @DisplayName("A PDF without text yields a blank document")
    void testBlankPdf() throws IOException {
        final ExtractedDocument document = extractor.extract(pdf("empty.pdf", Collections.singletonList(null)));

        assertEquals(1, document.pageCount());
        assertTrue(document.pages().isEmpty());
        assertTrue(document.isBlank());
        assertEquals("", document.joinedText());
    }

    @Test
    @DisplayName("A file that is not a PDF fails with an IOException")
    void testCorruptFile() throws IOException {
        final Path file = Files.writeString(dir.resolve("corrupt.pdf"), "definitely not a pdf");

        assertThrows(IOException.class, () -> extractor.extract(file));
    }
}
