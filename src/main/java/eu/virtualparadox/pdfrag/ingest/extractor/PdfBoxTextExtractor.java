package eu.virtualparadox.pdfrag.ingest.extractor;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;

/**
 * PDF extractor based on Apache PDFBox.
 * <p>Text is stripped page by page and NFC-normalized; blank pages are skipped but still
 * counted in {@link ExtractedDocument#pageCount()}.</p>
 */
@Service
@Slf4j
public final class PdfBoxTextExtractor implements TextExtractor {

    @Override
    public ExtractedDocument extract(final Path path) throws IOException {
        try (PDDocument pdf = PDDocument.load(path.toFile())) {
            final int pageCount = pdf.getNumberOfPages();
            final PDFTextStripper stripper = new PDFTextStripper();
            final List<ExtractedPage> pages = new ArrayList<>(pageCount);

            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);

                final String pageText = Normalizer.normalize(stripper.getText(pdf), Normalizer.Form.NFC);
                if (!pageText.isBlank()) {
                    pages.add(new ExtractedPage(page, pageText));
                }
            }

            log.debug("Extracted {} of {} pages from {}", pages.size(), pageCount, path);
            return new ExtractedDocument(path, pageCount, pages);
        }
    }
}
