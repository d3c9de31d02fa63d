package eu.virtualparadox.pdfrag.ingest.extractor;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Extracts ordered pages of raw text from a document file.
 */
public interface TextExtractor {

    /**
     * @param path document file
     * @return extracted pages
     * @throws IOException if the file cannot be read or parsed
     */
    ExtractedDocument extract(Path path) throws IOException;
}
