package eu.virtualparadox.pdfrag.catalog.service;

import eu.virtualparadox.pdfrag.application.config.ApplicationConfig;
import eu.virtualparadox.pdfrag.exception.DocumentInputException;
import eu.virtualparadox.pdfrag.ingest.extractor.ExtractedDocument;
import eu.virtualparadox.pdfrag.rag.summary.TextSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Filesystem side of the document catalog.
 * <p>
 * Responsibilities:
 * <ul>
 *     <li>Holding the source PDFs under {@code pdfrag.documents}, the filesystem of record</li>
 *     <li>Validating candidate files before ingestion</li>
 *     <li>Storing uploads atomically (temp file, then move)</li>
 *     <li>Writing and locating derived artifacts ({@code _raw.txt}, {@code _summary.txt})</li>
 * </ul>
 * A document's identity is its filename.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentStorage {

    public static final String PDF_EXTENSION = ".pdf";
    public static final String RAW_TEXT_SUFFIX = "_raw.txt";
    public static final String SUMMARY_SUFFIX = "_summary.txt";

    /** Temporary file prefix for atomic uploads. */
    private static final String TEMP_FILE_PREFIX = "up-";

    /** Temporary file suffix for atomic uploads. */
    private static final String TEMP_FILE_SUFFIX = ".tmp";

    private static final String HEADER_RULE = "=".repeat(50);

    private final ApplicationConfig props;

    /**
     * Identities of every PDF currently in the documents directory, sorted.
     *
     * @throws IOException if the directory cannot be listed
     */
    public Set<String> listIdentities() throws IOException {
        final Path dir = props.getDocuments();
        final Set<String> identities = new TreeSet<>();
        if (dir == null || !Files.isDirectory(dir)) {
            return identities;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (final Path file : stream) {
                if (Files.isRegularFile(file) && PDF_EXTENSION.equals(fileExtension(file.getFileName().toString()))) {
                    identities.add(file.getFileName().toString());
                }
            }
        }
        return identities;
    }

    /**
     * @return the backing file of the identity if it exists in the documents directory
     */
    public Optional<Path> locate(final String identity) {
        final Path file = conventionalPath(identity);
        return Files.isRegularFile(file) ? Optional.of(file) : Optional.empty();
    }

    /**
     * @return {@code true} if the file sits directly in the documents directory
     */
    public boolean isInDocumentsDirectory(final Path file) {
        final Path parent = file.toAbsolutePath().normalize().getParent();
        return parent != null && parent.equals(props.getDocuments().toAbsolutePath().normalize());
    }

    /**
     * Path where a document of this identity lives by convention, whether or not it exists.
     */
    public Path conventionalPath(final String identity) {
        return props.getDocuments().resolve(identity);
    }

    /**
     * Checks a file before ingestion.
     *
     * @param file candidate PDF
     * @throws DocumentInputException if the file is missing, not a regular file, not a {@code .pdf}
     *                                or larger than {@code pdfrag.max-file-size}
     */
    public void validate(final Path file) {
        if (file == null || !Files.exists(file)) {
            throw new DocumentInputException("PDF file not found: " + file);
        }
        if (!Files.isRegularFile(file)) {
            throw new DocumentInputException("Not a regular file: " + file);
        }
        if (!PDF_EXTENSION.equals(fileExtension(file.getFileName().toString()))) {
            throw new DocumentInputException("Only PDF files are supported: " + file.getFileName());
        }
        final long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new DocumentInputException("Cannot read file size of " + file, e);
        }
        checkSize(file.getFileName().toString(), size);
    }

    /**
     * Stores an upload in the documents directory, replacing a file with the same name.
     *
     * <p>Steps performed:
     * <ol>
     *     <li>Validates the filename (plain name, {@code .pdf} extension)</li>
     *     <li>Copies the content into a temp file next to the target</li>
     *     <li>Rejects content larger than {@code pdfrag.max-file-size}</li>
     *     <li>Moves the temp file into place atomically</li>
     * </ol>
     *
     * @param filename original filename, becomes the identity
     * @param content  document bytes (caller is responsible for closing)
     * @return path of the stored document
     * @throws DocumentInputException if the name or size is rejected
     * @throws IOException            if writing to the filesystem fails
     */
    public Path store(final String filename, final InputStream content) throws IOException {
        final String identity = identityOf(filename);

        final Path dir = props.getDocuments();
        Files.createDirectories(dir);

        final Path target = dir.resolve(identity);
        final Path temp = Files.createTempFile(dir, TEMP_FILE_PREFIX, TEMP_FILE_SUFFIX);
        try {
            final long bytes = Files.copy(content, temp, StandardCopyOption.REPLACE_EXISTING);
            checkSize(identity, bytes);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Stored upload {} ({} bytes)", identity, bytes);
            return target;
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Writes the extracted text of a document to {@code processed/{identity}_raw.txt}.
     *
     * @return the written artifact
     * @throws IOException if writing fails
     */
    public Path writeRawText(final String identity,
                             final ExtractedDocument document,
                             final String text,
                             final Instant extractedAt) throws IOException {
        final Path dir = props.getProcessed();
        Files.createDirectories(dir);
        final Path target = dir.resolve(identity + RAW_TEXT_SUFFIX);

        final String header = "=== PDF raw extracted text ===\n"
                + "Filename: " + identity + "\n"
                + "Pages: " + document.pageCount() + "\n"
                + "Characters: " + text.length() + "\n"
                + "Extracted at: " + extractedAt + "\n"
                + HEADER_RULE + "\n\n";

        Files.writeString(target, header + text, StandardCharsets.UTF_8);
        return target;
    }

    /**
     * Writes the condensed text of a document to {@code summaries/{identity}_summary.txt}.
     *
     * @return the written artifact
     * @throws IOException if writing fails
     */
    public Path writeSummary(final String identity, final TextSummary summary) throws IOException {
        final Path dir = props.getSummaries();
        Files.createDirectories(dir);
        final Path target = dir.resolve(identity + SUMMARY_SUFFIX);

        final String header = "=== Condensed text ===\n"
                + "Original length: " + summary.originalChars() + " characters\n"
                + "Condensed length: " + summary.text().length() + " characters\n"
                + "Compression: " + String.format(Locale.ROOT, "%.1f%%", summary.compressionRatio() * 100) + "\n"
                + "Pieces: " + summary.pieces() + " (" + summary.condensedPieces() + " condensed)\n"
                + HEADER_RULE + "\n\n";

        Files.writeString(target, header + summary.text(), StandardCharsets.UTF_8);
        return target;
    }

    /**
     * Derived artifact paths of an identity, existing or not.
     */
    public List<Path> derivedArtifacts(final String identity) {
        return List.of(
                props.getProcessed().resolve(identity + RAW_TEXT_SUFFIX),
                props.getSummaries().resolve(identity + SUMMARY_SUFFIX));
    }

    /**
     * Validates an upload filename and returns it as the document identity.
     *
     * @throws DocumentInputException if the name is blank, contains a path or is not a {@code .pdf}
     */
    public static String identityOf(final String filename) {
        final String name = requirePlainName(filename);
        if (!PDF_EXTENSION.equals(fileExtension(name))) {
            throw new DocumentInputException("Only PDF files are supported: " + filename);
        }
        return name;
    }

    /**
     * @return the stripped name
     * @throws DocumentInputException if the name is blank or contains a path
     */
    public static String requirePlainName(final String name) {
        if (name == null || name.isBlank()) {
            throw new DocumentInputException("Filename must not be blank");
        }
        final String stripped = name.strip();
        if (stripped.contains("/") || stripped.contains("\\") || stripped.equals("..") || stripped.equals(".")) {
            throw new DocumentInputException("Filename must not contain a path: " + name);
        }
        return stripped;
    }

    /**
     * Extracts the file extension from a filename.
     *
     * @param name original filename, may be null
     * @return the lowercase extension including the dot (e.g., ".pdf"), or an empty string if none found
     */
    public static String fileExtension(final String name) {
        if (name == null) {
            return "";
        }
        final int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return "";
        }
        return name.substring(dot).trim().toLowerCase(Locale.ROOT);
    }

    private void checkSize(final String name, final long bytes) {
        final long limit = props.getMaxFileSize().toBytes();
        if (bytes > limit) {
            throw new DocumentInputException("File " + name + " is " + bytes + " bytes, limit is " + limit);
        }
    }
}
