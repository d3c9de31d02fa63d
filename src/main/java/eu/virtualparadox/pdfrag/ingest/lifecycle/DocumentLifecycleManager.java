package eu.virtualparadox.pdfrag.ingest.lifecycle;

import eu.virtualparadox.pdfrag.application.config.IndexProperties;
import eu.virtualparadox.pdfrag.application.config.IngestionProperties;
import eu.virtualparadox.pdfrag.application.config.RetrievalProperties;
import eu.virtualparadox.pdfrag.catalog.EStorageStatus;
import eu.virtualparadox.pdfrag.catalog.entity.DocumentEntry;
import eu.virtualparadox.pdfrag.catalog.service.DocumentRegistry;
import eu.virtualparadox.pdfrag.catalog.service.DocumentStorage;
import eu.virtualparadox.pdfrag.exception.DocumentInputException;
import eu.virtualparadox.pdfrag.ingest.chunker.ChunkStatistics;
import eu.virtualparadox.pdfrag.ingest.chunker.Chunker;
import eu.virtualparadox.pdfrag.ingest.cleaner.TextNormalizer;
import eu.virtualparadox.pdfrag.ingest.extractor.ExtractedDocument;
import eu.virtualparadox.pdfrag.ingest.extractor.TextExtractor;
import eu.virtualparadox.pdfrag.ingest.lifecycle.result.BulkDeletionResult;
import eu.virtualparadox.pdfrag.ingest.lifecycle.result.DeletionResult;
import eu.virtualparadox.pdfrag.ingest.lifecycle.result.EIngestionStage;
import eu.virtualparadox.pdfrag.ingest.lifecycle.result.EStore;
import eu.virtualparadox.pdfrag.ingest.lifecycle.result.IngestionResult;
import eu.virtualparadox.pdfrag.ingest.lifecycle.result.IngestionTimings;
import eu.virtualparadox.pdfrag.ingest.lifecycle.result.StoreOutcome;
import eu.virtualparadox.pdfrag.ingest.lifecycle.result.SystemStatus;
import eu.virtualparadox.pdfrag.ingest.model.TextChunk;
import eu.virtualparadox.pdfrag.rag.index.DeletionReport;
import eu.virtualparadox.pdfrag.rag.index.IndexStats;
import eu.virtualparadox.pdfrag.rag.retriever.IndexManager;
import eu.virtualparadox.pdfrag.rag.retriever.IndexingOutcome;
import eu.virtualparadox.pdfrag.rag.summary.SummaryService;
import eu.virtualparadox.pdfrag.rag.summary.TextSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Manages the full lifecycle of documents across three independently failing stores:
 * <ul>
 *   <li>Filesystem (source PDFs and derived artifacts)</li>
 *   <li>Vector index</li>
 *   <li>Document registry (in-memory cache)</li>
 * </ul>
 * Nothing here is atomic across stores. Partial failures are returned as structured results and
 * divergence is left to {@link eu.virtualparadox.pdfrag.ingest.lifecycle.consistency.ConsistencyService}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentLifecycleManager {

    private final DocumentStorage storage;
    private final DocumentRegistry registry;
    private final TextExtractor textExtractor;
    private final TextNormalizer textNormalizer;
    private final Chunker chunker;
    private final SummaryService summaryService;
    private final IndexManager indexManager;
    private final IngestionProperties ingestionProperties;
    private final IndexProperties indexProperties;
    private final RetrievalProperties retrievalProperties;
    private final Clock clock;

    /**
     * Stores an upload in the documents directory and ingests it.
     *
     * @throws DocumentInputException if the filename or size is rejected
     * @throws IOException            if the upload cannot be written
     */
    public IngestionResult upload(final String filename, final InputStream content) throws IOException {
        final Path stored = storage.store(filename, content);
        return ingest(stored);
    }

    /**
     * Ingests one PDF: extract, normalize, optionally condense with the chat model
     * ({@code pdfrag.ingestion.summarize}), chunk, then embed and index in sequential batches of
     * {@code pdfrag.index.batch-size}. Existing records of the same identity are replaced.
     * <p>
     * A failing batch aborts the document. Batches already written stay in the index and the
     * document is not registered.
     *
     * @param file PDF in the documents directory; files elsewhere go through {@link #upload}
     * @return success, or the failed stage together with the progress made
     * @throws DocumentInputException if the file is rejected, lies outside the documents directory,
     *                                or yields no text or no chunks
     */
    public IngestionResult ingest(final Path file) {
        final long start = System.nanoTime();

        storage.validate(file);
        if (!storage.isInDocumentsDirectory(file)) {
            throw new DocumentInputException("Only files in the documents directory can be ingested, upload "
                    + file.getFileName() + " instead: " + file);
        }
        final String identity = file.getFileName().toString();
        log.info("Processing document: {}", identity);

        // 1. Extract
        final ExtractedDocument document;
        try {
            document = textExtractor.extract(file);
        } catch (IOException e) {
            log.error("Text extraction failed for {}", identity, e);
            return failure(identity, EIngestionStage.EXTRACTION, "Text extraction failed: " + e.getMessage(),
                    new IngestionTimings(since(start), Duration.ZERO, Duration.ZERO, Duration.ZERO, since(start)));
        }
        final String text = textNormalizer.normalize(document.joinedText());
        if (text.isBlank()) {
            throw new DocumentInputException("No text extracted from PDF: " + identity);
        }
        final Duration extraction = since(start);
        log.info("Extracted {} characters from {} pages of {}", text.length(), document.pageCount(), identity);

        final List<String> warnings = new ArrayList<>();
        try {
            final Path raw = storage.writeRawText(identity, document, text, clock.instant());
            log.debug("Raw extracted text saved to {}", raw);
        } catch (IOException e) {
            log.warn("Could not write raw text artifact for {}", identity, e);
            warnings.add("Raw text artifact not written: " + e.getMessage());
        }

        // 2. Summarize
        final long summaryStart = System.nanoTime();
        String indexedText = text;
        boolean summarized = false;
        if (ingestionProperties.isSummarize()) {
            final TextSummary summary = summaryService.summarize(text);
            if (summary.isCondensed()) {
                indexedText = summary.text();
                summarized = true;
            }
            try {
                final Path written = storage.writeSummary(identity, summary);
                log.debug("Condensed text saved to {}", written);
            } catch (IOException e) {
                log.warn("Could not write summary artifact for {}", identity, e);
                warnings.add("Summary artifact not written: " + e.getMessage());
            }
        }
        final Duration summarization = since(summaryStart);

        // 3. Chunk
        final long chunkStart = System.nanoTime();
        final List<TextChunk> chunks = chunker.segment(indexedText, identity).toList();
        if (chunks.isEmpty()) {
            throw new DocumentInputException("No chunks produced from " + identity);
        }
        final ChunkStatistics statistics = ChunkStatistics.of(chunks);
        final Duration chunking = since(chunkStart);
        log.info("Created {} chunks for {} (avg {} tokens)", chunks.size(), identity, Math.round(statistics.averageTokens()));

        final IngestionResult.IngestionResultBuilder result = IngestionResult.builder()
                .identity(identity)
                .totalChunks(chunks.size())
                .charCount(text.length())
                .summarized(summarized)
                .pageCount(document.pageCount())
                .statistics(statistics)
                .warnings(warnings);

        // 4. Embed and index
        final long indexStart = System.nanoTime();
        if (!indexManager.isEmbeddingAvailable()) {
            return result.success(false)
                    .stage(EIngestionStage.EMBEDDING)
                    .error("Embedding service is not available")
                    .timings(new IngestionTimings(extraction, summarization, chunking, since(indexStart), since(start)))
                    .build();
        }

        try {
            final DeletionReport replaced = indexManager.deleteSource(identity);
            if (replaced.matched() > 0) {
                log.info("Replaced {} existing records of {}", replaced.matched(), identity);
            }
        } catch (IOException e) {
            log.error("Could not remove existing records of {}", identity, e);
            return result.success(false)
                    .stage(EIngestionStage.INDEXING)
                    .error("Could not remove existing records: " + e.getMessage())
                    .timings(new IngestionTimings(extraction, summarization, chunking, since(indexStart), since(start)))
                    .build();
        }

        final int batchSize = Math.max(1, indexProperties.getBatchSize());
        final int batches = (chunks.size() + batchSize - 1) / batchSize;
        final List<String> skipped = new ArrayList<>();
        int written = 0;
        for (int from = 0, batch = 1; from < chunks.size(); from += batchSize, batch++) {
            final List<TextChunk> slice = chunks.subList(from, Math.min(from + batchSize, chunks.size()));
            try {
                final IndexingOutcome outcome = indexManager.add(slice);
                written += outcome.added();
                skipped.addAll(outcome.unembeddableChunkIds());
                log.info("Batch {}/{} of {} indexed ({} records)", batch, batches, identity, outcome.added());
            } catch (IOException | RuntimeException e) {
                log.error("Batch {}/{} of {} failed after {} records", batch, batches, identity, written, e);
                return result.success(false)
                        .stage(EIngestionStage.INDEXING)
                        .chunkCount(written)
                        .skippedChunkIds(skipped)
                        .error("Batch " + batch + "/" + batches + " failed: " + e.getMessage())
                        .timings(new IngestionTimings(extraction, summarization, chunking, since(indexStart), since(start)))
                        .build();
            }
        }
        final Duration indexing = since(indexStart);

        if (written == 0) {
            return result.success(false)
                    .stage(EIngestionStage.EMBEDDING)
                    .skippedChunkIds(skipped)
                    .error("No chunk of " + identity + " could be embedded")
                    .timings(new IngestionTimings(extraction, summarization, chunking, indexing, since(start)))
                    .build();
        }

        // 5. Register
        final Duration total = since(start);
        registry.put(DocumentEntry.builder()
                .identity(identity)
                .originalPath(file)
                .processedAt(clock.instant())
                .processingTime(total)
                .pageCount(document.pageCount())
                .characterCount(text.length())
                .chunkCount(written)
                .chunkStatistics(statistics)
                .chunkingStrategy(chunker.defaultStrategy())
                .storageStatus(EStorageStatus.PERMANENT)
                .discoveredByScan(false)
                .build());

        log.info("Document {} processed: {} chunks in {} ms", identity, written, total.toMillis());
        return result.success(true)
                .stage(EIngestionStage.COMPLETED)
                .chunkCount(written)
                .skippedChunkIds(skipped)
                .timings(new IngestionTimings(extraction, summarization, chunking, indexing, total))
                .build();
    }

    /**
     * Non-forced deletion.
     *
     * @see #delete(String, boolean)
     */
    public DeletionResult delete(final String identity) {
        return delete(identity, false);
    }

    /**
     * Removes a document from every store, independently and in order: vector records, backing
     * file, derived artifacts, registry entry. A failing store does not stop the others.
     * <p>
     * Without {@code force}, an identity unknown to the registry is left alone and reported as
     * {@code NOT_REGISTERED}. With {@code force}, every store is cleaned by convention.
     *
     * @param identity document identity
     * @param force    clean stores even if the registry does not know the identity
     * @return per-store outcomes
     * @throws DocumentInputException if the identity is blank or contains a path
     */
    public DeletionResult delete(final String identity, final boolean force) {
        DocumentStorage.requirePlainName(identity);

        Optional<DocumentEntry> entry;
        try {
            entry = registry.find(identity);
        } catch (IOException e) {
            log.warn("Registry lookup of {} failed, using cached entry only", identity, e);
            entry = registry.cached(identity);
        }

        if (!force && entry.isEmpty()) {
            log.info("Document {} is not registered, nothing deleted", identity);
            return DeletionResult.notRegistered(identity);
        }

        final List<StoreOutcome> outcomes = new ArrayList<>(EStore.values().length);
        outcomes.add(deleteVectors(identity));
        outcomes.add(deleteBackingFile(identity, entry));
        outcomes.add(deleteDerivedArtifacts(identity));
        outcomes.add(registry.remove(identity).isPresent()
                ? StoreOutcome.removed(EStore.REGISTRY, 1)
                : StoreOutcome.nothing(EStore.REGISTRY));

        final DeletionResult result = new DeletionResult(identity, outcomes);
        if (result.failedStores().isEmpty()) {
            log.info("Deleted {}: {} (removed from {})", identity, result.status(), result.removedStores());
        } else {
            log.warn("Deleted {}: {} (removed from {}, failed {})", identity, result.status(),
                    result.removedStores(), result.errors());
        }
        return result;
    }

    /**
     * Forced deletion of every known document, followed by an unconditional index clear and
     * registry clear.
     */
    public BulkDeletionResult deleteAll() {
        final Set<String> identities = new TreeSet<>();
        try {
            registry.list().forEach(e -> identities.add(e.identity()));
        } catch (IOException e) {
            log.warn("Document listing failed, deleting cached documents only", e);
            identities.addAll(registry.identities());
        }

        final List<DeletionResult> deletions = new ArrayList<>(identities.size());
        for (final String identity : identities) {
            deletions.add(delete(identity, true));
        }

        final List<String> errors = new ArrayList<>();
        boolean indexCleared = false;
        try {
            indexManager.clear();
            indexCleared = true;
        } catch (IOException | RuntimeException e) {
            log.error("Vector index clear failed", e);
            errors.add(EStore.VECTOR_INDEX + ": " + e.getMessage());
        }
        registry.clear();

        final BulkDeletionResult result = new BulkDeletionResult(deletions, indexCleared, true, errors);
        log.info("Deleted all documents: {} of {} removed, index cleared: {}",
                result.documentsRemoved(), identities.size(), indexCleared);
        return result;
    }

    /**
     * @return registry entries, including documents discovered on disk that have indexed chunks
     * @throws IOException if the documents directory or the vector index cannot be read
     */
    public List<DocumentEntry> listDocuments() throws IOException {
        return registry.list();
    }

    /**
     * @return number of documents in the rebuilt registry
     * @throws IOException if the documents directory or the vector index cannot be read
     */
    public int rebuildRegistry() throws IOException {
        return registry.rebuild();
    }

    public SystemStatus status() {
        IndexStats stats = null;
        try {
            stats = indexManager.stats();
        } catch (IOException | RuntimeException e) {
            log.warn("Vector index statistics unavailable: {}", e.getMessage());
        }
        return SystemStatus.builder()
                .documentCount(registry.size())
                .indexStats(stats)
                .embeddingAvailable(indexManager.isEmbeddingAvailable())
                .chunkingStrategy(chunker.defaultStrategy())
                .targetTokens(chunker.defaultSizing().targetTokens())
                .overlapTokens(chunker.defaultSizing().overlapTokens())
                .tokenizer(chunker.tokenizerName())
                .topK(retrievalProperties.getTopK())
                .similarityThreshold(retrievalProperties.getSimilarityThreshold())
                .rerankingEnabled(retrievalProperties.isRerankingEnabled())
                .build();
    }

    private StoreOutcome deleteVectors(final String identity) {
        try {
            final DeletionReport report = indexManager.deleteSource(identity);
            final long residual = indexManager.countSource(identity);
            if (residual > 0 || !report.isComplete()) {
                final long remaining = Math.max(residual, report.notRemovedIds().size());
                final long removed = Math.max(0, report.matched() - remaining);
                final String error = remaining + " records of " + identity + " remain after delete";
                return removed > 0
                        ? StoreOutcome.partial(EStore.VECTOR_INDEX, removed, error)
                        : StoreOutcome.failed(EStore.VECTOR_INDEX, error);
            }
            return report.removed() > 0
                    ? StoreOutcome.removed(EStore.VECTOR_INDEX, report.removed())
                    : StoreOutcome.nothing(EStore.VECTOR_INDEX);
        } catch (IOException | RuntimeException e) {
            log.error("Vector delete of {} failed", identity, e);
            return StoreOutcome.failed(EStore.VECTOR_INDEX, e.getMessage());
        }
    }

    private StoreOutcome deleteBackingFile(final String identity, final Optional<DocumentEntry> entry) {
        final Set<Path> candidates = new LinkedHashSet<>();
        entry.map(DocumentEntry::originalPath)
                .filter(storage::isInDocumentsDirectory)
                .ifPresent(candidates::add);
        candidates.add(storage.conventionalPath(identity));

        int removed = 0;
        for (final Path candidate : candidates) {
            try {
                if (Files.deleteIfExists(candidate)) {
                    removed++;
                }
            } catch (IOException e) {
                log.error("Could not delete {} of {}", candidate, identity, e);
                return StoreOutcome.failed(EStore.FILESYSTEM, "Could not delete " + candidate + ": " + e.getMessage());
            }
        }
        return removed > 0 ? StoreOutcome.removed(EStore.FILESYSTEM, removed) : StoreOutcome.nothing(EStore.FILESYSTEM);
    }

    private StoreOutcome deleteDerivedArtifacts(final String identity) {
        int removed = 0;
        final List<String> errors = new ArrayList<>();
        for (final Path artifact : storage.derivedArtifacts(identity)) {
            try {
                if (Files.deleteIfExists(artifact)) {
                    removed++;
                }
            } catch (IOException e) {
                log.error("Could not delete artifact {} of {}", artifact, identity, e);
                errors.add(artifact.getFileName() + ": " + e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            return StoreOutcome.failed(EStore.DERIVED_ARTIFACTS, String.join("; ", errors));
        }
        return removed > 0
                ? StoreOutcome.removed(EStore.DERIVED_ARTIFACTS, removed)
                : StoreOutcome.nothing(EStore.DERIVED_ARTIFACTS);
    }

    private static IngestionResult failure(final String identity,
                                           final EIngestionStage stage,
                                           final String error,
                                           final IngestionTimings timings) {
        return IngestionResult.builder()
                .identity(identity)
                .success(false)
                .stage(stage)
                .error(error)
                .timings(timings)
                .build();
    }

    private static Duration since(final long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
