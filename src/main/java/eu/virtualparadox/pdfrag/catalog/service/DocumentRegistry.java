package eu.virtualparadox.pdfrag.catalog.service;

import eu.virtualparadox.pdfrag.catalog.EStorageStatus;
import eu.virtualparadox.pdfrag.catalog.entity.DocumentEntry;
import eu.virtualparadox.pdfrag.rag.retriever.IndexManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Volatile read-through cache of {@link DocumentEntry} keyed by identity.
 * <p>
 * The registry is not the source of truth. A missing entry is loaded lazily when the backing PDF
 * exists in the documents directory and the vector index holds chunks for it; such entries are
 * marked {@code discoveredByScan}. {@link #rebuild()} recreates the whole cache from the
 * filesystem and the vector index.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentRegistry {

    private final Map<String, DocumentEntry> entries = new ConcurrentHashMap<>();

    private final DocumentStorage storage;
    private final IndexManager indexManager;

    /**
     * Replaces the entry of the identity wholesale.
     */
    public void put(final DocumentEntry entry) {
        entries.put(entry.identity(), entry);
    }

    /**
     * Read-through lookup.
     *
     * @return the cached entry, or an entry loaded from the filesystem and the vector index
     * @throws IOException if the vector index cannot be queried
     */
    public Optional<DocumentEntry> find(final String identity) throws IOException {
        final DocumentEntry cached = entries.get(identity);
        if (cached != null) {
            return Optional.of(cached);
        }
        final Optional<DocumentEntry> loaded = load(identity);
        loaded.ifPresent(entry -> entries.putIfAbsent(identity, entry));
        return loaded;
    }

    /**
     * Cache-only lookup, never touches a store.
     */
    public Optional<DocumentEntry> cached(final String identity) {
        return Optional.ofNullable(entries.get(identity));
    }

    /**
     * @return the removed entry, if one was cached
     */
    public Optional<DocumentEntry> remove(final String identity) {
        return Optional.ofNullable(entries.remove(identity));
    }

    /**
     * Scans the documents directory for uncached documents that have chunks, then returns a
     * snapshot of all entries sorted by identity.
     *
     * @throws IOException if the directory or the vector index cannot be read
     */
    public List<DocumentEntry> list() throws IOException {
        for (final String identity : storage.listIdentities()) {
            if (!entries.containsKey(identity)) {
                load(identity).ifPresent(entry -> {
                    entries.putIfAbsent(identity, entry);
                    log.info("Discovered existing document {}", identity);
                });
            }
        }
        final List<DocumentEntry> snapshot = new ArrayList<>(entries.values());
        snapshot.sort(Comparator.comparing(DocumentEntry::identity));
        return snapshot;
    }

    /**
     * Snapshot of the cached identities, without loading anything.
     */
    public Set<String> identities() {
        return new TreeSet<>(entries.keySet());
    }

    /**
     * Clears the cache and recreates an entry for every PDF that has chunks in the vector index.
     *
     * @return number of entries after the rebuild
     * @throws IOException if the directory or the vector index cannot be read
     */
    public int rebuild() throws IOException {
        entries.clear();
        for (final String identity : storage.listIdentities()) {
            load(identity).ifPresent(entry -> entries.put(identity, entry));
        }
        log.info("Registry rebuilt with {} documents", entries.size());
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private Optional<DocumentEntry> load(final String identity) throws IOException {
        final Optional<Path> file = storage.locate(identity);
        if (file.isEmpty()) {
            return Optional.empty();
        }
        final long chunks = indexManager.countSource(identity);
        if (chunks <= 0) {
            return Optional.empty();
        }
        final Path path = file.get();
        return Optional.of(DocumentEntry.builder()
                .identity(identity)
                .originalPath(path)
                .processedAt(Files.getLastModifiedTime(path).toInstant())
                .pageCount(0)
                .characterCount(Files.size(path))
                .chunkCount((int) chunks)
                .storageStatus(EStorageStatus.PERMANENT)
                .discoveredByScan(true)
                .build());
    }
}
