package eu.virtualparadox.pdfrag.ingest.lifecycle.consistency;

import eu.virtualparadox.pdfrag.catalog.service.DocumentRegistry;
import eu.virtualparadox.pdfrag.catalog.service.DocumentStorage;
import eu.virtualparadox.pdfrag.ingest.lifecycle.DocumentLifecycleManager;
import eu.virtualparadox.pdfrag.ingest.lifecycle.result.DeletionResult;
import eu.virtualparadox.pdfrag.ingest.lifecycle.result.EStore;
import eu.virtualparadox.pdfrag.rag.retriever.IndexManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Detects and repairs divergence between the documents directory, the registry and the vector
 * index.
 * <p>
 * The audit is a best-effort point-in-time comparison: the stores are read one after the other
 * without a common snapshot, and only cached registry entries are considered.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConsistencyService {

    private final DocumentStorage storage;
    private final DocumentRegistry registry;
    private final IndexManager indexManager;
    private final DocumentLifecycleManager lifecycleManager;
    private final Clock clock;

    /**
     * Classifies every identity known to any store. Never mutates a store.
     *
     * @throws IOException if the documents directory or the vector index cannot be read
     */
    public ConsistencyReport audit() throws IOException {
        final Set<String> files = storage.listIdentities();
        final Set<String> vectors = indexManager.sourceIdentities();
        final Set<String> records = registry.identities();

        final Set<String> all = new TreeSet<>(files);
        all.addAll(vectors);
        all.addAll(records);

        final Map<EConsistencyIssue, SortedSet<String>> issues = new EnumMap<>(EConsistencyIssue.class);
        for (final EConsistencyIssue issue : EConsistencyIssue.values()) {
            issues.put(issue, new TreeSet<>());
        }

        for (final String identity : all) {
            final boolean hasFile = files.contains(identity);
            final boolean hasVectors = vectors.contains(identity);
            final boolean hasRecord = records.contains(identity);

            if (!hasFile && hasVectors) {
                issues.get(EConsistencyIssue.ORPHANED_VECTORS).add(identity);
            } else if (!hasFile && hasRecord) {
                issues.get(EConsistencyIssue.RECORDS_WITHOUT_FILES).add(identity);
            } else if (hasFile && !hasVectors) {
                issues.get(EConsistencyIssue.MISSING_VECTORS).add(identity);
            } else if (hasFile && !hasRecord) {
                issues.get(EConsistencyIssue.FILES_WITHOUT_RECORDS).add(identity);
            }
        }

        final ConsistencyReport report = new ConsistencyReport(clock.instant(), files.size(), records.size(), vectors.size(), issues);
        if (report.isConsistent()) {
            log.info("Consistency audit: {} files, {} records, {} indexed sources, no issues",
                    files.size(), records.size(), vectors.size());
        } else {
            log.warn("Consistency audit found {} issues: {}", report.totalIssues(), report.issues());
        }
        return report;
    }

    /**
     * Removes vector records whose backing file no longer exists, one forced deletion per orphan.
     *
     * @throws IOException if the documents directory or the vector index cannot be read
     */
    public RepairReport repairOrphans() throws IOException {
        final Set<String> orphans = new TreeSet<>(indexManager.sourceIdentities());
        orphans.removeAll(storage.listIdentities());

        final List<String> repaired = new ArrayList<>();
        final List<RepairFailure> failed = new ArrayList<>();
        for (final String orphan : orphans) {
            try {
                final DeletionResult result = lifecycleManager.delete(orphan, true);
                if (result.failedStores().contains(EStore.VECTOR_INDEX)) {
                    failed.add(new RepairFailure(orphan, String.join("; ", result.errors())));
                } else {
                    repaired.add(orphan);
                }
            } catch (RuntimeException e) {
                log.error("Repair of orphan {} failed", orphan, e);
                failed.add(new RepairFailure(orphan, e.getMessage()));
            }
        }

        log.info("Orphan repair: {} found, {} repaired, {} failed", orphans.size(), repaired.size(), failed.size());
        return new RepairReport(new ArrayList<>(orphans), repaired, failed);
    }
}
