package eu.virtualparadox.pdfrag.ingest.lifecycle.consistency;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Read-only snapshot comparison of the three stores.
 *
 * @param checkedAt          time of the audit
 * @param fileCount          number of PDFs in the documents directory
 * @param registryCount      number of cached registry entries
 * @param vectorSourceCount  number of distinct source identities in the vector index
 * @param issues             identities per category, every category present
 */
public record ConsistencyReport(Instant checkedAt,
                                int fileCount,
                                int registryCount,
                                int vectorSourceCount,
                                Map<EConsistencyIssue, SortedSet<String>> issues) {

    public ConsistencyReport {
        final Map<EConsistencyIssue, SortedSet<String>> copy = new EnumMap<>(EConsistencyIssue.class);
        for (final EConsistencyIssue issue : EConsistencyIssue.values()) {
            final Set<String> identities = issues.get(issue);
            copy.put(issue, Collections.unmodifiableSortedSet(
                    identities == null ? new TreeSet<>() : new TreeSet<>(identities)));
        }
        issues = Collections.unmodifiableMap(copy);
    }

    public SortedSet<String> get(final EConsistencyIssue issue) {
        return issues.get(issue);
    }

    public int totalIssues() {
        return issues.values().stream().mapToInt(Set::size).sum();
    }

    public boolean isConsistent() {
        return totalIssues() == 0;
    }
}
