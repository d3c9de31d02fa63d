package eu.virtualparadox.pdfrag.ingest.lifecycle.consistency;

import java.util.List;

/**
 * Outcome of removing orphaned vector records.
 *
 * @param orphanIdentities identities found with records but without a backing file
 * @param repaired         identities whose records were removed
 * @param failed           identities that could not be repaired, with the reason
 */
public record RepairReport(List<String> orphanIdentities, List<String> repaired, List<RepairFailure> failed) {

    public RepairReport {
        orphanIdentities = List.copyOf(orphanIdentities);
        repaired = List.copyOf(repaired);
        failed = List.copyOf(failed);
    }

    public boolean success() {
        return failed.isEmpty();
    }
}
