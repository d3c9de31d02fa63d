package eu.virtualparadox.pdfrag.ingest.lifecycle.consistency;

public record RepairFailure(String identity, String reason) {
}
