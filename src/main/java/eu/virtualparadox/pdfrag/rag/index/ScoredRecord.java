package eu.virtualparadox.pdfrag.rag.index;

/**
 * @param record      matched record
 * @param rawDistance backend distance to the query, smaller is closer
 */
public record ScoredRecord(VectorRecord record, double rawDistance) {
}
