package eu.virtualparadox.pdfrag.rag.retriever;

import java.util.List;

/**
 * @param added                number of records written to the vector index
 * @param unembeddableChunkIds chunks skipped because no embedding could be produced
 */
public record IndexingOutcome(int added, List<String> unembeddableChunkIds) {

    public IndexingOutcome {
        unembeddableChunkIds = List.copyOf(unembeddableChunkIds);
    }
}
