package eu.virtualparadox.pdfrag.rag.summary;

/**
 * Result of condensing a document text piece by piece.
 *
 * @param text             joined pieces, condensed where the model succeeded
 * @param originalChars    length of the input text
 * @param pieces           number of pieces sent to the model
 * @param condensedPieces  pieces replaced by a model summary, the rest kept their original text
 */
public record TextSummary(String text, int originalChars, int pieces, int condensedPieces) {

    public boolean isCondensed() {
        return condensedPieces > 0;
    }

    public double compressionRatio() {
        return originalChars == 0 ? 1.0 : (double) text.length() / originalChars;
    }
}
