package eu.virtualparadox.pdfrag.rag.embed;

public enum EEmbeddingProvider {

    /** Spring AI {@code EmbeddingModel}, e.g. Ollama. */
    SPRING_AI,

    /** Local ONNX model under {@code pdfrag.models/retriever}. */
    ONNX
}
