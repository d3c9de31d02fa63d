package eu.virtualparadox.pdfrag.rag.embed;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Local sentence-embedding model run with ONNX Runtime.
 * <p>
 * Expects {@code model.onnx} and {@code tokenizer.json} in the model directory. Token vectors are
 * mean-pooled over the attention mask and L2-normalized.
 * </p>
 */
@Slf4j
public final class OnnxEmbeddingProvider implements EmbeddingProvider {

    private static final int MAX_LEN = 1024;

    private final Path modelPath;
    private final Path tokenizerPath;
    private final String modelName;

    private OrtEnvironment env;
    private OrtSession session;
    private HuggingFaceTokenizer tokenizer;

    public OnnxEmbeddingProvider(final Path modelRoot, final String modelName) {
        this.modelPath = modelRoot.resolve("model.onnx");
        this.tokenizerPath = modelRoot.resolve("tokenizer.json");
        this.modelName = modelName;
    }

    @PostConstruct
    public void init() throws IOException, OrtException {
        this.env = OrtEnvironment.getEnvironment();
        this.session = env.createSession(modelPath.toString(), sessionOptions());
        this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);

        log.info("Loaded ONNX embedding model: {}", modelPath);
        log.info("Model expects inputs: {}", session.getInputNames());
    }

    @PreDestroy
    public void cleanup() throws OrtException {
        if (tokenizer != null) {
            tokenizer.close();
        }
        if (session != null) {
            session.close();
        }
    }

    @Override
    public float[] embed(final String text) throws OrtException {
        final Encoding encoding = tokenizer.encode(text);
        final int len = Math.min(encoding.getIds().length, MAX_LEN);

        final long[][] inputIds = new long[1][len];
        final long[][] attentionMask = new long[1][len];
        final long[][] tokenTypes = new long[1][len];
        System.arraycopy(encoding.getIds(), 0, inputIds[0], 0, len);
        System.arraycopy(encoding.getAttentionMask(), 0, attentionMask[0], 0, len);

        try (OnnxTensor idsTensor = OnnxTensor.createTensor(env, inputIds);
             OnnxTensor maskTensor = OnnxTensor.createTensor(env, attentionMask);
             OnnxTensor typeTensor = OnnxTensor.createTensor(env, tokenTypes)) {

            final Set<String> inputNames = session.getInputNames();
            final Map<String, OnnxTensor> inputs = new HashMap<>();
            if (inputNames.contains("input_ids")) {
                inputs.put("input_ids", idsTensor);
            }
            if (inputNames.contains("attention_mask")) {
                inputs.put("attention_mask", maskTensor);
            }
            if (inputNames.contains("token_type_ids")) {
                inputs.put("token_type_ids", typeTensor);
            }

            try (OrtSession.Result result = session.run(inputs)) {
                final float[][][] tokenVectors = (float[][][]) result.get(0).getValue();
                final float[] vector = meanPool(tokenVectors[0], attentionMask[0]);
                normalize(vector);
                return vector;
            }
        }
    }

    @Override
    public String modelName() {
        return modelName;
    }

    private static OrtSession.SessionOptions sessionOptions() throws OrtException {
        final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();
        // leave one core free for other tasks
        final int intraThreads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        opts.setIntraOpNumThreads(intraThreads);
        opts.setInterOpNumThreads(1);
        log.info("Intra-op threads: {}, Inter-op threads: {}", intraThreads, 1);
        return opts;
    }

    static float[] meanPool(final float[][] tokenVectors, final long[] attentionMask) {
        final int hiddenDim = tokenVectors[0].length;
        final float[] pooled = new float[hiddenDim];

        int validCount = 0;
        for (int i = 0; i < tokenVectors.length; i++) {
            if (attentionMask[i] == 1) {
                final float[] tokenVec = tokenVectors[i];
                for (int j = 0; j < hiddenDim; j++) {
                    pooled[j] += tokenVec[j];
                }
                validCount++;
            }
        }

        if (validCount > 0) {
            for (int j = 0; j < hiddenDim; j++) {
                pooled[j] /= validCount;
            }
        }
        return pooled;
    }

    static void normalize(final float[] vec) {
        double norm = 0.0;
        for (final float v : vec) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm > 0.0) {
            for (int i = 0; i < vec.length; i++) {
                vec[i] /= (float) norm;
            }
        }
    }
}
