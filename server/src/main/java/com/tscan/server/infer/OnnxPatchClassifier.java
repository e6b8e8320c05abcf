package com.tscan.server.infer;

import ai.onnxruntime.NodeInfo;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import ai.onnxruntime.TensorInfo;
import com.tscan.server.detect.PatchTensor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.FloatBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Binary real/bogus classifier exported to ONNX. Expects input [N, 3, H, W] and
 * produces logits [N, 2]; the score is the softmax probability of class 1.
 */
public class OnnxPatchClassifier implements PatchClassifier {

    private static final Logger logger = LoggerFactory.getLogger(OnnxPatchClassifier.class);

    private final OrtEnvironment env;
    private final OrtSession session;
    private final String inputName;
    private final ClassifierInput input;
    private final String modelIdentity;

    public OnnxPatchClassifier(Path modelPath, int defaultInputSize, boolean useGpu) throws ClassifierException {
        if (modelPath == null || !Files.isRegularFile(modelPath)) {
            throw new ClassifierException("Classifier model not found at: " + modelPath);
        }
        try {
            this.env = OrtEnvironment.getEnvironment();
            OrtSession.SessionOptions opts = new OrtSession.SessionOptions();
            if (useGpu) {
                try {
                    opts.addCUDA(0);
                    logger.info("CUDA execution provider enabled");
                } catch (OrtException e) {
                    logger.warn("CUDA unavailable, falling back to CPU: {}", e.getMessage());
                    opts = new OrtSession.SessionOptions();
                }
            }
            this.session = env.createSession(modelPath.toString(), opts);
            this.inputName = session.getInputNames().iterator().next();

            int size = defaultInputSize;
            NodeInfo info = session.getInputInfo().get(inputName);
            if (info.getInfo() instanceof TensorInfo) {
                long[] shape = ((TensorInfo) info.getInfo()).getShape();
                if (shape.length == 4 && shape[2] > 0 && shape[2] == shape[3]) {
                    size = (int) shape[2];
                }
            }
            this.input = new ClassifierInput(size);
        } catch (OrtException e) {
            throw new ClassifierException("Failed to load classifier model " + modelPath, e);
        }
        this.modelIdentity = modelPath.toAbsolutePath().normalize().toString();
        logger.info("Loaded classifier {} (input {}x{})", modelIdentity, input.getOutSize(), input.getOutSize());
    }

    @Override
    public String getModelIdentity() {
        return modelIdentity;
    }

    @Override
    public synchronized double[] score(List<PatchTensor> batch) throws ClassifierException {
        if (batch.isEmpty()) {
            return new double[0];
        }
        int size = input.getOutSize();
        long[] shape = { batch.size(), PatchTensor.CHANNELS, size, size };
        FloatBuffer buffer = FloatBuffer.wrap(input.toNchw(batch));

        try (OnnxTensor tensor = OnnxTensor.createTensor(env, buffer, shape);
                OrtSession.Result result = session.run(Map.of(inputName, tensor))) {
            OnnxTensor logits = (OnnxTensor) result.get(0);
            long[] outShape = logits.getInfo().getShape();
            if (outShape.length != 2 || outShape[0] != batch.size() || outShape[1] < 2) {
                throw new ClassifierException("Unexpected classifier output shape " + java.util.Arrays.toString(outShape));
            }
            int classes = (int) outShape[1];
            FloatBuffer raw = logits.getFloatBuffer();
            double[] scores = new double[batch.size()];
            for (int n = 0; n < batch.size(); n++) {
                scores[n] = softmaxClassOne(raw, n * classes, classes);
            }
            return scores;
        } catch (OrtException e) {
            throw new ClassifierException("Classifier call failed on a batch of " + batch.size(), e);
        }
    }

    static double softmaxClassOne(FloatBuffer raw, int offset, int classes) {
        double max = Double.NEGATIVE_INFINITY;
        for (int k = 0; k < classes; k++) {
            max = Math.max(max, raw.get(offset + k));
        }
        double sum = 0;
        double one = 0;
        for (int k = 0; k < classes; k++) {
            double e = Math.exp(raw.get(offset + k) - max);
            sum += e;
            if (k == 1) {
                one = e;
            }
        }
        return one / sum;
    }

    @Override
    public void verifyReady() throws ClassifierException {
        logger.debug("Performing classifier dry run");
        List<PatchTensor> dummy = new ArrayList<>();
        int size = input.getOutSize();
        dummy.add(new PatchTensor(size, new float[PatchTensor.CHANNELS * size * size]));
        double[] out = score(dummy);
        if (out.length != 1 || Double.isNaN(out[0])) {
            throw new ClassifierException("Classifier dry run returned no usable score");
        }
        logger.info("Classifier dry run passed");
    }

    @Override
    public synchronized void close() {
        try {
            session.close();
        } catch (OrtException e) {
            logger.warn("Failed to close classifier session", e);
        }
    }
}
