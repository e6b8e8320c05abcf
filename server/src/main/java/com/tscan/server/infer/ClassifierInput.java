package com.tscan.server.infer;

import com.tscan.server.detect.PatchTensor;

import java.util.List;

/**
 * Turns patches into the NCHW float input of the classifier: bilinear resize
 * (half-pixel centers, no corner alignment) to the model resolution followed by
 * per-channel normalization.
 */
public class ClassifierInput {

    public static final float[] NORM_MEAN = { 0.2601623164967817f, 0.2682929013103806f, 0.26861570225529907f };
    public static final float[] NORM_STD = { 0.09133092247248126f, 0.10773878132887775f, 0.10867911864809723f };

    private final int outSize;
    private final float[] mean;
    private final float[] std;

    public ClassifierInput(int outSize) {
        this(outSize, NORM_MEAN, NORM_STD);
    }

    public ClassifierInput(int outSize, float[] mean, float[] std) {
        if (mean.length != PatchTensor.CHANNELS || std.length != PatchTensor.CHANNELS) {
            throw new IllegalArgumentException("Expected " + PatchTensor.CHANNELS + " normalization constants");
        }
        this.outSize = outSize;
        this.mean = mean;
        this.std = std;
    }

    public int getOutSize() {
        return outSize;
    }

    public float[] toNchw(List<PatchTensor> batch) {
        int plane = outSize * outSize;
        float[] out = new float[batch.size() * PatchTensor.CHANNELS * plane];
        for (int n = 0; n < batch.size(); n++) {
            PatchTensor patch = batch.get(n);
            for (int ch = 0; ch < PatchTensor.CHANNELS; ch++) {
                int base = (n * PatchTensor.CHANNELS + ch) * plane;
                resizeChannel(patch, ch, out, base);
                for (int i = 0; i < plane; i++) {
                    out[base + i] = (out[base + i] - mean[ch]) / std[ch];
                }
            }
        }
        return out;
    }

    private void resizeChannel(PatchTensor patch, int ch, float[] out, int base) {
        int in = patch.getSize();
        double scale = (double) in / outSize;
        for (int oy = 0; oy < outSize; oy++) {
            double sy = Math.max(0.0, (oy + 0.5) * scale - 0.5);
            int y0 = Math.min((int) sy, in - 1);
            int y1 = Math.min(y0 + 1, in - 1);
            double ly = sy - y0;
            for (int ox = 0; ox < outSize; ox++) {
                double sx = Math.max(0.0, (ox + 0.5) * scale - 0.5);
                int x0 = Math.min((int) sx, in - 1);
                int x1 = Math.min(x0 + 1, in - 1);
                double lx = sx - x0;
                double top = patch.get(ch, y0, x0) * (1 - lx) + patch.get(ch, y0, x1) * lx;
                double bottom = patch.get(ch, y1, x0) * (1 - lx) + patch.get(ch, y1, x1) * lx;
                out[base + oy * outSize + ox] = (float) (top * (1 - ly) + bottom * ly);
            }
        }
    }
}
