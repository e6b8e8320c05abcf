package com.tscan.server.detect;

/**
 * Channel-first float patch [channels][size][size] flattened, values in [0, 1].
 * Channel order follows the triplet roles: diff, new, reference.
 */
public class PatchTensor {
    public static final int CHANNELS = 3;

    private final int size;
    private final float[] data;

    public PatchTensor(int size, float[] data) {
        if (data.length != CHANNELS * size * size) {
            throw new IllegalArgumentException("Patch data length " + data.length + " does not match size " + size);
        }
        this.size = size;
        this.data = data;
    }

    public int getSize() {
        return size;
    }

    public float[] getData() {
        return data;
    }

    public float get(int channel, int row, int col) {
        return data[(channel * size + row) * size + col];
    }
}
