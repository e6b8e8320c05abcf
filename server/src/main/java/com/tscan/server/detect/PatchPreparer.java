package com.tscan.server.detect;

/**
 * Cuts a square patch centered on a candidate out of each frame. Parts of the
 * patch that fall outside the frame are zero.
 */
public class PatchPreparer {

    private final int cropSize;

    public PatchPreparer(int cropSize) {
        if (cropSize <= 0) {
            throw new IllegalArgumentException("cropSize must be positive");
        }
        this.cropSize = cropSize;
    }

    public PatchTensor prepare(ImageTriplet triplet, int cx, int cy) {
        float[] data = new float[PatchTensor.CHANNELS * cropSize * cropSize];
        GrayImage[] frames = { triplet.getDiff(), triplet.getFresh(), triplet.getReference() };
        int half = cropSize / 2;
        int x1 = cx - half;
        int y1 = cy - half;
        int w = triplet.getDiff().getWidth();
        int h = triplet.getDiff().getHeight();

        for (int ch = 0; ch < frames.length; ch++) {
            GrayImage frame = frames[ch];
            int base = ch * cropSize * cropSize;
            for (int r = 0; r < cropSize; r++) {
                int sy = y1 + r;
                if (sy < 0 || sy >= h) {
                    continue;
                }
                for (int c = 0; c < cropSize; c++) {
                    int sx = x1 + c;
                    if (sx < 0 || sx >= w) {
                        continue;
                    }
                    data[base + r * cropSize + c] = frame.get(sx, sy) / 255.0f;
                }
            }
        }
        return new PatchTensor(cropSize, data);
    }
}
