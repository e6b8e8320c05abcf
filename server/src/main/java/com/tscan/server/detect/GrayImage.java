package com.tscan.server.detect;

import java.util.Arrays;

// pixels[row][col], 0..255
public class GrayImage {

    private final int[][] pixels;
    private final int width;
    private final int height;

    public GrayImage(int[][] pixels) {
        if (pixels == null || pixels.length == 0 || pixels[0].length == 0) {
            throw new IllegalArgumentException("Image must have at least one pixel");
        }
        this.pixels = pixels;
        this.height = pixels.length;
        this.width = pixels[0].length;
    }

    public static GrayImage filled(int width, int height, int value) {
        int[][] px = new int[height][width];
        for (int[] row : px) {
            Arrays.fill(row, value);
        }
        return new GrayImage(px);
    }

    public int get(int x, int y) {
        return pixels[y][x];
    }

    public void set(int x, int y, int value) {
        pixels[y][x] = value;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public GrayImage crop(CropRect rect) {
        int[][] out = new int[rect.getHeight()][rect.getWidth()];
        for (int r = 0; r < rect.getHeight(); r++) {
            System.arraycopy(pixels[rect.getY() + r], rect.getX(), out[r], 0, rect.getWidth());
        }
        return new GrayImage(out);
    }

    /**
     * 3x3 Gaussian blur (1-2-1 kernel), borders reflected without repeating the
     * edge pixel.
     */
    public GrayImage gaussianBlur3() {
        int[][] horiz = new int[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                horiz[y][x] = pixels[y][reflect(x - 1, width)]
                        + 2 * pixels[y][x]
                        + pixels[y][reflect(x + 1, width)];
            }
        }
        int[][] out = new int[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int sum = horiz[reflect(y - 1, height)][x] + 2 * horiz[y][x] + horiz[reflect(y + 1, height)][x];
                out[y][x] = (sum + 8) >> 4;
            }
        }
        return new GrayImage(out);
    }

    private static int reflect(int i, int n) {
        if (n == 1) {
            return 0;
        }
        if (i < 0) {
            return -i;
        }
        if (i >= n) {
            return 2 * n - i - 2;
        }
        return i;
    }

    public double median() {
        int[] histogram = new int[256];
        for (int[] row : pixels) {
            for (int v : row) {
                histogram[clamp(v)]++;
            }
        }
        long total = (long) width * height;
        return histogramMedian(histogram, total);
    }

    /**
     * Statistics of the window [x0, x1) x [y0, y1), clipped to the image.
     * Returns null when the clipped window is empty.
     */
    public WindowStats stats(int x0, int y0, int x1, int y1) {
        int sx0 = Math.max(0, x0);
        int sy0 = Math.max(0, y0);
        int sx1 = Math.min(width, x1);
        int sy1 = Math.min(height, y1);
        if (sx0 >= sx1 || sy0 >= sy1) {
            return null;
        }
        int[] histogram = new int[256];
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        long sum = 0;
        for (int y = sy0; y < sy1; y++) {
            for (int x = sx0; x < sx1; x++) {
                int v = pixels[y][x];
                histogram[clamp(v)]++;
                min = Math.min(min, v);
                max = Math.max(max, v);
                sum += v;
            }
        }
        long n = (long) (sx1 - sx0) * (sy1 - sy0);
        return new WindowStats(min, max, (double) sum / n, histogramMedian(histogram, n));
    }

    private static double histogramMedian(int[] histogram, long n) {
        // Mean of the two middle values for even counts
        long lowRank = (n - 1) / 2;
        long highRank = n / 2;
        int low = -1;
        int high = -1;
        long seen = 0;
        for (int v = 0; v < histogram.length; v++) {
            seen += histogram[v];
            if (low < 0 && seen > lowRank) {
                low = v;
            }
            if (seen > highRank) {
                high = v;
                break;
            }
        }
        return (low + high) / 2.0;
    }

    private static int clamp(int v) {
        return Math.max(0, Math.min(255, v));
    }

    public static class WindowStats {
        public final int min;
        public final int max;
        public final double mean;
        public final double median;

        WindowStats(int min, int max, double mean, double median) {
            this.min = min;
            this.max = max;
            this.mean = mean;
            this.median = median;
        }
    }
}
