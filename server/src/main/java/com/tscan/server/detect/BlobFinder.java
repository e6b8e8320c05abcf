package com.tscan.server.detect;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds 8-connected foreground components of a binary mask. Each component is
 * reported once with its pixel count, bounding box and centroid; holes inside a
 * component do not produce separate blobs.
 */
public class BlobFinder {

    private static final int AUTO_CROP_WHITE = 240;
    private static final int AUTO_CROP_INSET = 2;

    public static class Blob {
        public final int area;
        public final int minX;
        public final int minY;
        public final int maxX;
        public final int maxY;
        private final long sumX;
        private final long sumY;

        Blob(int area, int minX, int minY, int maxX, int maxY, long sumX, long sumY) {
            this.area = area;
            this.minX = minX;
            this.minY = minY;
            this.maxX = maxX;
            this.maxY = maxY;
            this.sumX = sumX;
            this.sumY = sumY;
        }

        public int width() {
            return maxX - minX + 1;
        }

        public int height() {
            return maxY - minY + 1;
        }

        public int centroidX() {
            return (int) (sumX / area);
        }

        public int centroidY() {
            return (int) (sumY / area);
        }
    }

    /**
     * Components of pixels strictly above {@code threshold}.
     */
    public static List<Blob> findAbove(GrayImage img, double threshold) {
        int w = img.getWidth();
        int h = img.getHeight();
        boolean[] mask = new boolean[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                mask[y * w + x] = img.get(x, y) > threshold;
            }
        }
        return components(mask, w, h);
    }

    /**
     * Components of pixels at or below {@code threshold}.
     */
    public static List<Blob> findAtOrBelow(GrayImage img, double threshold) {
        int w = img.getWidth();
        int h = img.getHeight();
        boolean[] mask = new boolean[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                mask[y * w + x] = img.get(x, y) <= threshold;
            }
        }
        return components(mask, w, h);
    }

    /**
     * Bounding box of the largest non-white region, inset to drop the border
     * ring. Falls back to the full frame when the frame is entirely white.
     */
    public static CropRect autoCrop(GrayImage img) {
        Blob largest = null;
        for (Blob b : findAtOrBelow(img, AUTO_CROP_WHITE)) {
            if (largest == null || b.area > largest.area) {
                largest = b;
            }
        }
        if (largest == null) {
            return CropRect.fullFrame(img.getWidth(), img.getHeight());
        }
        int x = Math.max(0, largest.minX + AUTO_CROP_INSET);
        int y = Math.max(0, largest.minY + AUTO_CROP_INSET);
        int w = Math.max(1, largest.width() - 2 * AUTO_CROP_INSET);
        int h = Math.max(1, largest.height() - 2 * AUTO_CROP_INSET);
        w = Math.min(w, img.getWidth() - x);
        h = Math.min(h, img.getHeight() - y);
        if (w <= 0 || h <= 0) {
            return CropRect.fullFrame(img.getWidth(), img.getHeight());
        }
        return new CropRect(x, y, w, h);
    }

    private static List<Blob> components(boolean[] mask, int w, int h) {
        List<Blob> blobs = new ArrayList<>();
        boolean[] visited = new boolean[mask.length];
        int[] stack = new int[mask.length];
        for (int start = 0; start < mask.length; start++) {
            if (!mask[start] || visited[start]) {
                continue;
            }
            int top = 0;
            stack[top++] = start;
            visited[start] = true;
            int area = 0;
            int minX = Integer.MAX_VALUE, minY = Integer.MAX_VALUE;
            int maxX = Integer.MIN_VALUE, maxY = Integer.MIN_VALUE;
            long sumX = 0, sumY = 0;
            while (top > 0) {
                int idx = stack[--top];
                int px = idx % w;
                int py = idx / w;
                area++;
                sumX += px;
                sumY += py;
                minX = Math.min(minX, px);
                minY = Math.min(minY, py);
                maxX = Math.max(maxX, px);
                maxY = Math.max(maxY, py);
                for (int dy = -1; dy <= 1; dy++) {
                    int ny = py + dy;
                    if (ny < 0 || ny >= h) {
                        continue;
                    }
                    for (int dx = -1; dx <= 1; dx++) {
                        int nx = px + dx;
                        if ((dx == 0 && dy == 0) || nx < 0 || nx >= w) {
                            continue;
                        }
                        int n = ny * w + nx;
                        if (mask[n] && !visited[n]) {
                            visited[n] = true;
                            stack[top++] = n;
                        }
                    }
                }
            }
            blobs.add(new Blob(area, minX, minY, maxX, maxY, sumX, sumY));
        }
        return blobs;
    }
}
