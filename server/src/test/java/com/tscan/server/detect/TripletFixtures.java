package com.tscan.server.detect;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Synthetic triplets. A "spot" is a 13 pixel diamond (center 250, rim 150) on
 * a flat background of 20; after the 3x3 blur exactly those 13 pixels stay
 * above the default threshold of 80.
 */
public class TripletFixtures {

    public static final int WIDTH = 256;
    public static final int HEIGHT = 192;
    public static final int BACKGROUND = 20;

    public static GrayImage background() {
        return GrayImage.filled(WIDTH, HEIGHT, BACKGROUND);
    }

    public static void paintSpot(GrayImage img, int cx, int cy) {
        for (int dy = -2; dy <= 2; dy++) {
            for (int dx = -2; dx <= 2; dx++) {
                if (Math.abs(dx) + Math.abs(dy) <= 2) {
                    img.set(cx + dx, cy + dy, dx == 0 && dy == 0 ? 250 : 150);
                }
            }
        }
    }

    /**
     * Spots in the difference and fresh frames, nothing in the reference.
     * {@code spots} holds x,y pairs.
     */
    public static ImageTriplet transientTriplet(String name, int... spots) {
        GrayImage a = background();
        GrayImage b = background();
        for (int i = 0; i + 1 < spots.length; i += 2) {
            paintSpot(a, spots[i], spots[i + 1]);
            paintSpot(b, spots[i], spots[i + 1]);
        }
        return new ImageTriplet(name, a, b, background());
    }

    public static TripletPaths writeTriplet(Path dir, String stem, ImageTriplet triplet) throws IOException {
        Path a = dir.resolve(stem + "a.png");
        Path b = dir.resolve(stem + "b.png");
        Path c = dir.resolve(stem + "c.png");
        writePng(triplet.getDiff(), a);
        writePng(triplet.getFresh(), b);
        writePng(triplet.getReference(), c);
        return new TripletPaths(a, b, c);
    }

    public static TripletPaths writeTransient(Path dir, String stem, int... spots) throws IOException {
        return writeTriplet(dir, stem, transientTriplet(stem, spots));
    }

    public static void writePng(GrayImage img, Path file) throws IOException {
        BufferedImage bi = new BufferedImage(img.getWidth(), img.getHeight(), BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < img.getHeight(); y++) {
            for (int x = 0; x < img.getWidth(); x++) {
                int v = img.get(x, y);
                bi.setRGB(x, y, (v << 16) | (v << 8) | v);
            }
        }
        ImageIO.write(bi, "png", file.toFile());
    }
}
