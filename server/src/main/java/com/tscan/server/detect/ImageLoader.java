package com.tscan.server.detect;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

public class ImageLoader {

    public static GrayImage readGray(Path path) throws IOException {
        BufferedImage bi = ImageIO.read(path.toFile());
        if (bi == null) {
            throw new IOException("Unreadable image: " + path);
        }
        int width = bi.getWidth();
        int height = bi.getHeight();
        int[][] pixels = new int[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int clr = bi.getRGB(x, y);
                int red = (clr & 0x00ff0000) >> 16;
                int green = (clr & 0x0000ff00) >> 8;
                int blue = clr & 0x000000ff;
                pixels[y][x] = (int) Math.round(0.299 * red + 0.587 * green + 0.114 * blue);
            }
        }
        return new GrayImage(pixels);
    }

    public static ImageTriplet readTriplet(String name, TripletPaths paths) throws IOException {
        if (paths == null || paths.getFrameA() == null || paths.getFrameB() == null || paths.getFrameC() == null) {
            throw new IOException("Incomplete triplet: " + name);
        }
        GrayImage a = readGray(paths.getFrameA());
        GrayImage b = readGray(paths.getFrameB());
        GrayImage c = readGray(paths.getFrameC());
        try {
            return new ImageTriplet(name, a, b, c);
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
    }
}
