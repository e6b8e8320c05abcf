package com.tscan.server.detect;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BlobFinderTest {

    @Test
    public void testDiagonalPixelsAreOneBlob() {
        GrayImage img = GrayImage.filled(10, 10, 0);
        img.set(2, 2, 100);
        img.set(3, 3, 100);
        img.set(4, 4, 100);

        List<BlobFinder.Blob> blobs = BlobFinder.findAbove(img, 50);
        assertEquals(1, blobs.size());
        BlobFinder.Blob b = blobs.get(0);
        assertEquals(3, b.area);
        assertEquals(3, b.width());
        assertEquals(3, b.height());
        assertEquals(3, b.centroidX());
        assertEquals(3, b.centroidY());
    }

    @Test
    public void testThresholdIsStrict() {
        GrayImage img = GrayImage.filled(5, 5, 0);
        img.set(1, 1, 80);
        img.set(3, 3, 81);
        List<BlobFinder.Blob> blobs = BlobFinder.findAbove(img, 80);
        assertEquals(1, blobs.size());
        assertEquals(3, blobs.get(0).minX);
    }

    @Test
    public void testAutoCropInsetsLargestDarkRegion() {
        GrayImage img = GrayImage.filled(100, 80, 255);
        for (int y = 5; y < 75; y++) {
            for (int x = 10; x < 90; x++) {
                img.set(x, y, 50);
            }
        }
        CropRect rect = BlobFinder.autoCrop(img);
        assertEquals(new CropRect(12, 7, 76, 66), rect);
    }

    @Test
    public void testAutoCropAllWhiteFallsBackToFullFrame() {
        GrayImage img = GrayImage.filled(30, 20, 250);
        assertEquals(CropRect.fullFrame(30, 20), BlobFinder.autoCrop(img));
    }
}
