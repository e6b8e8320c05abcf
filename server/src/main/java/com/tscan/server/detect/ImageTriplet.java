package com.tscan.server.detect;

public class ImageTriplet {
    private final String name;
    private final GrayImage diff;
    private final GrayImage fresh;
    private final GrayImage reference;

    public ImageTriplet(String name, GrayImage diff, GrayImage fresh, GrayImage reference) {
        if (diff.getWidth() != fresh.getWidth() || diff.getWidth() != reference.getWidth()
                || diff.getHeight() != fresh.getHeight() || diff.getHeight() != reference.getHeight()) {
            throw new IllegalArgumentException("Triplet frames of " + name + " differ in size");
        }
        this.name = name;
        this.diff = diff;
        this.fresh = fresh;
        this.reference = reference;
    }

    public String getName() {
        return name;
    }

    public GrayImage getDiff() {
        return diff;
    }

    public GrayImage getFresh() {
        return fresh;
    }

    public GrayImage getReference() {
        return reference;
    }

    public ImageTriplet crop(CropRect rect) {
        return new ImageTriplet(name, diff.crop(rect), fresh.crop(rect), reference.crop(rect));
    }
}
