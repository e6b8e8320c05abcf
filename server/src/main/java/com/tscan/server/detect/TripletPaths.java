package com.tscan.server.detect;

import java.nio.file.Path;

public class TripletPaths {
    private final Path frameA;
    private final Path frameB;
    private final Path frameC;

    public TripletPaths(Path frameA, Path frameB, Path frameC) {
        this.frameA = frameA;
        this.frameB = frameB;
        this.frameC = frameC;
    }

    public Path getFrameA() {
        return frameA;
    }

    public Path getFrameB() {
        return frameB;
    }

    public Path getFrameC() {
        return frameC;
    }

    @Override
    public String toString() {
        return "TripletPaths{a=" + frameA + ", b=" + frameB + ", c=" + frameC + "}";
    }
}
