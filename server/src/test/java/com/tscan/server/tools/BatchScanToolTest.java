package com.tscan.server.tools;

import com.tscan.server.detect.TripletFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class BatchScanToolTest {

    @Test
    public void testEmptyDirectoryIsNotAnError(@TempDir Path dir) {
        assertEquals(0, BatchScanTool.run(dir.toFile()));
    }

    @Test
    public void testMissingModelIsFatal(@TempDir Path dir) throws IOException {
        TripletFixtures.writeTransient(dir, "NGC001", 120, 80);
        System.setProperty("scan.data.dir", dir.toString());
        try {
            assertEquals(2, BatchScanTool.run(dir.toFile()));
        } finally {
            System.clearProperty("scan.data.dir");
        }
    }
}
