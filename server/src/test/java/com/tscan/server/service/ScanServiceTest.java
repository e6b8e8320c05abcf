package com.tscan.server.service;

import com.tscan.db.CacheRecord;
import com.tscan.db.SqliteRecordStore;
import com.tscan.server.detect.DetectionParameters;
import com.tscan.server.detect.TripletFixtures;
import com.tscan.server.infer.ClassifierException;
import com.tscan.server.infer.StubPatchClassifier;
import com.tscan.server.pipeline.GroupState;
import com.tscan.server.util.ScanConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

public class ScanServiceTest {

    @TempDir
    Path dir;

    private ScanService service;
    private StubPatchClassifier classifier;

    @BeforeEach
    public void setup() throws SQLException {
        ScanConfig config = new ScanConfig();
        config.detection.autoCrop = false;
        classifier = new StubPatchClassifier(0.9);
        SqliteRecordStore store = new SqliteRecordStore(dir.resolve("db.sqlite").toString(), config.processing);
        service = new ScanService(config, store, params -> classifier);
    }

    @AfterEach
    public void teardown() {
        service.shutdown();
    }

    @Test
    public void testScanRunsInBackgroundAndExposesRecords() throws Exception {
        TripletFixtures.writeTransient(dir, "NGC001", 120, 80);
        TripletFixtures.writeTransient(dir, "NGC002", 60, 60);

        service.startScan(dir.toString());
        assertTrue(service.awaitIdle(30_000));

        ScanStatus status = service.getStatus();
        assertFalse(status.running);
        assertEquals(2, status.total);
        assertEquals(2, status.processed);
        assertEquals(2, status.computed);
        assertNull(status.error);
        assertEquals(Integer.valueOf(2), status.groupStates.get(GroupState.PERSISTED));
        assertTrue(classifier.isClosed());

        assertEquals(2, service.listRecords().size());
        CacheRecord record = service.getRecord("NGC001").orElseThrow();
        assertEquals(0.9, record.getMaxAi(), 1e-9);

        assertTrue(service.markStatus("NGC001", "seen"));
        assertEquals("seen", service.getRecord("NGC001").orElseThrow().getStatus());
        assertFalse(service.markStatus("missing", "seen"));

        assertTrue(service.delete("NGC002"));
        assertFalse(service.delete("NGC002"));
        service.clearAll();
        assertTrue(service.listRecords().isEmpty());
    }

    @Test
    public void testParameterEditsApplyToNextRun() {
        DetectionParameters params = service.getParameters();
        params.thresh = 55;
        assertEquals(80, service.getParameters().thresh, 1e-9);
        service.updateParameters(params);
        assertEquals(55, service.getParameters().thresh, 1e-9);
    }

    @Test
    public void testClassifierLoadFailureIsReported() throws SQLException {
        ScanConfig config = new ScanConfig();
        SqliteRecordStore store = new SqliteRecordStore(dir.resolve("other.sqlite").toString(), config.processing);
        ScanService failing = new ScanService(config, store, params -> {
            throw new ClassifierException("no model");
        });
        try {
            assertThrows(ClassifierException.class, () -> failing.startScan(dir.toString()));
            assertFalse(failing.isRunning());
        } finally {
            failing.shutdown();
        }
    }

    @Test
    public void testMissingDirectory() {
        assertThrows(IOException.class, () -> service.startScan(dir.resolve("absent").toString()));
    }

    @Test
    public void testFatalClassifierErrorEndsRun() throws Exception {
        classifier.failOnScore();
        TripletFixtures.writeTransient(dir, "NGC001", 120, 80);

        service.startScan(dir.toString());
        assertTrue(service.awaitIdle(30_000));

        assertEquals("stub failure", service.getStatus().error);
        assertFalse(service.stop());
    }
}
