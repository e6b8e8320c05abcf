package com.tscan.db;

import com.tscan.server.detect.Candidate;
import com.tscan.server.detect.CropRect;
import com.tscan.server.detect.ProcessingConfig;
import com.tscan.server.detect.Verdict;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class PersistenceIntegrationTest {

    private static final String TEST_DB = "test_scan_candidates.sqlite";
    private static final String LEGACY_JSON = "test_scan_candidates.json";
    private CacheRecordDao dao;

    @BeforeEach
    public void setup() throws SQLException {
        // Clean up previous run
        teardown();

        SqliteInitializer.initialize(TEST_DB);
        dao = new CacheRecordDao(TEST_DB);
    }

    @AfterEach
    public void teardown() {
        for (String name : new String[] { TEST_DB, TEST_DB + "-wal", TEST_DB + "-shm", LEGACY_JSON }) {
            File f = new File(name);
            if (f.exists()) {
                f.delete();
            }
        }
    }

    private static List<Candidate> candidates(double... aiScores) {
        List<Candidate> list = new ArrayList<>();
        for (int i = 0; i < aiScores.length; i++) {
            Candidate c = new Candidate(10 + i, 20 + i);
            c.setId(i);
            c.setRise(100);
            c.setAiScore(aiScores[i]);
            list.add(c);
        }
        return list;
    }

    @Test
    public void testRecordCrud() throws SQLException {
        CacheRecord record = new CacheRecord(null, candidates(0.2, 0.7), new CropRect(2, 3, 100, 90), "abc", 1000L);
        try (Connection conn = dao.connect()) {
            dao.upsert(conn, "M31", record);
        }

        Optional<CacheRecord> found = dao.find("M31");
        Assertions.assertTrue(found.isPresent());
        CacheRecord loaded = found.get();
        Assertions.assertEquals("unseen", loaded.getStatus());
        Assertions.assertEquals(2, loaded.getCandidatesCount());
        Assertions.assertEquals(1, loaded.getHasAi());
        Assertions.assertEquals(0.7, loaded.getMaxAi(), 1e-9);
        Assertions.assertEquals(new CropRect(2, 3, 100, 90), loaded.getCropRect());
        Assertions.assertEquals("abc", loaded.getParamsHash());
        Assertions.assertEquals(1000L, loaded.getTimestamp());
        Assertions.assertEquals(11, loaded.getCandidates().get(1).getX());

        try (Connection conn = dao.connect()) {
            dao.markStatus(conn, "M31", "seen", 2000L);
        }
        Assertions.assertEquals("seen", dao.find("M31").get().getStatus());
        Assertions.assertEquals(2000L, dao.find("M31").get().getTimestamp());

        try (Connection conn = dao.connect()) {
            dao.delete(conn, "M31");
        }
        Assertions.assertFalse(dao.find("M31").isPresent());
        Assertions.assertEquals(0, dao.count());
    }

    @Test
    public void testUpsertWithoutCropRectKeepsStoredOne() throws SQLException {
        try (Connection conn = dao.connect()) {
            dao.upsert(conn, "M31", new CacheRecord("seen", candidates(0.5), new CropRect(1, 1, 50, 50), "h1", 1L));
            dao.upsert(conn, "M31", new CacheRecord("seen", candidates(0.9, 0.1), null, "h2", 2L));
        }
        CacheRecord loaded = dao.find("M31").get();
        Assertions.assertEquals(new CropRect(1, 1, 50, 50), loaded.getCropRect());
        Assertions.assertEquals("h2", loaded.getParamsHash());
        Assertions.assertEquals(2, loaded.getCandidatesCount());
    }

    @Test
    public void testSummariesAreOrderedAndLight() throws SQLException {
        try (Connection conn = dao.connect()) {
            dao.upsert(conn, "b", new CacheRecord(null, candidates(0.3), null, "h", 1L));
            dao.upsert(conn, "a", new CacheRecord(null, new ArrayList<>(), null, "h", 1L));
        }
        Map<String, RecordSummary> summaries = dao.loadSummaries();
        Assertions.assertEquals(List.of("a", "b"), new ArrayList<>(summaries.keySet()));
        Assertions.assertEquals(0, summaries.get("a").getHasAi());
        Assertions.assertFalse(summaries.get("a").isAuthoritativeFor("h"));
        Assertions.assertTrue(summaries.get("b").isAuthoritativeFor("h"));
        Assertions.assertFalse(summaries.get("b").isAuthoritativeFor("other"));
    }

    @Test
    public void testStoreReadsItsOwnWritesAndPersists() throws SQLException {
        ProcessingConfig config = new ProcessingConfig();
        config.commitIntervalMs = 60_000;
        config.commitEvery = 1000;

        SqliteRecordStore store = new SqliteRecordStore(TEST_DB, config);
        store.put("NGC001", new CacheRecord(null, candidates(0.95), new CropRect(0, 0, 256, 192), "h", 5L));
        Assertions.assertEquals(0.95, store.get("NGC001").get().getMaxAi(), 1e-9);

        // Writes to the returned copy must not leak into the store
        store.get("NGC001").get().getCandidates().get(0).setVerdict(Verdict.BOGUS);
        Assertions.assertNull(store.get("NGC001").get().getCandidates().get(0).getVerdict());

        store.markStatus("NGC001", "processed");
        Assertions.assertEquals("processed", store.get("NGC001").get().getStatus());
        Assertions.assertEquals(1, store.loadSummaries().size());
        store.close();

        SqliteRecordStore reopened = new SqliteRecordStore(TEST_DB, config);
        CacheRecord loaded = reopened.get("NGC001").get();
        Assertions.assertEquals("processed", loaded.getStatus());
        Assertions.assertEquals(1, loaded.getCandidatesCount());
        Assertions.assertEquals(0, reopened.getPendingWriteCount());

        reopened.delete("NGC001");
        Assertions.assertFalse(reopened.get("NGC001").isPresent());
        reopened.put("x", new CacheRecord(null, candidates(0.1), null, "h", 1L));
        reopened.put("y", new CacheRecord(null, candidates(0.1), null, "h", 1L));
        reopened.clearAll();
        Assertions.assertTrue(reopened.loadSummaries().isEmpty());
        reopened.close();
    }

    @Test
    public void testStoreCoalescesCropRect() throws SQLException {
        SqliteRecordStore store = new SqliteRecordStore(TEST_DB, new ProcessingConfig());
        store.put("M31", new CacheRecord(null, candidates(0.5), new CropRect(4, 4, 10, 10), "h", 1L));
        store.put("M31", new CacheRecord(null, candidates(0.6), null, "h", 2L));
        Assertions.assertEquals(new CropRect(4, 4, 10, 10), store.get("M31").get().getCropRect());
        store.close();
    }

    @Test
    public void testLegacyJsonImport() throws SQLException, IOException {
        String json = "{"
                + "\"M31\": {\"status\": \"seen\", \"params_hash\": \"old\", \"timestamp\": 1700000000.5,"
                + "  \"crop_rect\": [1, 2, 30, 40],"
                + "  \"candidates\": [{\"x\": 5, \"y\": 6, \"ai_score\": 0.8, \"verdict\": \"real\", \"manual\": false}]},"
                + "\"M32\": {\"candidates\": []}"
                + "}";
        Path legacy = Paths.get(LEGACY_JSON);
        Files.write(legacy, json.getBytes(StandardCharsets.UTF_8));

        Assertions.assertEquals(2, LegacyJsonImporter.importIfEmpty(dao, legacy));
        CacheRecord m31 = dao.find("M31").get();
        Assertions.assertEquals("seen", m31.getStatus());
        Assertions.assertEquals(1700000000500L, m31.getTimestamp());
        Assertions.assertEquals(new CropRect(1, 2, 30, 40), m31.getCropRect());
        Assertions.assertEquals(Verdict.REAL, m31.getCandidates().get(0).getVerdict());
        Assertions.assertEquals(0.8, m31.getMaxAi(), 1e-9);
        Assertions.assertEquals("unseen", dao.find("M32").get().getStatus());

        // Only into an empty table
        Assertions.assertEquals(0, LegacyJsonImporter.importIfEmpty(dao, legacy));
    }

    @Test
    public void testCorruptCandidateJsonReadsAsEmpty() throws SQLException {
        try (Connection conn = dao.connect();
                java.sql.PreparedStatement ps = conn.prepareStatement(
                        "INSERT INTO images(stem, status, candidates_json, candidates_count, has_ai, max_ai, "
                                + "crop_rect, params_hash, timestamp) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            ps.setString(1, "bad");
            ps.setString(2, "unseen");
            ps.setString(3, "{not json");
            ps.setInt(4, 3);
            ps.setInt(5, 1);
            ps.setDouble(6, 0.5);
            ps.setString(7, null);
            ps.setString(8, "h");
            ps.setLong(9, 1L);
            ps.executeUpdate();
        }
        CacheRecord loaded = dao.find("bad").get();
        Assertions.assertTrue(loaded.getCandidates().isEmpty());
    }
}
