package com.tscan.db;

import com.tscan.server.detect.Candidate;
import com.tscan.server.detect.CropRect;
import com.tscan.util.CandidateJsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class CacheRecordDao {

    private static final Logger logger = LoggerFactory.getLogger(CacheRecordDao.class);

    private static final String UPSERT_SQL = "INSERT INTO images " +
            "(stem, status, candidates_json, candidates_count, has_ai, max_ai, crop_rect, params_hash, timestamp) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT(stem) DO UPDATE SET " +
            "status = excluded.status, " +
            "candidates_json = excluded.candidates_json, " +
            "candidates_count = excluded.candidates_count, " +
            "has_ai = excluded.has_ai, " +
            "max_ai = excluded.max_ai, " +
            "crop_rect = COALESCE(excluded.crop_rect, images.crop_rect), " +
            "params_hash = excluded.params_hash, " +
            "timestamp = excluded.timestamp";

    private final String dbPath;

    public CacheRecordDao(String dbPath) {
        this.dbPath = dbPath;
    }

    public String getDbPath() {
        return dbPath;
    }

    public Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public Optional<CacheRecord> find(String stem) throws SQLException {
        String sql = "SELECT status, candidates_json, crop_rect, params_hash, timestamp FROM images WHERE stem = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, stem);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    List<Candidate> candidates;
                    try {
                        candidates = CandidateJsonCodec.candidatesFromJson(rs.getString("candidates_json"));
                    } catch (IllegalArgumentException e) {
                        logger.warn("Corrupt candidate list for {}, treating as empty", stem, e);
                        candidates = List.of();
                    }
                    return Optional.of(new CacheRecord(
                            rs.getString("status"),
                            candidates,
                            decodeCropRect(stem, rs.getString("crop_rect")),
                            rs.getString("params_hash"),
                            rs.getLong("timestamp")));
                }
            }
        }
        return Optional.empty();
    }

    public Map<String, RecordSummary> loadSummaries() throws SQLException {
        String sql = "SELECT stem, status, candidates_count, has_ai, max_ai, crop_rect, params_hash, timestamp " +
                "FROM images ORDER BY stem";
        Map<String, RecordSummary> out = new LinkedHashMap<>();
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String stem = rs.getString("stem");
                out.put(stem, new RecordSummary(
                        rs.getString("status"),
                        rs.getInt("candidates_count"),
                        rs.getInt("has_ai"),
                        rs.getDouble("max_ai"),
                        decodeCropRect(stem, rs.getString("crop_rect")),
                        rs.getString("params_hash"),
                        rs.getLong("timestamp")));
            }
        }
        return out;
    }

    public int count() throws SQLException {
        try (Connection conn = connect();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT COUNT(1) FROM images")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    public void upsert(Connection conn, String stem, CacheRecord record) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
            bindRecord(ps, stem, record);
            ps.executeUpdate();
        }
    }

    public void upsertAll(Connection conn, Collection<Map.Entry<String, CacheRecord>> records) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
            for (Map.Entry<String, CacheRecord> e : records) {
                bindRecord(ps, e.getKey(), e.getValue());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    public void markStatus(Connection conn, String stem, String status, long timestamp) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE images SET status = ?, timestamp = ? WHERE stem = ?")) {
            ps.setString(1, status);
            ps.setLong(2, timestamp);
            ps.setString(3, stem);
            ps.executeUpdate();
        }
    }

    public void delete(Connection conn, String stem) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM images WHERE stem = ?")) {
            ps.setString(1, stem);
            ps.executeUpdate();
        }
    }

    public void deleteAll(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("DELETE FROM images");
        }
    }

    private static void bindRecord(PreparedStatement ps, String stem, CacheRecord record) throws SQLException {
        ps.setString(1, stem);
        ps.setString(2, record.getStatus());
        ps.setString(3, CandidateJsonCodec.candidatesToJson(record.getCandidates()));
        ps.setInt(4, record.getCandidatesCount());
        ps.setInt(5, record.getHasAi());
        ps.setDouble(6, record.getMaxAi());
        ps.setString(7, CandidateJsonCodec.cropRectToJson(record.getCropRect()));
        ps.setString(8, record.getParamsHash());
        ps.setLong(9, record.getTimestamp());
    }

    private static CropRect decodeCropRect(String stem, String json) {
        try {
            return CandidateJsonCodec.cropRectFromJson(json);
        } catch (IllegalArgumentException e) {
            logger.warn("Corrupt crop_rect for {}: {}", stem, json);
            return null;
        }
    }
}
