package com.tscan.db;

import com.fasterxml.jackson.databind.JsonNode;
import com.tscan.server.detect.Candidate;
import com.tscan.server.detect.CropRect;
import com.tscan.util.CandidateJsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * One-off import of the old JSON result file (stem -> record) into an empty
 * table.
 */
public class LegacyJsonImporter {

    private static final Logger logger = LoggerFactory.getLogger(LegacyJsonImporter.class);

    /**
     * @return number of imported stems, 0 when nothing was imported
     */
    public static int importIfEmpty(CacheRecordDao dao, Path jsonFile) throws SQLException {
        if (jsonFile == null || !Files.isRegularFile(jsonFile)) {
            return 0;
        }
        if (dao.count() > 0) {
            return 0;
        }

        List<Map.Entry<String, CacheRecord>> records = new ArrayList<>();
        try {
            JsonNode root = CandidateJsonCodec.mapper().readTree(jsonFile.toFile());
            long now = System.currentTimeMillis();
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> e = fields.next();
                records.add(new AbstractMap.SimpleEntry<>(e.getKey(), toRecord(e.getValue(), now)));
            }
        } catch (IOException | IllegalArgumentException e) {
            logger.error("Legacy import of {} failed", jsonFile, e);
            return 0;
        }

        try (Connection conn = dao.connect()) {
            conn.setAutoCommit(false);
            try {
                dao.upsertAll(conn, records);
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        }
        logger.info("Imported {} stems from legacy file {}", records.size(), jsonFile);
        return records.size();
    }

    private static CacheRecord toRecord(JsonNode node, long now) {
        String status = node.path("status").asText(CacheRecord.STATUS_UNSEEN);
        JsonNode cands = node.path("candidates");
        List<Candidate> candidates = cands.isArray()
                ? CandidateJsonCodec.candidatesFromJson(cands.toString())
                : new ArrayList<>();
        JsonNode rect = node.path("crop_rect");
        CropRect cropRect = rect.isArray() ? CandidateJsonCodec.cropRectFromJson(rect.toString()) : null;
        String paramsHash = node.path("params_hash").asText("");
        // Legacy timestamps are seconds
        long timestamp = node.has("timestamp") && node.get("timestamp").isNumber()
                ? (long) (node.get("timestamp").asDouble() * 1000)
                : now;
        return new CacheRecord(status, candidates, cropRect, paramsHash, timestamp);
    }
}
