package com.tscan.db;

import com.tscan.server.detect.ProcessingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link RecordStore} over a single SQLite table. A bounded LRU map mirrors the
 * most recent records so a read right after a write does not depend on the
 * writer having committed.
 */
public class SqliteRecordStore implements RecordStore {

    private static final Logger logger = LoggerFactory.getLogger(SqliteRecordStore.class);

    private final CacheRecordDao dao;
    private final AsyncRecordWriter writer;
    private final Map<String, CacheRecord> hot;

    public SqliteRecordStore(String dbPath, ProcessingConfig config) throws SQLException {
        this(dbPath, null, config);
    }

    public SqliteRecordStore(String dbPath, Path legacyJson, ProcessingConfig config) throws SQLException {
        SqliteInitializer.initialize(dbPath);
        this.dao = new CacheRecordDao(dbPath);
        if (legacyJson != null) {
            LegacyJsonImporter.importIfEmpty(dao, legacyJson);
        }
        final int capacity = Math.max(1, config.hotCacheSize);
        this.hot = Collections.synchronizedMap(new LinkedHashMap<String, CacheRecord>(64, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CacheRecord> eldest) {
                return size() > capacity;
            }
        });
        this.writer = new AsyncRecordWriter(dao, config.commitEvery, config.commitIntervalMs);
        logger.info("Opened record store at {}", dbPath);
    }

    @Override
    public Optional<CacheRecord> get(String stem) {
        CacheRecord cached = hot.get(stem);
        if (cached != null) {
            return Optional.of(cached.deepCopy());
        }
        try {
            if (writer.getPendingCount() > 0) {
                writer.sync();
            }
            Optional<CacheRecord> loaded = dao.find(stem);
            loaded.ifPresent(r -> hot.put(stem, r));
            return loaded.map(CacheRecord::deepCopy);
        } catch (SQLException e) {
            logger.error("Failed to load record {}", stem, e);
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @Override
    public void put(String stem, CacheRecord record) {
        CacheRecord toStore = record.deepCopy();
        if (toStore.getCropRect() == null) {
            CacheRecord previous = hot.get(stem);
            if (previous != null && previous.getCropRect() != null) {
                toStore = toStore.withCropRect(previous.getCropRect());
            }
        }
        hot.put(stem, toStore);
        final CacheRecord written = toStore;
        writer.submit(conn -> dao.upsert(conn, stem, written));
    }

    @Override
    public void markStatus(String stem, String status) {
        long now = System.currentTimeMillis();
        synchronized (hot) {
            CacheRecord cached = hot.get(stem);
            if (cached != null) {
                hot.put(stem, cached.withStatus(status, now));
            }
        }
        writer.submit(conn -> dao.markStatus(conn, stem, status, now));
    }

    @Override
    public void delete(String stem) {
        hot.remove(stem);
        writer.submit(conn -> dao.delete(conn, stem));
    }

    @Override
    public void clearAll() {
        hot.clear();
        writer.submit(dao::deleteAll);
    }

    @Override
    public Map<String, RecordSummary> loadSummaries() {
        try {
            writer.sync();
            return dao.loadSummaries();
        } catch (SQLException e) {
            logger.error("Failed to load record summaries", e);
            return Collections.emptyMap();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Collections.emptyMap();
        }
    }

    @Override
    public int getPendingWriteCount() {
        return writer.getPendingCount();
    }

    @Override
    public void close() {
        writer.close();
        logger.info("Closed record store at {}", dao.getDbPath());
    }
}
