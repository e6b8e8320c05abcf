package com.tscan.db;

import java.util.Map;
import java.util.Optional;

/**
 * Per-group result cache. Mutations return immediately and are applied by a
 * background writer; reads see the caller's own earlier mutations.
 */
public interface RecordStore extends AutoCloseable {

    Optional<CacheRecord> get(String stem);

    void put(String stem, CacheRecord record);

    void markStatus(String stem, String status);

    void delete(String stem);

    void clearAll();

    Map<String, RecordSummary> loadSummaries();

    int getPendingWriteCount();

    /**
     * Drains every queued write to durable storage, then closes.
     */
    @Override
    void close();
}
