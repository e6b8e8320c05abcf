package com.tscan.server.pipeline;

import com.tscan.db.CacheRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class RunSummary {

    private final int total;
    private final String paramsHash;
    private final Map<String, CacheRecord> results = new LinkedHashMap<>();
    private final Map<String, String> skipped = new LinkedHashMap<>();
    private final Map<String, String> failures = new LinkedHashMap<>();
    private int processed = 0;
    private int cached = 0;
    private int computed = 0;
    private int classifierCalls = 0;
    private boolean stopped = false;
    private long elapsedMs = 0;

    public RunSummary(int total, String paramsHash) {
        this.total = total;
        this.paramsHash = paramsHash;
    }

    synchronized int recordCached(String name, CacheRecord record) {
        results.put(name, record);
        cached++;
        return ++processed;
    }

    synchronized int recordComputed(String name, CacheRecord record) {
        results.put(name, record);
        computed++;
        return ++processed;
    }

    synchronized int recordSkipped(String name, String reason) {
        skipped.put(name, reason);
        return ++processed;
    }

    synchronized int recordFailure(String name, String error) {
        failures.put(name, error);
        return ++processed;
    }

    synchronized void finish(boolean wasStopped, int calls, long elapsed) {
        this.stopped = wasStopped;
        this.classifierCalls = calls;
        this.elapsedMs = elapsed;
    }

    public int getTotal() {
        return total;
    }

    public String getParamsHash() {
        return paramsHash;
    }

    public synchronized Map<String, CacheRecord> getResults() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public synchronized Map<String, String> getSkipped() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(skipped));
    }

    public synchronized Map<String, String> getFailures() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public synchronized List<String> getSkippedNames() {
        return new ArrayList<>(skipped.keySet());
    }

    public synchronized int getProcessed() {
        return processed;
    }

    public synchronized int getCached() {
        return cached;
    }

    public synchronized int getComputed() {
        return computed;
    }

    public synchronized int getClassifierCalls() {
        return classifierCalls;
    }

    public synchronized boolean isStopped() {
        return stopped;
    }

    public synchronized long getElapsedMs() {
        return elapsedMs;
    }

    @Override
    public synchronized String toString() {
        return "RunSummary{total=" + total + ", computed=" + computed + ", cached=" + cached
                + ", skipped=" + skipped.size() + ", failed=" + failures.size()
                + ", classifierCalls=" + classifierCalls + ", stopped=" + stopped + ", " + elapsedMs + " ms}";
    }
}
