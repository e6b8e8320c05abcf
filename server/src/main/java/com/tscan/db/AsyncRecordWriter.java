package com.tscan.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single consumer of all record mutations. Callers enqueue and return; the
 * writer thread applies operations in order on one connection and commits every
 * {@code commitEvery} operations or after {@code commitIntervalMs}, whichever
 * comes first. A failing operation is logged and skipped.
 * <p>
 * {@link #close()} enqueues a stop marker and waits until everything queued
 * before it has been applied and committed. If the writer thread exits on its
 * own (no connection), the writer stops accepting and later submits fail.
 */
public class AsyncRecordWriter implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(AsyncRecordWriter.class);

    @FunctionalInterface
    public interface WriteOp {
        void apply(Connection conn) throws SQLException;
    }

    private static final WriteOp STOP = conn -> {
    };

    private final CacheRecordDao dao;
    private final int commitEvery;
    private final long commitIntervalMs;
    private final BlockingQueue<WriteOp> queue = new LinkedBlockingQueue<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final Thread thread;

    private final Object submitLock = new Object();
    private volatile boolean accepting = true;
    private int uncommitted = 0;
    private long lastCommit = System.currentTimeMillis();
    private long failedOps = 0;

    public AsyncRecordWriter(CacheRecordDao dao, int commitEvery, long commitIntervalMs) {
        this.dao = dao;
        this.commitEvery = Math.max(1, commitEvery);
        this.commitIntervalMs = Math.max(1, commitIntervalMs);
        this.thread = new Thread(this::run, "record-writer");
        this.thread.setDaemon(true);
        this.thread.start();
    }

    public void submit(WriteOp op) {
        synchronized (submitLock) {
            if (!accepting) {
                throw new IllegalStateException("Record writer is closed");
            }
            inFlight.incrementAndGet();
            queue.add(op);
        }
    }

    /**
     * Blocks until every operation submitted so far is applied and committed.
     */
    public void sync() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        synchronized (submitLock) {
            if (!accepting) {
                return;
            }
            inFlight.incrementAndGet();
            queue.add(new Barrier(latch));
        }
        latch.await();
    }

    /**
     * False once {@link #close()} was called or the writer thread has exited.
     */
    public boolean isAccepting() {
        return accepting;
    }

    public int getPendingCount() {
        return inFlight.get();
    }

    public synchronized long getFailedCount() {
        return failedOps;
    }

    private static final class Barrier implements WriteOp {
        final CountDownLatch latch;

        Barrier(CountDownLatch latch) {
            this.latch = latch;
        }

        @Override
        public void apply(Connection conn) {
        }
    }

    private void run() {
        try (Connection conn = dao.connect()) {
            conn.setAutoCommit(false);
            while (true) {
                WriteOp op;
                try {
                    op = queue.poll(commitIntervalMs, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn("Record writer interrupted with {} operations queued", queue.size());
                    break;
                }
                if (op == null) {
                    commitIfDue(conn, true);
                    continue;
                }
                if (op == STOP) {
                    commit(conn);
                    inFlight.decrementAndGet();
                    break;
                }
                if (op instanceof Barrier) {
                    commit(conn);
                    inFlight.decrementAndGet();
                    ((Barrier) op).latch.countDown();
                    continue;
                }
                try {
                    op.apply(conn);
                    uncommitted++;
                } catch (SQLException | RuntimeException e) {
                    synchronized (this) {
                        failedOps++;
                    }
                    logger.error("Record write failed", e);
                } finally {
                    inFlight.decrementAndGet();
                }
                commitIfDue(conn, false);
            }
        } catch (SQLException e) {
            logger.error("Record writer lost its database connection", e);
        } finally {
            abandonQueue();
        }
    }

    private void abandonQueue() {
        synchronized (submitLock) {
            accepting = false;
            int dropped = 0;
            WriteOp left;
            while ((left = queue.poll()) != null) {
                inFlight.decrementAndGet();
                if (left instanceof Barrier) {
                    ((Barrier) left).latch.countDown();
                } else if (left != STOP) {
                    dropped++;
                }
            }
            if (dropped > 0) {
                synchronized (this) {
                    failedOps += dropped;
                }
                logger.error("Record writer exited with {} writes not applied", dropped);
            }
        }
    }

    private void commitIfDue(Connection conn, boolean idle) {
        if (uncommitted == 0) {
            return;
        }
        long now = System.currentTimeMillis();
        if (idle || uncommitted >= commitEvery || now - lastCommit >= commitIntervalMs) {
            commit(conn);
        }
    }

    private void commit(Connection conn) {
        if (uncommitted == 0) {
            lastCommit = System.currentTimeMillis();
            return;
        }
        try {
            conn.commit();
            logger.debug("Committed {} record writes", uncommitted);
        } catch (SQLException e) {
            logger.error("Commit of {} record writes failed", uncommitted, e);
        }
        uncommitted = 0;
        lastCommit = System.currentTimeMillis();
    }

    @Override
    public void close() {
        synchronized (submitLock) {
            if (!accepting) {
                return;
            }
            accepting = false;
            inFlight.incrementAndGet();
            queue.add(STOP);
        }
        try {
            thread.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while draining record writer");
        }
        logger.info("Record writer stopped ({} failed writes)", getFailedCount());
    }
}
