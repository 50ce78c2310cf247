package com.newsdigest.news.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Success and failure counts for one drain, updated by concurrent workers.
 * Reports every {@code interval} completions and once more when the drain ends.
 */
public class ProgressTracker {

    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final int interval;
    private final ProgressListener listener;

    private int total;
    private int succeeded;
    private int failed;
    private int lastReported = -1;

    public ProgressTracker(int total, int interval, ProgressListener listener) {
        this.total = total;
        this.interval = Math.max(1, interval);
        this.listener = listener != null ? listener : ProgressListener.NONE;
    }

    public void recordSuccess() {
        record(true);
    }

    public void recordFailure() {
        record(false);
    }

    private void record(boolean success) {
        ProgressSnapshot toReport = null;
        lock.lock();
        try {
            if (success) succeeded++;
            else failed++;
            int completed = succeeded + failed;
            // Items added during the drain can push the count past the initial total
            if (completed > total) total = completed;
            if (completed % interval == 0 || completed == total) {
                toReport = snapshotLocked();
                lastReported = completed;
            }
        } finally {
            lock.unlock();
        }
        if (toReport != null) {
            report(toReport);
        }
    }

    /**
     * Emit the final line unless the last completion already did.
     */
    public ProgressSnapshot finish() {
        ProgressSnapshot snapshot;
        boolean alreadyReported;
        lock.lock();
        try {
            snapshot = snapshotLocked();
            alreadyReported = lastReported == snapshot.completed();
            lastReported = snapshot.completed();
        } finally {
            lock.unlock();
        }
        if (!alreadyReported) {
            report(snapshot);
        }
        return snapshot;
    }

    public ProgressSnapshot snapshot() {
        lock.lock();
        try {
            return snapshotLocked();
        } finally {
            lock.unlock();
        }
    }

    private ProgressSnapshot snapshotLocked() {
        return new ProgressSnapshot(succeeded + failed, total, succeeded, failed);
    }

    private void report(ProgressSnapshot snapshot) {
        log.info("Progress: {}/{} (succeeded {}, failed {})",
            snapshot.completed(), snapshot.total(), snapshot.succeeded(), snapshot.failed());
        try {
            listener.onProgress(snapshot);
        } catch (RuntimeException e) {
            log.warn("Progress listener error: {}", e.getMessage());
        }
    }
}
