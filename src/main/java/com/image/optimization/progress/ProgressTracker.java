package com.image.optimization.progress;

import com.image.optimization.metrics.MetricsService;
import com.image.optimization.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Counts completed items and derives elapsed time, rate and ETA.
 *
 * <p>The increment and the snapshot built from it happen under one lock, so
 * concurrent completions never share or skip a {@code filesProcessed} value.
 * The callback runs outside the lock, and anything it throws is logged, counted
 * and dropped.</p>
 */
public class ProgressTracker {
    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    private static final double MIN_ELAPSED_SECONDS = 1e-3;

    private final int totalFiles;
    private final ProgressCallback callback;
    private final MetricsService metricsService;
    private final Clock clock;
    private final Object lock = new Object();

    private Instant startTime;
    private int filesProcessed;
    private String lastFile;

    public ProgressTracker(int totalFiles, ProgressCallback callback, MetricsService metricsService, Clock clock) {
        if (totalFiles < 0) {
            throw new IllegalArgumentException("totalFiles must be >= 0");
        }
        this.totalFiles = totalFiles;
        this.callback = callback;
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public ProgressTracker(int totalFiles, Clock clock) {
        this(totalFiles, null, null, clock);
    }

    /**
     * Marks the batch start. Later calls keep the first start time.
     */
    public void start() {
        synchronized (lock) {
            if (startTime == null) {
                startTime = clock.instant();
            }
        }
    }

    /**
     * Records one completed item and notifies the callback, if any.
     *
     * @return the snapshot for this completion
     */
    public ProgressSnapshot onItemCompleted(String fileName) {
        ProgressSnapshot snapshot = recordCompletion(fileName);
        if (callback != null) {
            notifyCallback(snapshot);
        }
        return snapshot;
    }

    /**
     * Atomically increments the counter and builds the matching snapshot.
     *
     * @throws IllegalStateException if every item has already been counted
     */
    public ProgressSnapshot recordCompletion(String fileName) {
        synchronized (lock) {
            if (filesProcessed >= totalFiles) {
                throw new IllegalStateException("All " + totalFiles + " completions already recorded");
            }
            if (startTime == null) {
                startTime = clock.instant();
            }
            filesProcessed++;
            lastFile = fileName;
            return buildSnapshot(clock.instant());
        }
    }

    /**
     * Returns the current state without counting a completion.
     */
    public ProgressSnapshot current() {
        synchronized (lock) {
            return buildSnapshot(clock.instant());
        }
    }

    public int filesProcessed() {
        synchronized (lock) {
            return filesProcessed;
        }
    }

    public int totalFiles() {
        return totalFiles;
    }

    private void notifyCallback(ProgressSnapshot snapshot) {
        try {
            callback.onProgress(snapshot);
        } catch (Throwable t) {
            metricsService.incrementCallbackFailure();
            log.warn("callback.failed processed={}/{} file='{}' error={}",
                    snapshot.filesProcessed(), snapshot.totalFiles(), snapshot.currentFile(), t.toString());
        }
    }

    private ProgressSnapshot buildSnapshot(Instant now) {
        Duration elapsed = startTime == null ? Duration.ZERO : Duration.between(startTime, now);
        if (elapsed.isNegative()) {
            elapsed = Duration.ZERO;
        }
        double elapsedSeconds = elapsed.toNanos() / 1_000_000_000.0;

        double percent = totalFiles == 0 ? 0.0 : round2((double) filesProcessed / totalFiles * 100.0);
        double rate = elapsedSeconds > MIN_ELAPSED_SECONDS ? filesProcessed / elapsedSeconds : 0.0;

        Duration remaining = Duration.ZERO;
        if (filesProcessed > 0 && filesProcessed < totalFiles) {
            double remainingSeconds = elapsedSeconds / filesProcessed * (totalFiles - filesProcessed);
            remaining = Duration.ofNanos(Math.round(remainingSeconds * 1_000_000_000.0));
        }
        return new ProgressSnapshot(percent, filesProcessed, totalFiles, lastFile, elapsed, remaining, rate, now);
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
