package com.image.optimization.progress;

/**
 * Receives a snapshot each time an item completes.
 *
 * <p>Invoked from worker threads, possibly concurrently. Exceptions thrown here are
 * logged and discarded; they never affect the batch.</p>
 */
@FunctionalInterface
public interface ProgressCallback {

    void onProgress(ProgressSnapshot snapshot);

    /**
     * A no-op progress callback.
     */
    ProgressCallback NOOP = snapshot -> {};
}
