package com.image.optimization.api;

import com.image.optimization.progress.ProgressSnapshot;
import com.image.optimization.progress.ProgressTracker;
import com.image.optimization.result.BatchSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle to a batch started with {@link BatchDispatcher#submit}.
 *
 * <p>{@link #cancel()} stops queued items from starting and interrupts the ones in
 * flight. Every item still receives a result, so the summary stays complete.</p>
 */
public class BatchRun {
    private static final Logger log = LoggerFactory.getLogger(BatchRun.class);

    private final String batchId;
    private final ProgressTracker tracker;
    private final CompletableFuture<BatchSummary> future = new CompletableFuture<>();
    private final AtomicBoolean cancellationRequested = new AtomicBoolean(false);
    private final AtomicReference<BatchState> state = new AtomicReference<>(BatchState.NOT_STARTED);
    private final Set<Thread> activeWorkers = ConcurrentHashMap.newKeySet();
    private boolean summarizing;

    BatchRun(String batchId, ProgressTracker tracker) {
        this.batchId = batchId;
        this.tracker = tracker;
    }

    public String batchId() {
        return batchId;
    }

    public BatchState state() {
        return state.get();
    }

    public boolean isDone() {
        return future.isDone();
    }

    public boolean isCancellationRequested() {
        return cancellationRequested.get();
    }

    /**
     * Requests cancellation.
     *
     * @return true if this call requested cancellation, false if every item already
     *         had its result or cancellation was already requested. A true return
     *         always shows up as {@code cancelled} in the summary.
     */
    public boolean cancel() {
        synchronized (this) {
            if (summarizing || state.get() == BatchState.COMPLETED) {
                return false;
            }
            if (!cancellationRequested.compareAndSet(false, true)) {
                return false;
            }
        }
        log.info("batch.cancel.requested batchId={} activeWorkers={}", batchId, activeWorkers.size());
        activeWorkers.forEach(Thread::interrupt);
        return true;
    }

    /**
     * Current progress without counting a completion.
     */
    public ProgressSnapshot progress() {
        return tracker.current();
    }

    /**
     * A view of the completion future. Completing the returned future does not affect the batch.
     */
    public CompletableFuture<BatchSummary> future() {
        return future.copy();
    }

    /**
     * Blocks until the batch has completed.
     */
    public BatchSummary await() {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw rethrow(e.getCause() != null ? e.getCause() : e);
        }
    }

    /**
     * Blocks until the batch has completed or the timeout elapses. The batch keeps
     * running after a timeout.
     */
    public BatchSummary await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw rethrow(e.getCause() != null ? e.getCause() : e);
        }
    }

    /**
     * Called once all items have results. Later {@link #cancel()} calls return false.
     *
     * @return whether cancellation was requested before this point
     */
    synchronized boolean closeForCancellation() {
        summarizing = true;
        return cancellationRequested.get();
    }

    void markRunning() {
        state.compareAndSet(BatchState.NOT_STARTED, BatchState.RUNNING);
    }

    void complete(BatchSummary summary) {
        state.set(BatchState.COMPLETED);
        future.complete(summary);
    }

    void fail(Throwable cause) {
        state.set(BatchState.COMPLETED);
        future.completeExceptionally(cause);
    }

    void registerWorker(Thread thread) {
        activeWorkers.add(thread);
        if (cancellationRequested.get()) {
            thread.interrupt();
        }
    }

    void unregisterWorker(Thread thread) {
        activeWorkers.remove(thread);
    }

    private static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException re) {
            return re;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new CompletionException(cause);
    }
}
