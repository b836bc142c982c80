package com.image.optimization.api;

/**
 * The per-image optimization engine plugged into the dispatcher.
 * Implementations may block on file I/O or on an external transcoder process,
 * and must be safe to call from several worker threads at once.
 *
 * <p>Throwing is allowed: the dispatcher turns any exception into a failed
 * result for that item only.</p>
 */
@FunctionalInterface
public interface ItemProcessor {

    /**
     * Optimizes a single image.
     *
     * @param item the source/destination pair
     * @return the outcome for this item
     * @throws Exception on any failure; the item is recorded as failed
     */
    ProcessingOutcome process(WorkItem item) throws Exception;
}
