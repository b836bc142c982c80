package com.image.optimization.api;

import com.image.optimization.progress.ProgressCallback;
import com.image.optimization.result.BatchSummary;

import java.util.List;

/**
 * Runs a per-image processor over a list of work items under a concurrency bound.
 *
 * <p>Every item yields exactly one result. Processor and callback failures are
 * contained; only invalid arguments raise {@link IllegalArgumentException}, before
 * any work starts.</p>
 */
public interface BatchDispatcher {

    /**
     * Processes all items and blocks until the batch has completed.
     */
    BatchSummary dispatch(List<WorkItem> items, ItemProcessor processor);

    /**
     * Processes all items, reporting each completion to {@code callback}, and blocks
     * until the batch has completed.
     *
     * @param callback optional, may be null
     */
    BatchSummary dispatch(List<WorkItem> items, ItemProcessor processor, ProgressCallback callback);

    /**
     * Starts processing and returns immediately.
     *
     * @param callback optional, may be null
     */
    BatchRun submit(List<WorkItem> items, ItemProcessor processor, ProgressCallback callback);

    DispatchOptions getOptions();
}
