package com.image.optimization.result;

import java.time.Duration;
import java.util.List;

/**
 * Final outcome of a batch run. Produced once, after every worker has finished.
 *
 * @param totalProcessed    number of results, always equal to the number of work items
 * @param successCount      results with {@code success == true}
 * @param errorCount        results with {@code success == false}
 * @param errors            failed items, in input order
 * @param threadsUsed       {@code min(throttleLimit, items)}
 * @param throttleLimitUsed the configured concurrency bound
 * @param processingMethod  always {@value #PARALLEL}
 * @param totalElapsedTime  wall-clock time of the whole batch
 * @param results           every result, in input order
 * @param cancelled         whether cancellation was requested while the batch ran
 */
public record BatchSummary(
        int totalProcessed,
        int successCount,
        int errorCount,
        List<ItemError> errors,
        int threadsUsed,
        int throttleLimitUsed,
        String processingMethod,
        Duration totalElapsedTime,
        List<ProcessingResult> results,
        boolean cancelled
) {
    public static final String PARALLEL = "Parallel";

    public BatchSummary {
        errors = errors != null ? List.copyOf(errors) : List.of();
        results = results != null ? List.copyOf(results) : List.of();
        totalElapsedTime = totalElapsedTime != null ? totalElapsedTime : Duration.ZERO;
        processingMethod = processingMethod != null ? processingMethod : PARALLEL;
    }

    /**
     * Summary of a batch with no work items.
     */
    public static BatchSummary empty(int throttleLimit) {
        return new BatchSummary(0, 0, 0, List.of(), 0, throttleLimit, PARALLEL, Duration.ZERO, List.of(), false);
    }

    public boolean hasErrors() {
        return errorCount > 0;
    }

    public long totalOriginalBytes() {
        return results.stream().filter(ProcessingResult::success).mapToLong(ProcessingResult::originalSize).sum();
    }

    public long totalOptimizedBytes() {
        return results.stream().filter(ProcessingResult::success).mapToLong(ProcessingResult::optimizedSize).sum();
    }

    public long bytesSaved() {
        return totalOriginalBytes() - totalOptimizedBytes();
    }

    @Override
    public String toString() {
        return "BatchSummary{total=" + totalProcessed +
                ", success=" + successCount +
                ", errors=" + errorCount +
                ", threads=" + threadsUsed +
                ", throttle=" + throttleLimitUsed +
                ", elapsed=" + totalElapsedTime.toMillis() + "ms" +
                (cancelled ? ", cancelled" : "") + '}';
    }
}
