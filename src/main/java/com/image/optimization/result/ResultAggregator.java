package com.image.optimization.result;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.IntStream;

/**
 * Thread-safe sink collecting exactly one {@link ProcessingResult} per work item.
 *
 * <p>Results are keyed by the item's position in the input list, so any number of
 * workers may record concurrently in any order. Recording a second result for the
 * same position is a programming error and fails with {@link IllegalStateException}.</p>
 */
public class ResultAggregator {
    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    private final int expectedItems;
    private final Map<Integer, ProcessingResult> results;

    public ResultAggregator(int expectedItems) {
        if (expectedItems < 0) {
            throw new IllegalArgumentException("expectedItems must be >= 0");
        }
        this.expectedItems = expectedItems;
        this.results = new ConcurrentHashMap<>(Math.max(16, expectedItems * 2));
    }

    /**
     * Records the result for the item at {@code index}.
     *
     * @throws IllegalArgumentException if the index is out of range
     * @throws IllegalStateException    if a result was already recorded for the index
     */
    public void record(int index, ProcessingResult result) {
        if (index < 0 || index >= expectedItems) {
            throw new IllegalArgumentException("index " + index + " out of range [0, " + expectedItems + ")");
        }
        if (result == null) {
            throw new IllegalArgumentException("result must not be null");
        }
        ProcessingResult previous = results.putIfAbsent(index, result);
        if (previous != null) {
            throw new IllegalStateException("Result already recorded for item " + index + " (" + previous.fileName() + ")");
        }
        log.debug("result.recorded index={} file='{}' success={}", index, result.fileName(), result.success());
    }

    public boolean hasResult(int index) {
        return results.containsKey(index);
    }

    public int size() {
        return results.size();
    }

    public int expectedItems() {
        return expectedItems;
    }

    public boolean isComplete() {
        return results.size() == expectedItems;
    }

    public int successCount() {
        return (int) results.values().stream().filter(ProcessingResult::success).count();
    }

    public int errorCount() {
        return (int) results.values().stream().filter(r -> !r.success()).count();
    }

    /**
     * Returns the recorded results in input order.
     */
    public List<ProcessingResult> results() {
        return IntStream.range(0, expectedItems)
                .mapToObj(results::get)
                .filter(r -> r != null)
                .toList();
    }

    /**
     * Returns the failed items in input order.
     */
    public List<ItemError> errors() {
        return results().stream()
                .filter(r -> !r.success())
                .map(ItemError::of)
                .toList();
    }

    /**
     * Builds the batch summary. Every item must have a result.
     *
     * @throws IllegalStateException if some items have no result yet
     */
    public BatchSummary summarize(int threadsUsed, int throttleLimit, Duration elapsed, boolean cancelled) {
        if (!isComplete()) {
            throw new IllegalStateException("Cannot summarize: " + results.size() + " of "
                    + expectedItems + " results recorded");
        }
        List<ProcessingResult> ordered = results();
        List<ItemError> errors = ordered.stream()
                .filter(r -> !r.success())
                .map(ItemError::of)
                .toList();
        int successCount = ordered.size() - errors.size();
        return new BatchSummary(ordered.size(), successCount, errors.size(), errors,
                threadsUsed, throttleLimit, BatchSummary.PARALLEL, elapsed, ordered, cancelled);
    }
}
