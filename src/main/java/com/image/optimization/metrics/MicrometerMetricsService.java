package com.image.optimization.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code image.item.duration} Timer (tag: outcome)</li>
 *   <li>{@code image.item.processed} Counter (tag: outcome)</li>
 *   <li>{@code image.item.retry} Counter</li>
 *   <li>{@code image.callback.failure} Counter</li>
 *   <li>{@code image.batch.duration} Timer</li>
 *   <li>{@code image.batch.size} DistributionSummary</li>
 *   <li>{@code image.bytes.saved} DistributionSummary</li>
 *   <li>{@code image.bytes.grown} DistributionSummary, for batches whose output outgrew the input</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    static final String OUTCOME_SUCCESS = "success";
    static final String OUTCOME_FAILURE = "failure";

    private final Timer successTimer;
    private final Timer failureTimer;
    private final Counter successCounter;
    private final Counter failureCounter;
    private final Counter retryCounter;
    private final Counter callbackFailureCounter;
    private final Timer batchTimer;
    private final DistributionSummary batchSizeSummary;
    private final DistributionSummary bytesSavedSummary;
    private final DistributionSummary bytesGrownSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.successTimer = itemTimer(registry, OUTCOME_SUCCESS);
        this.failureTimer = itemTimer(registry, OUTCOME_FAILURE);
        this.successCounter = itemCounter(registry, OUTCOME_SUCCESS);
        this.failureCounter = itemCounter(registry, OUTCOME_FAILURE);
        this.retryCounter = Counter.builder("image.item.retry")
                .description("Number of processor retries after an exception")
                .register(registry);
        this.callbackFailureCounter = Counter.builder("image.callback.failure")
                .description("Number of progress callback invocations that threw")
                .register(registry);
        this.batchTimer = Timer.builder("image.batch.duration")
                .description("Wall-clock duration of batch runs")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("image.batch.size")
                .description("Number of work items per batch")
                .register(registry);
        this.bytesSavedSummary = DistributionSummary.builder("image.bytes.saved")
                .description("Bytes saved per batch")
                .baseUnit("bytes")
                .register(registry);
        this.bytesGrownSummary = DistributionSummary.builder("image.bytes.grown")
                .description("Bytes added per batch when optimized output is larger than the source")
                .baseUnit("bytes")
                .register(registry);
    }

    private static Timer itemTimer(MeterRegistry registry, String outcome) {
        return Timer.builder("image.item.duration")
                .description("Duration of single image processing")
                .tag("outcome", outcome)
                .register(registry);
    }

    private static Counter itemCounter(MeterRegistry registry, String outcome) {
        return Counter.builder("image.item.processed")
                .description("Number of images processed")
                .tag("outcome", outcome)
                .register(registry);
    }

    @Override
    public void recordItemDuration(Duration duration, boolean success) {
        (success ? successTimer : failureTimer).record(duration);
    }

    @Override
    public void incrementItemProcessed(boolean success) {
        (success ? successCounter : failureCounter).increment();
    }

    @Override
    public void incrementRetry() {
        retryCounter.increment();
    }

    @Override
    public void incrementCallbackFailure() {
        callbackFailureCounter.increment();
    }

    @Override
    public void recordBatchDuration(Duration duration) {
        batchTimer.record(duration);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordBytesSaved(long bytes) {
        // summaries drop negative amounts
        if (bytes >= 0) {
            bytesSavedSummary.record(bytes);
        } else {
            bytesGrownSummary.record(-bytes);
        }
    }
}
