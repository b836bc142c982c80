package com.image.optimization.metrics;

import java.time.Duration;

/**
 * Interface for recording batch optimization metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the dispatcher works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordItemDuration(Duration duration, boolean success);

    void incrementItemProcessed(boolean success);

    void incrementRetry();

    void incrementCallbackFailure();

    void recordBatchDuration(Duration duration);

    void recordBatchSize(int size);

    void recordBytesSaved(long bytes);
}
