package com.image.optimization.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordItemDuration(Duration duration, boolean success) {
    }

    @Override
    public void incrementItemProcessed(boolean success) {
    }

    @Override
    public void incrementRetry() {
    }

    @Override
    public void incrementCallbackFailure() {
    }

    @Override
    public void recordBatchDuration(Duration duration) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordBytesSaved(long bytes) {
    }
}
