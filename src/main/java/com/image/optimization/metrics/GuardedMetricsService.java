package com.image.optimization.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Decorator that keeps a misbehaving {@link MetricsService} from failing the batch.
 * Each call that throws is logged at WARN and dropped.
 */
public final class GuardedMetricsService implements MetricsService {
    private static final Logger log = LoggerFactory.getLogger(GuardedMetricsService.class);

    private final MetricsService delegate;

    private GuardedMetricsService(MetricsService delegate) {
        this.delegate = delegate;
    }

    /**
     * Wraps {@code delegate} unless it is already guarded or a no-op.
     */
    public static MetricsService wrap(MetricsService delegate) {
        if (delegate == null) {
            return new NoOpMetricsService();
        }
        if (delegate instanceof GuardedMetricsService || delegate.getClass() == NoOpMetricsService.class) {
            return delegate;
        }
        return new GuardedMetricsService(delegate);
    }

    @Override
    public void recordItemDuration(Duration duration, boolean success) {
        guard("recordItemDuration", () -> delegate.recordItemDuration(duration, success));
    }

    @Override
    public void incrementItemProcessed(boolean success) {
        guard("incrementItemProcessed", () -> delegate.incrementItemProcessed(success));
    }

    @Override
    public void incrementRetry() {
        guard("incrementRetry", delegate::incrementRetry);
    }

    @Override
    public void incrementCallbackFailure() {
        guard("incrementCallbackFailure", delegate::incrementCallbackFailure);
    }

    @Override
    public void recordBatchDuration(Duration duration) {
        guard("recordBatchDuration", () -> delegate.recordBatchDuration(duration));
    }

    @Override
    public void recordBatchSize(int size) {
        guard("recordBatchSize", () -> delegate.recordBatchSize(size));
    }

    @Override
    public void recordBytesSaved(long bytes) {
        guard("recordBytesSaved", () -> delegate.recordBytesSaved(bytes));
    }

    private static void guard(String operation, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.warn("metrics.failed operation={} error={}", operation, e.toString());
        }
    }
}
