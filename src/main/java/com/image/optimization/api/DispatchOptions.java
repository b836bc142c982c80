package com.image.optimization.api;

import com.image.optimization.metrics.MetricsService;
import com.image.optimization.metrics.NoOpMetricsService;

import java.time.Clock;

/**
 * Options for a batch dispatch.
 * Configures the throttle limit, retry behavior, worker naming, metrics and time source.
 */
public class DispatchOptions {

    private static final int DEFAULT_THROTTLE_LIMIT = 4;
    private static final String DEFAULT_WORKER_THREAD_PREFIX = "image-worker";

    private final int throttleLimit;
    private final RetryPolicy retryPolicy;
    private final String workerThreadPrefix;
    private final MetricsService metricsService;
    private final Clock clock;

    private DispatchOptions(Builder builder) {
        this.throttleLimit = builder.throttleLimit;
        this.retryPolicy = builder.retryPolicy;
        this.workerThreadPrefix = builder.workerThreadPrefix;
        this.metricsService = builder.metricsService;
        this.clock = builder.clock;
    }

    public int getThrottleLimit() {
        return throttleLimit;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public String getWorkerThreadPrefix() {
        return workerThreadPrefix;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * Creates default options (throttle limit 4, no retry).
     */
    public static DispatchOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options that process one item at a time.
     */
    public static DispatchOptions sequential() {
        return builder().throttleLimit(1).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "DispatchOptions{throttleLimit=" + throttleLimit +
                ", maxAttempts=" + retryPolicy.maxAttempts() +
                ", workerThreadPrefix='" + workerThreadPrefix + '\'' + '}';
    }

    public static class Builder {
        private int throttleLimit = DEFAULT_THROTTLE_LIMIT;
        private RetryPolicy retryPolicy = RetryPolicy.none();
        private String workerThreadPrefix = DEFAULT_WORKER_THREAD_PREFIX;
        private MetricsService metricsService = new NoOpMetricsService();
        private Clock clock = Clock.systemUTC();

        public Builder throttleLimit(int throttleLimit) {
            if (throttleLimit < 1) {
                throw new IllegalArgumentException("throttleLimit must be >= 1");
            }
            this.throttleLimit = throttleLimit;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            if (retryPolicy == null) {
                throw new IllegalArgumentException("retryPolicy must not be null");
            }
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder workerThreadPrefix(String workerThreadPrefix) {
            if (workerThreadPrefix == null || workerThreadPrefix.isBlank()) {
                throw new IllegalArgumentException("workerThreadPrefix must not be blank");
            }
            this.workerThreadPrefix = workerThreadPrefix;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
            return this;
        }

        public Builder clock(Clock clock) {
            if (clock == null) {
                throw new IllegalArgumentException("clock must not be null");
            }
            this.clock = clock;
            return this;
        }

        public DispatchOptions build() {
            return new DispatchOptions(this);
        }
    }
}
