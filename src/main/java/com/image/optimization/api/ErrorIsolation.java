package com.image.optimization.api;

import com.image.optimization.metrics.MetricsService;
import com.image.optimization.result.ProcessingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Boundary between a worker and the caller's processor: whatever the processor
 * throws becomes a failed result for that item and the worker moves on.
 *
 * <p>{@link VirtualMachineError}s (a decoder overflowing its stack on a malformed
 * image, an oversized bitmap exhausting the heap) are contained the same way but
 * logged at ERROR and never retried.</p>
 */
public final class ErrorIsolation {
    private static final Logger log = LoggerFactory.getLogger(ErrorIsolation.class);

    public static final String CANCELLED_MESSAGE = "Cancelled before processing";

    private ErrorIsolation() {
    }

    /**
     * Runs the processor for one item, retrying thrown failures per {@code retryPolicy}.
     * Processor failures never escape; only a throwing {@code clock} or {@code metrics}
     * can, which is why the dispatcher passes guarded ones.
     */
    public static ProcessingResult invokeProcessor(ItemProcessor processor, WorkItem item, int workerId,
                                                   RetryPolicy retryPolicy, MetricsService metrics, Clock clock) {
        String fileName = item.fileName();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                ProcessingOutcome outcome = processor.process(item);
                return ProcessingResult.fromOutcome(fileName, outcome, workerId, clock.instant());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("item.interrupted file='{}' worker={}", fileName, workerId);
                return ProcessingResult.failure(fileName, describe(e), workerId, clock.instant());
            } catch (VirtualMachineError e) {
                log.error("item.failed.fatal file='{}' worker={} error={}", fileName, workerId, e.toString());
                return ProcessingResult.failure(fileName, describe(e), workerId, clock.instant());
            } catch (Throwable t) {
                if (attempt < retryPolicy.maxAttempts() && !Thread.currentThread().isInterrupted()) {
                    metrics.incrementRetry();
                    log.debug("item.retry file='{}' attempt={} error={}", fileName, attempt, describe(t));
                    if (!pause(retryPolicy.delay())) {
                        return ProcessingResult.failure(fileName, describe(t), workerId, clock.instant());
                    }
                    continue;
                }
                log.warn("item.failed file='{}' worker={} attempts={} error={}",
                        fileName, workerId, attempt, describe(t));
                return ProcessingResult.failure(fileName, describe(t), workerId, clock.instant());
            }
        }
    }

    /**
     * Message carried into the result: the throwable's message, or its class name when there is none.
     */
    static String describe(Throwable t) {
        String message = t.getMessage();
        return message != null && !message.isBlank() ? message : t.getClass().getSimpleName();
    }

    private static boolean pause(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
