package com.image.optimization.result;

import com.image.optimization.api.ProcessingOutcome;

import java.time.Instant;

/**
 * Outcome of one image, as recorded by the worker that processed it.
 *
 * @param fileName         source file name
 * @param success          whether the image was optimized
 * @param originalSize     bytes before optimization
 * @param optimizedSize    bytes after optimization
 * @param compressionRatio percentage saved, rounded to 2 decimals (0 for failures)
 * @param errorMessage     failure description, null on success
 * @param workerId         1-based id of the worker that produced this result
 * @param timestamp        when the result was recorded
 */
public record ProcessingResult(
        String fileName,
        boolean success,
        long originalSize,
        long optimizedSize,
        double compressionRatio,
        String errorMessage,
        int workerId,
        Instant timestamp
) {
    static final String UNSPECIFIED_FAILURE = "Processing failed";

    public ProcessingResult {
        if (fileName == null) {
            throw new IllegalArgumentException("fileName must not be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
    }

    /**
     * Builds a result from what the processor returned.
     */
    public static ProcessingResult fromOutcome(String fileName, ProcessingOutcome outcome,
                                               int workerId, Instant timestamp) {
        if (outcome == null) {
            return failure(fileName, "Processor returned no outcome", workerId, timestamp);
        }
        if (!outcome.success()) {
            String message = outcome.errorMessage() != null ? outcome.errorMessage() : UNSPECIFIED_FAILURE;
            return new ProcessingResult(fileName, false, outcome.originalSize(), outcome.optimizedSize(),
                    0.0, message, workerId, timestamp);
        }
        return new ProcessingResult(fileName, true, outcome.originalSize(), outcome.optimizedSize(),
                compressionRatio(outcome.originalSize(), outcome.optimizedSize()), null, workerId, timestamp);
    }

    /**
     * Builds a failed result for an item that threw or never ran.
     */
    public static ProcessingResult failure(String fileName, String errorMessage, int workerId, Instant timestamp) {
        String message = errorMessage != null ? errorMessage : UNSPECIFIED_FAILURE;
        return new ProcessingResult(fileName, false, 0, 0, 0.0, message, workerId, timestamp);
    }

    /**
     * Percentage of bytes saved, rounded to 2 decimals. Negative when the output grew.
     */
    public static double compressionRatio(long originalSize, long optimizedSize) {
        if (originalSize <= 0) {
            return 0.0;
        }
        double saved = (1.0 - (double) optimizedSize / originalSize) * 100.0;
        return Math.round(saved * 100.0) / 100.0;
    }

    public long bytesSaved() {
        return success ? originalSize - optimizedSize : 0;
    }
}
