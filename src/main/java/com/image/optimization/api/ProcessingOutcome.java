package com.image.optimization.api;

/**
 * What an {@link ItemProcessor} reports back for a single image.
 *
 * @param success       whether the image was optimized
 * @param originalSize  size of the source file in bytes
 * @param optimizedSize size of the written file in bytes (0 on failure)
 * @param errorMessage  failure description, null on success
 */
public record ProcessingOutcome(boolean success, long originalSize, long optimizedSize, String errorMessage) {

    public ProcessingOutcome {
        if (originalSize < 0) {
            throw new IllegalArgumentException("originalSize must be >= 0");
        }
        if (optimizedSize < 0) {
            throw new IllegalArgumentException("optimizedSize must be >= 0");
        }
    }

    public static ProcessingOutcome success(long originalSize, long optimizedSize) {
        return new ProcessingOutcome(true, originalSize, optimizedSize, null);
    }

    public static ProcessingOutcome failure(String errorMessage) {
        return new ProcessingOutcome(false, 0, 0, errorMessage);
    }

    public static ProcessingOutcome failure(long originalSize, String errorMessage) {
        return new ProcessingOutcome(false, originalSize, 0, errorMessage);
    }
}
