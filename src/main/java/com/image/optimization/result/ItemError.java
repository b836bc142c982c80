package com.image.optimization.result;

import java.time.Instant;

/**
 * A failed image as listed in the batch summary.
 */
public record ItemError(String fileName, String errorMessage, Instant timestamp) {

    static ItemError of(ProcessingResult result) {
        return new ItemError(result.fileName(), result.errorMessage(), result.timestamp());
    }
}
