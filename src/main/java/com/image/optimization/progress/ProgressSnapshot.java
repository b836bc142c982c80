package com.image.optimization.progress;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of batch progress, emitted once per completed item.
 *
 * @param percentComplete        0 to 100, rounded to 2 decimals
 * @param filesProcessed         completed items including this one
 * @param totalFiles             items in the batch
 * @param currentFile            file name of the item that just completed
 * @param elapsedTime            time since the batch started
 * @param estimatedTimeRemaining projected time to finish, never negative
 * @param processingRate         items per second, never negative
 * @param timestamp              when the snapshot was taken
 */
public record ProgressSnapshot(
        double percentComplete,
        int filesProcessed,
        int totalFiles,
        String currentFile,
        Duration elapsedTime,
        Duration estimatedTimeRemaining,
        double processingRate,
        Instant timestamp
) {
    public boolean isFinal() {
        return filesProcessed == totalFiles;
    }

    @Override
    public String toString() {
        return String.format("%.2f%% (%d/%d) %s elapsed=%ds eta=%ds rate=%.2f/s",
                percentComplete, filesProcessed, totalFiles, currentFile,
                elapsedTime.toSeconds(), estimatedTimeRemaining.toSeconds(), processingRate);
    }
}
