package com.image.optimization.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each snapshot to the log. Usually wrapped in a {@link ThresholdProgressCallback}.
 */
public class LoggingProgressCallback implements ProgressCallback {
    private static final Logger log = LoggerFactory.getLogger(LoggingProgressCallback.class);

    @Override
    public void onProgress(ProgressSnapshot snapshot) {
        log.info("batch.progress percent={} processed={}/{} file='{}' rate={}/s eta={}s",
                String.format("%.2f", snapshot.percentComplete()),
                snapshot.filesProcessed(), snapshot.totalFiles(), snapshot.currentFile(),
                String.format("%.2f", snapshot.processingRate()),
                snapshot.estimatedTimeRemaining().toSeconds());
    }
}
