package com.image.optimization.logging;

import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;

/**
 * Scoped SLF4J MDC entries for batch and per-image logging.
 *
 * <p>Closing a context puts back whatever the keys held before it was opened, so an
 * item context opened inside a batch context leaves the batch's {@code batchId} in place.</p>
 *
 * <pre>
 * try (LogContext ctx = LogContext.forItem(batchId, "photo.jpg", 2)) {
 *     log.info("item.completed success={}", success);
 * }
 * </pre>
 */
public final class LogContext implements AutoCloseable {

    public static final String BATCH_ID = "batchId";
    public static final String FILE_NAME = "fileName";
    public static final String WORKER_ID = "workerId";
    public static final String OPERATION = "operation";

    private final Deque<String[]> shadowed = new ArrayDeque<>();

    private LogContext() {
    }

    public static LogContext forBatch(String batchId) {
        return new LogContext()
                .with(BATCH_ID, batchId)
                .with(OPERATION, "batch");
    }

    public static LogContext forItem(String batchId, String fileName, int workerId) {
        return new LogContext()
                .with(BATCH_ID, batchId)
                .with(FILE_NAME, fileName)
                .with(WORKER_ID, Integer.toString(workerId))
                .with(OPERATION, "optimize");
    }

    public static String generateBatchId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Sets one more key for the lifetime of this context.
     */
    public LogContext with(String key, String value) {
        shadowed.push(new String[]{key, MDC.get(key)});
        MDC.put(key, value);
        return this;
    }

    @Override
    public void close() {
        while (!shadowed.isEmpty()) {
            String[] entry = shadowed.pop();
            if (entry[1] == null) {
                MDC.remove(entry[0]);
            } else {
                MDC.put(entry[0], entry[1]);
            }
        }
    }
}
