package com.image.optimization.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class LogContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Item context should set and remove its keys")
    void testForItem() {
        try (LogContext ctx = LogContext.forItem("batch-1", "photo.jpg", 3)) {
            assertEquals("batch-1", MDC.get("batchId"));
            assertEquals("photo.jpg", MDC.get("fileName"));
            assertEquals("3", MDC.get("workerId"));
            assertEquals("optimize", MDC.get("operation"));
        }
        assertNull(MDC.get("batchId"));
        assertNull(MDC.get("fileName"));
        assertNull(MDC.get("workerId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Batch context should support extra keys")
    void testForBatchWith() {
        try (LogContext ctx = LogContext.forBatch("batch-2").with("items", "12")) {
            assertEquals("batch", MDC.get("operation"));
            assertEquals("12", MDC.get("items"));
        }
        assertNull(MDC.get("items"));
    }

    @Test
    @DisplayName("Closing a nested context should restore the outer values")
    void testNesting() {
        try (LogContext batch = LogContext.forBatch("batch-3")) {
            try (LogContext item = LogContext.forItem("batch-3", "a.png", 1)) {
                assertEquals("optimize", MDC.get(LogContext.OPERATION));
            }
            assertEquals("batch-3", MDC.get(LogContext.BATCH_ID));
            assertEquals("batch", MDC.get(LogContext.OPERATION));
            assertNull(MDC.get(LogContext.FILE_NAME));
        }
        assertNull(MDC.get(LogContext.BATCH_ID));
    }

    @Test
    @DisplayName("Generated batch ids should be unique")
    void testGenerateBatchId() {
        assertNotEquals(LogContext.generateBatchId(), LogContext.generateBatchId());
    }
}
