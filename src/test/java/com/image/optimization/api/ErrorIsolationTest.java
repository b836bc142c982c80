package com.image.optimization.api;

import com.image.optimization.metrics.MetricsService;
import com.image.optimization.result.ProcessingResult;
import com.image.optimization.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ErrorIsolationTest {

    private static final WorkItem ITEM = WorkItem.of("/photos/cat.png", "/optimized/cat.png");

    @Mock
    private ItemProcessor processor;

    @Mock
    private MetricsService metrics;

    private final MutableClock clock = MutableClock.atEpoch();

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    @DisplayName("Should convert a successful outcome into a result")
    void testSuccess() throws Exception {
        when(processor.process(ITEM)).thenReturn(ProcessingOutcome.success(2000, 500));

        ProcessingResult result = ErrorIsolation.invokeProcessor(processor, ITEM, 3, RetryPolicy.none(), metrics, clock);

        assertTrue(result.success());
        assertEquals("cat.png", result.fileName());
        assertEquals(75.0, result.compressionRatio());
        assertEquals(3, result.workerId());
        assertEquals(clock.instant(), result.timestamp());
        verifyNoInteractions(metrics);
    }

    @Test
    @DisplayName("Should convert a thrown exception into a failed result")
    void testThrownException() throws Exception {
        when(processor.process(ITEM)).thenThrow(new IOException("truncated PNG"));

        ProcessingResult result = ErrorIsolation.invokeProcessor(processor, ITEM, 1, RetryPolicy.none(), metrics, clock);

        assertFalse(result.success());
        assertEquals("truncated PNG", result.errorMessage());
        verify(metrics, never()).incrementRetry();
    }

    @Test
    @DisplayName("Should retry thrown failures up to the attempt limit")
    void testRetryThenSucceed() throws Exception {
        when(processor.process(ITEM))
                .thenThrow(new IOException("busy"))
                .thenThrow(new IOException("busy"))
                .thenReturn(ProcessingOutcome.success(100, 90));

        ProcessingResult result = ErrorIsolation.invokeProcessor(processor, ITEM, 1,
                RetryPolicy.of(3, Duration.ofMillis(1)), metrics, clock);

        assertTrue(result.success());
        verify(processor, times(3)).process(ITEM);
        verify(metrics, times(2)).incrementRetry();
    }

    @Test
    @DisplayName("Should give up after the last attempt")
    void testRetryExhausted() throws Exception {
        when(processor.process(ITEM)).thenThrow(new IOException("still busy"));

        ProcessingResult result = ErrorIsolation.invokeProcessor(processor, ITEM, 1,
                RetryPolicy.of(2, Duration.ZERO), metrics, clock);

        assertFalse(result.success());
        assertEquals("still busy", result.errorMessage());
        verify(processor, times(2)).process(ITEM);
    }

    @Test
    @DisplayName("Should not retry outcomes that report failure")
    void testFailureOutcomeNotRetried() throws Exception {
        when(processor.process(ITEM)).thenReturn(ProcessingOutcome.failure("Invalid format"));

        ProcessingResult result = ErrorIsolation.invokeProcessor(processor, ITEM, 1,
                RetryPolicy.of(5, Duration.ZERO), metrics, clock);

        assertEquals("Invalid format", result.errorMessage());
        verify(processor, times(1)).process(ITEM);
    }

    @Test
    @DisplayName("Should convert interruption into a failure and keep the interrupt flag")
    void testInterrupted() throws Exception {
        when(processor.process(ITEM)).thenThrow(new InterruptedException("stopped"));

        ProcessingResult result = ErrorIsolation.invokeProcessor(processor, ITEM, 1,
                RetryPolicy.of(3, Duration.ZERO), metrics, clock);

        assertFalse(result.success());
        assertEquals("stopped", result.errorMessage());
        assertTrue(Thread.currentThread().isInterrupted());
        verify(processor, times(1)).process(ITEM);
    }

    @Test
    @DisplayName("Should contain non-fatal errors such as assertion failures")
    void testNonFatalError() throws Exception {
        when(processor.process(ITEM)).thenThrow(new AssertionError("bad pixel buffer"));

        ProcessingResult result = ErrorIsolation.invokeProcessor(processor, ITEM, 1, RetryPolicy.none(), metrics, clock);

        assertEquals("bad pixel buffer", result.errorMessage());
    }

    @Test
    @DisplayName("Should contain stack overflow as an item failure without retrying")
    void testStackOverflow() throws Exception {
        when(processor.process(ITEM)).thenThrow(new StackOverflowError("deep decoder recursion"));

        ProcessingResult result = ErrorIsolation.invokeProcessor(processor, ITEM, 1,
                RetryPolicy.of(3, Duration.ZERO), metrics, clock);

        assertFalse(result.success());
        assertEquals("deep decoder recursion", result.errorMessage());
        verify(processor, times(1)).process(ITEM);
        verify(metrics, never()).incrementRetry();
    }

    @Test
    @DisplayName("Should contain out of memory as an item failure")
    void testOutOfMemory() throws Exception {
        when(processor.process(ITEM)).thenThrow(new OutOfMemoryError());

        ProcessingResult result = ErrorIsolation.invokeProcessor(processor, ITEM, 1, RetryPolicy.none(), metrics, clock);

        assertEquals("OutOfMemoryError", result.errorMessage());
    }

    @Test
    @DisplayName("Describe should fall back to the class name")
    void testDescribe() {
        assertEquals("IllegalStateException", ErrorIsolation.describe(new IllegalStateException()));
        assertEquals("IOException", ErrorIsolation.describe(new IOException(" ")));
        assertEquals("boom", ErrorIsolation.describe(new RuntimeException("boom")));
    }
}
