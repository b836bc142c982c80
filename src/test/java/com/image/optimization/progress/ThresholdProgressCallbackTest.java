package com.image.optimization.progress;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ThresholdProgressCallbackTest {

    private static ProgressSnapshot snapshot(int processed, int total) {
        double percent = Math.round((double) processed / total * 100.0 * 100.0) / 100.0;
        return new ProgressSnapshot(percent, processed, total, "f" + processed + ".jpg",
                Duration.ZERO, Duration.ZERO, 0.0, Instant.EPOCH);
    }

    @Test
    @DisplayName("Should forward every five percent plus the final snapshot")
    void testEveryFivePercent() {
        List<ProgressSnapshot> forwarded = new ArrayList<>();
        ProgressCallback callback = ThresholdProgressCallback.everyFivePercent(forwarded::add);

        for (int i = 1; i <= 40; i++) {
            callback.onProgress(snapshot(i, 40));
        }

        assertEquals(20, forwarded.size());
        assertEquals(5.0, forwarded.get(0).percentComplete());
        assertEquals(95.0, forwarded.get(18).percentComplete());
        assertTrue(forwarded.get(19).isFinal());
    }

    @Test
    @DisplayName("Small batches should forward every snapshot that crosses a step")
    void testSmallBatch() {
        List<ProgressSnapshot> forwarded = new ArrayList<>();
        ProgressCallback callback = ThresholdProgressCallback.everyFivePercent(forwarded::add);

        for (int i = 1; i <= 3; i++) {
            callback.onProgress(snapshot(i, 3));
        }

        assertEquals(3, forwarded.size());
    }

    @Test
    @DisplayName("Out-of-order snapshots below the last step should be dropped")
    void testOutOfOrder() {
        List<ProgressSnapshot> forwarded = new ArrayList<>();
        ProgressCallback callback = new ThresholdProgressCallback(forwarded::add, 10.0);

        callback.onProgress(snapshot(3, 10));
        callback.onProgress(snapshot(2, 10));
        callback.onProgress(snapshot(10, 10));
        callback.onProgress(snapshot(10, 10));

        assertEquals(2, forwarded.size());
        assertEquals(3, forwarded.get(0).filesProcessed());
        assertEquals(10, forwarded.get(1).filesProcessed());
    }

    @Test
    @DisplayName("A late snapshot after the final one should not be forwarded")
    void testLateSnapshotAfterFinal() {
        List<ProgressSnapshot> forwarded = new ArrayList<>();
        ProgressCallback callback = new ThresholdProgressCallback(forwarded::add, 10.0);

        callback.onProgress(snapshot(8, 10));
        callback.onProgress(snapshot(10, 10));
        callback.onProgress(snapshot(9, 10));

        assertEquals(List.of(80.0, 100.0),
                forwarded.stream().map(ProgressSnapshot::percentComplete).toList());
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -5.0, 100.5})
    @DisplayName("Should reject steps outside (0, 100]")
    void testInvalidStep(double step) {
        assertThrows(IllegalArgumentException.class,
                () -> new ThresholdProgressCallback(ProgressCallback.NOOP, step));
    }

    @Test
    @DisplayName("Should reject a null delegate")
    void testNullDelegate() {
        assertThrows(IllegalArgumentException.class, () -> ThresholdProgressCallback.everyFivePercent(null));
    }

    @Test
    @DisplayName("Logging callback should accept any snapshot")
    void testLoggingCallback() {
        assertDoesNotThrow(() -> new LoggingProgressCallback().onProgress(snapshot(1, 3)));
    }
}
