package com.image.optimization.progress;

/**
 * Forwards a snapshot only when progress crosses the next step (every 5% by default),
 * plus the final 100% snapshot. Purely a display filter: the tracker's counters
 * are unaffected.
 *
 * <p>Workers report concurrently and their snapshots can arrive out of order.
 * Forwarded percentages only ever go up, and nothing is forwarded after the final
 * snapshot. The delegate is called under this filter's lock, one snapshot at a time.</p>
 */
public class ThresholdProgressCallback implements ProgressCallback {

    public static final double DEFAULT_STEP_PERCENT = 5.0;

    private final ProgressCallback delegate;
    private final double stepPercent;
    private final Object lock = new Object();

    private int lastStep;
    private boolean finalDelivered;

    public ThresholdProgressCallback(ProgressCallback delegate, double stepPercent) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate must not be null");
        }
        if (stepPercent <= 0.0 || stepPercent > 100.0) {
            throw new IllegalArgumentException("stepPercent must be in (0, 100]");
        }
        this.delegate = delegate;
        this.stepPercent = stepPercent;
    }

    public static ThresholdProgressCallback everyFivePercent(ProgressCallback delegate) {
        return new ThresholdProgressCallback(delegate, DEFAULT_STEP_PERCENT);
    }

    @Override
    public void onProgress(ProgressSnapshot snapshot) {
        synchronized (lock) {
            if (finalDelivered) {
                return;
            }
            if (snapshot.isFinal()) {
                finalDelivered = true;
                delegate.onProgress(snapshot);
                return;
            }
            int step = (int) Math.floor(snapshot.percentComplete() / stepPercent);
            if (step > lastStep) {
                lastStep = step;
                delegate.onProgress(snapshot);
            }
        }
    }
}
