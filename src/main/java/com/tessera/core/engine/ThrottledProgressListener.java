package com.tessera.core.engine;

import com.tessera.core.model.GenerationProgress;

import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Forwards at most one progress event per interval and drops repeats of the last forwarded
 * percent. Completion always passes through.
 */
public final class ThrottledProgressListener implements ProgressListener {

    private final ProgressListener delegate;
    private final long intervalMs;
    private final LongSupplier clock;
    private long lastForwardedAt = Long.MIN_VALUE;
    private int lastPercent = -1;

    public ThrottledProgressListener(ProgressListener delegate, long intervalMs) {
        this(delegate, intervalMs, System::currentTimeMillis);
    }

    ThrottledProgressListener(ProgressListener delegate, long intervalMs, LongSupplier clock) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.intervalMs = Math.max(0, intervalMs);
        this.clock = clock;
    }

    @Override
    public synchronized void onProgress(GenerationProgress progress) {
        int percent = progress.percentComplete();
        if (percent == lastPercent && percent != 100) {
            return;
        }
        long now = clock.getAsLong();
        boolean due = lastForwardedAt == Long.MIN_VALUE || now - lastForwardedAt >= intervalMs;
        if (percent == 100 || due) {
            lastForwardedAt = now;
            lastPercent = percent;
            delegate.onProgress(progress);
        }
    }
}
