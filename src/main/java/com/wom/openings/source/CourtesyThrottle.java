package com.wom.openings.source;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.LongSupplier;

/**
 * Keeps at least {@code minInterval} between the end of one call and the start of the next.
 */
public class CourtesyThrottle {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final long minIntervalNanos;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private long lastFinishedNanos;
    private boolean called;

    public CourtesyThrottle(Duration minInterval) {
        this(minInterval, System::nanoTime, Thread::sleep);
    }

    public CourtesyThrottle(Duration minInterval, LongSupplier nanoClock, Sleeper sleeper) {
        this.minIntervalNanos = minInterval.toNanos();
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
    }

    public synchronized <T> T call(Callable<T> action) throws Exception {
        if (called) {
            long waitNanos = minIntervalNanos - (nanoClock.getAsLong() - lastFinishedNanos);
            if (waitNanos > 0) {
                sleeper.sleep((waitNanos + 999_999) / 1_000_000);
            }
        }
        try {
            return action.call();
        } finally {
            called = true;
            lastFinishedNanos = nanoClock.getAsLong();
        }
    }
}
