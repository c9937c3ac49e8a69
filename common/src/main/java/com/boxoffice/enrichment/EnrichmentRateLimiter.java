package com.boxoffice.enrichment;

import java.util.function.LongSupplier;

/**
 * Paces lookup API requests to at most {@code permitsPerSecond}.
 *
 * <p>Each call to {@link #reservePermitMicros()} reserves the <b>next</b> available
 * time-slot and returns how many <b>microseconds</b> the caller must wait before
 * issuing the request. {@link #acquire(Sleeper)} does the waiting itself, which is what
 * the single-threaded enricher uses.</p>
 *
 * <p>When {@code permitsPerSecond} is {@code 0} (or negative), the limiter is
 * disabled and never waits.</p>
 */
public class EnrichmentRateLimiter {

    private final int permitsPerSecond;
    private final long intervalNanos;
    private final LongSupplier nanoClock;
    private long nextPermitTimeNanos;

    /**
     * @param permitsPerSecond max requests per second; {@code 0} = unlimited
     */
    public EnrichmentRateLimiter(int permitsPerSecond) {
        this(permitsPerSecond, System::nanoTime);
    }

    EnrichmentRateLimiter(int permitsPerSecond, LongSupplier nanoClock) {
        this.permitsPerSecond = permitsPerSecond;
        this.intervalNanos = permitsPerSecond > 0
                ? 1_000_000_000L / permitsPerSecond
                : 0;
        this.nanoClock = nanoClock;
        this.nextPermitTimeNanos = nanoClock.getAsLong();
    }

    /** Returns {@code true} when rate limiting is active. */
    public boolean isEnabled() {
        return permitsPerSecond > 0;
    }

    /**
     * Reserves one permit and returns the number of <b>microseconds</b> the caller
     * should wait before making the API call.  {@code 0} means proceed immediately.
     */
    public synchronized long reservePermitMicros() {
        if (permitsPerSecond <= 0) {
            return 0;
        }

        long now = nanoClock.getAsLong();

        if (now >= nextPermitTimeNanos) {
            nextPermitTimeNanos = now + intervalNanos;
            return 0;
        }

        long waitNanos = nextPermitTimeNanos - now;
        nextPermitTimeNanos += intervalNanos;
        return Math.max(1, waitNanos / 1_000);
    }

    /**
     * Reserves a permit and blocks until its slot arrives.
     */
    public void acquire(Sleeper sleeper) throws InterruptedException {
        long waitMicros = reservePermitMicros();
        if (waitMicros > 0) {
            // Round up so a sub-millisecond wait still yields.
            sleeper.sleep((waitMicros + 999) / 1_000);
        }
    }
}
