package com.delta.listingimport.ingest.http;

import com.delta.listingimport.ingest.util.Sleeper;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Minimum spacing between requests issued through one gate. Each caller reserves the next free slot
 * with a compare-and-set before sleeping, so concurrent callers never share a slot.
 */
public class RequestRateGate {
    private final long minIntervalNanos;
    private final LongSupplier nanoTicker;
    private final Sleeper sleeper;
    private final AtomicLong nextSlotNanos;

    public RequestRateGate(long minIntervalMs) {
        this(minIntervalMs, System::nanoTime, Sleeper.SYSTEM);
    }

    public RequestRateGate(long minIntervalMs, LongSupplier nanoTicker, Sleeper sleeper) {
        this.minIntervalNanos = TimeUnit.MILLISECONDS.toNanos(Math.max(0, minIntervalMs));
        this.nanoTicker = nanoTicker;
        this.sleeper = sleeper;
        this.nextSlotNanos = new AtomicLong(nanoTicker.getAsLong());
    }

    /**
     * Blocks until this caller's slot opens. Returns the milliseconds waited.
     */
    public long acquire() throws InterruptedException {
        long waitNanos = reserve();
        long waitMs = TimeUnit.NANOSECONDS.toMillis(waitNanos);
        if (waitMs > 0) {
            sleeper.sleep(waitMs);
        }
        return waitMs;
    }

    long reserve() {
        while (true) {
            long now = nanoTicker.getAsLong();
            long current = nextSlotNanos.get();
            long start = current - now > 0 ? current : now;
            if (nextSlotNanos.compareAndSet(current, start + minIntervalNanos)) {
                return start - now;
            }
        }
    }

    public long minIntervalMs() {
        return TimeUnit.NANOSECONDS.toMillis(minIntervalNanos);
    }
}
