package io.gridflow.budget;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Caps the number of concurrently running operations. Waiters are admitted in arrival order.
 */
public class ConcurrencyLimiter {
    private final Semaphore permits;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();

    public ConcurrencyLimiter(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive: " + capacity);
        this.permits = new Semaphore(capacity, true);
    }

    /** Blocks until a slot is free. */
    public void acquire() throws InterruptedException {
        permits.acquire();
        int now = inFlight.incrementAndGet();
        peak.accumulateAndGet(now, Math::max);
    }

    public void release() {
        inFlight.decrementAndGet();
        permits.release();
    }

    public int inFlight() { return inFlight.get(); }
    public int available() { return permits.availablePermits(); }

    /** Highest number of simultaneously held slots since construction. */
    public int peakInFlight() { return peak.get(); }
}
