// file: storage/src/main/java/io/kvgate/storage/TransactionStats.java
package io.kvgate.storage;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters a caller can hand to {@link Database#begin(boolean, TransactionStats, Duration)}.
 * One instance may be shared by many transactions; counts accumulate until {@link #reset()}.
 */
public final class TransactionStats {
    private final AtomicLong puts = new AtomicLong();
    private final AtomicLong dels = new AtomicLong();
    private volatile Instant started = Instant.now();
    private volatile long startedNanos = System.nanoTime();

    void recordPut() {
        puts.incrementAndGet();
    }

    void recordDelete() {
        dels.incrementAndGet();
    }

    public long puts() { return puts.get(); }
    public long dels() { return dels.get(); }

    public Instant started() {
        return started;
    }

    /** Time since construction or the last reset. */
    public Duration duration() {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    public void reset() {
        puts.set(0);
        dels.set(0);
        started = Instant.now();
        startedNanos = System.nanoTime();
    }

    @Override
    public String toString() {
        return "TransactionStats{puts=" + puts.get() + ", dels=" + dels.get() + ", duration=" + duration() + '}';
    }
}
