package com.whereq.dispatch.poll;

/**
 * Monotonic time source for wait budgets. Wall-clock adjustments must not affect it.
 */
@FunctionalInterface
public interface MonotonicClock {

    MonotonicClock SYSTEM = System::nanoTime;

    /**
     * Current reading in nanoseconds, meaningful only as a difference between two readings
     */
    long nanoTime();
}
