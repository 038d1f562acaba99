package com.questrail.delay.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every delay deadline.
 *
 * <h2>Binding invariant</h2>
 * Targets, re-arm deadlines and due checks MUST use a monotonic time source.
 * Wall-clock time (e.g. {@code Instant.now()}) is permitted only for
 * observability timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>
     * Values are only meaningful relative to each other and must be compared by
     * subtraction ({@code a - b < 0}), never with {@code <} directly.
     * </p>
     */
    long nowNanos();
}
