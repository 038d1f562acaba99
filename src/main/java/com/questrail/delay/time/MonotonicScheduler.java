package com.questrail.delay.time;

/**
 * MonotonicScheduler
 * =============================================================================
 * The low-level timer a {@code PostponableDelay} arms and re-arms.
 *
 * <h2>Binding invariant</h2>
 * Deadlines are monotonic ticks from the same {@link MonotonicClock} the delay
 * uses. A task MUST NOT run before its deadline; a deadline that has already
 * passed runs as soon as the backend can.
 *
 * <p>There is no cancellation. A delay whose target moved lets its timer fire
 * and re-arms from there.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos monotonic deadline in nanoseconds (from {@link MonotonicClock#nowNanos()})
     * @param task          runnable task
     * @throws RuntimeException if the backend no longer accepts tasks, e.g.
     *         {@link java.util.concurrent.RejectedExecutionException} after shutdown
     */
    void scheduleAtNanos(long deadlineNanos, Runnable task);
}
