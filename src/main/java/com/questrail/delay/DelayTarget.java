package com.questrail.delay;

import com.questrail.delay.time.MonotonicClock;

import java.util.OptionalLong;

/**
 * DelayTarget
 * -----------------------------------------------------------------------------
 * The one mutable cell shared by a {@link PostponableDelay} and all of its
 * {@link PostponableDelayHandle}s.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code targetNanos} never decreases, and only changes while unresolved.</li>
 *   <li>{@code resolved} goes false to true at most once, and only from
 *       {@link #resolveOrNextDeadline(long)}.</li>
 *   <li>Every read and write happens while holding this object's monitor.</li>
 * </ul>
 *
 * <p>Deadlines are monotonic nanoseconds and are compared by subtraction so
 * that {@link System#nanoTime()} wrap-around is harmless.</p>
 */
final class DelayTarget
{
    private final long delayId;
    private final MonotonicClock clock;

    private long targetNanos;
    private boolean resolved;

    DelayTarget(long delayId, long initialTargetNanos, MonotonicClock clock)
    {
        this.delayId = delayId;
        this.clock = clock;
        this.targetNanos = initialTargetNanos;
    }

    long delayId() {
        return delayId;
    }

    MonotonicClock clock() {
        return clock;
    }

    synchronized long targetNanos() {
        return targetNanos;
    }

    synchronized boolean isResolved() {
        return resolved;
    }

    synchronized PostponeResponse postpone(long newTargetNanos)
    {
        if (resolved) {
            return PostponeResponse.ALREADY_RESOLVED;
        }
        if (newTargetNanos - targetNanos < 0) {
            return PostponeResponse.CANT_RESOLVE_EARLIER;
        }
        targetNanos = newTargetNanos;
        return PostponeResponse.OK;
    }

    /**
     * Resolves if the current target is due at {@code nowNanos}.
     *
     * @return empty if this call resolved the target (or it was already
     *         resolved); otherwise the target still pending
     */
    synchronized OptionalLong resolveOrNextDeadline(long nowNanos)
    {
        if (resolved) {
            return OptionalLong.empty();
        }
        if (targetNanos - nowNanos <= 0) {
            resolved = true;
            return OptionalLong.empty();
        }
        return OptionalLong.of(targetNanos);
    }
}
