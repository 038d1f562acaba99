package com.questrail.delay.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record describing one step of a delay's timer lifecycle.
 *
 * @param timestamp     wall-clock time of the event, observational only
 * @param delayId       process-unique id of the delay
 * @param kind          what happened
 * @param deadlineNanos monotonic deadline the timer was armed for, or the final
 *                      target for {@link Kind#RESOLVED}
 * @param observedNanos monotonic time at which the event was produced
 */
public record DelayLifecycleEvent(
    Instant timestamp,
    long delayId,
    Kind kind,
    long deadlineNanos,
    long observedNanos
) {
    public DelayLifecycleEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
    }

    public enum Kind {
        /** Initial timer registration. */
        ARMED,
        /** Timer fired before a postponed target and was armed again. */
        REARMED,
        /** Target reached; the delay completed. */
        RESOLVED
    }

    /**
     * How far past the deadline this event was observed. Negative while the
     * deadline is still ahead.
     */
    public long lagNanos() {
        return observedNanos - deadlineNanos;
    }
}
