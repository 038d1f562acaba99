package com.questrail.delay.observability;

import com.questrail.delay.PostponeResponse;

import java.time.Instant;
import java.util.Objects;

/**
 * Record describing one postpone request and how it was answered.
 */
public record DelayPostponeEvent(
    Instant timestamp,
    long delayId,
    long requestedNanos,
    PostponeResponse response
) {
    public DelayPostponeEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(response, "response");
    }
}
