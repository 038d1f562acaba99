package com.questrail.delay.observability;

import java.time.Instant;

/**
 * Record representing a failure underneath a delay, such as a scheduler that
 * refused to arm the timer.
 */
public record DelayErrorEvent(
    Instant timestamp,
    long delayId,
    String message,
    Throwable cause
) {
}
