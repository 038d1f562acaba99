package com.questrail.delay.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly to timestamp observability events.
 *
 * <p>
 * This clock may jump due to DST, NTP adjustments or explicit time setting.
 * It MUST NOT be used to decide when a delay resolves.
 * </p>
 */
public interface WallClock
{
    Instant now();
}
