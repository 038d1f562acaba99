package com.questrail.delay.time;

/**
 * SystemMonotonicClock
 * =============================================================================
 * Production {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <h2>Properties</h2>
 * <ul>
 *   <li>Never goes backward</li>
 *   <li>Not affected by NTP, DST or manual wall-clock changes</li>
 *   <li>Only meaningful for elapsed time, not absolute timestamps</li>
 * </ul>
 *
 * <p>For deterministic tests use a manually advanced clock instead.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
