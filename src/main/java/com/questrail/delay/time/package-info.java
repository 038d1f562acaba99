/**
 * Delay Timing Ports
 * =============================================================================
 *
 * Clock and timer abstractions underneath {@code PostponableDelay}.
 *
 * <h2>Binding invariants</h2>
 * <ul>
 *   <li>Every deadline is a {@link com.questrail.delay.time.MonotonicClock}
 *       tick in nanoseconds. {@link com.questrail.delay.time.WallClock} only
 *       timestamps observability events.</li>
 *   <li>A {@link com.questrail.delay.time.MonotonicScheduler} never runs a task
 *       before its deadline.</li>
 *   <li>Backend types (JDK executors, Netty timers) do not escape their
 *       adapter classes.</li>
 * </ul>
 */
package com.questrail.delay.time;
