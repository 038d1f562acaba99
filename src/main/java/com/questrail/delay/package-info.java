/**
 * Postponable Delay
 * =============================================================================
 *
 * A timer that resolves no earlier than a target deadline, where the deadline
 * can be pushed later while the timer is pending.
 *
 * <h2>Roles</h2>
 * <ul>
 *   <li>{@link com.questrail.delay.PostponableDelay} is awaited by one
 *       consumer and owns the low-level timer registration.</li>
 *   <li>{@link com.questrail.delay.PostponableDelayHandle}s are handed to any
 *       number of other threads, which may only move the target later.</li>
 * </ul>
 *
 * <h2>Binding invariants</h2>
 * <ul>
 *   <li>The target never moves earlier.</li>
 *   <li>A delay resolves at most once, never before its target, and never
 *       accepts a postponement afterwards.</li>
 *   <li>All deadlines are monotonic nanoseconds; see
 *       {@link com.questrail.delay.time.MonotonicClock}.</li>
 * </ul>
 */
package com.questrail.delay;
