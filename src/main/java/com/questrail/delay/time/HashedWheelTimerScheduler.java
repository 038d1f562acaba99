package com.questrail.delay.time;

import io.netty.util.Timer;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * HashedWheelTimerScheduler
 * =============================================================================
 * {@link MonotonicScheduler} backed by a Netty {@link Timer}, normally an
 * {@link io.netty.util.HashedWheelTimer}.
 *
 * <h2>Precision</h2>
 * <p>A wheel timer fires on tick boundaries, so tasks run up to one tick after
 * their deadline. In exchange, arming and re-arming is O(1) and cheap enough
 * for very large numbers of outstanding delays.</p>
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this class; callers only see {@link MonotonicScheduler}.
 *
 * <h2>Timer Ownership</h2>
 * <p>This class does <strong>not</strong> stop the timer. Whoever created it
 * calls {@link Timer#stop()}.</p>
 */
public final class HashedWheelTimerScheduler implements MonotonicScheduler
{
    private final Timer timer;
    private final MonotonicClock clock;

    public HashedWheelTimerScheduler(Timer timer, MonotonicClock clock)
    {
        this.timer = Objects.requireNonNull(timer, "timer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void scheduleAtNanos(long deadlineNanos, Runnable task)
    {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());

        timer.newTimeout(t -> task.run(), delayNanos, TimeUnit.NANOSECONDS);
    }
}
