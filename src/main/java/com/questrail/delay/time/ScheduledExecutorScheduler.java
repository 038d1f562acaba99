package com.questrail.delay.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * {@link MonotonicScheduler} backed by a JDK {@link ScheduledExecutorService}.
 *
 * <h2>Design</h2>
 * <p>Monotonic deadlines are converted into relative delays at scheduling time,
 * using the provided {@link MonotonicClock}. Deadlines in the past are
 * scheduled with zero delay.</p>
 *
 * <h2>Clock Consistency</h2>
 * <p>The same {@link MonotonicClock} must be used for computing deadlines (by
 * delays) and for delay conversion (here). Typically this is
 * {@link SystemMonotonicClock#INSTANCE}.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>This class does <strong>not</strong> own the executor. Whoever created it
 * shuts it down.</p>
 *
 * <h2>Precision</h2>
 * <p>Tasks may run slightly after their deadline, never before.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());

        executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
    }
}
