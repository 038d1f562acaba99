package com.questrail.delay;

import com.questrail.delay.config.DelayRuntimeConfig;
import com.questrail.delay.observability.DelayObservabilitySink;
import com.questrail.delay.time.HashedWheelTimerScheduler;
import com.questrail.delay.time.MonotonicClock;
import com.questrail.delay.time.MonotonicScheduler;
import com.questrail.delay.time.ScheduledExecutorScheduler;
import com.questrail.delay.time.SystemWallClock;
import com.questrail.delay.time.WallClock;

import io.netty.util.HashedWheelTimer;
import io.netty.util.concurrent.DefaultThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * PostponableDelays
 * =============================================================================
 * Composition root for {@link PostponableDelay}s: binds one clock, one timer
 * backend and one observability sink, and hands out delays that share them.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #create(DelayRuntimeConfig)} starts its own daemon timer thread
 *       and stops it on {@link #close()}.</li>
 *   <li>{@link #using(MonotonicScheduler, MonotonicClock, DelayObservabilitySink)}
 *       borrows a caller-owned scheduler; {@link #close()} leaves it alone.</li>
 * </ul>
 *
 * <p>Delays still pending at {@link #close()} never resolve. Their completion
 * stages stay incomplete and their handles keep accepting postponements.
 * Delays created after closing an owned runtime complete exceptionally with
 * the timer's rejection.</p>
 *
 * <p>{@link #close()} may be called from a completion callback. On the timer
 * thread the stop is handed to a short-lived daemon thread, since the timer
 * cannot wait for its own worker to finish.</p>
 */
public final class PostponableDelays implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(PostponableDelays.class);

    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final DelayObservabilitySink sink;
    private final WallClock wallClock;
    private final Set<Thread> timerThreads;
    private final Runnable shutdown;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private PostponableDelays(MonotonicScheduler scheduler,
                              MonotonicClock clock,
                              DelayObservabilitySink sink,
                              WallClock wallClock,
                              Set<Thread> timerThreads,
                              Runnable shutdown)
    {
        this.scheduler = scheduler;
        this.clock = clock;
        this.sink = sink;
        this.wallClock = wallClock;
        this.timerThreads = timerThreads;
        this.shutdown = shutdown;
    }

    public static PostponableDelays withDefaults() {
        return create(DelayRuntimeConfig.defaults());
    }

    public static PostponableDelays create(DelayRuntimeConfig config)
    {
        Objects.requireNonNull(config, "config");

        Set<Thread> timerThreads = ConcurrentHashMap.newKeySet();
        ThreadFactory daemonFactory = new DefaultThreadFactory(config.timerThreadName(), true);
        ThreadFactory threadFactory = task -> {
            Thread thread = daemonFactory.newThread(task);
            timerThreads.add(thread);
            return thread;
        };

        switch (config.timerBackend()) {
            case HASHED_WHEEL -> {
                HashedWheelTimer timer = new HashedWheelTimer(
                        threadFactory,
                        config.wheelTickDuration().toNanos(),
                        TimeUnit.NANOSECONDS);
                log.debug("Started hashed wheel timer runtime, tick={}", config.wheelTickDuration());
                return new PostponableDelays(
                        new HashedWheelTimerScheduler(timer, config.clock()),
                        config.clock(),
                        config.sink(),
                        config.wallClock(),
                        timerThreads,
                        () -> {
                            int dropped = timer.stop().size();
                            log.debug("Stopped hashed wheel timer runtime, {} pending timers dropped", dropped);
                        });
            }
            case SCHEDULED_EXECUTOR -> {
                ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(threadFactory);
                log.debug("Started scheduled executor timer runtime");
                return new PostponableDelays(
                        new ScheduledExecutorScheduler(executor, config.clock()),
                        config.clock(),
                        config.sink(),
                        config.wallClock(),
                        timerThreads,
                        () -> {
                            int dropped = executor.shutdownNow().size();
                            log.debug("Stopped scheduled executor timer runtime, {} pending timers dropped", dropped);
                        });
            }
            default -> throw new IllegalArgumentException("Unsupported timer backend: " + config.timerBackend());
        }
    }

    /**
     * Wraps a scheduler owned by the caller. {@link #close()} does not stop it.
     */
    public static PostponableDelays using(MonotonicScheduler scheduler,
                                          MonotonicClock clock,
                                          DelayObservabilitySink sink)
    {
        return new PostponableDelays(
                Objects.requireNonNull(scheduler, "scheduler"),
                Objects.requireNonNull(clock, "clock"),
                Objects.requireNonNull(sink, "sink"),
                SystemWallClock.INSTANCE,
                Set.of(),
                () -> { });
    }

    /**
     * Returns a delay resolving no sooner than {@code deadlineNanos} on {@link #clock()}.
     */
    public PostponableDelay delayUntil(long deadlineNanos) {
        return PostponableDelay.arm(deadlineNanos, clock, scheduler, sink, wallClock);
    }

    /**
     * Returns a delay resolving no sooner than {@code delay} from now.
     */
    public PostponableDelay delayFor(Duration delay)
    {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        return delayUntil(clock.nowNanos() + delay.toNanos());
    }

    public MonotonicClock clock() {
        return clock;
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (timerThreads.contains(Thread.currentThread())) {
            Thread stopper = new Thread(this::stopFromOutsideTimer, "postponable-delays-close");
            stopper.setDaemon(true);
            stopper.start();
            return;
        }
        stopTimer();
    }

    // Runs the shutdown once; a failed stop leaves the runtime open so close() can be retried.
    private void stopTimer()
    {
        try {
            shutdown.run();
        } catch (RuntimeException e) {
            closed.set(false);
            throw e;
        }
    }

    private void stopFromOutsideTimer()
    {
        try {
            stopTimer();
        } catch (RuntimeException e) {
            log.warn("Stopping timer runtime failed", e);
        }
    }
}
