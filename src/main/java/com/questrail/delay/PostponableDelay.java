package com.questrail.delay;

import com.questrail.delay.observability.DelayErrorEvent;
import com.questrail.delay.observability.DelayLifecycleEvent;
import com.questrail.delay.observability.DelayObservabilitySink;
import com.questrail.delay.observability.NullDelayObservabilitySink;
import com.questrail.delay.time.MonotonicClock;
import com.questrail.delay.time.MonotonicScheduler;
import com.questrail.delay.time.SystemWallClock;
import com.questrail.delay.time.WallClock;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * PostponableDelay
 * =============================================================================
 * A single pending wake-up that completes no earlier than its target, where the
 * target can be pushed later through {@link PostponableDelayHandle}s while the
 * delay is outstanding.
 *
 * <h2>Ownership</h2>
 * <ul>
 *   <li>The delay is the only component that touches the low-level timer. It
 *       arms it once on creation and re-arms it whenever it wakes up to find
 *       that the target has moved.</li>
 *   <li>Handles only mutate the shared target. They never notify the delay;
 *       the delay notices at its next wake-up, which is never later than the
 *       previous target.</li>
 * </ul>
 *
 * <h2>Wake-up loop</h2>
 * On every timer firing:
 * <ol>
 *   <li>If the current target is due, mark it resolved and complete.</li>
 *   <li>Otherwise re-arm for the current target. If that target is already due
 *       by the time it is read back, go round the loop again instead of
 *       waiting for the scheduler.</li>
 * </ol>
 *
 * <h2>Completion</h2>
 * {@link #completion()} completes exactly once, on the scheduler's thread.
 * It completes exceptionally only if the scheduler refuses to arm the timer,
 * in which case the target is left unresolved.
 *
 * <p>There is no cancellation. Callers wanting an upper bound compose one on
 * top, e.g. {@code completion().toCompletableFuture().orTimeout(...)}.</p>
 */
public final class PostponableDelay
{
    private static final AtomicLong NEXT_ID = new AtomicLong(1);

    private final DelayTarget target;
    private final MonotonicScheduler scheduler;
    private final DelayObservabilitySink sink;
    private final WallClock wallClock;
    private final CompletableFuture<Void> completion = new CompletableFuture<>();

    private long armedDeadlineNanos;
    private boolean armed;

    private PostponableDelay(DelayTarget target,
                             MonotonicScheduler scheduler,
                             DelayObservabilitySink sink,
                             WallClock wallClock)
    {
        this.target = target;
        this.scheduler = scheduler;
        this.sink = GuardedDelayObservabilitySink.wrap(sink);
        this.wallClock = wallClock;
    }

    /**
     * Creates a delay that resolves no sooner than {@code deadlineNanos} and
     * arms its timer.
     *
     * @param deadlineNanos initial target, in ticks of {@code clock}
     * @param clock         monotonic clock the deadline is expressed in
     * @param scheduler     timer backend; must use the same clock
     * @param sink          observability sink
     * @param wallClock     timestamp source for observability events
     */
    public static PostponableDelay arm(long deadlineNanos,
                                       MonotonicClock clock,
                                       MonotonicScheduler scheduler,
                                       DelayObservabilitySink sink,
                                       WallClock wallClock)
    {
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(wallClock, "wallClock");

        DelayTarget target = new DelayTarget(NEXT_ID.getAndIncrement(), deadlineNanos, clock);
        PostponableDelay delay = new PostponableDelay(target, scheduler, sink, wallClock);

        delay.emit(DelayLifecycleEvent.Kind.ARMED, deadlineNanos);
        delay.armTimer(deadlineNanos);
        return delay;
    }

    /**
     * Creates a delay without observability.
     */
    public static PostponableDelay arm(long deadlineNanos, MonotonicClock clock, MonotonicScheduler scheduler)
    {
        return arm(deadlineNanos, clock, scheduler, NullDelayObservabilitySink.INSTANCE, SystemWallClock.INSTANCE);
    }

    /**
     * Creates a delay that resolves no sooner than {@code delay} from now.
     */
    public static PostponableDelay armAfter(Duration delay, MonotonicClock clock, MonotonicScheduler scheduler)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        return arm(clock.nowNanos() + delay.toNanos(), clock, scheduler);
    }

    /**
     * Returns a new handle able to postpone this delay. May be called any number
     * of times, from any thread, before or after the delay resolves.
     */
    public PostponableDelayHandle handle() {
        return new PostponableDelayHandle(target, sink, wallClock);
    }

    /**
     * Stage that completes once this delay has resolved. Callers cannot complete
     * it themselves.
     */
    public CompletionStage<Void> completion() {
        return completion.minimalCompletionStage();
    }

    /**
     * Blocks until this delay resolves.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting
     * @throws RuntimeException     the scheduler's exception, if it refused to arm the timer
     */
    public void await() throws InterruptedException
    {
        try {
            completion.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Delay " + id() + " failed", cause);
        }
    }

    public boolean isResolved() {
        return target.isResolved();
    }

    /**
     * The target currently in effect, including any accepted postponements.
     */
    public long targetNanos() {
        return target.targetNanos();
    }

    /**
     * The deadline the internal timer is currently armed for. Trails
     * {@link #targetNanos()} until the next wake-up after a postponement.
     * Empty if the scheduler never accepted a registration.
     */
    public synchronized OptionalLong armedDeadlineNanos() {
        return armed ? OptionalLong.of(armedDeadlineNanos) : OptionalLong.empty();
    }

    public long id() {
        return target.delayId();
    }

    private void onTimerFired()
    {
        MonotonicClock clock = target.clock();
        while (true) {
            long now = clock.nowNanos();
            OptionalLong next = target.resolveOrNextDeadline(now);
            if (next.isEmpty()) {
                if (completion.complete(null)) {
                    emit(DelayLifecycleEvent.Kind.RESOLVED, target.targetNanos(), now);
                }
                return;
            }

            long deadline = next.getAsLong();
            if (deadline - clock.nowNanos() <= 0) {
                continue;
            }

            if (armTimer(deadline)) {
                emit(DelayLifecycleEvent.Kind.REARMED, deadline);
            }
            return;
        }
    }

    private boolean armTimer(long deadlineNanos)
    {
        try {
            scheduler.scheduleAtNanos(deadlineNanos, this::onTimerFired);
        } catch (RuntimeException e) {
            sink.onError(new DelayErrorEvent(wallClock.now(), id(), "scheduler refused to arm timer", e));
            completion.completeExceptionally(e);
            return false;
        }
        recordArmed(deadlineNanos);
        return true;
    }

    // The task may already have fired and re-armed later before this runs.
    private synchronized void recordArmed(long deadlineNanos)
    {
        if (!armed || deadlineNanos - armedDeadlineNanos > 0) {
            armedDeadlineNanos = deadlineNanos;
            armed = true;
        }
    }

    private void emit(DelayLifecycleEvent.Kind kind, long deadlineNanos) {
        emit(kind, deadlineNanos, target.clock().nowNanos());
    }

    private void emit(DelayLifecycleEvent.Kind kind, long deadlineNanos, long observedNanos) {
        sink.onLifecycleEvent(new DelayLifecycleEvent(wallClock.now(), id(), kind, deadlineNanos, observedNanos));
    }

    @Override
    public String toString() {
        return "PostponableDelay[id=" + id()
            + ", targetNanos=" + target.targetNanos()
            + ", resolved=" + target.isResolved() + "]";
    }
}
