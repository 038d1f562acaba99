package com.questrail.delay;

import com.google.errorprone.annotations.CheckReturnValue;
import com.questrail.delay.observability.DelayObservabilitySink;
import com.questrail.delay.observability.DelayPostponeEvent;
import com.questrail.delay.time.WallClock;

import java.time.Duration;
import java.util.Objects;

/**
 * PostponableDelayHandle
 * -----------------------------------------------------------------------------
 * Capability to push back the resolution of one {@link PostponableDelay}.
 *
 * <p>Handles are thread-safe and may be shared freely. They stay usable after
 * the delay resolves (every request then answers
 * {@link PostponeResponse#ALREADY_RESOLVED}).</p>
 *
 * <p>If the delay can no longer fire, for example because its scheduler was
 * shut down, its handles keep answering {@link PostponeResponse#OK} and
 * {@link PostponeResponse#CANT_RESOLVE_EARLIER} as usual. Nothing marks the
 * shared target as abandoned.</p>
 */
public final class PostponableDelayHandle
{
    private final DelayTarget target;
    private final DelayObservabilitySink sink;
    private final WallClock wallClock;

    PostponableDelayHandle(DelayTarget target, DelayObservabilitySink sink, WallClock wallClock)
    {
        this.target = target;
        this.sink = sink;
        this.wallClock = wallClock;
    }

    /**
     * Attempts to move the delay's target to {@code deadlineNanos}.
     *
     * <p>Requests for a deadline earlier than the current target are refused;
     * a deadline equal to the current target is accepted and changes nothing.</p>
     *
     * @param deadlineNanos new target, on the delay's monotonic clock
     * @return whether the target was moved, and if not, why
     */
    @CheckReturnValue
    public PostponeResponse postpone(long deadlineNanos)
    {
        PostponeResponse response = target.postpone(deadlineNanos);
        sink.onPostpone(new DelayPostponeEvent(wallClock.now(), target.delayId(), deadlineNanos, response));
        return response;
    }

    /**
     * Attempts to move the delay's target to {@code delay} from now.
     *
     * @see #postpone(long)
     */
    @CheckReturnValue
    public PostponeResponse postponeFor(Duration delay)
    {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        return postpone(target.clock().nowNanos() + delay.toNanos());
    }

    public boolean isResolved() {
        return target.isResolved();
    }

    public long delayId() {
        return target.delayId();
    }
}
