package com.questrail.delay;

import com.questrail.delay.observability.DelayErrorEvent;
import com.questrail.delay.observability.DelayLifecycleEvent;
import com.questrail.delay.observability.DelayObservabilitySink;
import com.questrail.delay.observability.DelayPostponeEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * GuardedDelayObservabilitySink
 * -----------------------------------------------------------------------------
 * Keeps a failing sink from reaching the delay state machine or a postponing
 * caller. A sink exception is logged and the delay carries on; observability
 * must never decide whether a delay is armed or resolved.
 */
final class GuardedDelayObservabilitySink implements DelayObservabilitySink
{
    private static final Logger log = LoggerFactory.getLogger(GuardedDelayObservabilitySink.class);

    private final DelayObservabilitySink delegate;

    private GuardedDelayObservabilitySink(DelayObservabilitySink delegate) {
        this.delegate = delegate;
    }

    static DelayObservabilitySink wrap(DelayObservabilitySink sink)
    {
        if (sink instanceof GuardedDelayObservabilitySink) {
            return sink;
        }
        return new GuardedDelayObservabilitySink(sink);
    }

    @Override
    public void onLifecycleEvent(DelayLifecycleEvent event)
    {
        try {
            delegate.onLifecycleEvent(event);
        } catch (RuntimeException e) {
            log.warn("Delay {}: observability sink failed on {} event", event.delayId(), event.kind(), e);
        }
    }

    @Override
    public void onPostpone(DelayPostponeEvent event)
    {
        try {
            delegate.onPostpone(event);
        } catch (RuntimeException e) {
            log.warn("Delay {}: observability sink failed on postpone event", event.delayId(), e);
        }
    }

    @Override
    public void onError(DelayErrorEvent event)
    {
        try {
            delegate.onError(event);
        } catch (RuntimeException e) {
            log.warn("Delay {}: observability sink failed on error event", event.delayId(), e);
        }
    }
}
