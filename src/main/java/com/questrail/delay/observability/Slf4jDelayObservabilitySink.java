package com.questrail.delay.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Production implementation of DelayObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jDelayObservabilitySink implements DelayObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDelayObservabilitySink.class);

    @Override
    public void onLifecycleEvent(DelayLifecycleEvent event) {
        if (!log.isDebugEnabled()) {
            return;
        }
        switch (event.kind()) {
            case ARMED -> log.debug("Delay {}: armed, due in {} us",
                event.delayId(), micros(-event.lagNanos()));
            case REARMED -> log.debug("Delay {}: target moved, re-armed, due in {} us",
                event.delayId(), micros(-event.lagNanos()));
            case RESOLVED -> log.debug("Delay {}: resolved {} us after target",
                event.delayId(), micros(event.lagNanos()));
        }
    }

    @Override
    public void onPostpone(DelayPostponeEvent event) {
        log.debug("Delay {}: postpone to {} -> {}",
            event.delayId(), event.requestedNanos(), event.response());
    }

    @Override
    public void onError(DelayErrorEvent event) {
        log.error("Delay {}: {}", event.delayId(), event.message(), event.cause());
    }

    private static long micros(long nanos) {
        return TimeUnit.NANOSECONDS.toMicros(nanos);
    }
}
