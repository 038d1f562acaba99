package com.questrail.delay.observability;

/**
 * No-op implementation of DelayObservabilitySink.
 */
public final class NullDelayObservabilitySink implements DelayObservabilitySink {
    public static final NullDelayObservabilitySink INSTANCE = new NullDelayObservabilitySink();

    private NullDelayObservabilitySink() {}

    @Override
    public void onLifecycleEvent(DelayLifecycleEvent event) {}

    @Override
    public void onPostpone(DelayPostponeEvent event) {}

    @Override
    public void onError(DelayErrorEvent event) {}
}
