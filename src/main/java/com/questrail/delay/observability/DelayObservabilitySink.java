package com.questrail.delay.observability;

/**
 * Receives observability events from delays and their handles.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive on timer threads and on whatever threads call
 * {@code postpone}, so implementations must be thread-safe and must not block.</p>
 */
public interface DelayObservabilitySink {
    /**
     * Called when a delay's timer is armed, re-armed, or the delay resolves.
     * @param event the lifecycle event
     */
    void onLifecycleEvent(DelayLifecycleEvent event);

    /**
     * Called after every postpone request, whatever its outcome.
     * @param event the postpone event
     */
    void onPostpone(DelayPostponeEvent event);

    /**
     * Called when a delay can no longer make progress because of a failure
     * underneath it.
     * @param event the error event
     */
    void onError(DelayErrorEvent event);
}
