package com.questrail.delay;

/**
 * Outcome of {@link PostponableDelayHandle#postpone(long)}.
 *
 * <p>These are normal results, not errors. {@link #requireOk()} exists for
 * tests and assertions that want a refusal to be fatal.</p>
 */
public enum PostponeResponse
{
    /** The target was moved to the requested deadline. */
    OK,

    /** The delay has already resolved; the target is final. */
    ALREADY_RESOLVED,

    /**
     * The requested deadline is earlier than the current target. The delay may
     * already be armed past it, so the request was refused and the target left
     * unchanged.
     */
    CANT_RESOLVE_EARLIER;

    public boolean isOk() {
        return this == OK;
    }

    /**
     * Asserts that the postpone succeeded.
     *
     * @throws PostponeRejectedException if this response is not {@link #OK}
     */
    public void requireOk()
    {
        if (this != OK) {
            throw new PostponeRejectedException(this);
        }
    }
}
