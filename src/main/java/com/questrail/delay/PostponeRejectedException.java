package com.questrail.delay;

import java.util.Objects;

/**
 * Thrown by {@link PostponeResponse#requireOk()} when a postpone request was
 * refused.
 */
public final class PostponeRejectedException extends IllegalStateException
{
    private final PostponeResponse response;

    public PostponeRejectedException(PostponeResponse response)
    {
        super("Postpone was refused: " + Objects.requireNonNull(response, "response"));
        this.response = response;
    }

    public PostponeResponse response() {
        return response;
    }
}
