package com.questrail.delay;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PostponeResponseTest {

    @Test
    void requireOkPassesOnlyForOk() {
        assertDoesNotThrow(PostponeResponse.OK::requireOk);
        assertTrue(PostponeResponse.OK.isOk());
    }

    @Test
    void requireOkFailsWithTheRefusal() {
        PostponeRejectedException resolved =
                assertThrows(PostponeRejectedException.class, PostponeResponse.ALREADY_RESOLVED::requireOk);
        assertEquals(PostponeResponse.ALREADY_RESOLVED, resolved.response());
        assertTrue(resolved.getMessage().contains("ALREADY_RESOLVED"));

        PostponeRejectedException earlier =
                assertThrows(PostponeRejectedException.class, PostponeResponse.CANT_RESOLVE_EARLIER::requireOk);
        assertEquals(PostponeResponse.CANT_RESOLVE_EARLIER, earlier.response());
        assertFalse(PostponeResponse.CANT_RESOLVE_EARLIER.isOk());
    }

    @Test
    void rejectionIsAnIllegalStateException() {
        assertInstanceOf(IllegalStateException.class, new PostponeRejectedException(PostponeResponse.ALREADY_RESOLVED));
    }
}
