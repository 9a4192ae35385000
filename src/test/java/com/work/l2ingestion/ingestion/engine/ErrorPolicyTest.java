package com.work.l2ingestion.ingestion.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ErrorPolicyTest {

    @Test
    public void flag_maps_to_policy() {
        assertEquals(ErrorPolicy.CATCH_AND_BACKOFF, ErrorPolicy.fromCatchAllFlag(true));
        assertEquals(ErrorPolicy.FAIL_FAST, ErrorPolicy.fromCatchAllFlag(false));
    }

    @Test
    public void fail_fast_only_absorbs_after_stop() {
        assertFalse(ErrorPolicy.FAIL_FAST.absorbs(false));
        assertTrue(ErrorPolicy.FAIL_FAST.absorbs(true));
        assertTrue(ErrorPolicy.CATCH_AND_BACKOFF.absorbs(false));
        assertTrue(ErrorPolicy.CATCH_AND_BACKOFF.absorbs(true));
    }
}
