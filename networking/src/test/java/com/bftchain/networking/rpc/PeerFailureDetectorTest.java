package com.bftchain.networking.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class PeerFailureDetectorTest {
    private List<String> down;
    private List<String> up;
    private PeerFailureDetector detector;

    @BeforeEach
    public void setup() {
        down = new ArrayList<>();
        up = new ArrayList<>();
        detector = new PeerFailureDetector(3, down::add, up::add);
    }

    @Test
    public void testThresholdCrossedOnce() {
        assertFalse(detector.recordFailure("val2"));
        assertFalse(detector.recordFailure("val2"));
        assertTrue(detector.recordFailure("val2"));
        assertFalse(detector.recordFailure("val2"));

        assertTrue(detector.isSuspected("val2"));
        assertEquals(4, detector.getFailureCount("val2"));
        assertEquals(List.of("val2"), down);
    }

    @Test
    public void testSuccessClearsSuspicion() {
        for (int i = 0; i < 3; i++) {
            detector.recordFailure("val2");
        }
        assertTrue(detector.recordSuccess("val2"));
        assertFalse(detector.isSuspected("val2"));
        assertEquals(0, detector.getFailureCount("val2"));
        assertEquals(List.of("val2"), up);
    }

    @Test
    public void testSuccessBelowThresholdIsQuiet() {
        detector.recordFailure("val3");
        assertFalse(detector.recordSuccess("val3"));
        assertFalse(detector.recordSuccess("val4"));
        assertTrue(up.isEmpty());
    }

    @Test
    public void testSuspectedPeers() {
        for (int i = 0; i < 3; i++) {
            detector.recordFailure("val4");
            detector.recordFailure("val2");
        }
        detector.recordFailure("val3");
        assertEquals(Set.of("val2", "val4"), detector.getSuspectedPeers());
    }

    @Test
    public void testInvalidThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new PeerFailureDetector(0, null, null));
    }
}
