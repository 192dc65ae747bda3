package com.loopfuzz.fuzzer.coverage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class CoverageRuntimeTest {

    @Test
    void edgesAreIgnoredOutsideATrace() {
        CoverageRuntime.enterEdge(5);

        assertFalse(CoverageRuntime.isTracing());
        assertTrue(CoverageRuntime.stopTracing().isEmpty());
    }

    @Test
    void consecutiveBlocksHashIntoEdgeCounters() {
        CoverageRuntime.startTracing();
        CoverageRuntime.enterEdge(4);
        CoverageRuntime.enterEdge(9);
        CoverageBitmap trace = CoverageRuntime.stopTracing();

        // 0 ^ 4, then (4 >>> 1) ^ 9
        assertEquals(1, trace.hitCount(4));
        assertEquals(1, trace.hitCount(11));
        assertEquals(2, trace.countNonZero());
        assertEquals(12, trace.length());
        assertFalse(CoverageRuntime.isTracing());
    }

    @Test
    void countersSaturate() {
        CoverageRuntime.startTracing();
        for (int i = 0; i < 300; i++) {
            CoverageRuntime.enterEdge(0);
        }
        CoverageBitmap trace = CoverageRuntime.stopTracing();

        assertEquals(255, trace.hitCount(0));
    }

    @Test
    void startingAgainDiscardsThePreviousTrace() {
        CoverageRuntime.startTracing();
        CoverageRuntime.enterEdge(9);
        CoverageRuntime.startTracing();
        CoverageRuntime.enterEdge(3);

        assertEquals(CoverageBitmap.fromIndices(3), CoverageRuntime.stopTracing());
    }
}
