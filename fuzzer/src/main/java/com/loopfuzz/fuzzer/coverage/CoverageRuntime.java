package com.loopfuzz.fuzzer.coverage;

import java.util.Arrays;

/**
 * Edge coverage for targets running inside the fuzzer's JVM. Hand-instrumented or woven target
 * code calls {@link #enterEdge(int)} once per basic block; while the calling thread is being
 * traced, the AFL counter at {@code previous ^ current} is bumped (saturating at 255).
 */
public final class CoverageRuntime {
    static final int MAP_SIZE = 1 << 16;

    private static final ThreadLocal<Trace> TRACE = new ThreadLocal<>();

    private CoverageRuntime() {}

    /** Records a block. Ignored on threads that are not being traced. */
    public static void enterEdge(int blockId) {
        Trace trace = TRACE.get();
        if (trace == null) {
            return;
        }
        int location = blockId & (MAP_SIZE - 1);
        int index = trace.previous ^ location;
        if (trace.counts[index] != (byte) 0xFF) {
            trace.counts[index]++;
        }
        trace.previous = location >>> 1;
    }

    /** Starts a fresh trace on the calling thread, discarding any unfinished one. */
    public static void startTracing() {
        TRACE.set(new Trace());
    }

    /**
     * Ends the calling thread's trace.
     *
     * @return the collected hit counts with trailing zero entries dropped, or an empty bitmap when
     *     no trace was active
     */
    public static CoverageBitmap stopTracing() {
        Trace trace = TRACE.get();
        if (trace == null) {
            return CoverageBitmap.empty();
        }
        TRACE.remove();
        int end = trace.counts.length;
        while (end > 0 && trace.counts[end - 1] == 0) {
            end--;
        }
        return CoverageBitmap.fromBytes(Arrays.copyOf(trace.counts, end));
    }

    public static boolean isTracing() {
        return TRACE.get() != null;
    }

    private static final class Trace {
        private final byte[] counts = new byte[MAP_SIZE];
        private int previous;
    }
}
