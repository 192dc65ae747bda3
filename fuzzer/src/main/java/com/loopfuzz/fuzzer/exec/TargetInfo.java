package com.loopfuzz.fuzzer.exec;

/**
 * Opaque handle for one target run, created by {@link TargetExecutor#initialize(Object)} and
 * consumed by the coverage reader and fault detector of the same pipeline pass. Handles are never
 * reused across runs.
 */
public interface TargetInfo {

    /** Identifier unique to this run, used to correlate out-of-process coverage. */
    String runId();
}
