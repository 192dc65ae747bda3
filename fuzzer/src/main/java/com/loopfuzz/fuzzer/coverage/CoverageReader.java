package com.loopfuzz.fuzzer.coverage;

import com.loopfuzz.fuzzer.exec.TargetInfo;

/** Reads the coverage collected for a single target run. */
public interface CoverageReader {

    /** Discards any stale coverage associated with the run before the target executes. */
    void clear(TargetInfo targetInfo);

    /** Returns the raw coverage collected for the run. Called once, after the target executed. */
    CoverageBitmap read(TargetInfo targetInfo);
}
