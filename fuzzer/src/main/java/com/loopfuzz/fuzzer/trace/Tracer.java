package com.loopfuzz.fuzzer.trace;

import com.loopfuzz.fuzzer.coverage.CoverageBitmap;
import com.loopfuzz.fuzzer.fault.FaultResult;
import java.util.List;

/**
 * Observer of fuzzer progress. The fuzzer serializes all calls, so implementations see a strict
 * total order and need no locking of their own when used by a single fuzzer. Callbacks run while
 * that serialization lock is held and must return promptly.
 *
 * @param <I> input type
 */
public interface Tracer<I> {

    default void inputsEnqueued(List<I> inputs) {}

    default void inputDequeued(I input) {}

    default void inputFaulted(I input, FaultResult fault) {}

    /** Called after every execution with the raw coverage it produced. */
    default void inputFuzzed(I input, CoverageBitmap coverage) {}

    default void minimizationFound(I input, I minimized) {}

    default void mutationFound(I input, I mutated) {}

    default void fuzzerFinished() {}
}
