package com.loopfuzz.fuzzer.exec;

/**
 * Knows how to run the system under test against one input.
 *
 * @param <I> input type
 */
public interface TargetExecutor<I> {

    /**
     * One-time setup, invoked before any coverage is captured so that setup code is not
     * attributed to the target.
     */
    void globalInitializer();

    /** Prepares a run for {@code input}. The returned handle is valid for that run only. */
    TargetInfo initialize(I input);

    /**
     * Executes the run prepared by {@link #initialize(Object)}. Fault detectors call this.
     *
     * @throws TargetFaultException if the target reported a failure status
     * @throws Exception anything the target itself threw
     */
    void execute(TargetInfo targetInfo) throws Exception;
}
