package com.loopfuzz.fuzzer.core;

import com.loopfuzz.fuzzer.fault.FaultEquivalence;
import com.loopfuzz.fuzzer.fault.FaultResult;
import java.util.Objects;

/**
 * Minimal summary of one target execution: its compressed coverage and fault outcome.
 *
 * @param <C> compressed coverage type
 */
public record ExecutionResult<C>(C coverage, FaultResult fault) {

    public ExecutionResult {
        Objects.requireNonNull(coverage, "coverage");
        Objects.requireNonNull(fault, "fault");
    }

    /** Equal coverage and equivalent faults. */
    public boolean isEquivalentTo(ExecutionResult<C> other, FaultEquivalence faultEquivalence) {
        return coverage.equals(other.coverage) && faultEquivalence.equivalent(fault, other.fault);
    }

    public boolean isFaulted() {
        return fault.isFaulted();
    }
}
