package com.loopfuzz.fuzzer.fault;

import java.util.Objects;

/**
 * Decides whether two fault results describe the same failure. Used by minimization, where a
 * candidate must reproduce the fault of the input it replaces.
 */
@FunctionalInterface
public interface FaultEquivalence {

    /**
     * Same kind of outcome: both clean, or the same exception class thrown from the same frame, or
     * the same exit code, or both timeouts. Messages are ignored.
     */
    FaultEquivalence SAME_KIND =
            (a, b) -> {
                if (a.kind() != b.kind()) {
                    return false;
                }
                return switch (a.kind()) {
                    case NONE, TIMEOUT -> true;
                    case EXIT_CODE -> a.exitCode() == b.exitCode();
                    case EXCEPTION -> Objects.equals(a.exceptionType(), b.exceptionType())
                            && Objects.equals(a.topFrame(), b.topFrame());
                };
            };

    /** Only the faulted flag matters. */
    FaultEquivalence FAULTED_FLAG = (a, b) -> a.isFaulted() == b.isFaulted();

    boolean equivalent(FaultResult a, FaultResult b);
}
