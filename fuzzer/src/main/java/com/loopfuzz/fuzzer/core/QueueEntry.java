package com.loopfuzz.fuzzer.core;

import java.util.Objects;

/**
 * One unit of fuzzing work. Seed entries start without an execution result; entries queued by the
 * pipeline always carry the result of the execution that found them.
 */
public record QueueEntry<I, C>(I input, ExecutionResult<C> executionResult) {

    public QueueEntry {
        Objects.requireNonNull(input, "input");
    }

    public static <I, C> QueueEntry<I, C> seed(I input) {
        return new QueueEntry<>(input, null);
    }

    public boolean hasExecutionResult() {
        return executionResult != null;
    }

    public QueueEntry<I, C> withResult(ExecutionResult<C> result) {
        return new QueueEntry<>(input, result);
    }
}
