package com.loopfuzz.fuzzer.core;

/** Cooperative stop signal for {@link Fuzzer#run(CancellationToken)}. */
public final class CancellationToken {
    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }
}
