package com.loopfuzz.fuzzer.trace;

import com.loopfuzz.fuzzer.coverage.CoverageBitmap;
import com.loopfuzz.fuzzer.fault.FaultResult;
import java.util.List;
import java.util.Objects;

/**
 * Routes every notification to the delegate under one shared lock, so notifications from
 * concurrent workers are never interleaved.
 */
public final class SynchronizedTracer<I> implements Tracer<I> {
    private final Tracer<I> delegate;
    private final Object lock = new Object();

    public SynchronizedTracer(Tracer<I> delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public void inputsEnqueued(List<I> inputs) {
        synchronized (lock) {
            delegate.inputsEnqueued(inputs);
        }
    }

    @Override
    public void inputDequeued(I input) {
        synchronized (lock) {
            delegate.inputDequeued(input);
        }
    }

    @Override
    public void inputFaulted(I input, FaultResult fault) {
        synchronized (lock) {
            delegate.inputFaulted(input, fault);
        }
    }

    @Override
    public void inputFuzzed(I input, CoverageBitmap coverage) {
        synchronized (lock) {
            delegate.inputFuzzed(input, coverage);
        }
    }

    @Override
    public void minimizationFound(I input, I minimized) {
        synchronized (lock) {
            delegate.minimizationFound(input, minimized);
        }
    }

    @Override
    public void mutationFound(I input, I mutated) {
        synchronized (lock) {
            delegate.mutationFound(input, mutated);
        }
    }

    @Override
    public void fuzzerFinished() {
        synchronized (lock) {
            delegate.fuzzerFinished();
        }
    }
}
