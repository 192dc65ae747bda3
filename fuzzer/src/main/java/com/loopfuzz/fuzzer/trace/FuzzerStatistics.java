package com.loopfuzz.fuzzer.trace;

import com.loopfuzz.fuzzer.coverage.CoverageBitmap;
import com.loopfuzz.fuzzer.fault.FaultResult;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/** Counts fuzzer events. Safe to read from any thread while the fuzzer runs. */
public final class FuzzerStatistics<I> implements Tracer<I> {
    private final AtomicLong enqueued = new AtomicLong();
    private final AtomicLong dequeued = new AtomicLong();
    private final AtomicLong executions = new AtomicLong();
    private final AtomicLong faults = new AtomicLong();
    private final AtomicLong minimizations = new AtomicLong();
    private final AtomicLong mutations = new AtomicLong();
    private volatile boolean finished;

    @Override
    public void inputsEnqueued(List<I> inputs) {
        enqueued.addAndGet(inputs.size());
    }

    @Override
    public void inputDequeued(I input) {
        dequeued.incrementAndGet();
    }

    @Override
    public void inputFaulted(I input, FaultResult fault) {
        faults.incrementAndGet();
    }

    @Override
    public void inputFuzzed(I input, CoverageBitmap coverage) {
        executions.incrementAndGet();
    }

    @Override
    public void minimizationFound(I input, I minimized) {
        minimizations.incrementAndGet();
    }

    @Override
    public void mutationFound(I input, I mutated) {
        mutations.incrementAndGet();
    }

    @Override
    public void fuzzerFinished() {
        finished = true;
    }

    public long enqueued() {
        return enqueued.get();
    }

    public long dequeued() {
        return dequeued.get();
    }

    public long executions() {
        return executions.get();
    }

    public long faults() {
        return faults.get();
    }

    public long minimizations() {
        return minimizations.get();
    }

    public long mutations() {
        return mutations.get();
    }

    public boolean isFinished() {
        return finished;
    }

    @Override
    public String toString() {
        return "enqueued=" + enqueued() + " dequeued=" + dequeued() + " executions=" + executions()
                + " faults=" + faults() + " minimizations=" + minimizations()
                + " mutations=" + mutations();
    }
}
