package com.loopfuzz.fuzzer.trace;

import com.loopfuzz.fuzzer.coverage.CoverageBitmap;
import com.loopfuzz.fuzzer.fault.FaultResult;
import java.util.List;

/** Forwards each notification to several tracers, in registration order. */
public final class CompositeTracer<I> implements Tracer<I> {
    private final List<Tracer<I>> tracers;

    @SafeVarargs
    public CompositeTracer(Tracer<I>... tracers) {
        this.tracers = List.of(tracers);
    }

    @Override
    public void inputsEnqueued(List<I> inputs) {
        tracers.forEach(tracer -> tracer.inputsEnqueued(inputs));
    }

    @Override
    public void inputDequeued(I input) {
        tracers.forEach(tracer -> tracer.inputDequeued(input));
    }

    @Override
    public void inputFaulted(I input, FaultResult fault) {
        tracers.forEach(tracer -> tracer.inputFaulted(input, fault));
    }

    @Override
    public void inputFuzzed(I input, CoverageBitmap coverage) {
        tracers.forEach(tracer -> tracer.inputFuzzed(input, coverage));
    }

    @Override
    public void minimizationFound(I input, I minimized) {
        tracers.forEach(tracer -> tracer.minimizationFound(input, minimized));
    }

    @Override
    public void mutationFound(I input, I mutated) {
        tracers.forEach(tracer -> tracer.mutationFound(input, mutated));
    }

    @Override
    public void fuzzerFinished() {
        tracers.forEach(Tracer::fuzzerFinished);
    }
}
