package com.loopfuzz.fuzzer.core;

import com.loopfuzz.fuzzer.mut.InputMutator;
import com.loopfuzz.fuzzer.trace.Tracer;
import java.util.Iterator;
import java.util.Random;
import java.util.stream.Stream;

/** Executes every mutant of an entry; novel mutants reach the work queue through the pipeline. */
final class MutatorDriver<I, C> {
    private final InputMutator<I> mutator;
    private final ExecutionPipeline<I, C> pipeline;
    private final Random random;
    private final Tracer<I> tracer;

    MutatorDriver(
            InputMutator<I> mutator,
            ExecutionPipeline<I, C> pipeline,
            Random random,
            Tracer<I> tracer) {
        this.mutator = mutator;
        this.pipeline = pipeline;
        this.random = random;
        this.tracer = tracer;
    }

    /** The entry must carry an unfaulted execution result. */
    void mutate(QueueEntry<I, C> entry) {
        if (!entry.hasExecutionResult() || entry.executionResult().isFaulted()) {
            throw new IllegalArgumentException("Only unfaulted, executed entries are mutated");
        }
        try (Stream<I> mutants = mutator.mutate(random, entry.input())) {
            Iterator<I> iterator = mutants.iterator();
            while (iterator.hasNext()) {
                I mutant = iterator.next();
                if (pipeline.execute(mutant).novel()) {
                    tracer.mutationFound(entry.input(), mutant);
                }
            }
        }
    }
}
