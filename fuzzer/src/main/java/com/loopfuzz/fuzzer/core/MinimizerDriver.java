package com.loopfuzz.fuzzer.core;

import com.loopfuzz.fuzzer.fault.FaultEquivalence;
import com.loopfuzz.fuzzer.min.InputMinimizer;
import com.loopfuzz.fuzzer.trace.Tracer;
import java.util.Iterator;
import java.util.Random;
import java.util.stream.Stream;

/**
 * Shrinks an entry to a fixpoint. Each pass asks the minimizer for candidates derived from the
 * current input and adopts the first one whose execution is equivalent to the baseline; a pass
 * without such a candidate ends minimization.
 */
final class MinimizerDriver<I, C> {
    private final InputMinimizer<I> minimizer;
    private final FaultEquivalence faultEquivalence;
    private final ExecutionPipeline<I, C> pipeline;
    private final Random random;
    private final Tracer<I> tracer;

    MinimizerDriver(
            InputMinimizer<I> minimizer,
            FaultEquivalence faultEquivalence,
            ExecutionPipeline<I, C> pipeline,
            Random random,
            Tracer<I> tracer) {
        this.minimizer = minimizer;
        this.faultEquivalence = faultEquivalence;
        this.pipeline = pipeline;
        this.random = random;
        this.tracer = tracer;
    }

    /**
     * Returns the smallest equivalent entry found. The returned entry always carries an execution
     * result; if the input entry already had one and nothing smaller was found, it is returned as
     * is.
     */
    QueueEntry<I, C> minimize(QueueEntry<I, C> entry) {
        QueueEntry<I, C> current = withBaseline(entry);
        ExecutionResult<C> reference = current.executionResult();
        QueueEntry<I, C> reduced;
        while ((reduced = reduceOnce(current, reference)) != null) {
            current = reduced;
        }
        return current;
    }

    private QueueEntry<I, C> withBaseline(QueueEntry<I, C> entry) {
        if (entry.hasExecutionResult()) {
            return entry;
        }
        return entry.withResult(pipeline.execute(entry.input(), false).result());
    }

    private QueueEntry<I, C> reduceOnce(QueueEntry<I, C> current, ExecutionResult<C> reference) {
        try (Stream<I> candidates = minimizer.minimize(random, current.input())) {
            Iterator<I> iterator = candidates.iterator();
            while (iterator.hasNext()) {
                I candidate = iterator.next();
                ExecutionResult<C> result = pipeline.execute(candidate).result();
                if (result.isEquivalentTo(reference, faultEquivalence)) {
                    tracer.minimizationFound(current.input(), candidate);
                    return new QueueEntry<>(candidate, result);
                }
            }
        }
        return null;
    }
}
