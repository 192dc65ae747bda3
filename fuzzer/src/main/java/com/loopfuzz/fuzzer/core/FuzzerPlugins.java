package com.loopfuzz.fuzzer.core;

import com.loopfuzz.fuzzer.coverage.CoverageCompressor;
import com.loopfuzz.fuzzer.coverage.CoverageReader;
import com.loopfuzz.fuzzer.exec.TargetExecutor;
import com.loopfuzz.fuzzer.fault.FaultDetector;
import com.loopfuzz.fuzzer.fault.FaultEquivalence;
import com.loopfuzz.fuzzer.min.InputMinimizer;
import com.loopfuzz.fuzzer.mut.InputMutator;
import com.loopfuzz.fuzzer.trace.Tracer;
import java.util.Objects;

/**
 * The strategy plugins a {@link Fuzzer} is assembled from.
 *
 * @param <I> input type
 * @param <C> compressed coverage type
 */
public record FuzzerPlugins<I, C>(
        TargetExecutor<I> targetExecutor,
        CoverageReader coverageReader,
        CoverageCompressor<C> coverageCompressor,
        FaultDetector faultDetector,
        InputMinimizer<I> inputMinimizer,
        InputMutator<I> inputMutator,
        Tracer<I> tracer,
        FaultEquivalence faultEquivalence) {

    public FuzzerPlugins {
        Objects.requireNonNull(targetExecutor, "targetExecutor");
        Objects.requireNonNull(coverageReader, "coverageReader");
        Objects.requireNonNull(coverageCompressor, "coverageCompressor");
        Objects.requireNonNull(faultDetector, "faultDetector");
        Objects.requireNonNull(inputMinimizer, "inputMinimizer");
        Objects.requireNonNull(inputMutator, "inputMutator");
        Objects.requireNonNull(tracer, "tracer");
        Objects.requireNonNull(faultEquivalence, "faultEquivalence");
    }

    /** Uses {@link FaultEquivalence#SAME_KIND}. */
    public FuzzerPlugins(
            TargetExecutor<I> targetExecutor,
            CoverageReader coverageReader,
            CoverageCompressor<C> coverageCompressor,
            FaultDetector faultDetector,
            InputMinimizer<I> inputMinimizer,
            InputMutator<I> inputMutator,
            Tracer<I> tracer) {
        this(
                targetExecutor,
                coverageReader,
                coverageCompressor,
                faultDetector,
                inputMinimizer,
                inputMutator,
                tracer,
                FaultEquivalence.SAME_KIND);
    }
}
