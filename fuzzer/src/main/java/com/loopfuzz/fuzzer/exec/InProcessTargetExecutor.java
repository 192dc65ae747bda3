package com.loopfuzz.fuzzer.exec;

import com.loopfuzz.fuzzer.coverage.CoverageBitmap;
import com.loopfuzz.fuzzer.coverage.CoverageReader;
import com.loopfuzz.fuzzer.coverage.CoverageRuntime;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the target as a plain method call inside the fuzzer's JVM. Each run is traced through
 * {@link CoverageRuntime} on the thread that executes it; {@link #coverageReader()} hands the trace
 * to the fuzzer.
 *
 * @param <I> input type
 */
public final class InProcessTargetExecutor<I> implements TargetExecutor<I> {

    /** The code under test. */
    @FunctionalInterface
    public interface Target<I> {
        void run(I input) throws Exception;
    }

    /** Handle of one in-process run. */
    public record Run(String runId) implements TargetInfo {}

    private final Target<I> target;
    private final Runnable initializer;
    private final AtomicLong runCounter = new AtomicLong();
    private final Map<String, I> inputs = new ConcurrentHashMap<>();
    private final Map<String, CoverageBitmap> traces = new ConcurrentHashMap<>();

    public InProcessTargetExecutor(Target<I> target) {
        this(target, () -> {});
    }

    /**
     * @param initializer warm-up code run once by {@link #globalInitializer()}, typically forcing
     *     class initialization of the target
     */
    public InProcessTargetExecutor(Target<I> target, Runnable initializer) {
        this.target = Objects.requireNonNull(target, "target");
        this.initializer = Objects.requireNonNull(initializer, "initializer");
    }

    @Override
    public void globalInitializer() {
        initializer.run();
    }

    @Override
    public TargetInfo initialize(I input) {
        String runId = "run-" + runCounter.incrementAndGet();
        inputs.put(runId, Objects.requireNonNull(input, "input"));
        return new Run(runId);
    }

    /** Runs the target once per handle; a handle from elsewhere or one already run is rejected. */
    @Override
    public void execute(TargetInfo targetInfo) throws Exception {
        I input = targetInfo instanceof Run ? inputs.remove(targetInfo.runId()) : null;
        if (input == null) {
            throw new IllegalArgumentException("Not a pending in-process run: " + targetInfo);
        }
        CoverageRuntime.startTracing();
        try {
            target.run(input);
        } finally {
            traces.put(targetInfo.runId(), CoverageRuntime.stopTracing());
        }
    }

    /** Reads the traces recorded by {@link #execute(TargetInfo)}. */
    public CoverageReader coverageReader() {
        return new CoverageReader() {
            @Override
            public void clear(TargetInfo targetInfo) {
                traces.remove(targetInfo.runId());
            }

            @Override
            public CoverageBitmap read(TargetInfo targetInfo) {
                CoverageBitmap trace = traces.remove(targetInfo.runId());
                return trace != null ? trace : CoverageBitmap.empty();
            }
        };
    }
}
