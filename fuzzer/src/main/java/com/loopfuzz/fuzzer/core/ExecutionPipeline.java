package com.loopfuzz.fuzzer.core;

import com.loopfuzz.fuzzer.coverage.CoverageBitmap;
import com.loopfuzz.fuzzer.exec.TargetInfo;
import com.loopfuzz.fuzzer.fault.FaultResult;
import com.loopfuzz.fuzzer.trace.Tracer;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the target once for an input and decides whether the run is novel. This is the only place
 * coverage is read, compressed and checked against the seen set; novel runs are fed back into the
 * work queue.
 */
final class ExecutionPipeline<I, C> {
    private static final Logger log = LoggerFactory.getLogger(ExecutionPipeline.class);

    /** Result of one pass through the pipeline. */
    record Outcome<C>(ExecutionResult<C> result, boolean novel) {}

    private final FuzzerPlugins<I, C> plugins;
    private final SeenCoverageSet<C> seenCoverage;
    private final WorkQueue<I, C> queue;
    private final Tracer<I> tracer;

    ExecutionPipeline(
            FuzzerPlugins<I, C> plugins,
            SeenCoverageSet<C> seenCoverage,
            WorkQueue<I, C> queue,
            Tracer<I> tracer) {
        this.plugins = plugins;
        this.seenCoverage = seenCoverage;
        this.queue = queue;
        this.tracer = tracer;
    }

    Outcome<C> execute(I input) {
        return execute(input, true);
    }

    /**
     * @param requeueOnNovelty whether a novel run is appended to the work queue; the coverage is
     *     recorded as seen either way
     */
    Outcome<C> execute(I input, boolean requeueOnNovelty) {
        TargetInfo targetInfo = plugins.targetExecutor().initialize(input);
        plugins.coverageReader().clear(targetInfo);
        FaultResult fault = plugins.faultDetector().detect(plugins.targetExecutor(), targetInfo);
        if (fault.isFaulted()) {
            tracer.inputFaulted(input, fault);
        }
        CoverageBitmap coverage = plugins.coverageReader().read(targetInfo);
        tracer.inputFuzzed(input, coverage);

        C compressed = plugins.coverageCompressor().compress(coverage);
        boolean novel = seenCoverage.markSeen(compressed);
        ExecutionResult<C> result = new ExecutionResult<>(compressed, fault);
        log.trace("Run {} novel={} faulted={}", targetInfo.runId(), novel, fault.isFaulted());

        if (requeueOnNovelty && novel) {
            queue.offer(new QueueEntry<>(input, result));
            tracer.inputsEnqueued(List.of(input));
        }
        return new Outcome<>(result, novel);
    }
}
