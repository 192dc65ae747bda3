package com.loopfuzz.fuzzer.core;

import static com.loopfuzz.fuzzer.core.ScriptedTarget.crash;
import static com.loopfuzz.fuzzer.core.ScriptedTarget.ok;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.loopfuzz.fuzzer.coverage.CoverageBitmap;
import com.loopfuzz.fuzzer.trace.SynchronizedTracer;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;

final class ExecutionPipelineTest {

    private final SeenCoverageSet<CoverageBitmap> seen = new SeenCoverageSet<>();
    private final WorkQueue<String, CoverageBitmap> queue = new WorkQueue<>();
    private final RecordingTracer tracer = new RecordingTracer();

    private ExecutionPipeline<String, CoverageBitmap> pipeline(ScriptedTarget target) {
        return new ExecutionPipeline<>(
                target.plugins((random, input) -> Stream.empty(), (random, input) -> Stream.empty(), tracer),
                seen,
                queue,
                new SynchronizedTracer<>(tracer));
    }

    @Test
    void novelExecutionIsQueuedExactlyOnce() {
        ScriptedTarget target = ScriptedTarget.of(Map.of("a", ok(1, 2), "b", ok(1, 2)));
        ExecutionPipeline<String, CoverageBitmap> pipeline = pipeline(target);

        ExecutionPipeline.Outcome<CoverageBitmap> first = pipeline.execute("a");
        assertTrue(first.novel());
        assertEquals(1, queue.size());

        ExecutionPipeline.Outcome<CoverageBitmap> second = pipeline.execute("b");
        assertFalse(second.novel(), "equal coverage must not be novel twice");
        assertEquals(1, queue.size());

        QueueEntry<String, CoverageBitmap> queued = queue.poll();
        assertEquals("a", queued.input());
        assertSame(first.result(), queued.executionResult());
        assertNull(queue.poll());
        assertEquals(
                List.of("fuzzed(a)", "enqueued[a]", "fuzzed(b)"), tracer.events());
    }

    @Test
    void noveltyIsMonotonicAcrossRequeueModes() {
        ScriptedTarget target = ScriptedTarget.of(Map.of("a", ok(3), "b", ok(3), "c", ok(4)));
        ExecutionPipeline<String, CoverageBitmap> pipeline = pipeline(target);

        assertTrue(pipeline.execute("a", false).novel());
        assertEquals(0, queue.size(), "baseline executions are never queued");
        assertFalse(pipeline.execute("b").novel());
        assertFalse(pipeline.execute("a").novel());
        assertTrue(pipeline.execute("c").novel());
        assertEquals(1, queue.size());
        assertEquals(2, seen.size());
    }

    @Test
    void faultsAreReportedBeforeCoverage() {
        ScriptedTarget target = ScriptedTarget.of(Map.of("boom", crash(7)));
        ExecutionPipeline<String, CoverageBitmap> pipeline = pipeline(target);

        ExecutionPipeline.Outcome<CoverageBitmap> outcome = pipeline.execute("boom");

        assertTrue(outcome.result().isFaulted());
        assertEquals(134, outcome.result().fault().exitCode());
        assertEquals(CoverageBitmap.fromIndices(7), outcome.result().coverage());
        assertEquals(
                List.of("faulted(boom)", "fuzzed(boom)", "enqueued[boom]"), tracer.events());
        assertEquals(List.of("boom"), target.executed());
    }
}
