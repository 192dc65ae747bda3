package com.loopfuzz.fuzzer.core;

import static com.loopfuzz.fuzzer.core.ScriptedTarget.crash;
import static com.loopfuzz.fuzzer.core.ScriptedTarget.ok;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.loopfuzz.fuzzer.coverage.CoverageBitmap;
import com.loopfuzz.fuzzer.fault.FaultEquivalence;
import com.loopfuzz.fuzzer.fault.FaultResult;
import com.loopfuzz.fuzzer.min.InputMinimizer;
import com.loopfuzz.fuzzer.trace.SynchronizedTracer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;

final class MinimizerDriverTest {

    private final SeenCoverageSet<CoverageBitmap> seen = new SeenCoverageSet<>();
    private final WorkQueue<String, CoverageBitmap> queue = new WorkQueue<>();
    private final RecordingTracer tracer = new RecordingTracer();

    private MinimizerDriver<String, CoverageBitmap> driver(
            ScriptedTarget target, InputMinimizer<String> minimizer) {
        SynchronizedTracer<String> gateway = new SynchronizedTracer<>(tracer);
        ExecutionPipeline<String, CoverageBitmap> pipeline =
                new ExecutionPipeline<>(
                        target.plugins(minimizer, (random, input) -> Stream.empty(), tracer),
                        seen,
                        queue,
                        gateway);
        return new MinimizerDriver<>(
                minimizer, FaultEquivalence.SAME_KIND, pipeline, new Random(1), gateway);
    }

    @Test
    void emptyCandidateSequenceKeepsInputAfterOnePass() {
        ScriptedTarget target = ScriptedTarget.of(Map.of("abc", ok(1)));
        List<String> requested = new ArrayList<>();
        InputMinimizer<String> minimizer =
                (random, input) -> {
                    requested.add(input);
                    return Stream.empty();
                };

        QueueEntry<String, CoverageBitmap> result =
                driver(target, minimizer).minimize(QueueEntry.seed("abc"));

        assertEquals("abc", result.input());
        assertEquals(List.of("abc"), requested);
        assertEquals(CoverageBitmap.fromIndices(1), result.executionResult().coverage());
        assertEquals(0, queue.size(), "baseline of a seed must not be queued");
    }

    @Test
    void entryWithResultIsReturnedAsIsAndNotReExecuted() {
        ScriptedTarget target = ScriptedTarget.of(Map.of());
        QueueEntry<String, CoverageBitmap> entry =
                new QueueEntry<>("x", new ExecutionResult<>(CoverageBitmap.fromIndices(2), FaultResult.ok()));

        QueueEntry<String, CoverageBitmap> result =
                driver(target, (random, input) -> Stream.empty()).minimize(entry);

        assertSame(entry, result);
        assertTrue(target.executed().isEmpty());
    }

    @Test
    void firstEquivalentCandidateWinsAndMinimizationRestarts() {
        ScriptedTarget target =
                ScriptedTarget.of(
                        Map.of(
                                "aaaa", ok(1, 2),
                                "aaa", ok(1, 2),
                                "aa", ok(1, 2),
                                "a", ok(1),
                                "x", ok(3)));
        InputMinimizer<String> dropOne =
                (random, input) ->
                        input.length() <= 1
                                ? Stream.empty()
                                : Stream.of(input.substring(1), "x" + input.substring(2));

        QueueEntry<String, CoverageBitmap> result =
                driver(target, dropOne).minimize(QueueEntry.seed("aaaa"));

        assertEquals("aa", result.input(), "'a' changes coverage and must be rejected");
        assertEquals(
                List.of("minimized(aaaa->aaa)", "minimized(aaa->aa)"),
                tracer.events().stream().filter(event -> event.startsWith("minimized")).toList());
        // the first equivalent candidate ends each pass
        assertFalse(target.executed().contains("xaa"));
        assertFalse(target.executed().contains("xa"));
        assertTrue(target.executed().contains("x"));
    }

    @Test
    void neverAdoptsCandidateThatChangesFaultStatus() {
        ScriptedTarget target =
                ScriptedTarget.of(Map.of("crash!", crash(5), "crash", ok(5), "c", crash(5)));
        InputMinimizer<String> minimizer =
                (random, input) ->
                        input.equals("crash!") ? Stream.of("crash", "c") : Stream.empty();

        QueueEntry<String, CoverageBitmap> result =
                driver(target, minimizer).minimize(QueueEntry.seed("crash!"));

        assertEquals("c", result.input());
        assertTrue(result.executionResult().isFaulted());
    }

    @Test
    void independentlyNovelCandidateIsQueued() {
        ScriptedTarget target = ScriptedTarget.of(Map.of("ab", ok(1), "a", ok(9)));
        InputMinimizer<String> minimizer =
                (random, input) -> input.equals("ab") ? Stream.of("a") : Stream.empty();

        QueueEntry<String, CoverageBitmap> result =
                driver(target, minimizer).minimize(QueueEntry.seed("ab"));

        assertEquals("ab", result.input());
        assertEquals(1, queue.size());
        assertEquals("a", queue.poll().input());
    }
}
