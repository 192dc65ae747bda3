package com.loopfuzz.fuzzer.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.loopfuzz.fuzzer.coverage.CoverageReader;
import com.loopfuzz.fuzzer.coverage.CoverageRuntime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

final class InProcessTargetExecutorTest {

    @Test
    void runsTargetWithTheInitializedInput() throws Exception {
        List<String> received = new ArrayList<>();
        AtomicInteger initialized = new AtomicInteger();
        InProcessTargetExecutor<String> executor =
                new InProcessTargetExecutor<>(received::add, initialized::incrementAndGet);

        executor.globalInitializer();
        TargetInfo first = executor.initialize("one");
        TargetInfo second = executor.initialize("two");
        executor.execute(second);
        executor.execute(first);

        assertEquals(1, initialized.get());
        assertEquals(List.of("two", "one"), received);
        assertNotEquals(first.runId(), second.runId());
    }

    @Test
    void rejectsForeignAndReusedHandles() throws Exception {
        InProcessTargetExecutor<String> executor = new InProcessTargetExecutor<>(input -> {});
        TargetInfo run = executor.initialize("x");
        executor.execute(run);

        assertThrows(IllegalArgumentException.class, () -> executor.execute(() -> "foreign"));
        assertThrows(IllegalArgumentException.class, () -> executor.execute(run));
    }

    @Test
    void coverageReaderReturnsTheTraceOfEachRun() throws Exception {
        InProcessTargetExecutor<String> executor =
                new InProcessTargetExecutor<>(
                        input -> {
                            CoverageRuntime.enterEdge(10);
                            if (input.startsWith("b")) {
                                CoverageRuntime.enterEdge(20);
                            }
                        });
        CoverageReader reader = executor.coverageReader();
        TargetInfo plain = executor.initialize("a");
        TargetInfo branching = executor.initialize("bad");
        reader.clear(plain);
        reader.clear(branching);

        executor.execute(plain);
        executor.execute(branching);

        assertEquals(1, reader.read(plain).countNonZero());
        assertEquals(2, reader.read(branching).countNonZero());
        assertTrue(reader.read(plain).isEmpty(), "a trace is handed out once");
        assertFalse(CoverageRuntime.isTracing());
    }

    @Test
    void failingRunsStillRecordTheirTrace() throws Exception {
        InProcessTargetExecutor<String> executor =
                new InProcessTargetExecutor<>(
                        input -> {
                            CoverageRuntime.enterEdge(7);
                            throw new IllegalStateException(input);
                        });
        TargetInfo run = executor.initialize("boom");

        assertThrows(IllegalStateException.class, () -> executor.execute(run));
        assertEquals(1, executor.coverageReader().read(run).countNonZero());
    }
}
