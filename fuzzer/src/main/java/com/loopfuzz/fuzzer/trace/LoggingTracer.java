package com.loopfuzz.fuzzer.trace;

import com.loopfuzz.fuzzer.coverage.CoverageBitmap;
import com.loopfuzz.fuzzer.fault.FaultResult;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes fuzzer progress to SLF4J. Faults, minimizations and mutations are logged at INFO; queue
 * traffic and per-execution coverage at DEBUG and TRACE.
 */
public final class LoggingTracer<I> implements Tracer<I> {
    private static final Logger log = LoggerFactory.getLogger(LoggingTracer.class);

    private final Function<I, String> formatter;

    public LoggingTracer() {
        this(String::valueOf);
    }

    /** @param formatter renders inputs for log lines */
    public LoggingTracer(Function<I, String> formatter) {
        this.formatter = Objects.requireNonNull(formatter, "formatter");
    }

    @Override
    public void inputsEnqueued(List<I> inputs) {
        log.debug("Enqueued {} input(s)", inputs.size());
    }

    @Override
    public void inputDequeued(I input) {
        if (log.isDebugEnabled()) {
            log.debug("Dequeued {}", formatter.apply(input));
        }
    }

    @Override
    public void inputFaulted(I input, FaultResult fault) {
        log.info("Fault {} for input {}", fault, formatter.apply(input));
    }

    @Override
    public void inputFuzzed(I input, CoverageBitmap coverage) {
        if (log.isTraceEnabled()) {
            log.trace("Executed {} edges={}", formatter.apply(input), coverage.countNonZero());
        }
    }

    @Override
    public void minimizationFound(I input, I minimized) {
        log.info("Minimized {} -> {}", formatter.apply(input), formatter.apply(minimized));
    }

    @Override
    public void mutationFound(I input, I mutated) {
        log.info("New coverage from mutation {} -> {}", formatter.apply(input), formatter.apply(mutated));
    }

    @Override
    public void fuzzerFinished() {
        log.info("Fuzzer finished");
    }
}
