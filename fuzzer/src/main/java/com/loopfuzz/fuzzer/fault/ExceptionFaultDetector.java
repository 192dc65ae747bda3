package com.loopfuzz.fuzzer.fault;

import com.loopfuzz.fuzzer.exec.TargetExecutor;
import com.loopfuzz.fuzzer.exec.TargetFaultException;
import com.loopfuzz.fuzzer.exec.TargetInfo;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Treats anything thrown by the target as a fault. A {@link TargetFaultException} maps to an
 * exit-code fault, other throwables to exception faults.
 *
 * <p>With a timeout configured, each run executes on a detector-owned daemon thread; runs that
 * exceed the timeout are interrupted and reported as timeout faults.</p>
 *
 * <p>An {@link InterruptedException} is never a fault: the interrupt flag is restored and the
 * run is abandoned with a {@link CancellationException}.</p>
 */
public final class ExceptionFaultDetector implements FaultDetector, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExceptionFaultDetector.class);

    private final Duration timeout;
    private final ExecutorService runner;

    /** Runs the target on the calling thread, without a timeout. */
    public ExceptionFaultDetector() {
        this.timeout = null;
        this.runner = null;
    }

    /**
     * Runs each target on a pooled daemon thread and gives up on it after {@code timeout}. The pool
     * grows on demand: a target that ignores interruption keeps its thread busy until it returns,
     * and that thread is not reused in the meantime.
     */
    public ExceptionFaultDetector(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        this.timeout = timeout;
        AtomicInteger threads = new AtomicInteger();
        this.runner =
                Executors.newCachedThreadPool(
                        task -> {
                            Thread thread =
                                    new Thread(task, "fault-detector-" + threads.incrementAndGet());
                            thread.setDaemon(true);
                            return thread;
                        });
    }

    @Override
    public FaultResult detect(TargetExecutor<?> executor, TargetInfo targetInfo) {
        if (runner == null) {
            return runDirectly(executor, targetInfo);
        }
        Future<FaultResult> future = runner.submit(() -> runDirectly(executor, targetInfo));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.debug("Run {} exceeded {}", targetInfo.runId(), timeout);
            return FaultResult.ofTimeout(timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw interrupted(targetInfo, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CancellationException cancelled) {
                Thread.currentThread().interrupt();
                throw cancelled;
            }
            throw new IllegalStateException("Fault detection failed for " + targetInfo.runId(), e.getCause());
        }
    }

    @Override
    public void close() {
        if (runner != null) {
            runner.shutdownNow();
        }
    }

    private static FaultResult runDirectly(TargetExecutor<?> executor, TargetInfo targetInfo) {
        try {
            executor.execute(targetInfo);
            return FaultResult.ok();
        } catch (TargetFaultException e) {
            return FaultResult.ofExitCode(e.code(), e.getMessage());
        } catch (InterruptedException e) {
            throw interrupted(targetInfo, e);
        } catch (Exception | StackOverflowError | AssertionError e) {
            return FaultResult.ofException(e);
        }
    }

    private static CancellationException interrupted(TargetInfo targetInfo, InterruptedException cause) {
        Thread.currentThread().interrupt();
        CancellationException cancelled =
                new CancellationException("Interrupted while running " + targetInfo.runId());
        cancelled.initCause(cause);
        return cancelled;
    }
}
