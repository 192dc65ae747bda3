package com.loopfuzz.fuzzer.core;

import com.loopfuzz.fuzzer.trace.SynchronizedTracer;
import com.loopfuzz.fuzzer.trace.Tracer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coverage-guided fuzzing loop in the style of AFL. Each dequeued entry is first minimized to a
 * fixpoint, then, unless its execution faulted, mutated; executions that reach unseen coverage are
 * queued again, closing the loop.
 *
 * <p>With {@code maxDegreeOfParallelism == 1} entries are processed on the loop thread and a run is
 * fully determined by the seed, the seed inputs and the plugins. Otherwise entries are processed on
 * a worker pool and exploration order is not deterministic.</p>
 *
 * @param <I> input type
 * @param <C> compressed coverage type
 */
public final class Fuzzer<I, C> {
    private static final Logger log = LoggerFactory.getLogger(Fuzzer.class);
    private static final long ADMISSION_POLL_MILLIS = 10;

    public static final class Config {
        /** Seed of the shared random generator; random when {@code null}. */
        public Integer seed;
        /** Upper bound of concurrently processed entries; unbounded when {@code null}. */
        public Integer maxDegreeOfParallelism;
        /** Sleep between polls while the queue is empty. */
        public Duration idleBackoff = Duration.ofMillis(1);
        /**
         * Pool that processes entries when running in parallel. When {@code null}, a bounded run
         * uses a pool of {@code maxDegreeOfParallelism} daemon threads owned by the run, and an
         * unbounded run uses {@link ForkJoinPool#commonPool()}.
         */
        public ExecutorService workerPool;
        /**
         * Whether a cancelled run waits for already dispatched entries before reporting that it
         * finished. Off by default: {@code fuzzerFinished} may then precede the last
         * notifications of in-flight workers.
         */
        public boolean awaitInFlightOnCancel = false;
    }

    private final FuzzerPlugins<I, C> plugins;
    private final Config config;
    private final int seed;
    private final Random random;
    private final Tracer<I> tracer;
    private final WorkQueue<I, C> queue = new WorkQueue<>();
    private final SeenCoverageSet<C> seenCoverage = new SeenCoverageSet<>();
    private final MinimizerDriver<I, C> minimizerDriver;
    private final MutatorDriver<I, C> mutatorDriver;

    public Fuzzer(FuzzerPlugins<I, C> plugins) {
        this(plugins, new Config());
    }

    public Fuzzer(FuzzerPlugins<I, C> plugins, Config config) {
        this.plugins = Objects.requireNonNull(plugins, "plugins");
        this.config = Objects.requireNonNull(config, "config");
        validate(config);
        this.seed = config.seed != null ? config.seed : ThreadLocalRandom.current().nextInt();
        this.random = new Random(seed);
        this.tracer = new SynchronizedTracer<>(plugins.tracer());
        ExecutionPipeline<I, C> pipeline =
                new ExecutionPipeline<>(plugins, seenCoverage, queue, tracer);
        this.minimizerDriver =
                new MinimizerDriver<>(
                        plugins.inputMinimizer(), plugins.faultEquivalence(), pipeline, random, tracer);
        this.mutatorDriver =
                new MutatorDriver<>(plugins.inputMutator(), pipeline, random, tracer);
    }

    private static void validate(Config config) {
        if (config.maxDegreeOfParallelism != null && config.maxDegreeOfParallelism < 1) {
            throw new IllegalArgumentException(
                    "maxDegreeOfParallelism must be at least 1: " + config.maxDegreeOfParallelism);
        }
        if (config.idleBackoff == null || config.idleBackoff.isNegative()) {
            throw new IllegalArgumentException("idleBackoff must not be negative: " + config.idleBackoff);
        }
    }

    public int seed() {
        return seed;
    }

    public Integer maxDegreeOfParallelism() {
        return config.maxDegreeOfParallelism;
    }

    /**
     * The generator shared by all minimization and mutation passes. {@link Random} is safe for
     * concurrent use; at parallelism one its draw order is deterministic.
     */
    public Random random() {
        return random;
    }

    public int queueSize() {
        return queue.size();
    }

    public int seenCoverageCount() {
        return seenCoverage.size();
    }

    public void enqueue(I input) {
        queue.offer(QueueEntry.seed(input));
        tracer.inputsEnqueued(List.of(input));
    }

    public void enqueueRange(Iterable<? extends I> inputs) {
        List<I> added = new ArrayList<>();
        for (I input : inputs) {
            queue.offer(QueueEntry.seed(input));
            added.add(input);
        }
        tracer.inputsEnqueued(List.copyOf(added));
    }

    /**
     * Runs the fuzzing loop on the calling thread until {@code cancellation} is requested or the
     * thread is interrupted. The queue never runs dry by itself, so stopping is up to the caller.
     * After an interrupt the method returns normally with the thread's interrupt flag still set.
     */
    public void run(CancellationToken cancellation) {
        Objects.requireNonNull(cancellation, "cancellation");
        Integer maxParallelism = config.maxDegreeOfParallelism;
        boolean sequential = maxParallelism != null && maxParallelism == 1;
        log.info(
                "Fuzzer starting seed={} maxDegreeOfParallelism={}",
                seed,
                maxParallelism == null ? "unbounded" : maxParallelism);

        // Setup code must run before any coverage is captured
        plugins.targetExecutor().globalInitializer();

        Semaphore admission = maxParallelism != null && !sequential ? new Semaphore(maxParallelism) : null;
        ExecutorService ownedPool = null;
        ExecutorService pool = null;
        if (!sequential) {
            pool = config.workerPool;
            if (pool == null && maxParallelism != null) {
                ownedPool = newWorkerPool(maxParallelism);
                pool = ownedPool;
            } else if (pool == null) {
                pool = ForkJoinPool.commonPool();
            }
        }
        InFlight inFlight = new InFlight();

        try {
            while (!stopRequested(cancellation)) {
                QueueEntry<I, C> entry = nextEntry(cancellation);
                if (entry == null) {
                    break;
                }
                tracer.inputDequeued(entry.input());

                if (sequential) {
                    if (!processInterruptibly(entry)) {
                        break;
                    }
                } else if (admission == null || acquire(admission, cancellation)) {
                    dispatch(pool, admission, inFlight, entry);
                } else {
                    log.debug("Cancelled while waiting for a worker slot, dropping {}", entry.input());
                }
            }
            if (config.awaitInFlightOnCancel) {
                inFlight.awaitIdle();
            }
        } finally {
            if (ownedPool != null) {
                // Lets dispatched entries complete
                ownedPool.shutdown();
            }
        }
        tracer.fuzzerFinished();
        log.info("Fuzzer finished, {} queued, {} distinct coverage values", queue.size(), seenCoverage.size());
    }

    /** Interrupting the loop thread counts as cancellation; the flag stays set for the caller. */
    private static boolean stopRequested(CancellationToken cancellation) {
        return cancellation.isCancellationRequested() || Thread.currentThread().isInterrupted();
    }

    private QueueEntry<I, C> nextEntry(CancellationToken cancellation) {
        QueueEntry<I, C> entry;
        while ((entry = queue.poll()) == null) {
            if (stopRequested(cancellation)) {
                return null;
            }
            try {
                TimeUnit.NANOSECONDS.sleep(config.idleBackoff.toNanos());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        }
        return entry;
    }

    private static boolean acquire(Semaphore admission, CancellationToken cancellation) {
        try {
            while (!stopRequested(cancellation)) {
                if (admission.tryAcquire(ADMISSION_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    private void dispatch(
            ExecutorService pool, Semaphore admission, InFlight inFlight, QueueEntry<I, C> entry) {
        inFlight.increment();
        try {
            pool.submit(
                    () -> {
                        try {
                            process(entry);
                        } catch (CancellationException e) {
                            log.debug("Processing of {} was cancelled", entry.input());
                            throw e;
                        } catch (RuntimeException | Error e) {
                            log.error("Worker failed while processing {}", entry.input(), e);
                            throw e;
                        } finally {
                            if (admission != null) {
                                admission.release();
                            }
                            inFlight.decrement();
                        }
                    });
        } catch (RuntimeException e) {
            if (admission != null) {
                admission.release();
            }
            inFlight.decrement();
            throw e;
        }
    }

    /** Processes on the loop thread; false when an interrupt abandoned the entry. */
    private boolean processInterruptibly(QueueEntry<I, C> entry) {
        try {
            process(entry);
            return true;
        } catch (CancellationException e) {
            if (!Thread.currentThread().isInterrupted()) {
                throw e;
            }
            log.debug("Interrupted while processing {}", entry.input());
            return false;
        }
    }

    private void process(QueueEntry<I, C> entry) {
        QueueEntry<I, C> minimized = minimizerDriver.minimize(entry);
        if (minimized.executionResult().isFaulted()) {
            // Faulted lineages are terminal
            return;
        }
        mutatorDriver.mutate(minimized);
    }

    private static ExecutorService newWorkerPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(
                threads,
                task -> {
                    Thread thread = new Thread(task, "fuzzer-worker-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
    }

    /** Counts dispatched entries that have not completed. */
    private static final class InFlight {
        private int count;

        synchronized void increment() {
            count++;
        }

        synchronized void decrement() {
            count--;
            if (count == 0) {
                notifyAll();
            }
        }

        synchronized void awaitIdle() {
            while (count > 0) {
                try {
                    wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }
}
