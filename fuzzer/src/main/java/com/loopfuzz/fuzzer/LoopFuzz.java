package com.loopfuzz.fuzzer;

import com.loopfuzz.fuzzer.FuzzerSettings.RunMode;
import com.loopfuzz.fuzzer.core.CancellationToken;
import com.loopfuzz.fuzzer.core.Fuzzer;
import com.loopfuzz.fuzzer.core.FuzzerPlugins;
import com.loopfuzz.fuzzer.coverage.BucketedCoverageCompressor;
import com.loopfuzz.fuzzer.coverage.CoverageRuntime;
import com.loopfuzz.fuzzer.exec.InProcessTargetExecutor;
import com.loopfuzz.fuzzer.fault.ExceptionFaultDetector;
import com.loopfuzz.fuzzer.instrumentation.GrpcCoverageReader;
import com.loopfuzz.fuzzer.instrumentation.HttpTargetExecutor;
import com.loopfuzz.fuzzer.min.ByteArrayMinimizer;
import com.loopfuzz.fuzzer.mut.ByteArrayMutator;
import com.loopfuzz.fuzzer.trace.CompositeTracer;
import com.loopfuzz.fuzzer.trace.FuzzerStatistics;
import com.loopfuzz.fuzzer.trace.LoggingTracer;
import com.loopfuzz.fuzzer.trace.Tracer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line fuzzer for byte-array inputs. In process, it calls a target class's {@code
 * fuzzerTestOneInput(byte[])} and traces coverage through {@link CoverageRuntime}. Out of process,
 * it POSTs inputs to an HTTP service whose coverage agent streams coverage over gRPC. Runs until
 * the JVM is asked to shut down.
 */
public final class LoopFuzz {
    private static final Logger log = LoggerFactory.getLogger(LoopFuzz.class);
    private static final int MAX_INPUT_LENGTH = 64 * 1024;
    private static final String DEFAULT_COVERAGE_SOCKET = "/tmp/loopfuzz-coverage.sock";
    static final String ENTRY_METHOD = "fuzzerTestOneInput";

    private LoopFuzz() {
        // Utility class
    }

    public static void main(String[] args) throws Exception {
        FuzzerSettings settings;
        InProcessTargetExecutor<byte[]> inProcessTarget = null;
        try {
            settings = FuzzerSettings.parse(args);
            if (settings.help()) {
                System.out.println(FuzzerSettings.USAGE);
                return;
            }
            if (settings.runMode() == RunMode.IN_PROCESS) {
                if (settings.targetClass() == null) {
                    throw new IllegalArgumentException("--target-class is required in process");
                }
                inProcessTarget = inProcessExecutor(settings.targetClass());
            } else if (settings.target() == null) {
                throw new IllegalArgumentException("--target is required out of process");
            }
        } catch (IllegalArgumentException | UncheckedIOException e) {
            System.err.println(e.getMessage());
            System.err.println(FuzzerSettings.USAGE);
            System.exit(2);
            return;
        }

        List<byte[]> seeds = loadSeeds(settings.initialFiles());
        if (seeds.isEmpty()) {
            log.info("No initial files given, starting from an empty input");
            seeds.add(new byte[0]);
        }

        FuzzerStatistics<byte[]> statistics = new FuzzerStatistics<>();
        Tracer<byte[]> tracer =
                new CompositeTracer<>(new LoggingTracer<>(LoopFuzz::preview), statistics);
        Fuzzer.Config config = new Fuzzer.Config();
        config.seed = settings.seed();
        config.awaitInFlightOnCancel = true;

        if (inProcessTarget != null) {
            Integer requested = settings.maxDegreeOfParallelism();
            if (requested != null && requested != 1) {
                log.warn("In-process runs are sequential, ignoring max-parallelism {}", requested);
            }
            config.maxDegreeOfParallelism = 1;
            try (ExceptionFaultDetector faultDetector = new ExceptionFaultDetector()) {
                fuzz(
                        new FuzzerPlugins<>(
                                inProcessTarget,
                                inProcessTarget.coverageReader(),
                                new BucketedCoverageCompressor(),
                                faultDetector,
                                new ByteArrayMinimizer(),
                                new ByteArrayMutator(settings.mutationsPerInput(), MAX_INPUT_LENGTH),
                                tracer),
                        config,
                        seeds);
            }
        } else {
            config.maxDegreeOfParallelism = settings.maxDegreeOfParallelism();
            try (GrpcCoverageReader coverageReader = openCoverageReader(settings);
                    ExceptionFaultDetector faultDetector = new ExceptionFaultDetector()) {
                fuzz(
                        new FuzzerPlugins<>(
                                HttpTargetExecutor.create(
                                        settings.target(), input -> input, settings.requestTimeout()),
                                coverageReader,
                                new BucketedCoverageCompressor(),
                                faultDetector,
                                new ByteArrayMinimizer(),
                                new ByteArrayMutator(settings.mutationsPerInput(), MAX_INPUT_LENGTH),
                                tracer),
                        config,
                        seeds);
            }
        }
        log.info("loopfuzz exiting: {}", statistics);
    }

    private static <C> void fuzz(
            FuzzerPlugins<byte[], C> plugins, Fuzzer.Config config, List<byte[]> seeds) {
        Fuzzer<byte[], C> fuzzer = new Fuzzer<>(plugins, config);
        fuzzer.enqueueRange(seeds);

        CancellationToken cancellation = new CancellationToken();
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime()
                .addShutdownHook(
                        new Thread(
                                () -> {
                                    cancellation.cancel();
                                    try {
                                        stopped.await(10, TimeUnit.SECONDS);
                                    } catch (InterruptedException e) {
                                        Thread.currentThread().interrupt();
                                    }
                                }));
        try {
            fuzzer.run(cancellation);
        } finally {
            stopped.countDown();
        }
    }

    /**
     * Builds an executor around {@code className}'s {@code public static
     * fuzzerTestOneInput(byte[])}. The class is loaded here but initialized by the fuzzer's global
     * initializer, before coverage is captured.
     *
     * @throws IllegalArgumentException if the class or its entry method cannot be found
     */
    static InProcessTargetExecutor<byte[]> inProcessExecutor(String className) {
        Class<?> targetClass;
        try {
            targetClass = Class.forName(className, false, LoopFuzz.class.getClassLoader());
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("target class not found: " + className, e);
        }
        Method entry;
        try {
            entry = targetClass.getMethod(ENTRY_METHOD, byte[].class);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(missingEntry(className), e);
        }
        if (!Modifier.isStatic(entry.getModifiers())) {
            throw new IllegalArgumentException(missingEntry(className));
        }
        return new InProcessTargetExecutor<>(
                input -> invoke(entry, input), () -> initialize(targetClass));
    }

    private static String missingEntry(String className) {
        return className + " has no public static " + ENTRY_METHOD + "(byte[]) method";
    }

    private static void invoke(Method entry, byte[] input) throws Exception {
        try {
            entry.invoke(null, (Object) input);
        } catch (InvocationTargetException e) {
            // Faults are bucketed by what the target threw, not by the reflection wrapper
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    private static void initialize(Class<?> targetClass) {
        try {
            Class.forName(targetClass.getName(), true, targetClass.getClassLoader());
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("cannot initialize " + targetClass.getName(), e);
        }
    }

    private static GrpcCoverageReader openCoverageReader(FuzzerSettings settings) throws IOException {
        if (settings.coverageAddress() != null) {
            String address = settings.coverageAddress();
            int colon = address.lastIndexOf(':');
            if (colon <= 0) {
                throw new IllegalArgumentException("coverage-address must be host:port: " + address);
            }
            return GrpcCoverageReader.forAddress(
                    address.substring(0, colon),
                    Integer.parseInt(address.substring(colon + 1)),
                    settings.coverageTimeout());
        }
        String socket =
                settings.coverageSocket() != null ? settings.coverageSocket() : DEFAULT_COVERAGE_SOCKET;
        return GrpcCoverageReader.forUnixDomainSocket(socket, settings.coverageTimeout());
    }

    static List<byte[]> loadSeeds(List<Path> files) throws IOException {
        List<byte[]> seeds = new ArrayList<>();
        for (Path file : files) {
            seeds.add(Files.readAllBytes(file));
        }
        return seeds;
    }

    static String preview(byte[] input) {
        String text = new String(input, 0, Math.min(input.length, 64), StandardCharsets.UTF_8);
        return input.length > 64 ? text + "...(" + input.length + " bytes)" : text;
    }
}
