package com.loopfuzz.fuzzer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/** Command-line settings of {@link LoopFuzz}. */
public record FuzzerSettings(
        boolean help,
        RunMode runMode,
        Integer seed,
        Integer maxDegreeOfParallelism,
        List<Path> initialFiles,
        URI target,
        String targetClass,
        String coverageSocket,
        String coverageAddress,
        Duration requestTimeout,
        Duration coverageTimeout,
        int mutationsPerInput) {

    /** Where the target runs relative to the fuzzer. */
    public enum RunMode {
        /** A class on the fuzzer's classpath, called directly; always sequential. */
        IN_PROCESS,
        /** An instrumented HTTP service reporting coverage over gRPC. */
        OUT_OF_PROCESS
    }

    static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(5);
    static final Duration DEFAULT_COVERAGE_TIMEOUT = Duration.ofSeconds(2);
    static final int DEFAULT_MUTATIONS = 64;

    public static final String USAGE =
            String.join(
                    System.lineSeparator(),
                    "Usage: loopfuzz [options]",
                    "options:",
                    "    -h, --help: Show this help message",
                    "    -s, --seed <seed>: The seed to use for random number generation",
                    "    -ip, --in-process: Run the fuzzer in-process (implied by --target-class)",
                    "    -oop, --out-of-process: Run the fuzzer out-of-process (the default)",
                    "    -mp, --max-parallelism <degree>: The maximum degree of parallelism to use",
                    "    -ad, --add-directory <directory>: Add an entire directory to the initial files",
                    "    -af, --add-file <file>: Add a file to the initial files",
                    "    --target <uri>: HTTP endpoint that receives fuzz inputs",
                    "    --target-class <class>: In-process target declaring"
                            + " public static void fuzzerTestOneInput(byte[])",
                    "    --coverage-socket <path>: Unix domain socket of the coverage agent"
                            + " (default /tmp/loopfuzz-coverage.sock)",
                    "    --coverage-address <host:port>: TCP address of the coverage agent",
                    "    --request-timeout <ms>: Timeout of one HTTP request (default 5000)",
                    "    --coverage-timeout <ms>: Time to wait for coverage of one run (default 2000)",
                    "    --mutations <count>: Mutants generated per queue entry (default 64)");

    public FuzzerSettings {
        initialFiles = List.copyOf(initialFiles);
    }

    /**
     * Parses launcher arguments.
     *
     * @throws IllegalArgumentException on unknown, repeated or malformed arguments
     */
    public static FuzzerSettings parse(String[] args) {
        boolean help = false;
        RunMode runMode = null;
        Integer seed = null;
        Integer maxDegreeOfParallelism = null;
        List<Path> initialFiles = new ArrayList<>();
        URI target = null;
        String targetClass = null;
        String coverageSocket = null;
        String coverageAddress = null;
        Duration requestTimeout = null;
        Duration coverageTimeout = null;
        Integer mutations = null;

        int index = 0;
        while (index < args.length) {
            String arg = args[index++];
            switch (arg) {
                case "-h", "--help" -> help = true;
                case "-s", "--seed" -> {
                    requireUnset(seed, "seed");
                    seed = parseInt(value(args, index++, "seed"), "seed");
                }
                case "-ip", "--in-process" -> {
                    requireUnset(runMode, "run-mode");
                    runMode = RunMode.IN_PROCESS;
                }
                case "-oop", "--out-of-process" -> {
                    requireUnset(runMode, "run-mode");
                    runMode = RunMode.OUT_OF_PROCESS;
                }
                case "-mp", "--max-parallelism" -> {
                    requireUnset(maxDegreeOfParallelism, "max-parallelism");
                    maxDegreeOfParallelism = parseInt(value(args, index++, "degree"), "max-parallelism");
                    if (maxDegreeOfParallelism < 1) {
                        throw new IllegalArgumentException("max-parallelism must be at least 1");
                    }
                }
                case "-ad", "--add-directory" ->
                        initialFiles.addAll(listFiles(Path.of(value(args, index++, "directory"))));
                case "-af", "--add-file" -> initialFiles.add(Path.of(value(args, index++, "file")));
                case "--target" -> {
                    requireUnset(target, "target");
                    target = URI.create(value(args, index++, "target uri"));
                }
                case "--target-class" -> {
                    requireUnset(targetClass, "target-class");
                    targetClass = value(args, index++, "target class");
                }
                case "--coverage-socket" -> {
                    requireUnset(coverageSocket, "coverage-socket");
                    requireUnset(coverageAddress, "coverage-address");
                    coverageSocket = value(args, index++, "socket path");
                }
                case "--coverage-address" -> {
                    requireUnset(coverageAddress, "coverage-address");
                    requireUnset(coverageSocket, "coverage-socket");
                    coverageAddress = value(args, index++, "host:port");
                }
                case "--request-timeout" -> {
                    requireUnset(requestTimeout, "request-timeout");
                    requestTimeout = parseMillis(value(args, index++, "timeout"), "request-timeout");
                }
                case "--coverage-timeout" -> {
                    requireUnset(coverageTimeout, "coverage-timeout");
                    coverageTimeout = parseMillis(value(args, index++, "timeout"), "coverage-timeout");
                }
                case "--mutations" -> {
                    requireUnset(mutations, "mutations");
                    mutations = parseInt(value(args, index++, "count"), "mutations");
                    if (mutations < 0) {
                        throw new IllegalArgumentException("mutations must not be negative");
                    }
                }
                default -> throw new IllegalArgumentException("unknown argument: " + arg);
            }
        }

        if (runMode == null) {
            runMode = targetClass != null ? RunMode.IN_PROCESS : RunMode.OUT_OF_PROCESS;
        }
        if (runMode == RunMode.IN_PROCESS) {
            requireOutOfProcessOnly(target, "target");
            requireOutOfProcessOnly(coverageSocket, "coverage-socket");
            requireOutOfProcessOnly(coverageAddress, "coverage-address");
            requireOutOfProcessOnly(requestTimeout, "request-timeout");
            requireOutOfProcessOnly(coverageTimeout, "coverage-timeout");
        } else if (targetClass != null) {
            throw new IllegalArgumentException("target-class only applies in process");
        }

        return new FuzzerSettings(
                help,
                runMode,
                seed,
                maxDegreeOfParallelism,
                initialFiles,
                target,
                targetClass,
                coverageSocket,
                coverageAddress,
                requestTimeout != null ? requestTimeout : DEFAULT_REQUEST_TIMEOUT,
                coverageTimeout != null ? coverageTimeout : DEFAULT_COVERAGE_TIMEOUT,
                mutations != null ? mutations : DEFAULT_MUTATIONS);
    }

    private static String value(String[] args, int index, String name) {
        if (index >= args.length) {
            throw new IllegalArgumentException("missing " + name);
        }
        return args[index];
    }

    private static void requireUnset(Object current, String name) {
        if (current != null) {
            throw new IllegalArgumentException(name + " already set");
        }
    }

    private static void requireOutOfProcessOnly(Object value, String name) {
        if (value != null) {
            throw new IllegalArgumentException(name + " only applies out of process");
        }
    }

    private static int parseInt(String value, String name) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + name + ": " + value, e);
        }
    }

    private static Duration parseMillis(String value, String name) {
        int millis = parseInt(value, name);
        if (millis <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return Duration.ofMillis(millis);
    }

    private static List<Path> listFiles(Path directory) {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile).sorted().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("cannot list directory " + directory, e);
        }
    }
}
