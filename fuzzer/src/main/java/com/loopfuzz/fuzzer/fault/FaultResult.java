package com.loopfuzz.fuzzer.fault;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of fault detection for one target run. An unfaulted result carries no detail; a
 * faulted one carries exactly one of an exception, an exit code or a timeout.
 */
public final class FaultResult {

    public enum Kind {
        NONE,
        EXCEPTION,
        EXIT_CODE,
        TIMEOUT
    }

    private static final FaultResult OK = new FaultResult(Kind.NONE, null, null, null, 0, null);

    private final Kind kind;
    private final String exceptionType;
    private final String topFrame;
    private final String message;
    private final int exitCode;
    private final Duration timeout;

    private FaultResult(
            Kind kind,
            String exceptionType,
            String topFrame,
            String message,
            int exitCode,
            Duration timeout) {
        this.kind = kind;
        this.exceptionType = exceptionType;
        this.topFrame = topFrame;
        this.message = message;
        this.exitCode = exitCode;
        this.timeout = timeout;
    }

    public static FaultResult ok() {
        return OK;
    }

    public static FaultResult ofException(Throwable throwable) {
        Objects.requireNonNull(throwable, "throwable");
        StackTraceElement[] trace = throwable.getStackTrace();
        String frame = trace.length == 0 ? "" : trace[0].toString();
        return new FaultResult(
                Kind.EXCEPTION,
                throwable.getClass().getName(),
                frame,
                throwable.getMessage(),
                0,
                null);
    }

    public static FaultResult ofExitCode(int exitCode, String message) {
        return new FaultResult(Kind.EXIT_CODE, null, null, message, exitCode, null);
    }

    public static FaultResult ofTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        return new FaultResult(
                Kind.TIMEOUT, null, null, "timed out after " + timeout.toMillis() + "ms", 0, timeout);
    }

    public boolean isFaulted() {
        return kind != Kind.NONE;
    }

    public Kind kind() {
        return kind;
    }

    /** Fully qualified class name of the thrown exception, or {@code null}. */
    public String exceptionType() {
        return exceptionType;
    }

    /** First stack frame of the thrown exception, or {@code null}. */
    public String topFrame() {
        return topFrame;
    }

    public String message() {
        return message;
    }

    public int exitCode() {
        return exitCode;
    }

    public Duration timeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NONE -> "FaultResult{ok}";
            case EXCEPTION -> "FaultResult{exception=" + exceptionType + " at " + topFrame
                    + ", message=" + message + "}";
            case EXIT_CODE -> "FaultResult{exitCode=" + exitCode + ", message=" + message + "}";
            case TIMEOUT -> "FaultResult{timeout=" + timeout + "}";
        };
    }
}
