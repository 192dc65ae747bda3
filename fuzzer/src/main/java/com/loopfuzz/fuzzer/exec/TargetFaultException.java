package com.loopfuzz.fuzzer.exec;

/** Signals a target failure that carries a status, such as an HTTP 5xx or a process exit code. */
public class TargetFaultException extends Exception {
    private final int code;

    public TargetFaultException(int code, String message) {
        super(message);
        this.code = code;
    }

    public int code() {
        return code;
    }
}
