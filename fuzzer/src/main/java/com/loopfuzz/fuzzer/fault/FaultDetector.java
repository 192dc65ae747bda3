package com.loopfuzz.fuzzer.fault;

import com.loopfuzz.fuzzer.exec.TargetExecutor;
import com.loopfuzz.fuzzer.exec.TargetInfo;

/** Drives the actual execution of a prepared run and classifies its outcome. */
@FunctionalInterface
public interface FaultDetector {
    FaultResult detect(TargetExecutor<?> executor, TargetInfo targetInfo);
}
