package com.loopfuzz.fuzzer.core;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Grow-only set of compressed coverage values observed during a run. */
final class SeenCoverageSet<C> {
    private final Set<C> seen = ConcurrentHashMap.newKeySet();

    /**
     * Atomically records {@code coverage}.
     *
     * @return true if no equal value had been recorded before, i.e. the coverage is novel
     */
    boolean markSeen(C coverage) {
        return seen.add(Objects.requireNonNull(coverage, "coverage"));
    }

    int size() {
        return seen.size();
    }
}
