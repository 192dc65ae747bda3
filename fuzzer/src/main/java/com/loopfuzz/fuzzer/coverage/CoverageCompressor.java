package com.loopfuzz.fuzzer.coverage;

/**
 * Reduces raw coverage to a comparable value used for novelty checks.
 *
 * <p>Implementations must be deterministic, and the produced values must have stable {@code
 * equals}/{@code hashCode}: they are stored in the seen-coverage set for the whole run.</p>
 *
 * @param <C> compressed coverage type
 */
@FunctionalInterface
public interface CoverageCompressor<C> {
    C compress(CoverageBitmap coverage);
}
