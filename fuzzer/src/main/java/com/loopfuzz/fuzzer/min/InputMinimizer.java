package com.loopfuzz.fuzzer.min;

import java.util.Random;
import java.util.stream.Stream;

/**
 * Proposes smaller or simpler variants of an input. The fuzzer tries candidates in stream order and
 * keeps the first one whose execution is equivalent to the current input, so the order expresses the
 * minimization priority.
 *
 * <p>The returned stream is consumed lazily and must be finite, and minimizing must eventually
 * reach an input for which no candidate behaves equivalently; otherwise the fuzzer never leaves
 * the minimization phase.</p>
 *
 * @param <I> input type
 */
@FunctionalInterface
public interface InputMinimizer<I> {
    Stream<I> minimize(Random random, I input);
}
