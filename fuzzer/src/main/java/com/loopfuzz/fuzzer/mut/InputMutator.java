package com.loopfuzz.fuzzer.mut;

import java.util.Random;
import java.util.stream.Stream;

/**
 * Derives new inputs from an existing one. The returned stream is consumed lazily and fully; it
 * must be finite.
 *
 * @param <I> input type
 */
@FunctionalInterface
public interface InputMutator<I> {
    Stream<I> mutate(Random random, I input);
}
