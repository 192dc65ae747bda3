package com.loopfuzz.fuzzer.mut;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

final class ByteArrayMutatorTest {

    @Test
    void producesTheConfiguredNumberOfMutants() {
        ByteArrayMutator mutator = new ByteArrayMutator(10, 4096);

        List<byte[]> mutants = mutator.mutate(new Random(3), "hello".getBytes()).toList();

        assertEquals(10, mutants.size());
        assertTrue(mutants.stream().anyMatch(m -> !Arrays.equals(m, "hello".getBytes())));
    }

    @Test
    void sameSeedGivesSameMutants() {
        ByteArrayMutator mutator = new ByteArrayMutator();
        byte[] input = {1, 2, 3, 4, 5, 6, 7, 8};

        List<byte[]> first = mutator.mutate(new Random(11), input).toList();
        List<byte[]> second = mutator.mutate(new Random(11), input).toList();

        assertEquals(first.size(), second.size());
        for (int i = 0; i < first.size(); i++) {
            assertTrue(Arrays.equals(first.get(i), second.get(i)), "mutant " + i + " differs");
        }
    }

    @Test
    void inputIsNeverModifiedAndLengthIsCapped() {
        byte[] input = new byte[16];
        ByteArrayMutator mutator = new ByteArrayMutator(200, 16);

        mutator.mutate(new Random(5), input)
                .forEach(mutant -> assertTrue(mutant.length <= 16, "length " + mutant.length));

        assertTrue(Arrays.equals(input, new byte[16]));
    }

    @Test
    void emptyInputGrows() {
        List<byte[]> mutants = new ByteArrayMutator().mutate(new Random(1), new byte[0]).toList();

        assertEquals(64, mutants.size());
        assertTrue(mutants.stream().anyMatch(mutant -> mutant.length > 0));
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new ByteArrayMutator(-1, 10));
        assertThrows(IllegalArgumentException.class, () -> new ByteArrayMutator(1, 0));
    }
}
