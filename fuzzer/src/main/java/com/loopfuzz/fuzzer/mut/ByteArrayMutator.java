package com.loopfuzz.fuzzer.mut;

import java.util.Arrays;
import java.util.Random;
import java.util.stream.Stream;

/**
 * Havoc-style byte mutator in the spirit of AFL: each mutant stacks one to four random edits
 * (bit flips, small arithmetic, interesting values, chunk deletion, byte insertion, chunk
 * duplication) on a copy of the input.
 */
public final class ByteArrayMutator implements InputMutator<byte[]> {
    private static final byte[] INTERESTING = {-128, -1, 0, 1, 16, 32, 64, 100, 127};
    private static final int MAX_STACKED_EDITS = 4;

    private final int mutantsPerInput;
    private final int maxLength;

    public ByteArrayMutator() {
        this(64, 4096);
    }

    public ByteArrayMutator(int mutantsPerInput, int maxLength) {
        if (mutantsPerInput < 0) {
            throw new IllegalArgumentException("mutantsPerInput must not be negative");
        }
        if (maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be positive");
        }
        this.mutantsPerInput = mutantsPerInput;
        this.maxLength = maxLength;
    }

    @Override
    public Stream<byte[]> mutate(Random random, byte[] input) {
        return Stream.generate(() -> havoc(input, random)).limit(mutantsPerInput);
    }

    private byte[] havoc(byte[] input, Random random) {
        byte[] data = Arrays.copyOf(input, input.length);
        int edits = 1 + random.nextInt(MAX_STACKED_EDITS);
        for (int i = 0; i < edits; i++) {
            data = data.length == 0 ? insertByte(data, random) : edit(data, random);
        }
        return data.length > maxLength ? Arrays.copyOf(data, maxLength) : data;
    }

    private byte[] edit(byte[] data, Random random) {
        switch (random.nextInt(6)) {
            case 0 -> data[random.nextInt(data.length)] ^= (byte) (1 << random.nextInt(8));
            case 1 -> {
                int index = random.nextInt(data.length);
                data[index] += (byte) (random.nextBoolean() ? 1 + random.nextInt(35) : -1 - random.nextInt(35));
            }
            case 2 -> data[random.nextInt(data.length)] = INTERESTING[random.nextInt(INTERESTING.length)];
            case 3 -> {
                return deleteChunk(data, random);
            }
            case 4 -> {
                return insertByte(data, random);
            }
            default -> {
                return duplicateChunk(data, random);
            }
        }
        return data;
    }

    private static byte[] deleteChunk(byte[] data, Random random) {
        int start = random.nextInt(data.length);
        int length = 1 + random.nextInt(data.length - start);
        byte[] result = new byte[data.length - length];
        System.arraycopy(data, 0, result, 0, start);
        System.arraycopy(data, start + length, result, start, data.length - start - length);
        return result;
    }

    private static byte[] insertByte(byte[] data, Random random) {
        int position = data.length == 0 ? 0 : random.nextInt(data.length + 1);
        byte[] result = new byte[data.length + 1];
        System.arraycopy(data, 0, result, 0, position);
        result[position] = (byte) random.nextInt(256);
        System.arraycopy(data, position, result, position + 1, data.length - position);
        return result;
    }

    private static byte[] duplicateChunk(byte[] data, Random random) {
        int start = random.nextInt(data.length);
        int length = 1 + random.nextInt(Math.min(32, data.length - start));
        byte[] result = new byte[data.length + length];
        System.arraycopy(data, 0, result, 0, start + length);
        System.arraycopy(data, start, result, start + length, data.length - start);
        return result;
    }
}
