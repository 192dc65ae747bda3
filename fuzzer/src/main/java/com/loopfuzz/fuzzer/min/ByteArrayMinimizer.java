package com.loopfuzz.fuzzer.min;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Chunk-removal minimizer for byte inputs. Candidates remove one aligned chunk each, starting with
 * the largest power-of-two chunk that fits and halving down to single bytes, so big reductions are
 * tried first.
 */
public final class ByteArrayMinimizer implements InputMinimizer<byte[]> {

    @Override
    public Stream<byte[]> minimize(Random random, byte[] input) {
        if (input.length == 0) {
            return Stream.empty();
        }
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(
                        new ChunkRemovals(input), Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    private static final class ChunkRemovals implements Iterator<byte[]> {
        private final byte[] input;
        private int chunkSize;
        private int offset = 0;

        ChunkRemovals(byte[] input) {
            this.input = input;
            this.chunkSize = Integer.highestOneBit(input.length);
        }

        @Override
        public boolean hasNext() {
            return chunkSize > 0;
        }

        @Override
        public byte[] next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int end = Math.min(input.length, offset + chunkSize);
            byte[] candidate = new byte[input.length - (end - offset)];
            System.arraycopy(input, 0, candidate, 0, offset);
            System.arraycopy(input, end, candidate, offset, input.length - end);
            offset += chunkSize;
            if (offset >= input.length) {
                offset = 0;
                chunkSize >>= 1;
            }
            return candidate;
        }
    }
}
