package com.loopfuzz.fuzzer.coverage;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.IntUnaryOperator;

/**
 * Immutable wrapper around an AFL-style coverage bitmap. Each byte is an unsigned hit counter for
 * one edge index; non-zero bytes represent executed edges.
 *
 * <p>This is the raw coverage type produced by {@link CoverageReader}s. Equality is structural
 * over the full byte content, so bitmaps that differ only in trailing zero bytes are not equal;
 * use {@link #trimmed()} to normalize.</p>
 */
public final class CoverageBitmap {
    private static final CoverageBitmap EMPTY = new CoverageBitmap(new byte[0], false);
    private final byte[] data;

    private CoverageBitmap(byte[] data, boolean copy) {
        this.data = copy ? data.clone() : data;
    }

    public static CoverageBitmap empty() {
        return EMPTY;
    }

    public static CoverageBitmap fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return EMPTY;
        }
        return new CoverageBitmap(bytes, true);
    }

    /** Builds a bitmap with a hit count of one for every given edge index. */
    public static CoverageBitmap fromIndices(int... indices) {
        if (indices == null || indices.length == 0) {
            return EMPTY;
        }
        int max = -1;
        for (int index : indices) {
            if (index > max) {
                max = index;
            }
        }
        if (max < 0) {
            return EMPTY;
        }
        byte[] bytes = new byte[max + 1];
        for (int index : indices) {
            if (index >= 0) {
                bytes[index] = 1;
            }
        }
        return new CoverageBitmap(bytes, false);
    }

    public int length() {
        return data.length;
    }

    /** Unsigned hit count of the given edge, zero when out of range. */
    public int hitCount(int index) {
        if (index < 0 || index >= data.length) {
            return 0;
        }
        return Byte.toUnsignedInt(data[index]);
    }

    public byte[] toByteArray() {
        return data.clone();
    }

    public boolean isEmpty() {
        for (byte value : data) {
            if (value != 0) {
                return false;
            }
        }
        return true;
    }

    public int countNonZero() {
        int count = 0;
        for (byte value : data) {
            if (value != 0) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns a bitmap whose counters are the result of applying {@code mapper} to every unsigned
     * counter. Mapped values are clamped to {@code [0, 255]}.
     */
    public CoverageBitmap mapCounts(IntUnaryOperator mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (data.length == 0) {
            return EMPTY;
        }
        byte[] mapped = new byte[data.length];
        for (int i = 0; i < data.length; i++) {
            int value = mapper.applyAsInt(Byte.toUnsignedInt(data[i]));
            mapped[i] = (byte) Math.max(0, Math.min(0xFF, value));
        }
        return new CoverageBitmap(mapped, false);
    }

    /** Drops trailing zero counters. */
    public CoverageBitmap trimmed() {
        int end = data.length;
        while (end > 0 && data[end - 1] == 0) {
            end--;
        }
        if (end == data.length) {
            return this;
        }
        if (end == 0) {
            return EMPTY;
        }
        return new CoverageBitmap(Arrays.copyOf(data, end), false);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CoverageBitmap bitmap)) {
            return false;
        }
        return Arrays.equals(data, bitmap.data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("CoverageBitmap{");
        boolean first = true;
        for (int i = 0; i < data.length; i++) {
            if (data[i] == 0) {
                continue;
            }
            if (!first) {
                builder.append(", ");
            }
            builder.append(i).append('=').append(Byte.toUnsignedInt(data[i]));
            first = false;
        }
        return builder.append('}').toString();
    }
}
