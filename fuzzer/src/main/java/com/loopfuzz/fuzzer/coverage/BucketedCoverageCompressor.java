package com.loopfuzz.fuzzer.coverage;

/**
 * Compresses a bitmap by classifying hit counters into AFL's power-of-two buckets (1, 2, 3, 4-7,
 * 8-15, 16-31, 32-127, 128+) and trimming trailing zeros. Two runs that take the same edges a
 * similar number of times compress to equal values.
 */
public final class BucketedCoverageCompressor implements CoverageCompressor<CoverageBitmap> {

    @Override
    public CoverageBitmap compress(CoverageBitmap coverage) {
        if (coverage == null || coverage.isEmpty()) {
            return CoverageBitmap.empty();
        }
        return coverage.mapCounts(BucketedCoverageCompressor::bucket).trimmed();
    }

    static int bucket(int count) {
        if (count <= 3) {
            return count;
        }
        if (count < 8) {
            return 4;
        }
        if (count < 16) {
            return 8;
        }
        if (count < 32) {
            return 16;
        }
        if (count < 128) {
            return 32;
        }
        return 128;
    }
}
