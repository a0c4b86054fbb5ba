package io.cutpool.runtime;

import java.util.Arrays;

final class SortedIndices {

    private SortedIndices() {
    }

    /**
     * @throws IllegalArgumentException  if {@code indices} is not strictly increasing
     * @throws IndexOutOfBoundsException if an index is negative or not below {@code bound}
     */
    static void requireStrictlyIncreasing(int[] indices, int bound) {
        if (indices == null) {
            throw new IllegalArgumentException("indices required");
        }
        int previous = -1;
        for (int index : indices) {
            if (index < 0 || index >= bound) {
                throw new IndexOutOfBoundsException("index " + index + " out of bounds for count " + bound);
            }
            if (index <= previous) {
                throw new IllegalArgumentException("indices must be strictly increasing: "
                        + Arrays.toString(indices));
            }
            previous = index;
        }
    }
}
