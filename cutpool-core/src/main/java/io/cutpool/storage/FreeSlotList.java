package io.cutpool.storage;

import java.util.Arrays;

/**
 * LIFO stack of free slot indexes.
 * <p>
 * The most recently freed slot is reused first, keeping the working set of a
 * pool small. Not thread-safe; pools are driven by a single search worker.
 */
final class FreeSlotList {

    private int[] indexes;
    private int size;

    FreeSlotList() {
        this(16);
    }

    FreeSlotList(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive: " + initialCapacity);
        }
        this.indexes = new int[initialCapacity];
    }

    /**
     * Push a slot index onto the stack.
     *
     * @param slotIndex the free slot index
     */
    void push(int slotIndex) {
        if (slotIndex < 0) {
            throw new IllegalArgumentException("slotIndex must be non-negative: " + slotIndex);
        }
        if (size == indexes.length) {
            indexes = Arrays.copyOf(indexes, indexes.length * 2);
        }
        indexes[size++] = slotIndex;
    }

    /**
     * Pop a slot index from the stack.
     *
     * @return the slot index, or -1 if empty
     */
    int pop() {
        if (size == 0) {
            return -1;
        }
        return indexes[--size];
    }

    boolean isEmpty() {
        return size == 0;
    }

    int size() {
        return size;
    }

    void clear() {
        size = 0;
    }
}
