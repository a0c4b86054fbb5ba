package io.cutpool.runtime;

import io.cutpool.kernel.ManagedObject;
import io.cutpool.storage.Handle;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Bounded holding area for newly generated items pending batch admission
 * into an active set.
 * <p>
 * Entries are handles into a pool, optionally ranked. At the end of a round
 * {@link #extract(int, List)} hands out the best entries and empties the
 * buffer; entries that were not handed out are deleted from their pool
 * unless they were buffered with {@code keepInPool}. That keeps generated
 * but unused items from piling up in the pool.
 * <p>
 * Ranking is all or nothing: the first entry buffered without a rank turns
 * ranking off for the rest of the buffer's life, and later ranks are
 * ignored.
 * <p>
 * Buffered items are locked so that a pool cleanup cannot delete them.
 * Not thread-safe.
 *
 * @param <T> the item type
 */
public final class StagingBuffer<T extends ManagedObject> {

    private final Handle<T>[] handles;
    private final double[] ranks;
    private final boolean[] keepInPool;
    private int n;
    private boolean ranked = true;

    @SuppressWarnings("unchecked")
    public StagingBuffer(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be non-negative: " + capacity);
        }
        this.handles = (Handle<T>[]) new Handle<?>[capacity];
        this.ranks = new double[capacity];
        this.keepInPool = new boolean[capacity];
    }

    /**
     * Buffer an entry without rank. Switches the buffer to unranked mode.
     *
     * @param handle     the pooled item
     * @param keepInPool true if the item stays in its pool when not extracted
     * @return {@link InsertResult#ADDED} or {@link InsertResult#FULL}
     */
    public InsertResult insert(Handle<T> handle, boolean keepInPool) {
        if (handle == null) {
            throw new IllegalArgumentException("handle required");
        }
        if (n == handles.length) {
            return InsertResult.FULL;
        }
        ranked = false;
        store(handle, keepInPool, 0.0);
        return InsertResult.ADDED;
    }

    /**
     * Buffer a ranked entry. The rank is ignored once the buffer is unranked.
     *
     * @return {@link InsertResult#ADDED} or {@link InsertResult#FULL}
     */
    public InsertResult insert(Handle<T> handle, boolean keepInPool, double rank) {
        if (handle == null) {
            throw new IllegalArgumentException("handle required");
        }
        if (n == handles.length) {
            return InsertResult.FULL;
        }
        store(handle, keepInPool, rank);
        return InsertResult.ADDED;
    }

    private void store(Handle<T> handle, boolean keep, double rank) {
        handles[n] = handle;
        keepInPool[n] = keep;
        ranks[n] = rank;
        n++;
        T item = handle.get();
        if (item != null) {
            item.lock();
        }
    }

    /**
     * Sort the entries by descending rank, ties in insertion order. Does
     * nothing for an unranked buffer or one holding at most {@code threshold} entries.
     */
    public void sort(int threshold) {
        if (!ranked || n <= threshold) {
            return;
        }
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> ranks[i]).reversed());

        Handle<T>[] sortedHandles = Arrays.copyOf(handles, n);
        double[] sortedRanks = new double[n];
        boolean[] sortedKeep = new boolean[n];
        for (int i = 0; i < n; i++) {
            sortedHandles[i] = handles[order[i]];
            sortedRanks[i] = ranks[order[i]];
            sortedKeep[i] = keepInPool[order[i]];
        }
        System.arraycopy(sortedHandles, 0, handles, 0, n);
        System.arraycopy(sortedRanks, 0, ranks, 0, n);
        System.arraycopy(sortedKeep, 0, keepInPool, 0, n);
    }

    /**
     * Move up to {@code max} entries, best rank first, to {@code out} and
     * empty the buffer. Every other entry not marked {@code keepInPool} is
     * soft-deleted from its pool. Entries whose item already vanished are skipped.
     *
     * @return the number of handles appended to {@code out}
     */
    public int extract(int max, List<Handle<T>> out) {
        if (max < 0) {
            throw new IllegalArgumentException("max must be non-negative: " + max);
        }
        if (out == null) {
            throw new IllegalArgumentException("out required");
        }
        sort(max);
        for (int i = 0; i < n; i++) {
            T item = handles[i].get();
            if (item != null) {
                item.unlock();
            }
        }
        int extracted = 0;
        for (int i = 0; i < n; i++) {
            Handle<T> handle = handles[i];
            if (!handle.isLive()) {
                continue;
            }
            if (extracted < max) {
                out.add(handle);
                extracted++;
            } else if (!keepInPool[i]) {
                handle.pool().remove(handle);
            }
        }
        Arrays.fill(handles, 0, n, null);
        n = 0;
        return extracted;
    }

    /**
     * Discard the entries at the given positions. Items not marked
     * {@code keepInPool} are soft-deleted from their pool.
     *
     * @param sortedIndices strictly increasing positions below {@link #count()}
     */
    public void remove(int[] sortedIndices) {
        SortedIndices.requireStrictlyIncreasing(sortedIndices, n);
        if (sortedIndices.length == 0) {
            return;
        }
        for (int index : sortedIndices) {
            Handle<T> handle = handles[index];
            T item = handle.get();
            if (item != null) {
                item.unlock();
                if (!keepInPool[index]) {
                    handle.pool().remove(handle);
                }
            }
        }
        int next = 0;
        int write = sortedIndices[0];
        for (int read = sortedIndices[0]; read < n; read++) {
            if (next < sortedIndices.length && sortedIndices[next] == read) {
                next++;
                continue;
            }
            handles[write] = handles[read];
            ranks[write] = ranks[read];
            keepInPool[write] = keepInPool[read];
            write++;
        }
        Arrays.fill(handles, write, n, null);
        n = write;
    }

    public int count() {
        return n;
    }

    public int capacity() {
        return handles.length;
    }

    /**
     * Number of entries that can still be buffered.
     */
    public int space() {
        return handles.length - n;
    }

    /**
     * False once an entry was buffered without rank.
     */
    public boolean ranked() {
        return ranked;
    }

    public Handle<T> handle(int i) {
        return handles[Objects.checkIndex(i, n)];
    }

    public double rank(int i) {
        return ranks[Objects.checkIndex(i, n)];
    }

    public boolean keepInPool(int i) {
        return keepInPool[Objects.checkIndex(i, n)];
    }
}
