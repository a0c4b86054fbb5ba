package io.cutpool.runtime;

import io.cutpool.core.CutPoolConfiguration;
import io.cutpool.kernel.ManagedObject;
import io.cutpool.storage.Handle;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The constraints or variables in the relaxation of one subproblem.
 * <p>
 * An ordered, dense list of handles into a shared pool with a parallel
 * redundant-age counter per entry. Positions double as LP row or column
 * numbers, so removal compacts the list and keeps the survivors' order.
 * <p>
 * Entries are not owned: an entry whose object vanished from the pool
 * dereferences to null through {@link #at(int)}. While an entry's object is
 * live it carries one reference and one activation from this set.
 * <p>
 * Subproblem-local and not thread-safe.
 *
 * @param <T> the item type
 */
public final class ActiveSet<T extends ManagedObject> {

    public static final double DEFAULT_GROWTH_FACTOR = 1.5;

    private final double growthFactor;
    private Handle<T>[] handles;
    private int[] redundantAge;
    private int n;

    public ActiveSet(int capacity) {
        this(capacity, DEFAULT_GROWTH_FACTOR);
    }

    /**
     * @param capacity     initial capacity
     * @param growthFactor factor applied to the capacity when an insert overflows it
     */
    public ActiveSet(int capacity, double growthFactor) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be non-negative: " + capacity);
        }
        if (!(growthFactor > 1.0)) {
            throw new IllegalArgumentException("growthFactor must be greater than 1: " + growthFactor);
        }
        this.growthFactor = growthFactor;
        this.handles = newArray(capacity);
        this.redundantAge = new int[capacity];
    }

    /**
     * Active set growing by the configured {@code ActiveGrowthFactor}.
     */
    public ActiveSet(int capacity, CutPoolConfiguration configuration) {
        this(capacity, Objects.requireNonNull(configuration, "configuration").activeGrowthFactor());
    }

    /**
     * Build a subproblem's active set from its parent's: same entries in the
     * same order, redundant ages reset.
     *
     * @param parent   the parent subproblem's set
     * @param capacity capacity of the new set
     * @throws IllegalArgumentException if {@code capacity} is below the parent's count
     */
    public ActiveSet(ActiveSet<T> parent, int capacity) {
        this(capacity, Objects.requireNonNull(parent, "parent").growthFactor);
        if (capacity < parent.n) {
            throw new IllegalArgumentException("capacity " + capacity + " below parent count " + parent.n);
        }
        for (int i = 0; i < parent.n; i++) {
            handles[i] = parent.handles[i];
            retain(handles[i]);
        }
        n = parent.n;
    }

    public int count() {
        return n;
    }

    public int capacity() {
        return handles.length;
    }

    /**
     * The item at position {@code i}, or null if it vanished from its pool.
     *
     * @throws IndexOutOfBoundsException if {@code i >= count()}
     */
    public T at(int i) {
        return handles[Objects.checkIndex(i, n)].get();
    }

    public Handle<T> handle(int i) {
        return handles[Objects.checkIndex(i, n)];
    }

    /**
     * Append an entry, growing the capacity if needed.
     */
    public void insert(Handle<T> handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle required");
        }
        ensureCapacity(n + 1);
        handles[n] = handle;
        redundantAge[n] = 0;
        n++;
        retain(handle);
    }

    /**
     * Append entries in order, growing the capacity if needed.
     */
    public void insertAll(List<Handle<T>> newHandles) {
        if (newHandles == null) {
            throw new IllegalArgumentException("handles required");
        }
        ensureCapacity(n + newHandles.size());
        for (Handle<T> handle : newHandles) {
            insert(handle);
        }
    }

    /**
     * Remove the entries at the given positions and close the gaps.
     *
     * @param sortedIndices strictly increasing positions below {@link #count()}
     */
    public void remove(int[] sortedIndices) {
        SortedIndices.requireStrictlyIncreasing(sortedIndices, n);
        if (sortedIndices.length == 0) {
            return;
        }
        for (int index : sortedIndices) {
            release(handles[index]);
        }
        int next = 0;
        int write = sortedIndices[0];
        for (int read = sortedIndices[0]; read < n; read++) {
            if (next < sortedIndices.length && sortedIndices[next] == read) {
                next++;
                continue;
            }
            handles[write] = handles[read];
            redundantAge[write] = redundantAge[read];
            write++;
        }
        Arrays.fill(handles, write, n, null);
        n = write;
    }

    /**
     * Change the capacity.
     *
     * @throws IllegalArgumentException if {@code newCapacity} is below {@link #count()}
     */
    public void realloc(int newCapacity) {
        if (newCapacity < n) {
            throw new IllegalArgumentException("capacity " + newCapacity + " below count " + n);
        }
        handles = Arrays.copyOf(handles, newCapacity);
        redundantAge = Arrays.copyOf(redundantAge, newCapacity);
    }

    /**
     * Drop every entry, releasing the references this set holds.
     */
    public void clear() {
        for (int i = 0; i < n; i++) {
            release(handles[i]);
            handles[i] = null;
        }
        n = 0;
    }

    public int redundantAge(int i) {
        return redundantAge[Objects.checkIndex(i, n)];
    }

    public void incrementRedundantAge(int i) {
        redundantAge[Objects.checkIndex(i, n)]++;
    }

    public void resetRedundantAge(int i) {
        redundantAge[Objects.checkIndex(i, n)] = 0;
    }

    private void ensureCapacity(int required) {
        if (required <= handles.length) {
            return;
        }
        long grown = (long) Math.ceil(handles.length * growthFactor);
        realloc((int) Math.min(Integer.MAX_VALUE, Math.max(required, grown)));
    }

    private static <T extends ManagedObject> void retain(Handle<T> handle) {
        T item = handle.get();
        if (item != null) {
            item.addReference();
            item.activate();
        }
    }

    private static <T extends ManagedObject> void release(Handle<T> handle) {
        T item = handle.get();
        if (item != null) {
            item.deactivate();
            item.removeReference();
        }
    }

    @SuppressWarnings("unchecked")
    private static <T extends ManagedObject> Handle<T>[] newArray(int capacity) {
        return (Handle<T>[]) new Handle<?>[capacity];
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder("ActiveSet{count=").append(n)
                .append(", capacity=").append(handles.length).append(", items=[");
        for (int i = 0; i < n; i++) {
            if (i > 0) {
                out.append(", ");
            }
            T item = handles[i].get();
            out.append(i).append(": ").append(item == null ? "<removed>" : item);
        }
        return out.append("]}").toString();
    }
}
