package io.cutpool.storage;

import io.cutpool.core.CutPoolConfiguration;
import io.cutpool.core.PoolFullException;
import io.cutpool.kernel.ManagedObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Array-backed pool with slot reuse.
 * <p>
 * Slots are allocated monotonically up to the capacity; freed slots go onto
 * a free list and are reused first. Growing the capacity never relocates an
 * issued slot, so handles survive reallocation.
 * <p>
 * When no slot is free, an insert first runs {@link #cleanup()}. If that
 * frees nothing, the pool grows by its growth factor when automatic
 * reallocation is enabled, or, when configured, evicts items that are
 * neither active nor locked. If there is still no slot the insert fails
 * with {@link PoolFullException}.
 *
 * @param <T> the stored object type
 */
public class StandardPool<T extends ManagedObject> extends Pool<T> {

    private static final Logger LOG = LoggerFactory.getLogger(StandardPool.class);

    private final ArrayList<Slot<T>> slots;
    private final FreeSlotList freeSlots = new FreeSlotList();
    private final boolean autoRealloc;
    private final double growthFactor;
    private final boolean evictNonActiveOnFull;
    private int capacity;
    private boolean closed;

    /**
     * Create a pool.
     *
     * @param name        pool name (for diagnostics)
     * @param capacity    number of items held without reallocation (must be positive)
     * @param autoRealloc true to grow the pool when it is full
     */
    public StandardPool(String name, int capacity, boolean autoRealloc) {
        this(name, CutPoolConfiguration.builder()
                .poolSize(capacity)
                .autoRealloc(autoRealloc)
                .build());
    }

    /**
     * Create a pool sized and configured by {@code configuration}.
     */
    public StandardPool(String name, CutPoolConfiguration configuration) {
        super(name);
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.capacity = configuration.poolSize();
        this.autoRealloc = configuration.autoRealloc();
        this.growthFactor = configuration.growthFactor();
        this.evictNonActiveOnFull = configuration.evictNonActiveOnFull();
        this.slots = new ArrayList<>(Math.min(capacity, 1024));
    }

    @Override
    public Handle<T> insert(T item) {
        if (item == null) {
            throw new IllegalArgumentException("item required");
        }
        assertOpen();
        Slot<T> slot = getSlot();
        if (slot == null) {
            slot = makeRoom();
        }
        return occupy(slot, item);
    }

    private Slot<T> makeRoom() {
        if (cleanup() == 0) {
            if (autoRealloc) {
                increase(grownCapacity());
            } else if (evictNonActiveOnFull) {
                removeNonActive(capacity / 10 + 1);
            }
        }
        Slot<T> slot = getSlot();
        if (slot == null) {
            LOG.warn("Pool '{}' is full ({} items), insert rejected", name(), capacity);
            throw new PoolFullException(name(), capacity);
        }
        return slot;
    }

    private int grownCapacity() {
        long grown = (long) Math.ceil(capacity * growthFactor);
        return (int) Math.min(Integer.MAX_VALUE, Math.max(capacity + 1L, grown));
    }

    /**
     * Raise the capacity. Already issued slots keep their identity.
     *
     * @param newCapacity the new capacity
     * @throws IllegalArgumentException if {@code newCapacity} is below the current capacity
     */
    public void increase(int newCapacity) {
        if (newCapacity < capacity) {
            throw new IllegalArgumentException("Pool '" + name() + "' cannot shrink from "
                    + capacity + " to " + newCapacity);
        }
        LOG.debug("Pool '{}' grows from {} to {} slots", name(), capacity, newCapacity);
        capacity = newCapacity;
    }

    /**
     * Soft-delete every deletable item and free its slot.
     *
     * @return the number of freed slots
     */
    public int cleanup() {
        int removed = 0;
        for (Slot<T> slot : slots) {
            if (!slot.isEmpty() && softDeleteSlot(slot)) {
                removed++;
            }
        }
        if (removed > 0) {
            LOG.debug("Pool '{}' cleanup removed {} items, {} remain", name(), removed, count());
        }
        return removed;
    }

    /**
     * Hard-delete up to {@code maxRemove} items that are neither active nor
     * locked, the least referenced ones first. Handles to them go stale.
     *
     * @return the number of removed items
     */
    public int removeNonActive(int maxRemove) {
        if (maxRemove < 0) {
            throw new IllegalArgumentException("maxRemove must be non-negative: " + maxRemove);
        }
        Comparator<EvictionCandidate<T>> fewestReferences = Comparator.comparingInt(EvictionCandidate::references);
        PriorityQueue<EvictionCandidate<T>> candidates = new PriorityQueue<>(fewestReferences);
        for (Slot<T> slot : slots) {
            T item = slot.payload();
            if (item != null && !item.active() && !item.locked()) {
                candidates.add(new EvictionCandidate<>(slot, item.references()));
            }
        }
        int removed = 0;
        while (removed < maxRemove && !candidates.isEmpty()) {
            hardDeleteSlot(candidates.poll().slot());
            removed++;
        }
        if (removed > 0) {
            LOG.debug("Pool '{}' evicted {} non-active items", name(), removed);
        }
        return removed;
    }

    /**
     * Maximal number of items before the pool must grow or make room.
     */
    public int capacity() {
        return capacity;
    }

    /**
     * Number of slots allocated so far (occupied or free).
     */
    public int slotCount() {
        return slots.size();
    }

    /**
     * Handle to the item in slot {@code index}, or null if the slot is empty.
     */
    public Handle<T> handleAt(int index) {
        Slot<T> slot = slots.get(Objects.checkIndex(index, slots.size()));
        return slot.isEmpty() ? null : new Handle<>(slot);
    }

    public boolean autoRealloc() {
        return autoRealloc;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        for (Slot<T> slot : slots) {
            hardDeleteSlot(slot);
        }
        closed = true;
        LOG.debug("Pool '{}' closed", name());
    }

    @Override
    protected Slot<T> getSlot() {
        int free = freeSlots.pop();
        if (free >= 0) {
            return slots.get(free);
        }
        if (slots.size() < capacity) {
            Slot<T> slot = newSlot(slots.size());
            slots.add(slot);
            return slot;
        }
        return null;
    }

    @Override
    protected void putSlot(Slot<T> slot) {
        if (!slot.isEmpty()) {
            throw new IllegalStateException("Pool '" + name() + "': cannot put a non-void slot " + slot.index());
        }
        freeSlots.push(slot.index());
    }

    private void assertOpen() {
        if (closed) {
            throw new IllegalStateException("Pool '" + name() + "' is closed");
        }
    }

    private record EvictionCandidate<T extends ManagedObject>(Slot<T> slot, int references) {
    }
}
