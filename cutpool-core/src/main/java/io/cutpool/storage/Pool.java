package io.cutpool.storage;

import io.cutpool.kernel.ManagedObject;

/**
 * Collection of slots shared by every subproblem of a branch-and-cut tree.
 * <p>
 * A pool owns the objects stored in it. Everything else refers to them
 * through {@link Handle}s, which expire on their own when an object is
 * deleted or its slot recycled.
 * <p>
 * Deletion is advisory: {@link #remove(Handle)} only succeeds if the object
 * reports itself {@link ManagedObject#deletable() deletable}. Forced deletion
 * is reserved for the pool's own teardown and eviction.
 * <p>
 * Not thread-safe.
 *
 * @param <T> the stored object type
 */
public abstract class Pool<T extends ManagedObject> implements AutoCloseable {

    private final String name;
    private int number;

    protected Pool(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name required");
        }
        this.name = name;
    }

    public String name() {
        return name;
    }

    /**
     * Store an object in the pool.
     *
     * @param item the object; ownership passes to the pool
     * @return a handle to the slot now holding the object (or an equal one)
     * @throws io.cutpool.core.PoolFullException if no slot could be obtained
     */
    public abstract Handle<T> insert(T item);

    /**
     * Try to delete the referenced object.
     *
     * @param handle handle issued by this pool
     * @return true if the object was removed, false if it refused or was already gone
     * @throws IllegalArgumentException if the handle belongs to another pool
     */
    public boolean remove(Handle<T> handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle required");
        }
        if (handle.pool() != this) {
            throw new IllegalArgumentException("handle of pool '" + handle.pool().name()
                    + "' passed to pool '" + name + "'");
        }
        if (!handle.isLive()) {
            return false;
        }
        return softDeleteSlot(handle.slot());
    }

    /**
     * Number of objects currently stored.
     */
    public int count() {
        return number;
    }

    /**
     * Hard-delete every stored object. Outstanding handles go stale.
     */
    @Override
    public abstract void close();

    /**
     * Soft-delete the slot's payload and recycle the slot on success.
     *
     * @return true if the slot is empty afterwards
     */
    protected boolean softDeleteSlot(Slot<T> slot) {
        if (slot.isEmpty()) {
            return true;
        }
        if (slot.softDelete() == DeleteResult.REMOVED) {
            putSlot(slot);
            number--;
            return true;
        }
        return false;
    }

    /**
     * Delete the slot's payload unconditionally and recycle the slot.
     */
    protected void hardDeleteSlot(Slot<T> slot) {
        if (slot.isEmpty()) {
            return;
        }
        slot.hardDelete();
        putSlot(slot);
        number--;
    }

    /**
     * Fill a slot obtained from {@link #getSlot()} and count the new item.
     */
    protected Handle<T> occupy(Slot<T> slot, T item) {
        slot.insert(item);
        number++;
        return new Handle<>(slot);
    }

    protected Slot<T> newSlot(int index) {
        return new Slot<>(this, index);
    }

    /**
     * A free slot, or null if none is available without making room.
     */
    protected abstract Slot<T> getSlot();

    /**
     * Return an empty slot to the free slots.
     *
     * @throws IllegalStateException if the slot is not empty
     */
    protected abstract void putSlot(Slot<T> slot);
}
