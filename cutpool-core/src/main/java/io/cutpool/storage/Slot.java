package io.cutpool.storage;

import io.cutpool.kernel.ManagedObject;

/**
 * Storage cell of a pool owning at most one object.
 * <p>
 * The cell outlives its payloads: it is filled, emptied and refilled many
 * times. Every empty-to-occupied transition increments {@link #version()};
 * emptying never touches it. A {@link Handle} remembers the version it was
 * created for, which is how it notices that its object is gone.
 * <p>
 * Only the owning pool mutates a slot.
 *
 * @param <T> the stored object type
 */
public final class Slot<T extends ManagedObject> {

    private final Pool<T> owner;
    private final int index;
    private T payload;
    private long version;

    Slot(Pool<T> owner, int index) {
        this.owner = owner;
        this.index = index;
    }

    /**
     * Store an object in the empty slot.
     *
     * @throws IllegalStateException if the slot is occupied
     */
    void insert(T item) {
        if (payload != null) {
            throw new IllegalStateException("Slot " + index + " of pool '" + owner.name()
                    + "' is occupied; remove its item first");
        }
        if (item == null) {
            throw new IllegalArgumentException("item required");
        }
        payload = item;
        version++;
    }

    /**
     * Remove the payload if it agrees to be deleted.
     */
    DeleteResult softDelete() {
        if (payload == null) {
            return DeleteResult.REMOVED;
        }
        if (!payload.deletable()) {
            return DeleteResult.STILL_REFERENCED;
        }
        payload = null;
        return DeleteResult.REMOVED;
    }

    /**
     * Remove the payload regardless of {@link ManagedObject#deletable()}.
     */
    void hardDelete() {
        payload = null;
    }

    /**
     * Current payload, or null if the slot is empty.
     * <p>
     * Readers outside the pool go through a {@link Handle}.
     */
    T payload() {
        return payload;
    }

    public boolean isEmpty() {
        return payload == null;
    }

    public long version() {
        return version;
    }

    public int index() {
        return index;
    }

    Pool<T> owner() {
        return owner;
    }

    @Override
    public String toString() {
        return "Slot{pool=" + owner.name() + ", index=" + index + ", version=" + version
                + (payload == null ? ", empty" : "") + "}";
    }
}
