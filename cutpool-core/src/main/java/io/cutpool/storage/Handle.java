package io.cutpool.storage;

import io.cutpool.kernel.ManagedObject;

/**
 * Non-owning, staleness-checked reference to a pooled object.
 * <p>
 * A handle pairs a slot with the slot version current when the handle was
 * created. It stays valid only while the slot still holds that same
 * occupation: once the object is deleted, or the slot is reused for another
 * object, {@link #get()} returns null. Nothing has to be notified when that
 * happens, so pools can delete and recycle slots without walking the handles
 * held by active sets and buffers.
 * <p>
 * Equality is by slot identity and version, never by payload content.
 *
 * @param <T> the referenced object type
 */
public final class Handle<T extends ManagedObject> {

    private final Slot<T> slot;
    private final long version;

    Handle(Slot<T> slot) {
        this.slot = slot;
        this.version = slot.version();
    }

    /**
     * The referenced object, or null if it vanished.
     * <p>
     * A null result is routine and must be handled by every caller.
     */
    public T get() {
        if (slot.version() != version) {
            return null;
        }
        return slot.payload();
    }

    public boolean isLive() {
        return slot.version() == version && !slot.isEmpty();
    }

    public long version() {
        return version;
    }

    public int slotIndex() {
        return slot.index();
    }

    public Pool<T> pool() {
        return slot.owner();
    }

    Slot<T> slot() {
        return slot;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Handle<?> other = (Handle<?>) obj;
        return slot == other.slot && version == other.version;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(slot) + Long.hashCode(version);
    }

    @Override
    public String toString() {
        return "Handle{pool=" + slot.owner().name() + ", slot=" + slot.index() + ", version=" + version
                + (isLive() ? "" : ", stale") + "}";
    }
}
