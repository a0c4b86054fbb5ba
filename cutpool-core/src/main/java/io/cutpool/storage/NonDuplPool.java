package io.cutpool.storage;

import io.cutpool.core.CutPoolConfiguration;
import io.cutpool.index.ContentHashIndex;
import io.cutpool.kernel.ManagedObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pool that never stores two equal objects.
 * <p>
 * Every stored object is registered in a content hash index under its
 * {@link ManagedObject#hashKey()}. Inserting an object that is
 * {@link ManagedObject#equal(ManagedObject) equal} to a stored one discards
 * the new object and returns a handle to the stored one, for as long as that
 * object stays in the pool.
 *
 * @param <T> the stored object type; must support {@code hashKey()} and {@code equal()}
 */
public class NonDuplPool<T extends ManagedObject> extends StandardPool<T> {

    private static final Logger LOG = LoggerFactory.getLogger(NonDuplPool.class);

    private final ContentHashIndex<Slot<T>> hash;
    private int duplications;

    public NonDuplPool(String name, int capacity, boolean autoRealloc) {
        super(name, capacity, autoRealloc);
        this.hash = new ContentHashIndex<>(capacity);
    }

    public NonDuplPool(String name, CutPoolConfiguration configuration) {
        super(name, configuration);
        this.hash = new ContentHashIndex<>(configuration.poolSize());
    }

    @Override
    public Handle<T> insert(T item) {
        if (item == null) {
            throw new IllegalArgumentException("item required");
        }
        Handle<T> existing = present(item);
        if (existing != null) {
            duplications++;
            return existing;
        }
        Handle<T> handle = super.insert(item);
        hash.add(item.hashKey(), handle.slot());
        return handle;
    }

    /**
     * Handle to a stored object equal to {@code item}, or null if there is none.
     */
    public Handle<T> present(T item) {
        if (item == null) {
            throw new IllegalArgumentException("item required");
        }
        Slot<T> slot = hash.find(item.hashKey(), candidate -> {
            T stored = candidate.payload();
            return stored != null && stored.equal(item);
        });
        return slot == null ? null : new Handle<>(slot);
    }

    /**
     * Number of inserts answered with an already stored object.
     */
    public int duplications() {
        return duplications;
    }

    /**
     * Number of stored objects sharing their hash key with another one.
     */
    public int collisions() {
        return hash.collisions();
    }

    @Override
    public void close() {
        if (!isClosed()) {
            LOG.debug("Pool '{}': {} duplicated items rejected, {} hash collisions",
                    name(), duplications, hash.collisions());
        }
        super.close();
    }

    @Override
    protected boolean softDeleteSlot(Slot<T> slot) {
        T item = slot.payload();
        if (item == null) {
            return super.softDeleteSlot(slot);
        }
        long key = item.hashKey();
        if (super.softDeleteSlot(slot)) {
            hash.remove(key, slot);
            return true;
        }
        return false;
    }

    @Override
    protected void hardDeleteSlot(Slot<T> slot) {
        T item = slot.payload();
        if (item != null) {
            hash.remove(item.hashKey(), slot);
        }
        super.hardDeleteSlot(slot);
    }
}
