package io.cutpool.kernel;

/**
 * Capability of an object stored in a pool: a constraint, a variable, or
 * anything else the pool machinery manages.
 * <p>
 * Only {@link #deletable()} is mandatory. {@link #hashKey()} and
 * {@link #equal(ManagedObject)} are needed where duplicates are suppressed
 * (non-duplicate pools, separators); the defaults throw.
 * <p>
 * The bookkeeping hooks are called by active sets and staging buffers while
 * they hold a live handle to the object. Their defaults do nothing, so an
 * object that tracks its own deletability by other means can ignore them;
 * {@link AbstractConVar} implements them with counters.
 */
public interface ManagedObject {

    /**
     * Whether the object may be physically removed from its pool now.
     */
    boolean deletable();

    /**
     * Hash of the object's content. Equal objects must have equal keys.
     *
     * @throws UnsupportedOperationException if the object does not support deduplication
     */
    default long hashKey() {
        throw new UnsupportedOperationException("hashKey not supported by " + getClass().getName());
    }

    /**
     * Content equality used to detect duplicates among objects with the same {@link #hashKey()}.
     *
     * @throws UnsupportedOperationException if the object does not support deduplication
     */
    default boolean equal(ManagedObject other) {
        throw new UnsupportedOperationException("equal not supported by " + getClass().getName());
    }

    /**
     * Rank used when items are buffered by their own rank.
     */
    default double rank() {
        return 0.0;
    }

    /**
     * Whether the object may leave an active set again once it became redundant.
     */
    default boolean dynamic() {
        return true;
    }

    default void addReference() {
    }

    default void removeReference() {
    }

    default int references() {
        return 0;
    }

    default void activate() {
    }

    default void deactivate() {
    }

    /**
     * Whether the object belongs to the relaxation of at least one subproblem.
     */
    default boolean active() {
        return false;
    }

    default void lock() {
    }

    default void unlock() {
    }

    /**
     * Whether the object is held by a staging buffer.
     */
    default boolean locked() {
        return false;
    }
}
