package io.cutpool.core;

/**
 * Thrown by a pool insert when no slot could be obtained: there was no free
 * slot, a cleanup pass freed nothing, and the pool is not allowed to grow.
 * <p>
 * Recoverable: callers are expected to skip the item or stop generating.
 */
public class PoolFullException extends CutPoolException {

    private final String poolName;
    private final int capacity;

    public PoolFullException(String poolName, int capacity) {
        super("Pool '" + poolName + "' is full: capacity " + capacity);
        this.poolName = poolName;
        this.capacity = capacity;
    }

    public String poolName() {
        return poolName;
    }

    public int capacity() {
        return capacity;
    }
}
