package io.cutpool.runtime;

import io.cutpool.kernel.ManagedObject;
import io.cutpool.storage.Handle;
import io.cutpool.storage.StandardPool;

import java.util.function.ToDoubleFunction;

/**
 * Separation from a pool: finds stored items that are violated again and
 * buffers them for readmission.
 * <p>
 * Items that are active in some subproblem or already buffered are skipped.
 * Buffered items are marked {@code keepInPool}, so an item that is not
 * readmitted stays available for later rounds.
 *
 * @param <T> the item type
 */
public final class PoolSeparation<T extends ManagedObject> {

    /**
     * How buffered items are ranked.
     */
    public enum Ranking {
        /** No rank; the buffer becomes unranked. */
        NONE,
        /** The violation. */
        VIOLATION,
        /** The absolute violation. */
        ABS_VIOLATION,
        /** {@link ManagedObject#rank()}. */
        ITEM_RANK
    }

    private final double minAbsViolation;
    private final Ranking ranking;

    public PoolSeparation(double minAbsViolation, Ranking ranking) {
        if (minAbsViolation < 0.0) {
            throw new IllegalArgumentException("minAbsViolation must be non-negative: " + minAbsViolation);
        }
        if (ranking == null) {
            throw new IllegalArgumentException("ranking required");
        }
        this.minAbsViolation = minAbsViolation;
        this.ranking = ranking;
    }

    /**
     * Scan {@code pool} and buffer every item whose absolute violation is at
     * least the minimum, until the buffer is full.
     *
     * @param violation violation of an item by the current solution
     * @return the number of buffered items
     */
    public int separate(StandardPool<T> pool, ToDoubleFunction<? super T> violation, StagingBuffer<T> buffer) {
        if (pool == null || violation == null || buffer == null) {
            throw new IllegalArgumentException("pool, violation and buffer required");
        }
        int added = 0;
        int slots = pool.slotCount();
        for (int i = 0; i < slots && buffer.space() > 0; i++) {
            Handle<T> handle = pool.handleAt(i);
            if (handle == null) {
                continue;
            }
            T item = handle.get();
            if (item.active() || item.locked()) {
                continue;
            }
            double value = violation.applyAsDouble(item);
            if (Math.abs(value) < minAbsViolation) {
                continue;
            }
            InsertResult result = switch (ranking) {
                case NONE -> buffer.insert(handle, true);
                case VIOLATION -> buffer.insert(handle, true, value);
                case ABS_VIOLATION -> buffer.insert(handle, true, Math.abs(value));
                case ITEM_RANK -> buffer.insert(handle, true, item.rank());
            };
            if (result == InsertResult.ADDED) {
                added++;
            }
        }
        return added;
    }

    public double minAbsViolation() {
        return minAbsViolation;
    }

    public Ranking ranking() {
        return ranking;
    }
}
