package io.cutpool.runtime;

import io.cutpool.core.CutPoolConfiguration;
import io.cutpool.core.PoolFullException;
import io.cutpool.index.ContentHashIndex;
import io.cutpool.kernel.ManagedObject;
import io.cutpool.storage.Handle;
import io.cutpool.storage.NonDuplPool;
import io.cutpool.storage.Pool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generator of new constraints or variables from an LP solution.
 * <p>
 * Subclasses implement {@link #separate()}, reading {@link #solution()} and
 * reporting every candidate through {@link #cutFound(ManagedObject)}.
 * Candidates equal to one already found in the same round, or to one stored
 * in a watched {@link NonDuplPool}, are discarded; the others are stored in
 * the target pool and buffered, unranked unless a rank is given, for
 * admission by the driver.
 * <p>
 * Candidates must support {@link ManagedObject#hashKey()} and
 * {@link ManagedObject#equal(ManagedObject)}.
 *
 * @param <T> the generated item type
 * @param <S> the type of the solution separated
 */
public abstract class Separator<T extends ManagedObject, S> {

    private static final Logger LOG = LoggerFactory.getLogger(Separator.class);

    private final Pool<T> pool;
    private final StagingBuffer<T> buffer;
    private final double minAbsViolation;
    private final ContentHashIndex<T> roundIndex;
    private NonDuplPool<T> watchedPool;
    private S solution;
    private int generated;
    private int duplicates;

    /**
     * @param pool            pool receiving the accepted candidates
     * @param maxGenerated    maximal number of candidates buffered per round
     * @param minAbsViolation violation a candidate must reach to be worth reporting
     */
    protected Separator(Pool<T> pool, int maxGenerated, double minAbsViolation) {
        if (pool == null) {
            throw new IllegalArgumentException("pool required");
        }
        if (minAbsViolation < 0.0) {
            throw new IllegalArgumentException("minAbsViolation must be non-negative: " + minAbsViolation);
        }
        this.pool = pool;
        this.buffer = new StagingBuffer<>(maxGenerated);
        this.minAbsViolation = minAbsViolation;
        this.roundIndex = new ContentHashIndex<>(maxGenerated);
    }

    /**
     * Buffer sized by {@code MaxConBuffered} or {@code MaxVarBuffered}, violation
     * threshold {@code MinAbsViolation}.
     */
    protected Separator(Pool<T> pool, ItemKind kind, CutPoolConfiguration configuration) {
        this(pool, requireConfiguration(kind, configuration).maxBuffered(configuration),
                configuration.minAbsViolation());
    }

    private static ItemKind requireConfiguration(ItemKind kind, CutPoolConfiguration configuration) {
        if (kind == null || configuration == null) {
            throw new IllegalArgumentException("kind and configuration required");
        }
        return kind;
    }

    /**
     * Run one separation round on {@code solution}.
     *
     * @return the number of candidates buffered in this round
     */
    public final int call(S solution) {
        if (solution == null) {
            throw new IllegalArgumentException("solution required");
        }
        this.solution = solution;
        roundIndex.clear();
        generated = 0;
        duplicates = 0;
        separate();
        LOG.debug("{}: {} generated, {} duplicates, {} buffered",
                getClass().getSimpleName(), generated, duplicates, buffer.count());
        return generated;
    }

    /**
     * Search {@link #solution()} for violated items and report them with {@link #cutFound}.
     */
    protected abstract void separate();

    /**
     * Report an unranked candidate.
     */
    public InsertResult cutFound(T candidate) {
        return admit(candidate, false, 0.0);
    }

    /**
     * Report a ranked candidate.
     */
    public InsertResult cutFound(T candidate, double rank) {
        return admit(candidate, true, rank);
    }

    private InsertResult admit(T candidate, boolean ranked, double rank) {
        if (candidate == null) {
            throw new IllegalArgumentException("candidate required");
        }
        long key = candidate.hashKey();
        if (roundIndex.find(key, found -> found.equal(candidate)) != null
                || (watchedPool != null && watchedPool.present(candidate) != null)) {
            duplicates++;
            return InsertResult.DUPLICATION;
        }
        if (buffer.space() == 0) {
            return InsertResult.FULL;
        }
        Handle<T> handle;
        try {
            handle = pool.insert(candidate);
        } catch (PoolFullException e) {
            LOG.debug("{}: candidate dropped, {}", getClass().getSimpleName(), e.getMessage());
            return InsertResult.FULL;
        }
        if (ranked) {
            buffer.insert(handle, false, rank);
        } else {
            buffer.insert(handle, false);
        }
        roundIndex.add(key, candidate);
        generated++;
        return InsertResult.ADDED;
    }

    /**
     * Whether {@link #separate()} should stop generating.
     * By default once the buffer is full.
     */
    public boolean terminateSeparation() {
        return buffer.space() == 0;
    }

    /**
     * Also discard candidates equal to an item stored in {@code pool}.
     */
    public void watchNonDuplPool(NonDuplPool<T> pool) {
        this.watchedPool = pool;
    }

    public S solution() {
        return solution;
    }

    public StagingBuffer<T> buffer() {
        return buffer;
    }

    public Pool<T> pool() {
        return pool;
    }

    public double minAbsViolation() {
        return minAbsViolation;
    }

    public int maxGenerated() {
        return buffer.capacity();
    }

    /**
     * Number of candidates buffered in the current round.
     */
    public int numGenerated() {
        return generated;
    }

    /**
     * Number of candidates discarded as duplicates in the current round.
     */
    public int numDuplicates() {
        return duplicates;
    }

    /**
     * Hash collisions among the candidates of the current round.
     */
    public int numCollisions() {
        return roundIndex.collisions();
    }
}
