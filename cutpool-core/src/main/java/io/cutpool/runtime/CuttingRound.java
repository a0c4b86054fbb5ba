package io.cutpool.runtime;

import io.cutpool.core.CutPoolConfiguration;
import io.cutpool.kernel.ManagedObject;
import io.cutpool.storage.Handle;
import io.cutpool.storage.StandardPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * The per-round admission and cleanup protocol of one subproblem.
 * <p>
 * {@link #run(Object)} separates, extracts the best buffered items and
 * appends them to the active set. {@link #cleanup(Predicate)} removes items
 * that stayed redundant too long and runs a garbage-collection pass on the
 * pool.
 *
 * @param <T> the item type
 * @param <S> the solution type
 */
public final class CuttingRound<T extends ManagedObject, S> {

    private static final Logger LOG = LoggerFactory.getLogger(CuttingRound.class);

    private final Separator<T, S> separator;
    private final ActiveSet<T> active;
    private final StandardPool<T> pool;
    private final int maxAdd;
    private final AgeBasedElimination<T> elimination;

    /**
     * @param maxAdd  maximal number of items admitted per round
     * @param elimAge rounds an item may stay redundant before removal
     */
    public CuttingRound(Separator<T, S> separator, ActiveSet<T> active, StandardPool<T> pool,
                        int maxAdd, int elimAge) {
        if (separator == null || active == null || pool == null) {
            throw new IllegalArgumentException("separator, active and pool required");
        }
        if (maxAdd < 0) {
            throw new IllegalArgumentException("maxAdd must be non-negative: " + maxAdd);
        }
        this.separator = separator;
        this.active = active;
        this.pool = pool;
        this.maxAdd = maxAdd;
        this.elimination = new AgeBasedElimination<>(elimAge);
    }

    /**
     * Round limited by the configuration's add limit and elimination age for {@code kind}.
     */
    public static <T extends ManagedObject, S> CuttingRound<T, S> of(
            ItemKind kind, Separator<T, S> separator, ActiveSet<T> active, StandardPool<T> pool,
            CutPoolConfiguration configuration) {
        if (kind == null || configuration == null) {
            throw new IllegalArgumentException("kind and configuration required");
        }
        return new CuttingRound<>(separator, active, pool, kind.maxAdd(configuration), kind.elimAge(configuration));
    }

    /**
     * Round over constraints, limited by {@code MaxConAdd} and {@code ConElimAge}.
     */
    public static <T extends ManagedObject, S> CuttingRound<T, S> forConstraints(
            Separator<T, S> separator, ActiveSet<T> active, StandardPool<T> pool,
            CutPoolConfiguration configuration) {
        return of(ItemKind.CONSTRAINT, separator, active, pool, configuration);
    }

    /**
     * Round over variables, limited by {@code MaxVarAdd} and {@code VarElimAge}.
     */
    public static <T extends ManagedObject, S> CuttingRound<T, S> forVariables(
            Separator<T, S> separator, ActiveSet<T> active, StandardPool<T> pool,
            CutPoolConfiguration configuration) {
        return of(ItemKind.VARIABLE, separator, active, pool, configuration);
    }

    /**
     * Separate {@code solution} and admit the best new items.
     *
     * @return the handles appended to the active set, in admission order
     */
    public List<Handle<T>> run(S solution) {
        separator.call(solution);
        List<Handle<T>> admitted = new ArrayList<>();
        separator.buffer().extract(maxAdd, admitted);
        active.insertAll(admitted);
        LOG.debug("Round admitted {} items, active set holds {}", admitted.size(), active.count());
        return admitted;
    }

    /**
     * Age and eliminate redundant items, then clean up the pool.
     *
     * @param redundant true for an item that was not binding in this round
     * @return the number of items freed in the pool
     */
    public int cleanup(Predicate<? super T> redundant) {
        int eliminated = elimination.eliminate(active, redundant);
        int freed = pool.cleanup();
        LOG.debug("Round eliminated {} active items, freed {} pool slots", eliminated, freed);
        return freed;
    }

    public ActiveSet<T> active() {
        return active;
    }

    public Separator<T, S> separator() {
        return separator;
    }
}
