package io.cutpool.runtime;

import io.cutpool.core.CutPoolConfiguration;
import io.cutpool.kernel.ManagedObject;

import java.util.Arrays;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;

/**
 * Removes items from an active set once they have been redundant for a
 * number of consecutive rounds.
 * <p>
 * Each call ages the redundant entries and resets the others. Entries whose
 * item vanished from the pool are always selected; non-dynamic items are
 * aged but never selected.
 *
 * @param <T> the item type
 */
public final class AgeBasedElimination<T extends ManagedObject> {

    private final int maxAge;

    /**
     * @param maxAge number of consecutive redundant rounds before removal (at least 1)
     */
    public AgeBasedElimination(int maxAge) {
        if (maxAge < 1) {
            throw new IllegalArgumentException("maxAge must be at least 1: " + maxAge);
        }
        this.maxAge = maxAge;
    }

    /**
     * Update the redundant ages and select the entries to remove.
     *
     * @param redundant true for an item that was not binding in this round
     * @return strictly increasing positions to pass to {@link ActiveSet#remove(int[])}
     */
    public int[] select(ActiveSet<T> active, Predicate<? super T> redundant) {
        if (active == null || redundant == null) {
            throw new IllegalArgumentException("active and redundant required");
        }
        int[] selected = new int[active.count()];
        int k = 0;
        for (int i = 0; i < active.count(); i++) {
            T item = active.at(i);
            if (item == null) {
                selected[k++] = i;
                continue;
            }
            if (!redundant.test(item)) {
                active.resetRedundantAge(i);
                continue;
            }
            active.incrementRedundantAge(i);
            if (item.dynamic() && active.redundantAge(i) >= maxAge) {
                selected[k++] = i;
            }
        }
        return Arrays.copyOf(selected, k);
    }

    /**
     * {@link #select} and remove the selected entries.
     *
     * @return the number of removed entries
     */
    public int eliminate(ActiveSet<T> active, Predicate<? super T> redundant) {
        int[] selected = select(active, redundant);
        active.remove(selected);
        return selected.length;
    }

    /**
     * Redundancy test for constraints: non-binding when the absolute slack
     * exceeds {@code eps}.
     *
     * @param slack slack of a constraint in the current LP solution
     */
    public static <T extends ManagedObject> Predicate<T> nonBinding(ToDoubleFunction<? super T> slack, double eps) {
        if (slack == null) {
            throw new IllegalArgumentException("slack required");
        }
        if (eps < 0.0) {
            throw new IllegalArgumentException("eps must be non-negative: " + eps);
        }
        return item -> Math.abs(slack.applyAsDouble(item)) > eps;
    }

    /**
     * {@link #nonBinding(ToDoubleFunction, double)} with the configured {@code ConElimEps}.
     */
    public static <T extends ManagedObject> Predicate<T> nonBinding(ToDoubleFunction<? super T> slack,
                                                                    CutPoolConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        return nonBinding(slack, configuration.conElimEps());
    }

    public int maxAge() {
        return maxAge;
    }
}
