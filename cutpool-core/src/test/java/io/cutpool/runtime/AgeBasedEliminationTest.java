package io.cutpool.runtime;

import io.cutpool.kernel.ManagedObject;
import io.cutpool.storage.Handle;
import io.cutpool.storage.StandardPool;
import io.cutpool.testutil.FlagItem;
import io.cutpool.testutil.TestCut;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgeBasedEliminationTest {

    private final StandardPool<ManagedObject> pool = new StandardPool<>("mixed", 8, false);

    @Test
    void redundantItemIsRemovedAfterMaxAgeRounds() {
        TestCut binding = TestCut.of("binding", 0, 1);
        TestCut redundant = TestCut.of("redundant", 1, 1);
        ActiveSet<ManagedObject> active = new ActiveSet<>(2);
        active.insert(pool.insert(binding));
        active.insert(pool.insert(redundant));
        AgeBasedElimination<ManagedObject> elimination = new AgeBasedElimination<>(2);

        assertThat(elimination.eliminate(active, Set.of(redundant)::contains)).isZero();
        assertThat(active.redundantAge(1)).isEqualTo(1);

        assertThat(elimination.eliminate(active, Set.of(redundant)::contains)).isEqualTo(1);
        assertThat(active.count()).isEqualTo(1);
        assertThat(active.at(0)).isSameAs(binding);
        assertThat(redundant.deletable()).isTrue();
    }

    @Test
    void bindingRoundResetsAge() {
        TestCut cut = TestCut.of("cut", 1, 1);
        ActiveSet<ManagedObject> active = new ActiveSet<>(1);
        active.insert(pool.insert(cut));
        AgeBasedElimination<ManagedObject> elimination = new AgeBasedElimination<>(2);

        elimination.eliminate(active, item -> true);
        elimination.eliminate(active, item -> false);
        assertThat(active.redundantAge(0)).isZero();

        assertThat(elimination.eliminate(active, item -> true)).isZero();
        assertThat(active.count()).isEqualTo(1);
    }

    @Test
    void nonDynamicItemsAreAgedButKept() {
        TestCut pinned = TestCut.nonDynamic("pinned", 1, 1);
        ActiveSet<ManagedObject> active = new ActiveSet<>(1);
        active.insert(pool.insert(pinned));
        AgeBasedElimination<ManagedObject> elimination = new AgeBasedElimination<>(1);

        assertThat(elimination.select(active, item -> true)).isEmpty();
        assertThat(elimination.select(active, item -> true)).isEmpty();
        assertThat(active.redundantAge(0)).isEqualTo(2);
    }

    @Test
    void vanishedItemsAreAlwaysSelected() {
        Handle<ManagedObject> gone = pool.insert(FlagItem.deletable("gone"));
        Handle<ManagedObject> kept = pool.insert(TestCut.of("kept", 0, 1));
        ActiveSet<ManagedObject> active = new ActiveSet<>(2);
        active.insert(gone);
        active.insert(kept);
        pool.remove(gone);

        int[] selected = new AgeBasedElimination<ManagedObject>(5).select(active, item -> false);

        assertThat(selected).containsExactly(0);
    }

    @Test
    void nonBindingComparesAbsoluteSlackWithTolerance() {
        Predicate<TestCut> nonBinding = AgeBasedElimination.nonBinding(cut -> cut.violation(new double[]{1.0}), 0.01);

        assertThat(nonBinding.test(TestCut.of("tight", 1, 1))).isFalse();
        assertThat(nonBinding.test(TestCut.of("slack", 2, 1))).isTrue();
        assertThat(nonBinding.test(TestCut.of("violated", 0, 1))).isTrue();
        assertThatThrownBy(() -> AgeBasedElimination.<TestCut>nonBinding(cut -> 0.0, -1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void maxAgeMustBePositive() {
        assertThatThrownBy(() -> new AgeBasedElimination<ManagedObject>(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
