package io.cutpool.kernel;

import io.cutpool.testutil.TestCut;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AbstractConVarTest {

    @Test
    void deletableOnlyWithoutReferencesAndLocks() {
        TestCut cut = TestCut.of("cut", 1, 1);
        assertThat(cut.deletable()).isTrue();

        cut.addReference();
        assertThat(cut.deletable()).isFalse();
        cut.lock();
        cut.removeReference();
        assertThat(cut.deletable()).isFalse();
        cut.unlock();

        assertThat(cut.deletable()).isTrue();
    }

    @Test
    void activationsAreCounted() {
        TestCut cut = TestCut.of("cut", 1, 1);
        cut.activate();
        cut.activate();
        cut.deactivate();

        assertThat(cut.active()).isTrue();
        assertThat(cut.deletable()).isTrue();

        cut.deactivate();
        assertThat(cut.active()).isFalse();
    }

    @Test
    void unbalancedCallsFailFast() {
        TestCut cut = TestCut.of("cut", 1, 1);

        assertThatThrownBy(cut::removeReference).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(cut::deactivate).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(cut::unlock).isInstanceOf(IllegalStateException.class);
        assertThat(cut.references()).isZero();
    }

    @Test
    void dynamicAndScopeFlags() {
        assertThat(TestCut.of("dynamic", 1, 1).dynamic()).isTrue();
        assertThat(TestCut.nonDynamic("static", 1, 1).dynamic()).isFalse();
        assertThat(TestCut.of("global", 1, 1).global()).isTrue();
        assertThat(TestCut.of("global", 1, 1).local()).isFalse();
    }

    @Test
    void managedObjectDefaultsRejectDeduplication() {
        ManagedObject plain = () -> true;

        assertThatThrownBy(plain::hashKey).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> plain.equal(plain)).isInstanceOf(UnsupportedOperationException.class);
        assertThat(plain.rank()).isZero();
        assertThat(plain.active()).isFalse();
        assertThat(plain.locked()).isFalse();
    }
}
