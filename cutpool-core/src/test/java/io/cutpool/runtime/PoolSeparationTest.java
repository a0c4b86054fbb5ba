package io.cutpool.runtime;

import io.cutpool.storage.Handle;
import io.cutpool.storage.StandardPool;
import io.cutpool.testutil.TestCut;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.ToDoubleFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PoolSeparationTest {

    private static final double[] POINT = {1.0, 1.0};
    private static final ToDoubleFunction<TestCut> VIOLATION = cut -> cut.violation(POINT);

    private StandardPool<TestCut> pool;
    private Handle<TestCut> violated;
    private Handle<TestCut> negative;
    private Handle<TestCut> slack;
    private Handle<TestCut> active;

    @BeforeEach
    void setUp() {
        pool = new StandardPool<>("cuts", 8, false);
        violated = pool.insert(TestCut.of("violated", 0, 1, 1).rank(7.0));
        negative = pool.insert(TestCut.of("negative", 5, 1, 1));
        slack = pool.insert(TestCut.of("slack", 2, 1, 1));
        active = pool.insert(TestCut.of("active", 0, 3, 3));
        new ActiveSet<TestCut>(1).insert(active);
    }

    @Test
    void buffersInactiveViolatedItemsAndKeepsThemInPool() {
        PoolSeparation<TestCut> separation = new PoolSeparation<>(0.5, PoolSeparation.Ranking.ABS_VIOLATION);
        StagingBuffer<TestCut> buffer = new StagingBuffer<>(4);

        int added = separation.separate(pool, VIOLATION, buffer);

        assertThat(added).isEqualTo(2);
        assertThat(buffer.handle(0)).isEqualTo(violated);
        assertThat(buffer.handle(1)).isEqualTo(negative);
        assertThat(buffer.rank(0)).isEqualTo(2.0);
        assertThat(buffer.rank(1)).isEqualTo(3.0);
        assertThat(buffer.keepInPool(0)).isTrue();

        List<Handle<TestCut>> out = new ArrayList<>();
        buffer.extract(1, out);

        assertThat(out).containsExactly(negative);
        assertThat(violated.isLive()).isTrue();
        assertThat(pool.count()).isEqualTo(4);
    }

    @Test
    void rankingModes() {
        StagingBuffer<TestCut> byViolation = new StagingBuffer<>(4);
        new PoolSeparation<TestCut>(0.5, PoolSeparation.Ranking.VIOLATION).separate(pool, VIOLATION, byViolation);
        assertThat(byViolation.rank(1)).isEqualTo(-3.0);
        byViolation.extract(0, new ArrayList<>());

        StagingBuffer<TestCut> byItem = new StagingBuffer<>(4);
        new PoolSeparation<TestCut>(0.5, PoolSeparation.Ranking.ITEM_RANK).separate(pool, VIOLATION, byItem);
        assertThat(byItem.rank(0)).isEqualTo(7.0);
        byItem.extract(0, new ArrayList<>());

        StagingBuffer<TestCut> unranked = new StagingBuffer<>(4);
        new PoolSeparation<TestCut>(0.5, PoolSeparation.Ranking.NONE).separate(pool, VIOLATION, unranked);
        assertThat(unranked.ranked()).isFalse();
    }

    @Test
    void lockedItemsAreSkipped() {
        StagingBuffer<TestCut> first = new StagingBuffer<>(4);
        PoolSeparation<TestCut> separation = new PoolSeparation<>(0.5, PoolSeparation.Ranking.VIOLATION);
        separation.separate(pool, VIOLATION, first);

        StagingBuffer<TestCut> second = new StagingBuffer<>(4);
        int added = separation.separate(pool, VIOLATION, second);

        assertThat(added).isZero();
        assertThat(slack.isLive()).isTrue();
    }

    @Test
    void stopsWhenBufferIsFull() {
        StagingBuffer<TestCut> buffer = new StagingBuffer<>(1);

        int added = new PoolSeparation<TestCut>(0.0, PoolSeparation.Ranking.NONE).separate(pool, VIOLATION, buffer);

        assertThat(added).isEqualTo(1);
        assertThat(buffer.handle(0)).isEqualTo(violated);
    }

    @Test
    void constructorValidatesArguments() {
        assertThatThrownBy(() -> new PoolSeparation<TestCut>(-0.1, PoolSeparation.Ranking.NONE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PoolSeparation<TestCut>(0.1, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
