package io.cutpool.storage;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FreeSlotListTest {

    @Test
    void popReturnsMostRecentlyPushedFirst() {
        FreeSlotList list = new FreeSlotList(2);
        list.push(3);
        list.push(7);
        list.push(1);

        assertThat(list.size()).isEqualTo(3);
        assertThat(list.pop()).isEqualTo(1);
        assertThat(list.pop()).isEqualTo(7);
        assertThat(list.pop()).isEqualTo(3);
        assertThat(list.pop()).isEqualTo(-1);
        assertThat(list.isEmpty()).isTrue();
    }

    @Test
    void clearEmptiesList() {
        FreeSlotList list = new FreeSlotList();
        list.push(0);
        list.clear();

        assertThat(list.isEmpty()).isTrue();
        assertThat(list.pop()).isEqualTo(-1);
    }

    @Test
    void negativeIndexIsRejected() {
        FreeSlotList list = new FreeSlotList();

        assertThatThrownBy(() -> list.push(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FreeSlotList(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
