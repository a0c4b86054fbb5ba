package io.cutpool.index;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentHashIndexTest {

    @Test
    void addAndLookup() {
        ContentHashIndex<String> index = new ContentHashIndex<>();
        index.add(1L, "a");
        index.add(1L, "b");
        index.add(2L, "c");

        assertThat(index.lookup(1L)).containsExactly("a", "b");
        assertThat(index.lookup(2L)).containsExactly("c");
        assertThat(index.lookup(3L)).isEmpty();
        assertThat(index.size()).isEqualTo(3);
        assertThat(index.keyCount()).isEqualTo(2);
        assertThat(index.collisions()).isEqualTo(1);
    }

    @Test
    void lookupIsReadOnly() {
        ContentHashIndex<String> index = new ContentHashIndex<>();
        index.add(1L, "a");

        assertThatThrownBy(() -> index.lookup(1L).add("b"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void removeMatchesByIdentity() {
        ContentHashIndex<String> index = new ContentHashIndex<>();
        String stored = new String("a");
        String equalCopy = new String("a");
        index.add(1L, stored);

        assertThat(index.remove(1L, equalCopy)).isFalse();
        assertThat(index.remove(2L, stored)).isFalse();
        assertThat(index.remove(1L, stored)).isTrue();
        assertThat(index.lookup(1L)).isEmpty();
        assertThat(index.keyCount()).isZero();
        assertThat(index.size()).isZero();
    }

    @Test
    void findReturnsFirstMatch() {
        ContentHashIndex<String> index = new ContentHashIndex<>();
        index.add(5L, "apple");
        index.add(5L, "avocado");
        index.add(5L, "banana");

        assertThat(index.find(5L, s -> s.startsWith("a"))).isEqualTo("apple");
        assertThat(index.find(5L, s -> s.startsWith("b"))).isEqualTo("banana");
        assertThat(index.find(5L, s -> s.startsWith("c"))).isNull();
        assertThat(index.find(6L, s -> true)).isNull();
    }

    @Test
    void removeAllAndClear() {
        ContentHashIndex<String> index = new ContentHashIndex<>();
        index.add(1L, "a");
        index.add(1L, "b");
        index.add(2L, "c");

        index.removeAll(1L);
        assertThat(index.size()).isEqualTo(1);
        assertThat(index.collisions()).isZero();

        index.clear();
        assertThat(index.size()).isZero();
        assertThat(index.keyCount()).isZero();
    }

    @Test
    void nullValueIsRejected() {
        ContentHashIndex<String> index = new ContentHashIndex<>();

        assertThatThrownBy(() -> index.add(1L, null)).isInstanceOf(NullPointerException.class);
        assertThat(index.remove(1L, null)).isFalse();
    }
}
