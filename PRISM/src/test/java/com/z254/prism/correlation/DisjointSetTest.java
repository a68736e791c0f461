package com.z254.prism.correlation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DisjointSet}.
 */
class DisjointSetTest {

    @Test
    @DisplayName("should connect elements transitively")
    void transitiveUnion() {
        DisjointSet set = new DisjointSet(5);

        assertThat(set.union(0, 1)).isTrue();
        assertThat(set.union(1, 2)).isTrue();
        assertThat(set.union(0, 2)).isFalse();

        assertThat(set.connected(0, 2)).isTrue();
        assertThat(set.connected(0, 3)).isFalse();
        assertThat(set.find(3)).isEqualTo(3);
        assertThat(set.size()).isEqualTo(5);
    }
}
