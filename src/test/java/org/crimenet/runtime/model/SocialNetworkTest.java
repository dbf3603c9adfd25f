package org.crimenet.runtime.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class SocialNetworkTest {

    @Test
    void edgesAreUndirected() {
        SocialNetwork network = new SocialNetwork(4);

        assertThat(network.addEdge(0, 2)).isTrue();

        assertThat(network.hasEdge(2, 0)).isTrue();
        assertThat(network.neighbors(2)).containsExactly(0);
        assertThat(network.degree(0)).isEqualTo(1);
        assertThat(network.edgeCount()).isEqualTo(1);
    }

    @Test
    void duplicateAndMissingEdgesAreNoOps() {
        SocialNetwork network = new SocialNetwork(3);
        network.addEdge(0, 1);

        assertThat(network.addEdge(1, 0)).isFalse();
        assertThat(network.edgeCount()).isEqualTo(1);
        assertThat(network.removeEdge(1, 2)).isFalse();
        assertThat(network.removeEdge(1, 0)).isTrue();
        assertThat(network.edgeCount()).isZero();
        assertThat(network.neighbors(0)).isEmpty();
    }

    @Test
    void rejectsSelfLoopsAndUnknownNodes() {
        SocialNetwork network = new SocialNetwork(3);

        assertThatThrownBy(() -> network.addEdge(1, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> network.addEdge(0, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> network.neighbors(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SocialNetwork(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void neighborViewIsReadOnly() {
        SocialNetwork network = new SocialNetwork(3);
        network.addEdge(0, 1);

        assertThatThrownBy(() -> network.neighbors(0).add(2)).isInstanceOf(UnsupportedOperationException.class);
    }
}
