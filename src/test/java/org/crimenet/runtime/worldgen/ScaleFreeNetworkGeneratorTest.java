package org.crimenet.runtime.worldgen;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.crimenet.runtime.internal.services.SeededRandomProvider;
import org.crimenet.runtime.model.SocialNetwork;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ScaleFreeNetworkGeneratorTest {

    @Test
    void everyNewNodeAddsExactlyMEdges() {
        SocialNetwork network = new ScaleFreeNetworkGenerator(3).generate(500, new SeededRandomProvider(42));

        assertThat(network.size()).isEqualTo(500);
        assertThat(network.edgeCount()).isEqualTo(3 + (500 - 4) * 3L);
        for (int node = 4; node < 500; node++) {
            assertThat(network.degree(node)).isGreaterThanOrEqualTo(3);
        }
        for (int node = 0; node < 500; node++) {
            assertThat(network.hasEdge(node, node)).isFalse();
        }
    }

    @Test
    void degreeDistributionIsHeavyTailed() {
        SocialNetwork network = new ScaleFreeNetworkGenerator(2).generate(2000, new SeededRandomProvider(5));

        int maxDegree = 0;
        for (int node = 0; node < network.size(); node++) {
            maxDegree = Math.max(maxDegree, network.degree(node));
        }
        double meanDegree = 2.0 * network.edgeCount() / network.size();

        assertThat(maxDegree).isGreaterThan((int) (5 * meanDegree));
    }

    @Test
    void sameSeedGivesSameNetwork() {
        SocialNetwork a = new ScaleFreeNetworkGenerator(3).generate(300, new SeededRandomProvider(11));
        SocialNetwork b = new ScaleFreeNetworkGenerator(3).generate(300, new SeededRandomProvider(11));

        for (int node = 0; node < 300; node++) {
            assertThat(a.neighbors(node)).isEqualTo(b.neighbors(node));
        }
    }

    @Test
    void smallestValidNetworkIsTheSeedStar() {
        SocialNetwork network = new ScaleFreeNetworkGenerator(2).generate(3, new SeededRandomProvider(1));

        assertThat(network.edgeCount()).isEqualTo(2);
        assertThat(network.neighbors(0)).containsExactlyInAnyOrder(1, 2);
    }

    @Test
    void rejectsInvalidAttachmentCounts() {
        assertThatThrownBy(() -> new ScaleFreeNetworkGenerator(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ScaleFreeNetworkGenerator(5).generate(5, new SeededRandomProvider(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
