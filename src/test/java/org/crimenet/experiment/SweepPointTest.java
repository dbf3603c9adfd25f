package org.crimenet.experiment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.crimenet.runtime.metrics.RunSummary;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class SweepPointTest {

    private static RunSummary summary(long arrests, long wrongful, double meanCriminal) {
        return new RunSummary(10, 0, arrests, wrongful, 0, 0, 0,
                arrests == 0 ? 0.0 : (double) wrongful / arrests, meanCriminal, 0.0, 0.0, 0.0, 0.0, 0.0);
    }

    @Test
    void ratesArePooledOverArrestsNotAveraged() {
        SweepPoint point = new SweepPoint(0.04, List.of(summary(10, 5, 0.1), summary(30, 3, 0.3)));

        assertThat(point.totalArrests()).isEqualTo(40);
        assertThat(point.totalWrongfulDetentions()).isEqualTo(8);
        assertThat(point.pooledWrongfulDetentionRate()).isEqualTo(0.2);
        assertThat(point.meanCriminalShare()).isCloseTo(0.2, within(1e-12));
    }
}
