package org.crimenet.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.crimenet.runtime.spi.IRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class DurationDistributionTest {

    @Test
    void exponentialTruncatesAndNeverReturnsLessThanOneDay() {
        IRandomProvider random = mock(IRandomProvider.class);
        when(random.nextExponential(30.0)).thenReturn(0.4, 12.9);

        assertThat(DurationDistribution.EXPONENTIAL.draw(random, 30.0)).isEqualTo(1);
        assertThat(DurationDistribution.EXPONENTIAL.draw(random, 30.0)).isEqualTo(12);
    }

    @Test
    void fixedUsesTheRoundedMeanWithoutRandomness() {
        IRandomProvider random = mock(IRandomProvider.class);

        assertThat(DurationDistribution.FIXED.draw(random, 44.6)).isEqualTo(45);
        assertThat(DurationDistribution.FIXED.draw(random, 0.2)).isEqualTo(1);
        verifyNoInteractions(random);
    }
}
