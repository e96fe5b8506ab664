package com.latencysentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RollingStatistics}.
 */
class RollingStatisticsTest {

    @Test
    @DisplayName("Mean of an empty sequence is zero")
    void meanOfEmptyIsZero() {
        assertThat(RollingStatistics.rollingMean(List.of(), 20)).isZero();
    }

    @Test
    @DisplayName("Mean uses the whole sequence when it is shorter than the window")
    void meanUsesAllWhenShorterThanWindow() {
        assertThat(RollingStatistics.rollingMean(List.of(10.0, 20.0, 30.0), 20)).isEqualTo(20.0);
    }

    @Test
    @DisplayName("Mean uses the whole sequence when it is exactly the window size")
    void meanUsesAllWhenEqualToWindow() {
        assertThat(RollingStatistics.rollingMean(List.of(10.0, 20.0, 30.0), 3)).isEqualTo(20.0);
    }

    @Test
    @DisplayName("Mean uses only the last windowSize samples")
    void meanUsesTrailingWindow() {
        List<Double> samples = List.of(1000.0, 1000.0, 10.0, 20.0);

        assertThat(RollingStatistics.rollingMean(samples, 2)).isEqualTo(15.0);
    }

    @Test
    @DisplayName("Standard deviation is the population deviation of the window")
    void stdDevIsPopulationDeviation() {
        // mean 5, squared diffs 9+1+1+1+0+0+4+16 = 32, / 8 = 4
        List<Double> samples = List.of(2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0);

        assertThat(RollingStatistics.rollingStdDev(samples, 20)).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Standard deviation uses only the last windowSize samples")
    void stdDevUsesTrailingWindow() {
        List<Double> samples = List.of(1000.0, 1000.0, 10.0, 20.0);

        assertThat(RollingStatistics.rollingStdDev(samples, 2)).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Standard deviation uses the supplied mean")
    void stdDevUsesSuppliedMean() {
        List<Double> samples = List.of(10.0, 20.0);

        // around 15 the deviation is 5; around 0 it is sqrt((100 + 400) / 2)
        assertThat(RollingStatistics.rollingStdDev(samples, 20, 15.0)).isEqualTo(5.0);
        assertThat(RollingStatistics.rollingStdDev(samples, 20, 0.0))
                .isCloseTo(Math.sqrt(250.0), within(1e-12));
    }

    @Test
    @DisplayName("Standard deviation of an empty or constant sequence is zero")
    void stdDevOfEmptyOrConstantIsZero() {
        assertThat(RollingStatistics.rollingStdDev(List.of(), 20)).isZero();
        assertThat(RollingStatistics.rollingStdDev(List.of(7.0, 7.0, 7.0), 20)).isZero();
    }

    @Test
    @DisplayName("Z-score is the signed distance in standard deviations")
    void zScoreIsSignedDistance() {
        assertThat(RollingStatistics.zScore(130, 100, 10)).isEqualTo(3.0);
        assertThat(RollingStatistics.zScore(70, 100, 10)).isEqualTo(-3.0);
    }

    @Test
    @DisplayName("Z-score is zero when the standard deviation is zero")
    void zScoreWithZeroStdDevIsZero() {
        assertThat(RollingStatistics.zScore(500, 100, 0)).isZero();
    }

    @Test
    @DisplayName("Should reject a non-positive window size")
    void shouldRejectNonPositiveWindow() {
        assertThatThrownBy(() -> RollingStatistics.rollingMean(List.of(1.0, 2.0), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("windowSize");
    }

    @Test
    @DisplayName("Should reject null samples")
    void shouldRejectNullSamples() {
        assertThatThrownBy(() -> RollingStatistics.rollingStdDev(null, 20))
                .isInstanceOf(NullPointerException.class);
    }
}
