package com.latencysentinel.core.detection;

import com.latencysentinel.core.model.AnomalyType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RelativeMagnitudePolicy}.
 */
class RelativeMagnitudePolicyTest {

    private final RelativeMagnitudePolicy policy = new RelativeMagnitudePolicy();

    @Test
    @DisplayName("Should produce exactly the classifier's verdict")
    void shouldMatchClassifier() {
        List<Double> history = List.of(120.0, 80.0, 95.0, 130.0, 101.0, 99.0);

        for (double value : new double[] {0, 100, 160, 180, 400}) {
            assertThat(policy.classify(value, history, 5, 2.5))
                    .isEqualTo(AnomalyClassifier.detect(value, history, 5, 2.5));
        }
    }

    @Test
    @DisplayName("Should call a 3σ excursion below twice the mean a slowdown")
    void shouldUseRelativeSplit() {
        assertThat(policy.classify(104.5, List.of(100.0, 102.0), 20, 3).getAnomalyType())
                .isEqualTo(AnomalyType.SLOWDOWN);
    }
}
