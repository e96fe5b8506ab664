package com.latencysentinel.core.detection;

import com.latencysentinel.core.config.DetectionSettings;
import com.latencysentinel.core.model.AnomalyVerdict;

import java.util.List;

/**
 * Z-score detection with a relative-magnitude type split.
 *
 * <p>
 * Delegates to {@link AnomalyClassifier#detect(double, List, int, double)}:
 * flagged when {@code |z| >= threshold}, a positive anomaly is a spike above
 * twice the baseline mean and a slowdown below it.
 * </p>
 *
 * @since 1.0.0
 */
public class RelativeMagnitudePolicy implements AnomalyPolicy {

    private static final long serialVersionUID = 1L;

    @Override
    public AnomalyVerdict classify(double currentValue, List<Double> historicalValues,
            int windowSize, double threshold) {
        return AnomalyClassifier.detect(currentValue, historicalValues, windowSize, threshold);
    }

    @Override
    public String getName() {
        return DetectionSettings.POLICY_RELATIVE;
    }

    @Override
    public String toString() {
        return "RelativeMagnitudePolicy";
    }
}
