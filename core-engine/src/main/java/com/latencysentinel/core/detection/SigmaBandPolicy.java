package com.latencysentinel.core.detection;

import com.latencysentinel.core.config.DetectionSettings;
import com.latencysentinel.core.model.AnomalyType;
import com.latencysentinel.core.model.AnomalyVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fixed σ-band classification.
 *
 * <ul>
 * <li>{@code value > mean + 3σ} — {@link AnomalyType#SPIKE}</li>
 * <li>{@code mean + 2σ < value <= mean + 3σ} — {@link AnomalyType#SLOWDOWN}</li>
 * <li>anything else — not anomalous, {@link AnomalyType#UNKNOWN}</li>
 * </ul>
 *
 * <p>
 * The bands match {@link AnomalyClassifier#isSpike} and
 * {@link AnomalyClassifier#isSlowdown}. The threshold does not move the
 * bands; it only normalises the reported score. With a constant history
 * (σ = 0) any value above the mean falls in the spike band.
 * </p>
 *
 * @since 1.0.0
 */
public class SigmaBandPolicy implements AnomalyPolicy {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SigmaBandPolicy.class);

    @Override
    public AnomalyVerdict classify(double currentValue, List<Double> historicalValues,
            int windowSize, double threshold) {
        AnomalyClassifier.requireValidArguments(historicalValues, windowSize);
        AnomalyClassifier.requireValidThreshold(threshold);

        if (historicalValues.size() < AnomalyClassifier.MIN_HISTORY_SIZE) {
            return AnomalyVerdict.insufficientHistory(currentValue);
        }

        double mean = RollingStatistics.rollingMean(historicalValues, windowSize);
        double stdDev = RollingStatistics.rollingStdDev(historicalValues, windowSize, mean);
        double zScore = RollingStatistics.zScore(currentValue, mean, stdDev);

        AnomalyType type = AnomalyType.UNKNOWN;
        if (AnomalyClassifier.aboveSpikeBand(currentValue, mean, stdDev)) {
            type = AnomalyType.SPIKE;
        } else if (AnomalyClassifier.inSlowdownBand(currentValue, mean, stdDev)) {
            type = AnomalyType.SLOWDOWN;
        }
        boolean detected = type != AnomalyType.UNKNOWN;

        LOG.debug("value={} mean={} stddev={} z={} -> detected={} type={}",
                currentValue, mean, stdDev, zScore, detected, type);

        return AnomalyVerdict.builder()
                .anomalyDetected(detected)
                .anomalyType(type)
                .anomalyScore(AnomalyClassifier.score(zScore, threshold))
                .mean(mean)
                .stdDev(stdDev)
                .zScore(zScore)
                .build();
    }

    @Override
    public String getName() {
        return DetectionSettings.POLICY_SIGMA_BAND;
    }

    @Override
    public String toString() {
        return "SigmaBandPolicy";
    }
}
