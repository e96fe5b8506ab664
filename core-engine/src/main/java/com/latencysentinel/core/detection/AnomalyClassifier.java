package com.latencysentinel.core.detection;

import com.latencysentinel.core.config.DetectionSettings;
import com.latencysentinel.core.model.AnomalyType;
import com.latencysentinel.core.model.AnomalyVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Z-score classifier for a single latency sample against its history.
 *
 * <h3>Detection</h3>
 * <p>
 * The sample is anomalous when {@code |z| >= threshold}; the boundary is
 * inclusive. Positive anomalies are typed {@link AnomalyType#SPIKE} when the
 * sample is more than twice the baseline mean and
 * {@link AnomalyType#SLOWDOWN} otherwise. Negative anomalies (faster than
 * usual) are always {@link AnomalyType#UNKNOWN}.
 * </p>
 *
 * <h3>Score</h3>
 * <p>
 * {@code |z| / threshold * 100}, clamped to [0, 100], so a z-score exactly at
 * the threshold scores 100 whatever the configured threshold is.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * With fewer than {@value #MIN_HISTORY_SIZE} historical samples the verdict
 * is {@link AnomalyVerdict#insufficientHistory(double)}.
 * </p>
 *
 * <h3>Sigma-band predicates</h3>
 * <p>
 * {@link #isSpike} and {@link #isSlowdown} are a separate, simpler check with
 * fixed 2σ / 3σ bands. They ignore the threshold and do not agree with
 * {@link #detect}'s spike/slowdown split; callers pick one through
 * {@link AnomalyPolicy}.
 * </p>
 *
 * <p>
 * All methods are pure and thread-safe. The history list must not be mutated
 * while a call is in progress.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyClassifier.class);

    /** Minimum number of historical samples before anything can be flagged. */
    public static final int MIN_HISTORY_SIZE = 2;

    static final double SPIKE_SIGMAS = 3.0;
    static final double SLOWDOWN_SIGMAS = 2.0;

    /** Multiple of the baseline mean above which a positive anomaly is a spike. */
    static final double SPIKE_MEAN_MULTIPLIER = 2.0;

    private AnomalyClassifier() {
        // utility class — not instantiable
    }

    // ---------------------------------------------------------------
    // Full classification
    // ---------------------------------------------------------------

    /**
     * Classify with the default window and threshold.
     *
     * @see #detect(double, List, int, double)
     */
    public static AnomalyVerdict detect(double currentValue, List<Double> historicalValues) {
        return detect(currentValue, historicalValues,
                DetectionSettings.DEFAULT_WINDOW_SIZE, DetectionSettings.DEFAULT_THRESHOLD);
    }

    /**
     * Classify with the window and threshold of {@code settings}.
     *
     * @see #detect(double, List, int, double)
     */
    public static AnomalyVerdict detect(double currentValue, List<Double> historicalValues,
            DetectionSettings settings) {
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        return detect(currentValue, historicalValues, settings.getWindowSize(), settings.getThreshold());
    }

    /**
     * Classify {@code currentValue} against the trailing window of
     * {@code historicalValues}.
     *
     * @param currentValue     latency of the latest probe in milliseconds
     * @param historicalValues earlier latencies, oldest first; must not be
     *                         {@code null}
     * @param windowSize       trailing samples used as baseline; must be &gt; 0
     * @param threshold        z-score magnitude that flags an anomaly; must be
     *                         a positive finite number
     * @return a new verdict
     * @throws NullPointerException     if {@code historicalValues} is {@code null}
     * @throws IllegalArgumentException if {@code windowSize} or {@code threshold}
     *                                  is out of range
     */
    public static AnomalyVerdict detect(double currentValue, List<Double> historicalValues,
            int windowSize, double threshold) {
        requireValidArguments(historicalValues, windowSize);
        requireValidThreshold(threshold);

        if (historicalValues.size() < MIN_HISTORY_SIZE) {
            return AnomalyVerdict.insufficientHistory(currentValue);
        }

        double mean = RollingStatistics.rollingMean(historicalValues, windowSize);
        double stdDev = RollingStatistics.rollingStdDev(historicalValues, windowSize, mean);
        double zScore = RollingStatistics.zScore(currentValue, mean, stdDev);

        boolean detected = Math.abs(zScore) >= threshold;
        AnomalyType type = AnomalyType.UNKNOWN;
        if (detected && zScore > 0) {
            type = currentValue > mean * SPIKE_MEAN_MULTIPLIER ? AnomalyType.SPIKE : AnomalyType.SLOWDOWN;
        }

        LOG.debug("value={} mean={} stddev={} z={} threshold={} -> detected={} type={}",
                currentValue, mean, stdDev, zScore, threshold, detected, type);

        return AnomalyVerdict.builder()
                .anomalyDetected(detected)
                .anomalyType(type)
                .anomalyScore(score(zScore, threshold))
                .mean(mean)
                .stdDev(stdDev)
                .zScore(zScore)
                .build();
    }

    // ---------------------------------------------------------------
    // Sigma-band predicates
    // ---------------------------------------------------------------

    public static boolean isSpike(double currentValue, List<Double> historicalValues) {
        return isSpike(currentValue, historicalValues, DetectionSettings.DEFAULT_WINDOW_SIZE);
    }

    /**
     * @return {@code true} iff there are at least {@value #MIN_HISTORY_SIZE}
     *         historical samples and {@code currentValue > mean + 3σ}
     * @throws NullPointerException     if {@code historicalValues} is {@code null}
     * @throws IllegalArgumentException if {@code windowSize} &lt;= 0
     */
    public static boolean isSpike(double currentValue, List<Double> historicalValues, int windowSize) {
        requireValidArguments(historicalValues, windowSize);
        if (historicalValues.size() < MIN_HISTORY_SIZE) {
            return false;
        }
        double mean = RollingStatistics.rollingMean(historicalValues, windowSize);
        double stdDev = RollingStatistics.rollingStdDev(historicalValues, windowSize, mean);
        return aboveSpikeBand(currentValue, mean, stdDev);
    }

    public static boolean isSlowdown(double currentValue, List<Double> historicalValues) {
        return isSlowdown(currentValue, historicalValues, DetectionSettings.DEFAULT_WINDOW_SIZE);
    }

    /**
     * @return {@code true} iff there are at least {@value #MIN_HISTORY_SIZE}
     *         historical samples and
     *         {@code mean + 2σ < currentValue <= mean + 3σ}
     * @throws NullPointerException     if {@code historicalValues} is {@code null}
     * @throws IllegalArgumentException if {@code windowSize} &lt;= 0
     */
    public static boolean isSlowdown(double currentValue, List<Double> historicalValues, int windowSize) {
        requireValidArguments(historicalValues, windowSize);
        if (historicalValues.size() < MIN_HISTORY_SIZE) {
            return false;
        }
        double mean = RollingStatistics.rollingMean(historicalValues, windowSize);
        double stdDev = RollingStatistics.rollingStdDev(historicalValues, windowSize, mean);
        return inSlowdownBand(currentValue, mean, stdDev);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static boolean aboveSpikeBand(double value, double mean, double stdDev) {
        return value > mean + SPIKE_SIGMAS * stdDev;
    }

    static boolean inSlowdownBand(double value, double mean, double stdDev) {
        return value > mean + SLOWDOWN_SIGMAS * stdDev && value <= mean + SPIKE_SIGMAS * stdDev;
    }

    static double score(double zScore, double threshold) {
        return Math.min(AnomalyVerdict.MAX_SCORE, Math.max(0, Math.abs(zScore) / threshold * 100));
    }

    static void requireValidArguments(List<Double> historicalValues, int windowSize) {
        Objects.requireNonNull(historicalValues, "Historical values must not be null");
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be > 0, got: " + windowSize);
        }
    }

    static void requireValidThreshold(double threshold) {
        if (!(threshold > 0) || Double.isInfinite(threshold)) {
            throw new IllegalArgumentException(
                    "threshold must be a positive finite number, got: " + threshold);
        }
    }
}
