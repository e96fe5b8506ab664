package com.latencysentinel.core.detection;

import java.util.List;
import java.util.Objects;

/**
 * Windowed statistics over a chronological sample sequence (oldest first).
 *
 * <h3>Windowing</h3>
 * <p>
 * Every method looks at the last {@code windowSize} samples. When the
 * sequence is shorter than the window, all available samples are used; no
 * padding is applied. An empty sequence yields {@code 0}.
 * </p>
 *
 * <p>
 * The standard deviation is the <strong>population</strong> deviation
 * (divided by the window count, not count − 1): the window is the whole
 * recent history, not a sample of it.
 * </p>
 *
 * @since 1.0.0
 */
public final class RollingStatistics {

    private RollingStatistics() {
        // utility class — not instantiable
    }

    /**
     * Arithmetic mean of the trailing window.
     *
     * @param samples    chronological samples; must not be {@code null}
     * @param windowSize maximum number of trailing samples to use; must be &gt; 0
     * @return the mean, or {@code 0} if {@code samples} is empty
     * @throws NullPointerException     if {@code samples} is {@code null}
     * @throws IllegalArgumentException if {@code windowSize} &lt;= 0
     */
    public static double rollingMean(List<Double> samples, int windowSize) {
        List<Double> window = window(samples, windowSize);
        if (window.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (double v : window) {
            sum += v;
        }
        return sum / window.size();
    }

    /**
     * Population standard deviation of the trailing window.
     *
     * @param samples    chronological samples; must not be {@code null}
     * @param windowSize maximum number of trailing samples to use; must be &gt; 0
     * @return the standard deviation, or {@code 0} if {@code samples} is empty
     */
    public static double rollingStdDev(List<Double> samples, int windowSize) {
        return rollingStdDev(samples, windowSize, rollingMean(samples, windowSize));
    }

    /**
     * Population standard deviation of the trailing window around a mean the
     * caller already computed.
     *
     * <p>
     * {@code mean} must come from {@link #rollingMean(List, int)} with the same
     * {@code samples} and {@code windowSize}; it is not recomputed.
     * </p>
     *
     * @param samples    chronological samples; must not be {@code null}
     * @param windowSize maximum number of trailing samples to use; must be &gt; 0
     * @param mean       the mean of the same window
     * @return the standard deviation, or {@code 0} if {@code samples} is empty
     */
    public static double rollingStdDev(List<Double> samples, int windowSize, double mean) {
        List<Double> window = window(samples, windowSize);
        if (window.isEmpty()) {
            return 0;
        }
        double sumSquaredDiff = 0;
        for (double v : window) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / window.size());
    }

    /**
     * Signed distance of {@code value} from {@code mean} in standard
     * deviations.
     *
     * @return {@code (value - mean) / stdDev}, or {@code 0} when
     *         {@code stdDev == 0}
     */
    public static double zScore(double value, double mean, double stdDev) {
        if (stdDev == 0) {
            return 0;
        }
        return (value - mean) / stdDev;
    }

    static List<Double> window(List<Double> samples, int windowSize) {
        Objects.requireNonNull(samples, "Samples must not be null");
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be > 0, got: " + windowSize);
        }
        int size = samples.size();
        return size <= windowSize ? samples : samples.subList(size - windowSize, size);
    }
}
