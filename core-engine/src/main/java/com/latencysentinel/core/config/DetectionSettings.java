package com.latencysentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Tuning knobs for latency anomaly detection, loaded from configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * windowSize: 20
 * threshold: 3.0
 * historyLimit: 50
 * policy: relative
 * </pre>
 *
 * <p>
 * Every field has a default, so an empty document is a valid configuration.
 * Call {@link #validate()} after construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Trailing samples used as the statistical baseline. */
    public static final int DEFAULT_WINDOW_SIZE = 20;

    /** Z-score magnitude, in standard deviations, that flags an anomaly. */
    public static final double DEFAULT_THRESHOLD = 3.0;

    /** Most recent samples kept from the history handed over by storage. */
    public static final int DEFAULT_HISTORY_LIMIT = 50;

    public static final String POLICY_RELATIVE = "relative";
    public static final String POLICY_SIGMA_BAND = "sigma-band";

    private int windowSize = DEFAULT_WINDOW_SIZE;
    private double threshold = DEFAULT_THRESHOLD;
    private int historyLimit = DEFAULT_HISTORY_LIMIT;

    /** Classification policy name: "relative" or "sigma-band". */
    private String policy = POLICY_RELATIVE;

    /**
     * @return settings holding every default value
     */
    public static DetectionSettings defaults() {
        return new DetectionSettings();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that every field holds a legal value.
     *
     * @throws IllegalStateException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (windowSize <= 0) {
            errors.add("'windowSize' must be > 0, got: " + windowSize);
        }
        if (!(threshold > 0) || Double.isInfinite(threshold)) {
            errors.add("'threshold' must be a positive finite number, got: " + threshold);
        }
        if (historyLimit < 2) {
            errors.add("'historyLimit' must be >= 2, got: " + historyLimit);
        }
        if (policy == null || policy.isBlank()) {
            errors.add("'policy' is required");
        } else if (!POLICY_RELATIVE.equals(policy) && !POLICY_SIGMA_BAND.equals(policy)) {
            errors.add("Unknown policy: '" + policy + "'. Supported: "
                    + POLICY_RELATIVE + ", " + POLICY_SIGMA_BAND);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectionSettings: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = historyLimit;
    }

    public String getPolicy() {
        return policy;
    }

    /**
     * Set the policy name, normalised to lowercase.
     *
     * @param policy policy name
     */
    public void setPolicy(String policy) {
        this.policy = policy != null ? policy.trim().toLowerCase(Locale.ROOT) : null;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionSettings that))
            return false;
        return windowSize == that.windowSize
                && Double.compare(threshold, that.threshold) == 0
                && historyLimit == that.historyLimit
                && Objects.equals(policy, that.policy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(windowSize, threshold, historyLimit, policy);
    }

    @Override
    public String toString() {
        return "DetectionSettings{" +
                "windowSize=" + windowSize +
                ", threshold=" + threshold +
                ", historyLimit=" + historyLimit +
                ", policy='" + policy + '\'' +
                '}';
    }
}
