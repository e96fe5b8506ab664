package com.latencysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Objects;

/**
 * Result of classifying one latency sample against its history.
 *
 * <p>
 * Instances are immutable and created fresh for every classification call.
 * Serialized to JSON with the field names the incident manager consumes
 * ({@code anomalyDetected}, {@code anomalyType}, {@code anomalyScore},
 * {@code mean}, {@code stdDev}, {@code zScore}).
 * </p>
 *
 * <h3>Equality</h3>
 * <p>
 * Doubles are compared with {@link Double#compare(double, double)}, so two
 * verdicts are equal only when every statistic is bit-for-bit identical.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"anomalyDetected", "anomalyType", "anomalyScore", "mean", "stdDev", "zScore"})
public final class AnomalyVerdict implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Upper bound of {@link #getAnomalyScore()}. */
    public static final double MAX_SCORE = 100.0;

    private final boolean anomalyDetected;
    private final AnomalyType anomalyType;
    private final double anomalyScore;
    private final double mean;
    private final double stdDev;
    private final double zScore;

    @JsonCreator
    AnomalyVerdict(@JsonProperty("anomalyDetected") boolean anomalyDetected,
            @JsonProperty("anomalyType") AnomalyType anomalyType,
            @JsonProperty("anomalyScore") double anomalyScore,
            @JsonProperty("mean") double mean,
            @JsonProperty("stdDev") double stdDev,
            @JsonProperty("zScore") double zScore) {
        this.anomalyDetected = anomalyDetected;
        this.anomalyType = Objects.requireNonNull(anomalyType, "anomalyType must not be null");
        this.anomalyScore = anomalyScore;
        this.mean = mean;
        this.stdDev = stdDev;
        this.zScore = zScore;
    }

    /**
     * Verdict returned when the history is too short to say anything:
     * not anomalous, {@link AnomalyType#UNKNOWN}, score 0, the current value
     * standing in as the mean.
     *
     * @param currentValue the latency sample being classified
     * @return the fallback verdict
     */
    public static AnomalyVerdict insufficientHistory(double currentValue) {
        return builder()
                .anomalyDetected(false)
                .anomalyType(AnomalyType.UNKNOWN)
                .anomalyScore(0)
                .mean(currentValue)
                .stdDev(0)
                .zScore(0)
                .build();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnomalyVerdict}. The type defaults to
     * {@link AnomalyType#UNKNOWN}; all numbers default to 0.
     */
    public static class Builder {
        private boolean anomalyDetected;
        private AnomalyType anomalyType = AnomalyType.UNKNOWN;
        private double anomalyScore;
        private double mean;
        private double stdDev;
        private double zScore;

        public Builder anomalyDetected(boolean anomalyDetected) {
            this.anomalyDetected = anomalyDetected;
            return this;
        }

        public Builder anomalyType(AnomalyType anomalyType) {
            this.anomalyType = anomalyType;
            return this;
        }

        public Builder anomalyScore(double anomalyScore) {
            this.anomalyScore = anomalyScore;
            return this;
        }

        public Builder mean(double mean) {
            this.mean = mean;
            return this;
        }

        public Builder stdDev(double stdDev) {
            this.stdDev = stdDev;
            return this;
        }

        public Builder zScore(double zScore) {
            this.zScore = zScore;
            return this;
        }

        /**
         * @return a new {@link AnomalyVerdict}
         * @throws NullPointerException if the type was set to {@code null}
         */
        public AnomalyVerdict build() {
            return new AnomalyVerdict(anomalyDetected, anomalyType, anomalyScore, mean, stdDev, zScore);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("anomalyDetected")
    public boolean isAnomalyDetected() {
        return anomalyDetected;
    }

    @JsonProperty("anomalyType")
    public AnomalyType getAnomalyType() {
        return anomalyType;
    }

    /**
     * @return severity on a 0-100 scale, 100 meaning the z-score reached the
     *         configured threshold
     */
    @JsonProperty("anomalyScore")
    public double getAnomalyScore() {
        return anomalyScore;
    }

    @JsonProperty("mean")
    public double getMean() {
        return mean;
    }

    @JsonProperty("stdDev")
    public double getStdDev() {
        return stdDev;
    }

    @JsonProperty("zScore")
    public double getZScore() {
        return zScore;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyVerdict that))
            return false;
        return anomalyDetected == that.anomalyDetected
                && anomalyType == that.anomalyType
                && Double.compare(anomalyScore, that.anomalyScore) == 0
                && Double.compare(mean, that.mean) == 0
                && Double.compare(stdDev, that.stdDev) == 0
                && Double.compare(zScore, that.zScore) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(anomalyDetected, anomalyType, anomalyScore, mean, stdDev, zScore);
    }

    @Override
    public String toString() {
        return "AnomalyVerdict{" +
                "anomalyDetected=" + anomalyDetected +
                ", anomalyType=" + anomalyType.getWireValue() +
                ", anomalyScore=" + anomalyScore +
                ", mean=" + mean +
                ", stdDev=" + stdDev +
                ", zScore=" + zScore +
                '}';
    }
}
