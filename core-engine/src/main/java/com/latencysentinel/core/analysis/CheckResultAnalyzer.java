package com.latencysentinel.core.analysis;

import com.latencysentinel.core.config.DetectionSettings;
import com.latencysentinel.core.detection.AnomalyPolicy;
import com.latencysentinel.core.detection.PolicyFactory;
import com.latencysentinel.core.model.AnomalyVerdict;
import com.latencysentinel.core.model.CheckResult;
import com.latencysentinel.core.model.CheckStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs the configured {@link AnomalyPolicy} against each incoming
 * {@link CheckResult}.
 *
 * <h3>Eligibility</h3>
 * <p>
 * Only checks with status {@link CheckStatus#UP} and a measured response time
 * are classified. Failed probes carry no meaningful latency, so they produce
 * no verdict at all.
 * </p>
 *
 * <h3>History</h3>
 * <p>
 * The storage layer hands over the service's previous latencies, oldest
 * first. Only the most recent {@code historyLimit} of them are passed to the
 * policy, which in turn uses its own trailing window.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * With fewer than two historical samples the policy returns
 * {@link AnomalyVerdict#insufficientHistory(double)}: not anomalous,
 * {@link com.latencysentinel.core.model.AnomalyType#UNKNOWN}, score 0. For a
 * newly monitored service an UNKNOWN verdict with a zero score therefore means
 * "still warming up", not "checked and found normal". An empty result is
 * reserved for ineligible checks.
 * </p>
 *
 * <p>
 * Holds only immutable configuration; safe for concurrent use.
 * </p>
 *
 * @since 1.0.0
 */
public class CheckResultAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(CheckResultAnalyzer.class);

    private final AnomalyPolicy policy;
    private final int windowSize;
    private final double threshold;
    private final int historyLimit;

    /**
     * @param settings detection settings; validated here
     * @throws NullPointerException  if {@code settings} is {@code null}
     * @throws IllegalStateException if {@code settings} is invalid
     */
    public CheckResultAnalyzer(DetectionSettings settings) {
        this(settings, PolicyFactory.create(validated(settings)));
    }

    /**
     * @param settings detection settings; validated here
     * @param policy   policy to use instead of the configured one
     */
    public CheckResultAnalyzer(DetectionSettings settings, AnomalyPolicy policy) {
        validated(settings);
        this.policy = Objects.requireNonNull(policy, "AnomalyPolicy must not be null");
        this.windowSize = settings.getWindowSize();
        this.threshold = settings.getThreshold();
        this.historyLimit = settings.getHistoryLimit();
        LOG.info("CheckResultAnalyzer created: policy={} windowSize={} threshold={} historyLimit={}",
                policy.getName(), windowSize, threshold, historyLimit);
    }

    /**
     * Classify one check result.
     *
     * @param check            the probe result; must not be {@code null}
     * @param historicalValues previous latencies of the same service, oldest
     *                         first; must not be {@code null}
     * @return the verdict, or empty if the check is not eligible
     */
    public Optional<AnomalyVerdict> analyze(CheckResult check, List<Double> historicalValues) {
        Objects.requireNonNull(check, "CheckResult must not be null");
        Objects.requireNonNull(historicalValues, "Historical values must not be null");

        if (check.getStatus() != CheckStatus.UP || !check.hasResponseTime()) {
            LOG.trace("Service [{}]: status={} responseTime={} – skipping",
                    check.getServiceId(), check.getStatus(), check.getResponseTimeMs());
            return Optional.empty();
        }

        AnomalyVerdict verdict = policy.classify(check.getResponseTimeMs(),
                recent(historicalValues), windowSize, threshold);

        if (verdict.isAnomalyDetected()) {
            LOG.info("Service [{}]: {} detected (score: {}, z-score: {})",
                    check.getServiceId(),
                    verdict.getAnomalyType().getWireValue(),
                    String.format(Locale.ROOT, "%.2f", verdict.getAnomalyScore()),
                    String.format(Locale.ROOT, "%.2f", verdict.getZScore()));
        }
        return Optional.of(verdict);
    }

    public AnomalyPolicy getPolicy() {
        return policy;
    }

    private List<Double> recent(List<Double> historicalValues) {
        int size = historicalValues.size();
        return size <= historyLimit ? historicalValues : historicalValues.subList(size - historyLimit, size);
    }

    private static DetectionSettings validated(DetectionSettings settings) {
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        settings.validate();
        return settings;
    }
}
