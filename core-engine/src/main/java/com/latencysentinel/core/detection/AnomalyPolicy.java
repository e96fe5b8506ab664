package com.latencysentinel.core.detection;

import com.latencysentinel.core.model.AnomalyVerdict;

import java.io.Serializable;
import java.util.List;

/**
 * Contract for latency classification policies.
 * <p>
 * Implementations differ only in how they decide whether a sample is
 * anomalous and which {@link com.latencysentinel.core.model.AnomalyType} it
 * gets. All of them report the same baseline statistics and the same 0-100
 * score, so verdicts from different policies can be compared.
 * </p>
 * <p>
 * Policies are stateless and may be shared between threads. They are
 * {@link Serializable} so they can travel with a stream-processing operator.
 * </p>
 *
 * @since 1.0.0
 */
public interface AnomalyPolicy extends Serializable {

    /**
     * Classify a sample against its history.
     *
     * @param currentValue     latency of the latest probe in milliseconds
     * @param historicalValues earlier latencies, oldest first
     * @param windowSize       trailing samples used as baseline; must be &gt; 0
     * @param threshold        z-score threshold; must be a positive finite number
     * @return a new verdict
     */
    AnomalyVerdict classify(double currentValue, List<Double> historicalValues,
            int windowSize, double threshold);

    /**
     * Return the configuration name of this policy.
     *
     * @return policy name
     */
    String getName();
}
