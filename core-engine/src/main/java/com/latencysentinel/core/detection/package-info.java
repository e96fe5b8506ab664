/**
 * Statistical latency anomaly detection.
 *
 * <p>
 * {@link com.latencysentinel.core.detection.RollingStatistics} holds the
 * windowed mean / standard deviation / z-score primitives and
 * {@link com.latencysentinel.core.detection.AnomalyClassifier} turns them
 * into a verdict. Two classification policies implement
 * {@link com.latencysentinel.core.detection.AnomalyPolicy}:
 * </p>
 * <ul>
 * <li>{@link com.latencysentinel.core.detection.RelativeMagnitudePolicy} —
 * z-score threshold, spike when above twice the mean</li>
 * <li>{@link com.latencysentinel.core.detection.SigmaBandPolicy} — fixed
 * 2σ / 3σ bands</li>
 * </ul>
 * <p>
 * The two disagree on purpose for some inputs; pick one in configuration
 * and create it with
 * {@link com.latencysentinel.core.detection.PolicyFactory}.
 * </p>
 *
 * @since 1.0.0
 */
package com.latencysentinel.core.detection;
