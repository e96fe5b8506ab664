/**
 * Configuration loading and validation for latency anomaly detection.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.latencysentinel.core.config.SettingsLoader} into a
 * {@link com.latencysentinel.core.config.DetectionSettings} instance, which
 * is validated straight after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.latencysentinel.core.config;
