/**
 * Value types exchanged with the collaborators around the detection engine.
 *
 * <ul>
 * <li>{@link com.latencysentinel.core.model.CheckResult} — probe result from
 * the check scheduler</li>
 * <li>{@link com.latencysentinel.core.model.AnomalyVerdict} — classification
 * handed to the incident manager</li>
 * <li>{@link com.latencysentinel.core.model.AnomalyType} and
 * {@link com.latencysentinel.core.model.CheckStatus} — their enumerated
 * fields</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.latencysentinel.core.model;
