/**
 * Glue between the check scheduler's results and the detection engine.
 *
 * @since 1.0.0
 */
package com.latencysentinel.core.analysis;
