/**
 * Domain model classes for Crowd Sentinel.
 *
 * <p>
 * This package contains the value objects shared between the risk engine and
 * the Flink job layer:
 * </p>
 * <ul>
 * <li>{@link com.crowdsentinel.core.model.RawSample} - one raw sensor
 * reading</li>
 * <li>{@link com.crowdsentinel.core.model.IndexSet} - normalized indices in
 * [0,1]</li>
 * <li>{@link com.crowdsentinel.core.model.RiskSnapshot} - scored sample with
 * its alert level</li>
 * <li>{@link com.crowdsentinel.core.model.AlertLevel} - Green &lt; Yellow &lt;
 * Orange &lt; Red</li>
 * <li>{@link com.crowdsentinel.core.model.IngestResult} - accepted / degraded
 * / rejected outcome</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.crowdsentinel.core.model;
