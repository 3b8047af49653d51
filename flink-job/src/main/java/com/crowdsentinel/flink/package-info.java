/**
 * Flink streaming job that scores crowd sensor samples per zone.
 *
 * <p>
 * {@link com.crowdsentinel.flink.CrowdRiskJob} reads raw samples from Kafka,
 * keys them by zone and runs each zone through its own
 * {@link com.crowdsentinel.core.engine.RiskEngine}. Snapshots and alert-level
 * transitions are written back to Kafka as JSON.
 * </p>
 *
 * @since 1.0.0
 */
package com.crowdsentinel.flink;
