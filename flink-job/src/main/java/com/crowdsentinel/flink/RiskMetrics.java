package com.crowdsentinel.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Custom Flink metric definitions for Crowd Sentinel.
 * <p>
 * Flink exposes these via its configured metric reporters (e.g. Prometheus).
 * The metric reporter is configured in {@code flink-conf.yaml} at cluster
 * level; the job only defines the metrics.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code samples_processed_total} - samples scored</li>
 *   <li>{@code samples_degraded_total} - scored samples with substituted fields</li>
 *   <li>{@code samples_rejected_total} - samples refused by the engine</li>
 *   <li>{@code alert_escalations_total} - upward alert transitions</li>
 *   <li>{@code processing_latency_ms} - histogram of per-sample latency</li>
 * </ul>
 */
public class RiskMetrics {

    private final Counter samplesProcessed;
    private final Counter samplesDegraded;
    private final Counter samplesRejected;
    private final Counter alertEscalations;
    private final Histogram processingLatency;

    public RiskMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("crowd_sentinel");

        this.samplesProcessed = group.counter("samples_processed_total");
        this.samplesDegraded = group.counter("samples_degraded_total");
        this.samplesRejected = group.counter("samples_rejected_total");
        this.alertEscalations = group.counter("alert_escalations_total");
        this.processingLatency = group
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementProcessed() {
        samplesProcessed.inc();
    }

    public void incrementDegraded() {
        samplesDegraded.inc();
    }

    public void incrementRejected() {
        samplesRejected.inc();
    }

    public void incrementEscalations() {
        alertEscalations.inc();
    }

    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }
}
