package com.secureflow.ensemble.config;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsConfigTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MetricsConfig metrics = new MetricsConfig(registry);

    @Test
    void recordDetection_tagsDecisionAndSeverity() {
        metrics.recordDetection(true, "HIGH", 0.7);
        metrics.recordDetection(false, "LOW", 0.1);

        assertThat(registry.get("ensemble.detection.count").tag("decision", "anomaly").tag("severity", "HIGH")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("ensemble.detection.final_score").tag("decision", "normal")
                .summary().totalAmount()).isEqualTo(0.1);
    }

    @Test
    void recordBenchmark_updatesAccuracyGauge() {
        assertThat(registry.get("ensemble.benchmark.accuracy").gauge().value()).isEqualTo(0.0);

        metrics.recordBenchmark(0.875, false);

        assertThat(registry.get("ensemble.benchmark.accuracy").gauge().value()).isEqualTo(0.875);
        assertThat(registry.get("ensemble.benchmark.count").tag("complete", "false").counter().count())
                .isEqualTo(1.0);
    }
}
