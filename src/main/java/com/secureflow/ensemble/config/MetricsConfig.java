package com.secureflow.ensemble.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicLong lastBenchmarkAccuracyBits;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        // raw bits of the last benchmark accuracy
        this.lastBenchmarkAccuracyBits = registry.gauge("ensemble.benchmark.accuracy",
                new AtomicLong(Double.doubleToLongBits(0.0)), v -> Double.longBitsToDouble(v.get()));
    }

    public void recordDetection(boolean anomaly, String severity, double finalScore) {
        Counter.builder("ensemble.detection.count")
                .tag("decision", anomaly ? "anomaly" : "normal")
                .tag("severity", severity)
                .register(registry)
                .increment();

        DistributionSummary.builder("ensemble.detection.final_score")
                .tag("decision", anomaly ? "anomaly" : "normal")
                .register(registry)
                .record(finalScore);
    }

    public void recordDetectorLatency(String detector, long elapsedNanos) {
        Timer.builder("ensemble.detector.latency")
                .tag("detector", detector)
                .register(registry)
                .record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void recordDetectorFailure(String detector, String reason) {
        Counter.builder("ensemble.detector.failure.count")
                .tag("detector", detector)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordRebalance() {
        Counter.builder("ensemble.rebalance.count")
                .register(registry)
                .increment();
    }

    public void recordBenchmark(double accuracy, boolean complete) {
        Counter.builder("ensemble.benchmark.count")
                .tag("complete", String.valueOf(complete))
                .register(registry)
                .increment();
        lastBenchmarkAccuracyBits.set(Double.doubleToLongBits(accuracy));
    }
}
