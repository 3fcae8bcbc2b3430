package com.secureflow.ensemble.service;

import com.secureflow.ensemble.engine.EnsembleOrchestrator;
import com.secureflow.ensemble.model.AlgorithmResult;
import com.secureflow.ensemble.model.BenchmarkReport;
import com.secureflow.ensemble.model.DetectorType;
import com.secureflow.ensemble.model.EnsembleConfig;
import com.secureflow.ensemble.model.EnsembleResult;
import com.secureflow.ensemble.model.EnsembleStatistics;
import com.secureflow.ensemble.model.FeatureVector;
import com.secureflow.ensemble.model.LabeledSample;
import com.secureflow.ensemble.model.PerformanceSample;
import com.secureflow.ensemble.model.WeightTable;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Entry point for callers of the ensemble.
 *
 * Flow for a detection:
 * 1. The orchestrator scores the vector with every enabled detector concurrently
 * 2. Failed or timed-out detectors are dropped from the vote
 * 3. The configured voting strategy produces the final score and decision
 * 4. Anomalies are logged with the detectors that flagged them
 */
@Service
public class EnsembleDetectionService {

    private static final Logger log = LoggerFactory.getLogger(EnsembleDetectionService.class);

    private final EnsembleOrchestrator orchestrator;

    public EnsembleDetectionService(EnsembleOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Observed(name = "ensemble.detect", contextualName = "detect-anomaly")
    public EnsembleResult detect(FeatureVector vector) {
        EnsembleResult result = orchestrator.detect(vector);

        if (result.isFinalDecision()) {
            String flaggedBy = result.getAlgorithmResults().stream()
                    .filter(AlgorithmResult::isAnomaly)
                    .map(r -> r.getDetector().getId())
                    .collect(Collectors.joining(", "));
            log.info("Anomaly detected: score={}, severity={}, consensus={}, flaggedBy=[{}]",
                    String.format("%.3f", result.getFinalScore()), result.getSeverity(),
                    String.format("%.2f", result.getConsensus()), flaggedBy);
        }
        if (!result.getExcludedDetectors().isEmpty()) {
            log.warn("Detection completed without {}", result.getExcludedDetectors());
        }
        return result;
    }

    public EnsembleResult detect(List<Double> features) {
        return detect(FeatureVector.of(features));
    }

    @Observed(name = "ensemble.rebalance", contextualName = "rebalance-weights")
    public WeightTable rebalance(Map<DetectorType, PerformanceSample> feedback) {
        return orchestrator.rebalance(feedback);
    }

    @Observed(name = "ensemble.benchmark", contextualName = "run-benchmark")
    public BenchmarkReport benchmark(List<LabeledSample> dataset, Duration timeout) {
        log.info("Starting benchmark over {} samples (timeout={})", dataset == null ? 0 : dataset.size(), timeout);
        return timeout == null ? orchestrator.benchmark(dataset) : orchestrator.benchmark(dataset, timeout);
    }

    public void reconfigure(EnsembleConfig config) {
        orchestrator.reconfigure(config);
    }

    public EnsembleStatistics statistics() {
        return orchestrator.statistics();
    }
}
