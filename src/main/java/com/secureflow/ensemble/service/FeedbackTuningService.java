package com.secureflow.ensemble.service;

import com.secureflow.ensemble.config.FeedbackConfig;
import com.secureflow.ensemble.engine.EnsembleOrchestrator;
import com.secureflow.ensemble.model.AlgorithmResult;
import com.secureflow.ensemble.model.ConfusionMatrix;
import com.secureflow.ensemble.model.DetectorType;
import com.secureflow.ensemble.model.EnsembleResult;
import com.secureflow.ensemble.model.PerformanceSample;
import com.secureflow.ensemble.model.WeightTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Turns ground-truth outcomes into performance feedback.
 *
 * Each labeled outcome is scored against every detector's own decision in that result.
 * Periodically, detectors with enough outcomes get a {@link PerformanceSample} built from
 * their confusion matrix, and the ensemble is rebalanced.
 */
@Service
public class FeedbackTuningService {

    private static final Logger log = LoggerFactory.getLogger(FeedbackTuningService.class);

    private final EnsembleOrchestrator orchestrator;
    private final FeedbackConfig feedbackConfig;
    private final Map<DetectorType, ConfusionMatrix> outcomes = new EnumMap<>(DetectorType.class);

    public FeedbackTuningService(EnsembleOrchestrator orchestrator, FeedbackConfig feedbackConfig) {
        this.orchestrator = orchestrator;
        this.feedbackConfig = feedbackConfig;
    }

    /**
     * Record the true label of an earlier detection.
     */
    public synchronized void recordOutcome(EnsembleResult result, boolean actualAnomaly) {
        for (AlgorithmResult algorithmResult : result.getAlgorithmResults()) {
            outcomes.computeIfAbsent(algorithmResult.getDetector(), k -> new ConfusionMatrix())
                    .record(algorithmResult.isAnomaly(), actualAnomaly);
        }
    }

    public synchronized long pendingOutcomes(DetectorType detector) {
        ConfusionMatrix matrix = outcomes.get(detector);
        return matrix == null ? 0 : matrix.total();
    }

    @Scheduled(fixedRateString = "${ensemble.feedback.tuning-interval-minutes:60}",
               timeUnit = TimeUnit.MINUTES,
               initialDelayString = "${ensemble.feedback.tuning-interval-minutes:60}")
    public void tuneWeights() {
        if (!feedbackConfig.isEnabled()) {
            return;
        }
        log.info("Starting ensemble weight tuning cycle...");

        Map<DetectorType, PerformanceSample> samples = new EnumMap<>(DetectorType.class);
        synchronized (this) {
            for (Map.Entry<DetectorType, ConfusionMatrix> entry : outcomes.entrySet()) {
                ConfusionMatrix matrix = entry.getValue();
                if (matrix.total() < feedbackConfig.getMinSamplesForTuning()) {
                    log.debug("Detector {} has only {} outcomes (min {}). Skipping.",
                            entry.getKey().getId(), matrix.total(), feedbackConfig.getMinSamplesForTuning());
                    continue;
                }
                samples.put(entry.getKey(), PerformanceSample.fromConfusionMatrix(matrix));
            }
            samples.keySet().forEach(outcomes::remove);
        }

        if (samples.isEmpty()) {
            log.info("No detector has enough outcomes. Skipping tuning cycle.");
            return;
        }

        WeightTable weights = orchestrator.rebalance(samples);
        log.info("Ensemble weight tuning cycle complete. {} detectors tuned, weights={}",
                samples.size(), weights.asMap());
    }
}
