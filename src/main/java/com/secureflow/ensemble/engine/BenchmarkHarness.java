package com.secureflow.ensemble.engine;

import com.secureflow.ensemble.config.MetricsConfig;
import com.secureflow.ensemble.exception.AllDetectorsFailedException;
import com.secureflow.ensemble.exception.DetectionCancelledException;
import com.secureflow.ensemble.exception.InsufficientDataException;
import com.secureflow.ensemble.model.BenchmarkPrediction;
import com.secureflow.ensemble.model.BenchmarkReport;
import com.secureflow.ensemble.model.ConfusionMatrix;
import com.secureflow.ensemble.model.EnsembleResult;
import com.secureflow.ensemble.model.LabeledSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the orchestrator over a labeled dataset. The loop stops early on thread
 * interruption or when the deadline passes, returning what it has with
 * {@code complete = false}.
 */
class BenchmarkHarness {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkHarness.class);

    private final EnsembleOrchestrator orchestrator;
    private final MetricsConfig metrics;

    BenchmarkHarness(EnsembleOrchestrator orchestrator, MetricsConfig metrics) {
        this.orchestrator = orchestrator;
        this.metrics = metrics;
    }

    /**
     * @param deadlineNanos absolute {@link System#nanoTime()} deadline, or {@link Long#MAX_VALUE}
     */
    BenchmarkReport run(List<LabeledSample> dataset, long deadlineNanos) {
        if (dataset == null || dataset.isEmpty()) {
            throw new InsufficientDataException("Benchmark dataset is empty");
        }

        ConfusionMatrix matrix = new ConfusionMatrix();
        List<BenchmarkPrediction> predictions = new ArrayList<>(dataset.size());
        int processed = 0;
        int failed = 0;
        boolean complete = true;

        for (LabeledSample sample : dataset) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Benchmark interrupted after {} of {} samples", processed, dataset.size());
                complete = false;
                break;
            }
            if (expired(deadlineNanos)) {
                log.warn("Benchmark timed out after {} of {} samples", processed, dataset.size());
                complete = false;
                break;
            }

            EnsembleResult result;
            try {
                result = orchestrator.detect(sample.getVector(), deadlineNanos);
                if (expired(deadlineNanos) && !result.getExcludedDetectors().isEmpty()) {
                    // detectors were cut short by the deadline, not by their own failure
                    log.warn("Benchmark timed out during sample {} of {}", processed + 1, dataset.size());
                    complete = false;
                    break;
                }
            } catch (DetectionCancelledException e) {
                log.warn("Benchmark cancelled after {} of {} samples", processed, dataset.size());
                complete = false;
                break;
            } catch (AllDetectorsFailedException e) {
                if (expired(deadlineNanos)) {
                    log.warn("Benchmark timed out during sample {} of {}", processed + 1, dataset.size());
                    complete = false;
                    break;
                }
                log.warn("No detector could score benchmark sample {}, leaving it out of the metrics: {}",
                        processed + 1, e.getMessage());
                processed++;
                failed++;
                continue;
            }

            processed++;
            matrix.record(result.isFinalDecision(), sample.isAnomaly());
            predictions.add(new BenchmarkPrediction(result.isFinalDecision(), sample.isAnomaly(),
                    result.getFinalScore(), result.getConfidence()));
        }

        BenchmarkReport report = BenchmarkReport.builder()
                .accuracy(matrix.accuracy())
                .precision(matrix.precision())
                .recall(matrix.recall())
                .f1Score(matrix.f1Score())
                .falsePositiveRate(matrix.falsePositiveRate())
                .totalSamples(dataset.size())
                .evaluatedSamples(predictions.size())
                .failedSamples(failed)
                .truePositives(matrix.getTruePositives())
                .falsePositives(matrix.getFalsePositives())
                .trueNegatives(matrix.getTrueNegatives())
                .falseNegatives(matrix.getFalseNegatives())
                .predictions(predictions)
                .complete(complete)
                .build();

        metrics.recordBenchmark(report.getAccuracy(), complete);
        log.info("Benchmark finished: evaluated={}/{}, failed={}, accuracy={}, precision={}, recall={}, f1={}, fpr={}, complete={}",
                report.getEvaluatedSamples(), report.getTotalSamples(), failed,
                String.format("%.4f", report.getAccuracy()), String.format("%.4f", report.getPrecision()),
                String.format("%.4f", report.getRecall()), String.format("%.4f", report.getF1Score()),
                String.format("%.4f", report.getFalsePositiveRate()), complete);
        return report;
    }

    private static boolean expired(long deadlineNanos) {
        return deadlineNanos != Long.MAX_VALUE && System.nanoTime() - deadlineNanos >= 0;
    }
}
