package com.secureflow.ensemble.engine;

import com.secureflow.ensemble.config.MetricsConfig;
import com.secureflow.ensemble.exception.AllDetectorsFailedException;
import com.secureflow.ensemble.exception.ConfigurationException;
import com.secureflow.ensemble.exception.DetectionCancelledException;
import com.secureflow.ensemble.exception.DetectionException;
import com.secureflow.ensemble.model.AlgorithmResult;
import com.secureflow.ensemble.model.BenchmarkReport;
import com.secureflow.ensemble.model.DetectorType;
import com.secureflow.ensemble.model.EnsembleConfig;
import com.secureflow.ensemble.model.EnsembleResult;
import com.secureflow.ensemble.model.EnsembleStatistics;
import com.secureflow.ensemble.model.FeatureVector;
import com.secureflow.ensemble.model.LabeledSample;
import com.secureflow.ensemble.model.PerformanceProfile;
import com.secureflow.ensemble.model.PerformanceSample;
import com.secureflow.ensemble.model.WeightTable;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Runs the enabled detectors against a feature vector and combines their results.
 *
 * Detection reads one immutable {@link EnsembleState} snapshot per call and never locks.
 * {@link #rebalance(Map)} and {@link #reconfigure(EnsembleConfig)} are serialized by a
 * writer lock and publish a new snapshot atomically, so concurrent detections always see
 * a consistent weight table.
 */
public class EnsembleOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(EnsembleOrchestrator.class);

    private static final long QUEUE_POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(5);

    private final DetectorRegistry registry;
    private final List<FeatureVector> reference;
    private final ExecutorService executor;
    private final MetricsConfig metrics;
    private final EnsembleAggregator aggregator = new EnsembleAggregator();
    private final WeightCalculator weightCalculator = new WeightCalculator();
    private final BenchmarkHarness benchmarkHarness;

    private final AtomicReference<EnsembleState> state = new AtomicReference<>();
    private final ReentrantLock writeLock = new ReentrantLock();
    /** Every detector trained so far, including ones disabled by a later reconfigure. Guarded by writeLock. */
    private final Map<DetectorType, AnomalyDetector> trained = new EnumMap<>(DetectorType.class);

    private EnsembleOrchestrator(DetectorRegistry registry, List<FeatureVector> reference,
                                 ExecutorService executor, MetricsConfig metrics) {
        this.registry = registry;
        this.reference = List.copyOf(reference);
        this.executor = executor;
        this.metrics = metrics;
        this.benchmarkHarness = new BenchmarkHarness(this, metrics);
    }

    /**
     * Validate the configuration, train every enabled detector on the reference corpus and
     * compute the initial weights.
     *
     * @throws ConfigurationException if the configuration is invalid
     * @throws com.secureflow.ensemble.exception.InsufficientDataException if the reference
     *         corpus is empty, ragged or non-finite
     */
    public static EnsembleOrchestrator configure(EnsembleConfig config, DetectorRegistry registry,
                                                 List<FeatureVector> reference, ExecutorService executor,
                                                 MetricsConfig metrics) {
        if (config == null) {
            throw new ConfigurationException("Ensemble configuration is required");
        }
        config.validate();
        if (registry == null || executor == null || metrics == null) {
            throw new ConfigurationException("Detector registry, executor and metrics are required");
        }
        if (reference == null) {
            throw new ConfigurationException("Reference corpus is required");
        }

        EnsembleOrchestrator orchestrator = new EnsembleOrchestrator(registry, reference, executor, metrics);
        orchestrator.writeLock.lock();
        try {
            orchestrator.publish(config);
        } finally {
            orchestrator.writeLock.unlock();
        }
        return orchestrator;
    }

    /**
     * Built-in detectors with default hyperparameters and an in-memory meter registry.
     */
    public static EnsembleOrchestrator configure(EnsembleConfig config, List<FeatureVector> reference,
                                                 ExecutorService executor) {
        return configure(config, DetectorRegistry.withDefaults(), reference, executor,
                new MetricsConfig(new SimpleMeterRegistry()));
    }

    /**
     * Score a feature vector with every enabled detector and vote.
     *
     * @throws AllDetectorsFailedException if no detector produced a result
     * @throws DetectionCancelledException if the calling thread was interrupted
     */
    public EnsembleResult detect(FeatureVector vector) {
        return detect(vector, Long.MAX_VALUE);
    }

    /**
     * Detection bounded by an absolute {@link System#nanoTime()} deadline on top of the
     * per-detector timeout. Each detector's timeout starts when a pool thread begins running
     * it; time spent queued behind other callers only counts against the deadline.
     */
    EnsembleResult detect(FeatureVector vector, long deadlineNanos) {
        EnsembleState snapshot = state.get();
        EnsembleConfig config = snapshot.getConfig();
        long timeoutNanos = config.getDetectorTimeout().toNanos();

        List<DetectorType> order = new ArrayList<>(snapshot.getDetectors().keySet());
        List<DetectorTask> tasks = new ArrayList<>(order.size());
        List<Future<AlgorithmResult>> futures = new ArrayList<>(order.size());
        for (DetectorType type : order) {
            DetectorTask task = new DetectorTask(snapshot.getDetectors().get(type), vector);
            tasks.add(task);
            futures.add(executor.submit(task));
        }

        List<AlgorithmResult> results = new ArrayList<>(order.size());
        List<DetectorType> excluded = new ArrayList<>();
        List<DetectionException> failures = new ArrayList<>();
        try {
            for (int i = 0; i < order.size(); i++) {
                DetectorType type = order.get(i);
                try {
                    AlgorithmResult result = collect(tasks.get(i), futures.get(i), timeoutNanos, deadlineNanos);
                    results.add(result);
                    metrics.recordDetectorLatency(type.getId(), result.getElapsedNanos());
                } catch (DetectionException e) {
                    // Don't let one bad detector block the whole ensemble
                    excluded.add(type);
                    failures.add(e);
                    log.warn("Detector {} excluded from vote: {}", type.getId(), e.getMessage());
                }
            }
        } finally {
            for (Future<AlgorithmResult> future : futures) {
                if (!future.isDone()) {
                    future.cancel(true);
                }
            }
        }

        if (results.isEmpty()) {
            throw new AllDetectorsFailedException(failures);
        }

        List<DetectorType> survivors = results.stream()
                .map(AlgorithmResult::getDetector)
                .collect(Collectors.toList());
        EnsembleResult result = aggregator.aggregate(results, snapshot.getWeights().restrictTo(survivors),
                config.getVotingStrategy(), config.getThreshold(), excluded);

        metrics.recordDetection(result.isFinalDecision(), result.getSeverity().name(), result.getFinalScore());
        log.debug("Ensemble detection: score={}, decision={}, severity={}, consensus={}",
                result.getFinalScore(), result.isFinalDecision(), result.getSeverity(), result.getConsensus());
        return result;
    }

    private AlgorithmResult collect(DetectorTask task, Future<AlgorithmResult> future,
                                    long timeoutNanos, long deadlineNanos) {
        DetectorType type = task.type();
        try {
            while (true) {
                long remaining = remainingNanos(task, timeoutNanos, deadlineNanos);
                if (remaining <= 0L && !future.isDone()) {
                    future.cancel(true);
                    throw timedOut(type, timeoutNanos);
                }
                // Not started yet: poll so the timeout can begin once a thread picks it up
                long wait = task.isStarted() ? remaining : Math.min(remaining, QUEUE_POLL_NANOS);
                try {
                    return future.get(Math.max(wait, 0L), TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    log.trace("Still waiting on detector {} (started={})", type.getId(), task.isStarted());
                }
            }
        } catch (CancellationException e) {
            throw timedOut(type, timeoutNanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DetectionCancelledException("Detection interrupted", e);
        } catch (ExecutionException e) {
            metrics.recordDetectorFailure(type.getId(), "error");
            Throwable cause = e.getCause();
            if (cause instanceof DetectionException) {
                throw (DetectionException) cause;
            }
            log.error("Unexpected failure in detector {}: {}", type.getId(), cause.getMessage(), cause);
            throw new DetectionException(type, String.valueOf(cause.getMessage()), cause);
        }
    }

    private static long remainingNanos(DetectorTask task, long timeoutNanos, long deadlineNanos) {
        long now = System.nanoTime();
        long remaining = deadlineNanos == Long.MAX_VALUE ? Long.MAX_VALUE : deadlineNanos - now;
        if (task.isStarted()) {
            remaining = Math.min(remaining, task.startedNanos() + timeoutNanos - now);
        }
        return remaining;
    }

    private DetectionException timedOut(DetectorType type, long timeoutNanos) {
        metrics.recordDetectorFailure(type.getId(), "timeout");
        return new DetectionException(type, "timed out after "
                + TimeUnit.NANOSECONDS.toMillis(timeoutNanos) + " ms");
    }

    /**
     * Fold optional performance feedback into the detectors' rolling histories and
     * recompute every weight.
     *
     * @param feedback samples by detector; may be null or empty to just recompute
     * @return the new weight table
     * @throws IllegalArgumentException if a sample metric lies outside [0, 1]; nothing is
     *         applied in that case
     */
    public WeightTable rebalance(Map<DetectorType, PerformanceSample> feedback) {
        writeLock.lock();
        try {
            EnsembleState current = state.get();
            Map<DetectorType, PerformanceSample> accepted = new EnumMap<>(DetectorType.class);
            if (feedback != null) {
                for (Map.Entry<DetectorType, PerformanceSample> entry : feedback.entrySet()) {
                    if (entry.getKey() == null || !current.getDetectors().containsKey(entry.getKey())) {
                        log.warn("Ignoring performance feedback for {}: detector not enabled", entry.getKey());
                        continue;
                    }
                    if (entry.getValue() == null) {
                        log.warn("Ignoring empty performance feedback for {}", entry.getKey().getId());
                        continue;
                    }
                    entry.getValue().validate();
                    accepted.put(entry.getKey(), entry.getValue());
                }
            }
            accepted.forEach((type, sample) -> current.getDetectors().get(type).recordPerformance(sample));

            WeightTable weights = applyWeights(current.getConfig(), current.getDetectors());
            state.set(EnsembleState.of(current.getConfig(), current.getDetectors(), weights));
            metrics.recordRebalance();
            log.info("Rebalanced ensemble weights from {} feedback samples: {}", accepted.size(), weights.asMap());
            return weights;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Switch to a new configuration. Detectors that were trained before are reused with
     * their performance history; newly enabled ones are trained now.
     */
    public void reconfigure(EnsembleConfig config) {
        if (config == null) {
            throw new ConfigurationException("Ensemble configuration is required");
        }
        config.validate();
        writeLock.lock();
        try {
            publish(config);
        } finally {
            writeLock.unlock();
        }
    }

    // Caller holds writeLock
    private void publish(EnsembleConfig config) {
        Map<DetectorType, AnomalyDetector> enabled = new EnumMap<>(DetectorType.class);
        for (DetectorType type : config.enabledInOrder()) {
            AnomalyDetector detector = trained.get(type);
            if (detector == null) {
                long start = System.nanoTime();
                detector = registry.create(type, reference);
                trained.put(type, detector);
                log.info("Trained detector {} on {} reference vectors in {} ms", type.getId(), reference.size(),
                        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            }
            enabled.put(type, detector);
        }
        WeightTable weights = applyWeights(config, enabled);
        state.set(EnsembleState.of(config, enabled, weights));
        log.info("Ensemble configured: detectors={}, strategy={}, threshold={}, weights={}",
                enabled.keySet(), config.getVotingStrategy().label(), config.getThreshold(), weights.asMap());
    }

    private WeightTable applyWeights(EnsembleConfig config, Map<DetectorType, AnomalyDetector> detectors) {
        WeightTable weights = weightCalculator.compute(detectors, config);
        detectors.forEach((type, detector) -> detector.applyWeight(weights.get(type)));
        return weights;
    }

    /**
     * Run detection over a labeled dataset and report confusion-matrix metrics.
     *
     * @throws com.secureflow.ensemble.exception.InsufficientDataException if the dataset is empty
     */
    public BenchmarkReport benchmark(List<LabeledSample> dataset) {
        return benchmarkHarness.run(dataset, Long.MAX_VALUE);
    }

    /**
     * Like {@link #benchmark(List)}, but stops when the timeout elapses and returns the
     * samples evaluated so far with {@code complete = false}.
     */
    public BenchmarkReport benchmark(List<LabeledSample> dataset, Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("Benchmark timeout must be non-negative");
        }
        return benchmarkHarness.run(dataset, System.nanoTime() + timeout.toNanos());
    }

    public EnsembleStatistics statistics() {
        EnsembleState snapshot = state.get();
        int active = snapshot.getDetectors().size();
        double accuracy = 0, precision = 0, recall = 0, f1 = 0, fpr = 0, diversity = 0, weight = 0;
        for (AnomalyDetector detector : snapshot.getDetectors().values()) {
            PerformanceProfile profile = detector.performanceProfile();
            accuracy += profile.getAccuracy();
            precision += profile.getPrecision();
            recall += profile.getRecall();
            f1 += profile.getF1Score();
            fpr += profile.getFalsePositiveRate();
            diversity += profile.getDiversity();
            weight += profile.getWeight();
        }

        return EnsembleStatistics.builder()
                .totalDetectors(DetectorType.values().length)
                .activeDetectors(active)
                .weights(snapshot.getWeights())
                .votingStrategy(snapshot.getConfig().getVotingStrategy())
                .threshold(snapshot.getConfig().getThreshold())
                .averagePerformance(PerformanceProfile.builder()
                        .accuracy(accuracy / active)
                        .precision(precision / active)
                        .recall(recall / active)
                        .f1Score(f1 / active)
                        .falsePositiveRate(fpr / active)
                        .diversity(diversity / active)
                        .weight(weight / active)
                        .build())
                .build();
    }

    public EnsembleConfig config() {
        return state.get().getConfig();
    }

    public WeightTable weights() {
        return state.get().getWeights();
    }

    /**
     * Live detector instance, for inspection. Null if the detector is not enabled.
     */
    public AnomalyDetector detector(DetectorType type) {
        return state.get().getDetectors().get(type);
    }
}
