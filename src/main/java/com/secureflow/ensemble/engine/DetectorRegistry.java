package com.secureflow.ensemble.engine;

import com.secureflow.ensemble.config.DetectionConfig;
import com.secureflow.ensemble.engine.clustering.DensityNeighborhoodDetector;
import com.secureflow.ensemble.engine.isolationforest.IsolationForestDetector;
import com.secureflow.ensemble.engine.isolationforest.IsolationForestTrainer;
import com.secureflow.ensemble.engine.kernel.KernelBoundaryDetector;
import com.secureflow.ensemble.engine.kernel.KernelBoundaryTrainer;
import com.secureflow.ensemble.engine.lof.LocalOutlierFactorDetector;
import com.secureflow.ensemble.engine.lof.LocalOutlierFactorTrainer;
import com.secureflow.ensemble.engine.neighbors.KdTree;
import com.secureflow.ensemble.exception.ConfigurationException;
import com.secureflow.ensemble.model.DetectorType;
import com.secureflow.ensemble.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps each {@link DetectorType} to the factory that trains it.
 * Register factories before handing the registry to an orchestrator.
 */
public class DetectorRegistry {

    private static final Logger log = LoggerFactory.getLogger(DetectorRegistry.class);

    private final Map<DetectorType, DetectorFactory> factories = new EnumMap<>(DetectorType.class);

    /**
     * Registry with the four built-in detectors and their default hyperparameters.
     */
    public static DetectorRegistry withDefaults() {
        return withDefaults(new DetectionConfig());
    }

    public static DetectorRegistry withDefaults(DetectionConfig settings) {
        DetectionConfig.IsolationForestSettings forest = settings.getIsolationForest();
        DetectionConfig.KernelBoundarySettings kernel = settings.getKernelBoundary();
        DetectionConfig.LocalOutlierFactorSettings lof = settings.getLocalOutlierFactor();
        DetectionConfig.DensityNeighborhoodSettings density = settings.getDensityNeighborhood();

        return new DetectorRegistry()
                .register(DetectorType.ISOLATION_FOREST, reference -> new IsolationForestDetector(
                        new IsolationForestTrainer(forest.getTrees(), forest.getSampleSize(), forest.getSeed())
                                .train(reference),
                        dimensionOf(reference), forest.getThreshold()))
                .register(DetectorType.KERNEL_BOUNDARY, reference -> new KernelBoundaryDetector(
                        new KernelBoundaryTrainer(kernel.getMaxSupportVectors(), kernel.getNu(),
                                kernel.getGamma(), kernel.getSeed()).train(reference),
                        dimensionOf(reference), kernel.getThreshold()))
                .register(DetectorType.LOCAL_OUTLIER_FACTOR, reference -> new LocalOutlierFactorDetector(
                        new LocalOutlierFactorTrainer(lof.getNeighbors()).train(reference),
                        dimensionOf(reference), lof.getThreshold()))
                .register(DetectorType.DENSITY_NEIGHBORHOOD, reference -> new DensityNeighborhoodDetector(
                        new KdTree(TrainingData.toMatrix(reference)),
                        dimensionOf(reference), density.getEps(), density.getMinPoints(), density.getThreshold()));
    }

    public DetectorRegistry register(DetectorType type, DetectorFactory factory) {
        factories.put(type, factory);
        log.info("Registered detector factory: {} -> {}", type.getId(), factory.getClass().getSimpleName());
        return this;
    }

    /**
     * Train a detector of the given type on the reference corpus.
     *
     * @throws ConfigurationException if no factory is registered for the type, or the
     *         factory builds a detector of another type
     */
    public AnomalyDetector create(DetectorType type, List<FeatureVector> reference) {
        DetectorFactory factory = factories.get(type);
        if (factory == null) {
            throw new ConfigurationException("No factory registered for detector " + type.getId());
        }
        AnomalyDetector detector = factory.create(reference);
        if (detector.type() != type) {
            throw new ConfigurationException("Factory for " + type.getId() + " built a "
                    + detector.type().getId() + " detector");
        }
        return detector;
    }

    // only called after training has validated the corpus
    private static int dimensionOf(List<FeatureVector> reference) {
        return reference.get(0).dimension();
    }
}
