package com.secureflow.ensemble.config;

import com.secureflow.ensemble.exception.ConfigurationException;
import com.secureflow.ensemble.model.DetectorType;
import com.secureflow.ensemble.model.EnsembleConfig;
import com.secureflow.ensemble.model.VotingStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ensemble settings bound from {@code ensemble.*}. Detector names and the voting strategy
 * are kept as strings here and parsed by {@link #toEnsembleConfig()}, so a typo fails
 * startup with a {@link ConfigurationException}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "ensemble")
public class DetectionConfig {
    private List<String> detectors = new ArrayList<>(List.of("isolation_forest", "one_class_svm", "lof", "dbscan"));
    private String votingStrategy = "weighted";
    private double threshold = 0.6;
    private double diversityWeight = 0.3;
    private double performanceWeight = 0.7;
    private Map<String, Double> weights = new LinkedHashMap<>();   // explicit overrides by detector name
    private Duration detectorTimeout = Duration.ofSeconds(5);
    private int detectorPoolSize = 4;

    private IsolationForestSettings isolationForest = new IsolationForestSettings();
    private KernelBoundarySettings kernelBoundary = new KernelBoundarySettings();
    private LocalOutlierFactorSettings localOutlierFactor = new LocalOutlierFactorSettings();
    private DensityNeighborhoodSettings densityNeighborhood = new DensityNeighborhoodSettings();
    private ReferenceDataSettings reference = new ReferenceDataSettings();

    public EnsembleConfig toEnsembleConfig() {
        if (detectors == null || detectors.isEmpty()) {
            throw new ConfigurationException("At least one detector must be enabled");
        }
        EnsembleConfig.EnsembleConfigBuilder builder = EnsembleConfig.builder()
                .votingStrategy(VotingStrategy.fromName(votingStrategy))
                .threshold(threshold)
                .diversityWeight(diversityWeight)
                .performanceWeight(performanceWeight)
                .detectorTimeout(detectorTimeout);
        for (String name : detectors) {
            builder.detector(DetectorType.fromName(name));
        }
        if (weights != null) {
            for (Map.Entry<String, Double> entry : weights.entrySet()) {
                builder.weightOverride(DetectorType.fromName(entry.getKey()), entry.getValue());
            }
        }
        EnsembleConfig config = builder.build();
        config.validate();
        return config;
    }

    @Data
    public static class IsolationForestSettings {
        private int trees = 100;
        private int sampleSize = 256;
        private double threshold = 0.6;
        private long seed = 42;
    }

    @Data
    public static class KernelBoundarySettings {
        private int maxSupportVectors = 200;
        private double nu = 0.1;
        private double gamma = 0.0;        // <= 0 derives gamma from the corpus variance
        private double threshold = 0.0;    // in decision-value units
        private long seed = 42;
    }

    @Data
    public static class LocalOutlierFactorSettings {
        private int neighbors = 20;
        private double threshold = 1.5;    // LOF ratio
    }

    @Data
    public static class DensityNeighborhoodSettings {
        private double eps = 0.5;
        private int minPoints = 5;
        private double threshold = 0.0;
    }

    @Data
    public static class ReferenceDataSettings {
        private long seed = 42;
        private int dimension = 3;
        private int size = 500;
        private double radius = 1.0;
    }
}
