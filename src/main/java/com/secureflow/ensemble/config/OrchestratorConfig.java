package com.secureflow.ensemble.config;

import com.secureflow.ensemble.engine.DetectorRegistry;
import com.secureflow.ensemble.engine.EnsembleOrchestrator;
import com.secureflow.ensemble.reference.GaussianClusterReferenceData;
import com.secureflow.ensemble.reference.ReferenceDataSource;
import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class OrchestratorConfig {

    @Bean
    public ReferenceDataSource referenceDataSource(DetectionConfig detectionConfig) {
        DetectionConfig.ReferenceDataSettings reference = detectionConfig.getReference();
        return new GaussianClusterReferenceData(reference.getSeed(), reference.getDimension(),
                reference.getSize(), reference.getRadius());
    }

    @Bean
    public DetectorRegistry detectorRegistry(DetectionConfig detectionConfig) {
        return DetectorRegistry.withDefaults(detectionConfig);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService detectorExecutor(DetectionConfig detectionConfig) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "ensemble-detector-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, detectionConfig.getDetectorPoolSize()), threadFactory);
    }

    @Bean
    public EnsembleOrchestrator ensembleOrchestrator(DetectionConfig detectionConfig,
                                                     DetectorRegistry detectorRegistry,
                                                     ReferenceDataSource referenceDataSource,
                                                     ExecutorService detectorExecutor,
                                                     MetricsConfig metricsConfig) {
        return EnsembleOrchestrator.configure(detectionConfig.toEnsembleConfig(), detectorRegistry,
                referenceDataSource.load(), detectorExecutor, metricsConfig);
    }

    @Bean
    public ObservedAspect observedAspect(ObservationRegistry observationRegistry) {
        return new ObservedAspect(observationRegistry);
    }
}
