package com.secureflow.ensemble.service;

import com.secureflow.ensemble.engine.EnsembleOrchestrator;
import com.secureflow.ensemble.exception.AllDetectorsFailedException;
import com.secureflow.ensemble.model.BenchmarkReport;
import com.secureflow.ensemble.model.EnsembleConfig;
import com.secureflow.ensemble.model.EnsembleResult;
import com.secureflow.ensemble.model.FeatureVector;
import com.secureflow.ensemble.model.LabeledSample;
import com.secureflow.ensemble.model.Severity;
import com.secureflow.ensemble.model.VotingStrategy;
import com.secureflow.ensemble.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static com.secureflow.ensemble.model.DetectorType.ISOLATION_FOREST;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EnsembleDetectionServiceTest {

    @Mock private EnsembleOrchestrator orchestrator;

    private EnsembleDetectionService service;

    @BeforeEach
    void setUp() {
        service = new EnsembleDetectionService(orchestrator);
    }

    private static EnsembleResult anomalyResult() {
        return EnsembleResult.builder()
                .finalScore(0.95)
                .finalDecision(true)
                .confidence(0.9)
                .consensus(1.0)
                .severity(Severity.CRITICAL)
                .votingStrategy(VotingStrategy.WEIGHTED)
                .weights(TestDataFactory.equalWeights().restrictTo(List.of(ISOLATION_FOREST)))
                .algorithmResult(TestDataFactory.result(ISOLATION_FOREST, 0.95, 0.9, true))
                .build();
    }

    @Test
    void detect_delegatesToOrchestrator() {
        FeatureVector vector = TestDataFactory.farDiagonal();
        EnsembleResult expected = anomalyResult();
        when(orchestrator.detect(vector)).thenReturn(expected);

        assertThat(service.detect(vector)).isSameAs(expected);
    }

    @Test
    void detect_listOfFeatures_buildsVector() {
        EnsembleResult expected = anomalyResult();
        when(orchestrator.detect(FeatureVector.of(1.0, 2.0, 3.0))).thenReturn(expected);

        assertThat(service.detect(List.of(1.0, 2.0, 3.0))).isSameAs(expected);
    }

    @Test
    void detect_allDetectorsFailed_propagates() {
        when(orchestrator.detect(any(FeatureVector.class))).thenThrow(new AllDetectorsFailedException(List.of()));

        assertThatThrownBy(() -> service.detect(TestDataFactory.centroid()))
                .isInstanceOf(AllDetectorsFailedException.class);
    }

    @Test
    void benchmark_withoutTimeout_usesUnboundedRun() {
        List<LabeledSample> dataset = TestDataFactory.separableDataset();
        BenchmarkReport report = BenchmarkReport.builder().accuracy(1.0).complete(true).build();
        when(orchestrator.benchmark(dataset)).thenReturn(report);

        assertThat(service.benchmark(dataset, null)).isSameAs(report);
        verify(orchestrator, never()).benchmark(any(), any(Duration.class));
    }

    @Test
    void benchmark_withTimeout_passesItThrough() {
        List<LabeledSample> dataset = TestDataFactory.separableDataset();
        BenchmarkReport report = BenchmarkReport.builder().accuracy(0.5).complete(false).build();
        when(orchestrator.benchmark(dataset, Duration.ofSeconds(2))).thenReturn(report);

        assertThat(service.benchmark(dataset, Duration.ofSeconds(2))).isSameAs(report);
    }

    @Test
    void reconfigure_delegatesToOrchestrator() {
        EnsembleConfig config = EnsembleConfig.defaults();

        service.reconfigure(config);

        verify(orchestrator).reconfigure(config);
    }
}
