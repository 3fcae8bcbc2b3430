package com.secureflow.ensemble.engine.isolationforest;

import com.secureflow.ensemble.exception.DetectionException;
import com.secureflow.ensemble.model.AlgorithmResult;
import com.secureflow.ensemble.model.DetectorType;
import com.secureflow.ensemble.model.FeatureVector;
import com.secureflow.ensemble.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class IsolationForestDetectorTest {

    private static IsolationForestDetector detector;

    @BeforeAll
    static void trainForest() {
        IsolationForest forest = new IsolationForestTrainer(100, 256, TestDataFactory.SEED)
                .train(TestDataFactory.reference());
        detector = new IsolationForestDetector(forest, TestDataFactory.DIMENSION);
    }

    @Test
    void averagePathLength_knownValues() {
        assertThat(IsolationNode.averagePathLength(0)).isEqualTo(0.0);
        assertThat(IsolationNode.averagePathLength(1)).isEqualTo(0.0);
        assertThat(IsolationNode.averagePathLength(2)).isEqualTo(1.0);
        assertThat(IsolationNode.averagePathLength(256)).isCloseTo(10.2448, within(1e-4));
    }

    @Test
    void train_buildsRequestedTreesWithCappedSample() {
        IsolationForest forest = detector.getForest();
        assertThat(forest.getTreeCount()).isEqualTo(100);
        assertThat(forest.getSampleSize()).isEqualTo(256);

        IsolationForest small = new IsolationForestTrainer(10, 256, 7)
                .train(TestDataFactory.reference().subList(0, 40));
        assertThat(small.getSampleSize()).isEqualTo(40);
    }

    @Test
    void score_farPoint_flaggedWithDiagnostics() {
        AlgorithmResult result = detector.score(TestDataFactory.farDiagonal());

        assertThat(result.getDetector()).isEqualTo(DetectorType.ISOLATION_FOREST);
        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getScore()).isGreaterThan(0.7);
        assertThat(result.getConfidence()).isCloseTo(Math.abs(result.getScore() - 0.5) * 2, within(1e-12));
        assertThat(result.getDiagnostics())
                .containsKeys("averagePathLength", "expectedPathLength", "trees")
                .containsEntry("trees", 100.0);
    }

    @Test
    void score_centroid_isNormal() {
        AlgorithmResult result = detector.score(TestDataFactory.centroid());

        assertThat(result.isAnomaly()).isFalse();
        assertThat(result.getScore()).isLessThan(0.5);
        assertThat(result.getDiagnostics().keySet()).noneMatch(k -> k.startsWith("contribution.f"));
    }

    @Test
    void score_randomVectors_boundedAndConsistentWithThreshold() {
        Random random = new Random(3);
        for (int i = 0; i < 200; i++) {
            double scale = random.nextDouble() * 5;
            FeatureVector v = FeatureVector.of(random.nextGaussian() * scale,
                    random.nextGaussian() * scale, random.nextGaussian() * scale);
            AlgorithmResult result = detector.score(v);

            assertThat(result.getScore()).isBetween(0.0, 1.0);
            assertThat(result.getConfidence()).isBetween(0.0, 1.0);
            assertThat(result.isAnomaly()).isEqualTo(result.getScore() > detector.threshold());
        }
    }

    @Test
    void train_sameSeed_sameScores() {
        IsolationForest again = new IsolationForestTrainer(100, 256, TestDataFactory.SEED)
                .train(TestDataFactory.reference());
        double[] point = {0.4, -0.2, 0.9};

        assertThat(again.anomalyScore(point)).isEqualTo(detector.getForest().anomalyScore(point));
    }

    @Test
    void setThreshold_changesDecisionNotScore() {
        IsolationForestDetector strict = new IsolationForestDetector(detector.getForest(), 3);
        AlgorithmResult before = strict.score(TestDataFactory.centroid());
        strict.setThreshold(0.1);
        AlgorithmResult after = strict.score(TestDataFactory.centroid());

        assertThat(after.getScore()).isEqualTo(before.getScore());
        assertThat(after.isAnomaly()).isTrue();
    }

    @Test
    void score_wrongDimension_throwsDetectionException() {
        assertThatThrownBy(() -> detector.score(FeatureVector.of(1.0, 2.0)))
                .isInstanceOf(DetectionException.class)
                .hasMessageContaining("expected 3 features but got 2");
    }

    @Test
    void score_nonFiniteVector_throwsDetectionException() {
        assertThatThrownBy(() -> detector.score(FeatureVector.of(1.0, Double.NaN, 0.0)))
                .isInstanceOf(DetectionException.class)
                .hasMessageContaining("NaN");
        assertThatThrownBy(() -> detector.score(FeatureVector.of(Double.POSITIVE_INFINITY, 0.0, 0.0)))
                .isInstanceOf(DetectionException.class);
    }

    @Test
    void topN_ordersByValueThenIndex() {
        assertThat(IsolationForestDetector.topN(new double[]{0.1, 0.5, 0.5, 0.3}, 3)).containsExactly(1, 2, 3);
        assertThat(IsolationForestDetector.topN(new double[]{0.2}, 3)).containsExactly(0);
    }
}
