package com.secureflow.ensemble.engine.clustering;

import com.secureflow.ensemble.engine.TrainingData;
import com.secureflow.ensemble.engine.neighbors.KdTree;
import com.secureflow.ensemble.model.AlgorithmResult;
import com.secureflow.ensemble.model.DetectorType;
import com.secureflow.ensemble.model.FeatureVector;
import com.secureflow.ensemble.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DensityNeighborhoodDetectorTest {

    private DensityNeighborhoodDetector detector;

    @BeforeEach
    void setUp() {
        // five points around the origin, three of them within 0.5 of (1, 0)
        KdTree index = new KdTree(new double[][]{
                {0.0, 0.0}, {0.5, 0.0}, {0.0, 0.5}, {0.6, 0.2}, {0.7, -0.1}, {3.0, 3.0}});
        detector = new DensityNeighborhoodDetector(index, 2,
                DensityNeighborhoodDetector.DEFAULT_EPS, DensityNeighborhoodDetector.DEFAULT_MIN_POINTS);
    }

    @Test
    void score_denseRegion_isNormal() {
        AlgorithmResult result = detector.score(FeatureVector.of(0.3, 0.1));

        assertThat(result.getDetector()).isEqualTo(DetectorType.DENSITY_NEIGHBORHOOD);
        assertThat(result.getDiagnostics()).containsEntry("neighborsWithinEps", 5.0);
        assertThat(result.getScore()).isEqualTo(0.0);
        assertThat(result.isAnomaly()).isFalse();
        assertThat(result.getConfidence()).isEqualTo(1.0);
    }

    @Test
    void score_sparseRegion_partialScore() {
        AlgorithmResult result = detector.score(FeatureVector.of(1.0, 0.0));

        assertThat(result.getDiagnostics()).containsEntry("neighborsWithinEps", 3.0);
        assertThat(result.getScore()).isCloseTo(0.4, within(1e-12));
        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getConfidence()).isCloseTo(0.2, within(1e-12));
    }

    @Test
    void score_boundaryDistanceCounts() {
        // (0.5, 0) and (0, 0.5) sit exactly at eps from the origin
        AlgorithmResult result = detector.score(FeatureVector.of(0.0, 0.0));
        assertThat(result.getDiagnostics().get("neighborsWithinEps")).isGreaterThanOrEqualTo(3.0);
        assertThat(detector.score(FeatureVector.of(-0.5, 0.0)).getDiagnostics())
                .containsEntry("neighborsWithinEps", 1.0);
    }

    @Test
    void score_isolatedPoint_fullScore() {
        AlgorithmResult result = detector.score(FeatureVector.of(10.0, -10.0));

        assertThat(result.getScore()).isEqualTo(1.0);
        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getConfidence()).isEqualTo(1.0);
    }

    @Test
    void score_randomVectors_flagAgreesWithScore() {
        DensityNeighborhoodDetector trained = new DensityNeighborhoodDetector(
                new KdTree(TrainingData.toMatrix(TestDataFactory.reference())), TestDataFactory.DIMENSION,
                DensityNeighborhoodDetector.DEFAULT_EPS, DensityNeighborhoodDetector.DEFAULT_MIN_POINTS);
        Random random = new Random(TestDataFactory.SEED);
        for (int i = 0; i < 100; i++) {
            double scale = random.nextDouble() * 3;
            AlgorithmResult result = trained.score(FeatureVector.of(random.nextGaussian() * scale,
                    random.nextGaussian() * scale, random.nextGaussian() * scale));
            double count = result.getDiagnostics().get("neighborsWithinEps");

            assertThat(result.getScore()).isBetween(0.0, 1.0);
            assertThat(result.getScore()).isCloseTo(1.0 - Math.min(count / 5.0, 1.0), within(1e-12));
            assertThat(result.getConfidence()).isCloseTo(Math.abs(result.getScore() - 0.5) * 2, within(1e-12));
            assertThat(result.isAnomaly()).isEqualTo(count < 5.0);
            assertThat(result.isAnomaly()).isEqualTo(result.getScore() > 0.0);
        }
    }

    @Test
    void constructor_rejectsNonPositiveParameters() {
        KdTree index = new KdTree(new double[][]{{0.0}});
        assertThatThrownBy(() -> new DensityNeighborhoodDetector(index, 1, 0.0, 5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DensityNeighborhoodDetector(index, 1, 0.5, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
