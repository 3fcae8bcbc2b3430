package com.secureflow.ensemble.engine.lof;

import com.secureflow.ensemble.engine.neighbors.Neighbor;
import com.secureflow.ensemble.exception.InsufficientDataException;
import com.secureflow.ensemble.model.AlgorithmResult;
import com.secureflow.ensemble.model.DetectorType;
import com.secureflow.ensemble.model.FeatureVector;
import com.secureflow.ensemble.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LocalOutlierFactorDetectorTest {

    private static LocalOutlierFactorDetector detector;

    @BeforeAll
    static void train() {
        LocalOutlierFactorModel model = new LocalOutlierFactorTrainer(20).train(TestDataFactory.reference());
        detector = new LocalOutlierFactorDetector(model, TestDataFactory.DIMENSION);
    }

    @Test
    void score_farPoint_saturates() {
        AlgorithmResult result = detector.score(TestDataFactory.farDiagonal());

        assertThat(result.getDetector()).isEqualTo(DetectorType.LOCAL_OUTLIER_FACTOR);
        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getScore()).isEqualTo(1.0);
        assertThat(result.getConfidence()).isEqualTo(1.0);
        assertThat(result.getDiagnostics().get("lofRatio")).isGreaterThan(3.0);
        assertThat(result.getDiagnostics()).containsEntry("neighbors", 20.0);
    }

    @Test
    void score_centroid_ratioNearOne() {
        AlgorithmResult result = detector.score(TestDataFactory.centroid());

        assertThat(result.isAnomaly()).isFalse();
        assertThat(result.getDiagnostics().get("lofRatio")).isCloseTo(1.0, within(0.2));
        assertThat(result.getScore()).isCloseTo(result.getDiagnostics().get("lofRatio") / 3.0, within(1e-12));
    }

    @Test
    void score_randomVectors_flagAgreesWithRatio() {
        Random random = new Random(21);
        for (int i = 0; i < 100; i++) {
            double scale = random.nextDouble() * 3;
            AlgorithmResult result = detector.score(FeatureVector.of(random.nextGaussian() * scale,
                    random.nextGaussian() * scale, random.nextGaussian() * scale));
            double ratio = result.getDiagnostics().get("lofRatio");

            assertThat(result.getScore()).isBetween(0.0, 1.0);
            assertThat(result.getConfidence()).isBetween(0.0, 1.0);
            assertThat(result.isAnomaly()).isEqualTo(ratio > 1.5);
        }
    }

    @Test
    void train_capsKToCorpusSizeMinusOne() {
        List<FeatureVector> corpus = List.of(
                FeatureVector.of(0.0, 0.0), FeatureVector.of(1.0, 0.0), FeatureVector.of(0.0, 1.0),
                FeatureVector.of(1.0, 1.0), FeatureVector.of(0.5, 0.5));

        LocalOutlierFactorModel model = new LocalOutlierFactorTrainer(20).train(corpus);

        assertThat(model.getK()).isEqualTo(4);
        assertThat(model.getReferenceSize()).isEqualTo(5);
    }

    @Test
    void score_duplicateCorpus_staysFinite() {
        List<FeatureVector> corpus = Collections.nCopies(10, FeatureVector.of(1.0, 1.0));
        LocalOutlierFactorDetector duplicates = new LocalOutlierFactorDetector(
                new LocalOutlierFactorTrainer(3).train(corpus), 2);

        AlgorithmResult same = duplicates.score(FeatureVector.of(1.0, 1.0));
        AlgorithmResult away = duplicates.score(FeatureVector.of(2.0, 1.0));

        assertThat(same.getDiagnostics().get("lofRatio")).isCloseTo(1.0, within(1e-9));
        assertThat(same.isAnomaly()).isFalse();
        assertThat(away.isAnomaly()).isTrue();
        assertThat(away.getScore()).isEqualTo(1.0);
    }

    @Test
    void reachDistance_usesNeighborsKDistance() {
        List<FeatureVector> corpus = List.of(
                FeatureVector.of(0.0, 0.0), FeatureVector.of(1.0, 0.0), FeatureVector.of(10.0, 0.0));
        LocalOutlierFactorModel model = new LocalOutlierFactorTrainer(1).train(corpus);

        List<Neighbor> neighbors = model.neighbors(new double[]{9.5, 0.0});

        // (10, 0) has k-distance 9, which outweighs the query's own distance of 0.5
        assertThat(neighbors).hasSize(1);
        assertThat(neighbors.get(0).getIndex()).isEqualTo(2);
        assertThat(model.reachDistance(neighbors.get(0))).isCloseTo(9.0, within(1e-12));
        assertThat(model.localReachabilityDensity(neighbors)).isCloseTo(1.0 / 9.0, within(1e-12));
        assertThat(model.lrdOf(2)).isCloseTo(1.0 / 9.0, within(1e-12));
    }

    @Test
    void train_singlePoint_throwsInsufficientData() {
        assertThatThrownBy(() -> new LocalOutlierFactorTrainer(5).train(List.of(FeatureVector.of(1.0))))
                .isInstanceOf(InsufficientDataException.class);
        assertThatThrownBy(() -> new LocalOutlierFactorTrainer(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
