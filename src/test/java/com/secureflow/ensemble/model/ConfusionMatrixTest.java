package com.secureflow.ensemble.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ConfusionMatrixTest {

    @Test
    void metrics_fromMixedOutcomes() {
        ConfusionMatrix matrix = new ConfusionMatrix();
        matrix.record(true, true);
        matrix.record(true, true);
        matrix.record(true, false);
        matrix.record(false, true);
        matrix.record(false, false);
        matrix.record(false, false);

        assertThat(matrix.total()).isEqualTo(6);
        assertThat(matrix.accuracy()).isCloseTo(4.0 / 6, within(1e-12));
        assertThat(matrix.precision()).isCloseTo(2.0 / 3, within(1e-12));
        assertThat(matrix.recall()).isCloseTo(2.0 / 3, within(1e-12));
        assertThat(matrix.f1Score()).isCloseTo(2.0 / 3, within(1e-12));
        assertThat(matrix.falsePositiveRate()).isCloseTo(1.0 / 3, within(1e-12));
    }

    @Test
    void metrics_emptyDenominators_reportZero() {
        ConfusionMatrix matrix = new ConfusionMatrix();

        assertThat(matrix.accuracy()).isZero();
        assertThat(matrix.precision()).isZero();
        assertThat(matrix.f1Score()).isZero();

        matrix.record(false, false);
        assertThat(matrix.accuracy()).isEqualTo(1.0);
        assertThat(matrix.recall()).isZero();
        assertThat(matrix.falsePositiveRate()).isZero();
    }

    @Test
    void performanceSample_fromConfusionMatrix_isValid() {
        ConfusionMatrix matrix = new ConfusionMatrix();
        matrix.record(true, true);
        matrix.record(false, false);

        PerformanceSample sample = PerformanceSample.fromConfusionMatrix(matrix);

        assertThat(sample.getAccuracy()).isEqualTo(1.0);
        assertThatCode(sample::validate).doesNotThrowAnyException();
    }

    @Test
    void performanceSample_outOfRangeMetric_rejected() {
        PerformanceSample sample = PerformanceSample.builder()
                .accuracy(0.9).precision(1.2).recall(0.5).f1Score(0.5).falsePositiveRate(0.1)
                .build();

        assertThatThrownBy(sample::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("precision");
    }
}
