package com.secureflow.ensemble.engine;

import com.secureflow.ensemble.exception.InsufficientDataException;
import com.secureflow.ensemble.model.FeatureVector;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrainingDataTest {

    @Test
    void toMatrix_copiesRowsInOrder() {
        double[][] data = TrainingData.toMatrix(List.of(FeatureVector.of(1.0, 2.0), FeatureVector.of(3.0, 4.0)));

        assertThat(data).hasDimensions(2, 2);
        assertThat(data[1]).containsExactly(3.0, 4.0);
    }

    @Test
    void toMatrix_rejectsEmptyRaggedOrNonFiniteCorpus() {
        assertThatThrownBy(() -> TrainingData.toMatrix(List.of()))
                .isInstanceOf(InsufficientDataException.class);
        assertThatThrownBy(() -> TrainingData.toMatrix(List.of(FeatureVector.of(1.0, 2.0), FeatureVector.of(1.0))))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("has 1 features, expected 2");
        assertThatThrownBy(() -> TrainingData.toMatrix(List.of(FeatureVector.of(Double.NaN))))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void subsample_drawsDistinctRowsDeterministically() {
        double[][] data = new double[50][];
        for (int i = 0; i < data.length; i++) {
            data[i] = new double[]{i};
        }

        double[][] first = TrainingData.subsample(data, 10, new Random(7));
        double[][] second = TrainingData.subsample(data, 10, new Random(7));

        assertThat(first).hasNumberOfRows(10);
        assertThat(Arrays.stream(first).mapToDouble(row -> row[0]).distinct().count()).isEqualTo(10);
        assertThat(first).isDeepEqualTo(second);
    }

    @Test
    void subsample_smallCorpus_returnsAllRowsInOrder() {
        double[][] data = {{1.0}, {2.0}, {3.0}};

        assertThat(TrainingData.subsample(data, 5, new Random(1))).isDeepEqualTo(data);
    }
}
