package com.secureflow.ensemble.reference;

import com.secureflow.ensemble.model.FeatureVector;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GaussianClusterReferenceDataTest {

    @Test
    void load_producesRequestedSizeWithinRadius() {
        List<FeatureVector> corpus = new GaussianClusterReferenceData(42, 3, 500, 1.0).load();

        assertThat(corpus).hasSize(500);
        assertThat(corpus).allMatch(v -> v.dimension() == 3);
        assertThat(corpus).allMatch(v -> v.norm() <= 1.0);
    }

    @Test
    void load_sameSeed_sameCorpus() {
        List<FeatureVector> first = new GaussianClusterReferenceData(7, 4, 50, 2.0).load();
        List<FeatureVector> second = new GaussianClusterReferenceData(7, 4, 50, 2.0).load();

        assertThat(second).isEqualTo(first);
        assertThat(new GaussianClusterReferenceData(8, 4, 50, 2.0).load()).isNotEqualTo(first);
    }

    @Test
    void load_centeredOnOrigin() {
        List<FeatureVector> corpus = new GaussianClusterReferenceData(42, 2, 2000, 1.0).load();

        double meanX = corpus.stream().mapToDouble(v -> v.get(0)).average().orElseThrow();
        double meanY = corpus.stream().mapToDouble(v -> v.get(1)).average().orElseThrow();
        assertThat(Math.abs(meanX)).isLessThan(0.05);
        assertThat(Math.abs(meanY)).isLessThan(0.05);
    }

    @Test
    void constructor_invalidArguments_rejected() {
        assertThatThrownBy(() -> new GaussianClusterReferenceData(1, 0, 10, 1.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GaussianClusterReferenceData(1, 2, 10, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void inMemory_returnsCopyOfVectors() {
        List<FeatureVector> vectors = new ArrayList<>(List.of(FeatureVector.of(1.0)));
        InMemoryReferenceData source = new InMemoryReferenceData(vectors);
        vectors.add(FeatureVector.of(2.0));

        assertThat(source.load()).containsExactly(FeatureVector.of(1.0));
    }
}
