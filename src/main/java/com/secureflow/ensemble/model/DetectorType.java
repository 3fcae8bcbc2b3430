package com.secureflow.ensemble.model;

import com.secureflow.ensemble.exception.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The closed set of detectors the ensemble knows how to build. Declaration order is the
 * order in which results are reported.
 */
public enum DetectorType {

    ISOLATION_FOREST("isolation_forest"),
    KERNEL_BOUNDARY("one_class_svm"),
    LOCAL_OUTLIER_FACTOR("lof"),
    DENSITY_NEIGHBORHOOD("dbscan");

    private final String id;

    DetectorType(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Resolve a detector from either its id ({@code lof}) or its enum name
     * ({@code LOCAL_OUTLIER_FACTOR}, {@code local-outlier-factor}).
     */
    public static DetectorType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Detector name must not be blank");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (DetectorType type : values()) {
            if (type.id.equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        throw new ConfigurationException("Unknown detector '" + name + "'. Known detectors: "
                + Arrays.stream(values()).map(DetectorType::getId).collect(Collectors.joining(", ")));
    }
}
