package com.secureflow.ensemble.model;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static Severity fromScore(double score) {
        if (score >= 0.9) return CRITICAL;
        if (score >= 0.6) return HIGH;
        if (score >= 0.3) return MEDIUM;
        return LOW;
    }
}
