package com.secureflow.ensemble.model;

import com.secureflow.ensemble.exception.ConfigurationException;

import java.util.Locale;

public enum VotingStrategy {
    HARD,
    SOFT,
    WEIGHTED;

    public static VotingStrategy fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Voting strategy must not be blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown voting strategy '" + name + "'. Expected hard, soft or weighted", e);
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
