package com.driverlens.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Qualitative strength of a driver's relationship to the KPI, derived from
 * {@code |r|}.
 */
public enum DriverStrength {

    STRONG("Strong"),
    MODERATE("Moderate"),
    WEAK("Weak");

    private final String label;

    DriverStrength(String label) {
        this.label = label;
    }

    /**
     * Classify an absolute correlation coefficient.
     *
     * @param absR              {@code |r|}
     * @param strongThreshold   {@code |r|} above this is {@link #STRONG}
     * @param moderateThreshold {@code |r|} above this (and not strong) is
     *                          {@link #MODERATE}
     * @return the strength class
     */
    public static DriverStrength classify(double absR, double strongThreshold, double moderateThreshold) {
        if (absR > strongThreshold) {
            return STRONG;
        }
        if (absR > moderateThreshold) {
            return MODERATE;
        }
        return WEAK;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static DriverStrength fromLabel(String value) {
        for (DriverStrength strength : values()) {
            if (strength.label.equalsIgnoreCase(value)) {
                return strength;
            }
        }
        throw new IllegalArgumentException("Unknown driver strength: '" + value + "'");
    }

    @Override
    public String toString() {
        return label;
    }
}
