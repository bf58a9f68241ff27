package com.driverlens.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Correlation coefficient used for a single driver.
 */
public enum CorrelationMethod {

    /** Pearson product-moment correlation. */
    LINEAR("pearson"),

    /** Spearman rank correlation. */
    RANK_BASED("spearman");

    private final String label;

    CorrelationMethod(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Parse a method from its label ({@code pearson} / {@code spearman}) or
     * constant name.
     *
     * @param value label or name
     * @return matching method
     * @throws IllegalArgumentException if nothing matches
     */
    @JsonCreator
    public static CorrelationMethod fromLabel(String value) {
        for (CorrelationMethod method : values()) {
            if (method.label.equalsIgnoreCase(value) || method.name().equalsIgnoreCase(value)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown correlation method: '" + value
                + "'. Supported: pearson, spearman");
    }

    @Override
    public String toString() {
        return label;
    }
}
