package com.driverlens.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Tuning parameters of the statistical stages, loaded from YAML.
 *
 * <p>
 * Expected YAML structure (all keys optional, shown with their defaults):
 * </p>
 *
 * <pre>
 * skewnessThreshold: 1.0
 * outlierZThreshold: 3.0
 * iqrMultiplier: 1.5
 * strongThreshold: 0.7
 * moderateThreshold: 0.3
 * significanceLevel: 0.05
 * topK: 10
 * metadataKeyPrefix: value_
 * </pre>
 *
 * <p>
 * The defaults are the values the strength thresholds were tuned against.
 * Call {@link #validate()} after construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisSettings {

    /** Both columns must have {@code |skewness|} below this for the linear method. */
    private double skewnessThreshold = 1.0;

    /** {@code |z|} above this flags an outlier. */
    private double outlierZThreshold = 3.0;

    /** Tukey fence multiplier applied to the interquartile range. */
    private double iqrMultiplier = 1.5;

    /** {@code |r|} above this is classified Strong. */
    private double strongThreshold = 0.7;

    /** {@code |r|} above this (and not Strong) is classified Moderate. */
    private double moderateThreshold = 0.3;

    /** p-values below this are described as statistically significant. */
    private double significanceLevel = 0.05;

    /** Number of drivers kept in the ranking; {@code 0} keeps all. */
    private int topK = 10;

    /** Prefix stripped from driver names before a metadata lookup. */
    private String metadataKeyPrefix = "value_";

    /**
     * @return settings with every parameter at its default
     */
    public static AnalysisSettings defaults() {
        return new AnalysisSettings();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Check that every parameter has a legal value.
     *
     * @throws IllegalStateException listing every violation
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (!(skewnessThreshold > 0)) {
            errors.add("'skewnessThreshold' must be > 0, got: " + skewnessThreshold);
        }
        if (!(outlierZThreshold > 0)) {
            errors.add("'outlierZThreshold' must be > 0, got: " + outlierZThreshold);
        }
        if (!(iqrMultiplier > 0)) {
            errors.add("'iqrMultiplier' must be > 0, got: " + iqrMultiplier);
        }
        if (!(moderateThreshold >= 0 && moderateThreshold < strongThreshold && strongThreshold <= 1)) {
            errors.add("thresholds must satisfy 0 <= moderateThreshold < strongThreshold <= 1, got: "
                    + moderateThreshold + " / " + strongThreshold);
        }
        if (!(significanceLevel > 0 && significanceLevel < 1)) {
            errors.add("'significanceLevel' must be in (0, 1), got: " + significanceLevel);
        }
        if (topK < 0) {
            errors.add("'topK' must be >= 0, got: " + topK);
        }
        if (metadataKeyPrefix == null) {
            errors.add("'metadataKeyPrefix' must not be null");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid AnalysisSettings: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for SnakeYAML)
    // ---------------------------------------------------------------

    public double getSkewnessThreshold() {
        return skewnessThreshold;
    }

    public void setSkewnessThreshold(double skewnessThreshold) {
        this.skewnessThreshold = skewnessThreshold;
    }

    public double getOutlierZThreshold() {
        return outlierZThreshold;
    }

    public void setOutlierZThreshold(double outlierZThreshold) {
        this.outlierZThreshold = outlierZThreshold;
    }

    public double getIqrMultiplier() {
        return iqrMultiplier;
    }

    public void setIqrMultiplier(double iqrMultiplier) {
        this.iqrMultiplier = iqrMultiplier;
    }

    public double getStrongThreshold() {
        return strongThreshold;
    }

    public void setStrongThreshold(double strongThreshold) {
        this.strongThreshold = strongThreshold;
    }

    public double getModerateThreshold() {
        return moderateThreshold;
    }

    public void setModerateThreshold(double moderateThreshold) {
        this.moderateThreshold = moderateThreshold;
    }

    public double getSignificanceLevel() {
        return significanceLevel;
    }

    public void setSignificanceLevel(double significanceLevel) {
        this.significanceLevel = significanceLevel;
    }

    public int getTopK() {
        return topK;
    }

    public void setTopK(int topK) {
        this.topK = topK;
    }

    public String getMetadataKeyPrefix() {
        return metadataKeyPrefix;
    }

    public void setMetadataKeyPrefix(String metadataKeyPrefix) {
        this.metadataKeyPrefix = metadataKeyPrefix;
    }

    @Override
    public String toString() {
        return "AnalysisSettings{" +
                "skewnessThreshold=" + skewnessThreshold +
                ", outlierZThreshold=" + outlierZThreshold +
                ", iqrMultiplier=" + iqrMultiplier +
                ", strongThreshold=" + strongThreshold +
                ", moderateThreshold=" + moderateThreshold +
                ", significanceLevel=" + significanceLevel +
                ", topK=" + topK +
                ", metadataKeyPrefix='" + metadataKeyPrefix + '\'' +
                '}';
    }
}
