package com.driverlens.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A driver's position in the impact ranking.
 *
 * <p>
 * Combines the driver's {@link CorrelationRecord} with the composite score,
 * its strength class, a short explanation, a display name and, when the
 * metadata source knows the driver, a description, unit and normal operating
 * range. Enrichment fields that are absent are omitted from JSON.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #builder(CorrelationRecord)}. {@code score}, {@code strength}
 * and {@code explanation} are <strong>required</strong>.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"driver_name", "display_name", "method", "r", "p_value", "score", "strength", "explanation",
        "description", "unit", "normal_range"})
public final class RankedDriver {

    private final CorrelationRecord correlation;
    private final double score;
    private final DriverStrength strength;
    private final String explanation;
    private final String displayName;
    private final String description;
    private final String unit;
    private final String normalRange;

    private RankedDriver(Builder builder) {
        this.correlation = Objects.requireNonNull(builder.correlation, "correlation must not be null");
        if (Double.isNaN(builder.score) || builder.score < 0) {
            throw new IllegalArgumentException("score must be >= 0, got: " + builder.score);
        }
        this.score = builder.score;
        this.strength = Objects.requireNonNull(builder.strength, "strength must not be null");
        this.explanation = Objects.requireNonNull(builder.explanation, "explanation must not be null");
        this.displayName = builder.displayName;
        this.description = builder.description;
        this.unit = builder.unit;
        this.normalRange = builder.normalRange;
    }

    @JsonCreator
    static RankedDriver fromJson(@JsonProperty("driver_name") String driverName,
            @JsonProperty("display_name") String displayName,
            @JsonProperty("method") CorrelationMethod method,
            @JsonProperty("r") double r,
            @JsonProperty("p_value") double pValue,
            @JsonProperty("score") double score,
            @JsonProperty("strength") DriverStrength strength,
            @JsonProperty("explanation") String explanation,
            @JsonProperty("description") String description,
            @JsonProperty("unit") String unit,
            @JsonProperty("normal_range") String normalRange) {
        return builder(new CorrelationRecord(driverName, method, r, pValue))
                .score(score)
                .strength(strength)
                .explanation(explanation)
                .displayName(displayName)
                .description(description)
                .unit(unit)
                .normalRange(normalRange)
                .build();
    }

    public static Builder builder(CorrelationRecord correlation) {
        return new Builder(correlation);
    }

    /**
     * Fluent builder for {@link RankedDriver}.
     */
    public static class Builder {
        private final CorrelationRecord correlation;
        private double score = Double.NaN;
        private DriverStrength strength;
        private String explanation;
        private String displayName;
        private String description;
        private String unit;
        private String normalRange;

        private Builder(CorrelationRecord correlation) {
            this.correlation = correlation;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder strength(DriverStrength strength) {
            this.strength = strength;
            return this;
        }

        public Builder explanation(String explanation) {
            this.explanation = explanation;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        public Builder normalRange(String normalRange) {
            this.normalRange = normalRange;
            return this;
        }

        /**
         * Copy the non-null fields of a metadata entry.
         *
         * @param metadata metadata entry; ignored when {@code null}
         * @return this builder
         */
        public Builder metadata(DriverMetadata metadata) {
            if (metadata != null) {
                this.description = metadata.getDescription();
                this.unit = metadata.getUnit();
                this.normalRange = metadata.getNormalRange();
            }
            return this;
        }

        /**
         * @return a new immutable {@link RankedDriver}
         * @throws NullPointerException     if strength or explanation is missing
         * @throws IllegalArgumentException if score is missing or negative
         */
        public RankedDriver build() {
            return new RankedDriver(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public CorrelationRecord toCorrelationRecord() {
        return correlation;
    }

    @JsonProperty("driver_name")
    public String getDriverName() {
        return correlation.getDriverName();
    }

    @JsonProperty("display_name")
    public String getDisplayName() {
        return displayName;
    }

    @JsonProperty("method")
    public CorrelationMethod getMethod() {
        return correlation.getMethod();
    }

    @JsonProperty("r")
    public double getR() {
        return correlation.getR();
    }

    @JsonProperty("p_value")
    public double getPValue() {
        return correlation.getPValue();
    }

    @JsonProperty("score")
    public double getScore() {
        return score;
    }

    @JsonProperty("strength")
    public DriverStrength getStrength() {
        return strength;
    }

    @JsonProperty("explanation")
    public String getExplanation() {
        return explanation;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @JsonProperty("unit")
    public String getUnit() {
        return unit;
    }

    @JsonProperty("normal_range")
    public String getNormalRange() {
        return normalRange;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RankedDriver that))
            return false;
        return Double.compare(score, that.score) == 0
                && correlation.equals(that.correlation)
                && strength == that.strength
                && explanation.equals(that.explanation)
                && Objects.equals(displayName, that.displayName)
                && Objects.equals(description, that.description)
                && Objects.equals(unit, that.unit)
                && Objects.equals(normalRange, that.normalRange);
    }

    @Override
    public int hashCode() {
        return Objects.hash(correlation, score, strength, explanation, displayName, description, unit, normalRange);
    }

    @Override
    public String toString() {
        return "RankedDriver{" +
                "driverName='" + getDriverName() + '\'' +
                ", r=" + getR() +
                ", pValue=" + getPValue() +
                ", score=" + score +
                ", strength=" + strength +
                '}';
    }
}
