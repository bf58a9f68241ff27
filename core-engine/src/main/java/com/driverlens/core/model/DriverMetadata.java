package com.driverlens.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Human-readable description of a driver, supplied by an external metadata
 * source. Every field is optional.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DriverMetadata {

    private String description;
    private String unit;
    private String normalRange;

    /** No-arg constructor required by Jackson. */
    public DriverMetadata() {
    }

    public DriverMetadata(String description, String unit, String normalRange) {
        this.description = description;
        this.unit = unit;
        this.normalRange = normalRange;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getUnit() {
        return unit;
    }

    public void setUnit(String unit) {
        this.unit = unit;
    }

    @JsonProperty("normal_range")
    public String getNormalRange() {
        return normalRange;
    }

    @JsonProperty("normal_range")
    public void setNormalRange(String normalRange) {
        this.normalRange = normalRange;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DriverMetadata that))
            return false;
        return Objects.equals(description, that.description)
                && Objects.equals(unit, that.unit)
                && Objects.equals(normalRange, that.normalRange);
    }

    @Override
    public int hashCode() {
        return Objects.hash(description, unit, normalRange);
    }

    @Override
    public String toString() {
        return "DriverMetadata{" +
                "description='" + description + '\'' +
                ", unit='" + unit + '\'' +
                ", normalRange='" + normalRange + '\'' +
                '}';
    }
}
