package com.driverlens.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single flagged cell: a row of the source table and the driver column in
 * which it was found to be anomalous.
 *
 * @since 1.0.0
 */
public final class OutlierPoint {

    private final int row;
    private final String driver;

    @JsonCreator
    public OutlierPoint(@JsonProperty("row") int row, @JsonProperty("driver") String driver) {
        if (row < 0) {
            throw new IllegalArgumentException("row must be >= 0, got: " + row);
        }
        this.row = row;
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
    }

    @JsonProperty("row")
    public int getRow() {
        return row;
    }

    @JsonProperty("driver")
    public String getDriver() {
        return driver;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof OutlierPoint that))
            return false;
        return row == that.row && driver.equals(that.driver);
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, driver);
    }

    @Override
    public String toString() {
        return "OutlierPoint{row=" + row + ", driver='" + driver + "'}";
    }
}
