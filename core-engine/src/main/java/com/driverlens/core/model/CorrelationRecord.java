package com.driverlens.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Correlation of one driver column against the KPI.
 *
 * <p>
 * Immutable. The constructor clips {@code r} into {@code [-1, 1]} and
 * {@code p_value} into {@code [0, 1]}; a {@code NaN} coefficient or p-value
 * is replaced by the neutral pair {@code r = 0, p_value = 1}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"driver_name", "method", "r", "p_value"})
public final class CorrelationRecord {

    private final String driverName;
    private final CorrelationMethod method;
    private final double r;
    private final double pValue;

    @JsonCreator
    public CorrelationRecord(@JsonProperty("driver_name") String driverName,
            @JsonProperty("method") CorrelationMethod method,
            @JsonProperty("r") double r,
            @JsonProperty("p_value") double pValue) {
        this.driverName = Objects.requireNonNull(driverName, "driverName must not be null");
        this.method = Objects.requireNonNull(method, "method must not be null");
        if (Double.isNaN(r) || Double.isNaN(pValue)) {
            this.r = 0.0;
            this.pValue = 1.0;
        } else {
            this.r = Math.max(-1.0, Math.min(1.0, r));
            this.pValue = Math.max(0.0, Math.min(1.0, pValue));
        }
    }

    /**
     * Neutral record used when a driver has too few valid pairs or an undefined
     * coefficient.
     *
     * @param driverName driver column name
     * @return {@code r = 0, p_value = 1} with the linear method
     */
    public static CorrelationRecord neutral(String driverName) {
        return new CorrelationRecord(driverName, CorrelationMethod.LINEAR, 0.0, 1.0);
    }

    @JsonProperty("driver_name")
    public String getDriverName() {
        return driverName;
    }

    @JsonProperty("method")
    public CorrelationMethod getMethod() {
        return method;
    }

    @JsonProperty("r")
    public double getR() {
        return r;
    }

    @JsonProperty("p_value")
    public double getPValue() {
        return pValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CorrelationRecord that))
            return false;
        return Double.compare(r, that.r) == 0
                && Double.compare(pValue, that.pValue) == 0
                && driverName.equals(that.driverName)
                && method == that.method;
    }

    @Override
    public int hashCode() {
        return Objects.hash(driverName, method, r, pValue);
    }

    @Override
    public String toString() {
        return "CorrelationRecord{" +
                "driverName='" + driverName + '\'' +
                ", method=" + method +
                ", r=" + r +
                ", pValue=" + pValue +
                '}';
    }
}
