package com.driverlens.core.report;

import com.driverlens.core.error.AnalysisError;
import com.driverlens.core.error.AnalysisResult;
import com.driverlens.core.error.ErrorEnvelope;
import com.driverlens.core.model.CorrelationRecord;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Persisted correlation result: {@code {kpi, drivers}}, most significant
 * driver first.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"kpi", "drivers"})
public class CorrelationReport extends StageReport {

    private String kpi;
    private List<CorrelationRecord> drivers = new ArrayList<>();

    /** No-arg constructor required by Jackson. */
    public CorrelationReport() {
    }

    /**
     * Build the report for a correlation outcome.
     *
     * @param kpi    the KPI column
     * @param result the engine's result
     * @return the report; empty and carrying the envelope on failure
     */
    public static CorrelationReport of(String kpi, AnalysisResult<List<CorrelationRecord>> result) {
        Objects.requireNonNull(result, "result must not be null");
        CorrelationReport report = new CorrelationReport();
        report.kpi = kpi;
        Optional<AnalysisError> error = result.getError();
        if (error.isPresent()) {
            report.applyEnvelope(ErrorEnvelope.from(error.get()));
        } else {
            report.drivers = new ArrayList<>(result.getValue());
        }
        return report;
    }

    public static CorrelationReport failed(String kpi, AnalysisError error) {
        return of(kpi, AnalysisResult.failure(error));
    }

    @JsonProperty("kpi")
    public String getKpi() {
        return kpi;
    }

    @JsonProperty("kpi")
    public void setKpi(String kpi) {
        this.kpi = kpi;
    }

    @JsonProperty("drivers")
    public List<CorrelationRecord> getDrivers() {
        return drivers;
    }

    @JsonProperty("drivers")
    public void setDrivers(List<CorrelationRecord> drivers) {
        this.drivers = drivers != null ? new ArrayList<>(drivers) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "CorrelationReport{kpi='" + kpi + "', drivers=" + drivers.size()
                + (isFailed() ? ", failed: " + getErrorMessage() : "") + '}';
    }
}
