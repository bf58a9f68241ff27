package com.driverlens.core.report;

import com.driverlens.core.analysis.OutlierDetector;
import com.driverlens.core.error.AnalysisError;
import com.driverlens.core.error.AnalysisResult;
import com.driverlens.core.error.ErrorEnvelope;
import com.driverlens.core.model.OutlierPoint;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Persisted outlier result: {@code {kpi, outliers, summary}}.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"kpi", "outliers", "summary"})
public class OutlierReport extends StageReport {

    private String kpi;
    private List<OutlierPoint> outliers = new ArrayList<>();
    private String summary;

    /** No-arg constructor required by Jackson. */
    public OutlierReport() {
    }

    /**
     * Build the report for an outlier detection outcome.
     *
     * @param kpi    the KPI column
     * @param result the detector's result
     * @return the report with its summary line; empty and carrying the
     *         envelope on failure
     */
    public static OutlierReport of(String kpi, AnalysisResult<List<OutlierPoint>> result) {
        Objects.requireNonNull(result, "result must not be null");
        OutlierReport report = new OutlierReport();
        report.kpi = kpi;
        Optional<AnalysisError> error = result.getError();
        if (error.isPresent()) {
            report.applyEnvelope(ErrorEnvelope.from(error.get()));
        } else {
            report.outliers = new ArrayList<>(result.getValue());
            report.summary = OutlierDetector.summarize(report.outliers);
        }
        return report;
    }

    @JsonProperty("kpi")
    public String getKpi() {
        return kpi;
    }

    @JsonProperty("kpi")
    public void setKpi(String kpi) {
        this.kpi = kpi;
    }

    @JsonProperty("outliers")
    public List<OutlierPoint> getOutliers() {
        return outliers;
    }

    @JsonProperty("outliers")
    public void setOutliers(List<OutlierPoint> outliers) {
        this.outliers = outliers != null ? new ArrayList<>(outliers) : new ArrayList<>();
    }

    @JsonProperty("summary")
    public String getSummary() {
        return summary;
    }

    @JsonProperty("summary")
    public void setSummary(String summary) {
        this.summary = summary;
    }

    @Override
    public String toString() {
        return "OutlierReport{kpi='" + kpi + "', outliers=" + outliers.size()
                + (isFailed() ? ", failed: " + getErrorMessage() : "") + '}';
    }
}
