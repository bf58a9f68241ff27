package com.driverlens.core.report;

import com.driverlens.core.error.AnalysisError;
import com.driverlens.core.error.AnalysisResult;
import com.driverlens.core.error.ErrorEnvelope;
import com.driverlens.core.model.RankedDriver;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Persisted ranking result: {@code {kpi_name, ranking}}, highest score first.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"kpi_name", "ranking"})
public class ImpactRankingReport extends StageReport {

    private String kpiName;
    private List<RankedDriver> ranking = new ArrayList<>();

    /** No-arg constructor required by Jackson. */
    public ImpactRankingReport() {
    }

    /**
     * Build the report for a ranking outcome.
     *
     * @param kpiName the KPI column
     * @param result  the ranker's result
     * @return the report; empty and carrying the envelope on failure
     */
    public static ImpactRankingReport of(String kpiName, AnalysisResult<List<RankedDriver>> result) {
        Objects.requireNonNull(result, "result must not be null");
        ImpactRankingReport report = new ImpactRankingReport();
        report.kpiName = kpiName;
        Optional<AnalysisError> error = result.getError();
        if (error.isPresent()) {
            report.applyEnvelope(ErrorEnvelope.from(error.get()));
        } else {
            report.ranking = new ArrayList<>(result.getValue());
        }
        return report;
    }

    /**
     * An empty ranking that carries an upstream stage's envelope unchanged.
     *
     * @param kpiName  the KPI column
     * @param upstream the envelope of the stage that failed first
     * @return the report
     */
    public static ImpactRankingReport carrying(String kpiName, ErrorEnvelope upstream) {
        ImpactRankingReport report = new ImpactRankingReport();
        report.kpiName = kpiName;
        report.applyEnvelope(upstream);
        return report;
    }

    @JsonProperty("kpi_name")
    public String getKpiName() {
        return kpiName;
    }

    @JsonProperty("kpi_name")
    public void setKpiName(String kpiName) {
        this.kpiName = kpiName;
    }

    @JsonProperty("ranking")
    public List<RankedDriver> getRanking() {
        return ranking;
    }

    @JsonProperty("ranking")
    public void setRanking(List<RankedDriver> ranking) {
        this.ranking = ranking != null ? new ArrayList<>(ranking) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "ImpactRankingReport{kpiName='" + kpiName + "', ranking=" + ranking.size()
                + (isFailed() ? ", failed: " + getErrorMessage() : "") + '}';
    }
}
