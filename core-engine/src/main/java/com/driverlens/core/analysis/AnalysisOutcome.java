package com.driverlens.core.analysis;

import com.driverlens.core.report.CorrelationReport;
import com.driverlens.core.report.ImpactRankingReport;
import com.driverlens.core.report.OutlierReport;
import com.driverlens.core.store.ArtifactReference;

import java.util.Objects;

/**
 * The persisted results of one full analysis run.
 *
 * @since 1.0.0
 */
public final class AnalysisOutcome {

    private final ArtifactReference dataset;
    private final CorrelationReport correlation;
    private final ImpactRankingReport ranking;
    private final OutlierReport outliers;

    public AnalysisOutcome(ArtifactReference dataset, CorrelationReport correlation,
            ImpactRankingReport ranking, OutlierReport outliers) {
        this.dataset = dataset;
        this.correlation = Objects.requireNonNull(correlation, "correlation must not be null");
        this.ranking = Objects.requireNonNull(ranking, "ranking must not be null");
        this.outliers = Objects.requireNonNull(outliers, "outliers must not be null");
    }

    /**
     * @return reference to the saved input table, or {@code null} if the
     *         input could not be resolved
     */
    public ArtifactReference getDataset() {
        return dataset;
    }

    public CorrelationReport getCorrelation() {
        return correlation;
    }

    public ImpactRankingReport getRanking() {
        return ranking;
    }

    public OutlierReport getOutliers() {
        return outliers;
    }

    /**
     * @return {@code true} if the input was saved and no stage report carries
     *         an error envelope
     */
    public boolean isComplete() {
        return dataset != null && !correlation.isFailed() && !ranking.isFailed() && !outliers.isFailed();
    }

    @Override
    public String toString() {
        return "AnalysisOutcome{dataset=" + dataset +
                ", correlation=" + correlation +
                ", ranking=" + ranking +
                ", outliers=" + outliers +
                '}';
    }
}
