package com.driverlens.core.error;

/**
 * The statistical stages guarded by the fallback policy, with the artifact name
 * each stage's result is persisted under.
 */
public enum AnalysisStage {

    CORRELATION("correlation", "correlation_matrix"),
    RANKING("ranking", "impact_ranking"),
    OUTLIERS("outliers", "outlier_report");

    private final String stageName;
    private final String artifactName;

    AnalysisStage(String stageName, String artifactName) {
        this.stageName = stageName;
        this.artifactName = artifactName;
    }

    public String getStageName() {
        return stageName;
    }

    public String getArtifactName() {
        return artifactName;
    }

    @Override
    public String toString() {
        return stageName;
    }
}
