package com.driverlens.core.analysis;

import com.driverlens.core.config.AnalysisSettings;
import com.driverlens.core.error.ErrorCategory;
import com.driverlens.core.model.ColumnType;
import com.driverlens.core.model.CorrelationMethod;
import com.driverlens.core.model.DataTable;
import com.driverlens.core.model.OutlierPoint;
import com.driverlens.core.report.CorrelationReport;
import com.driverlens.core.report.DataReport;
import com.driverlens.core.report.ImpactRankingReport;
import com.driverlens.core.report.OutlierReport;
import com.driverlens.core.store.ArtifactKind;
import com.driverlens.core.store.ArtifactStore;
import com.driverlens.core.store.TableInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.driverlens.core.analysis.AnalysisFixtures.KPI;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DriverAnalysisService}.
 */
class DriverAnalysisServiceTest {

    @TempDir
    Path baseDir;

    private ArtifactStore store;
    private DriverAnalysisService service;

    @BeforeEach
    void setUp() {
        store = new ArtifactStore(ArtifactStore.startSession(baseDir));
        service = DriverAnalysisService.create(store, AnalysisSettings.defaults(), DriverMetadataProvider.none());
    }

    @Test
    @DisplayName("Should persist the dataset and all three reports under their fixed names")
    void shouldAnalyzeAndPersist() {
        AnalysisOutcome outcome = service.analyze(TableInput.inline(AnalysisFixtures.scenarioA()), KPI, null);

        assertThat(outcome.isComplete()).isTrue();
        assertThat(outcome.getDataset().getName()).isEqualTo(DriverAnalysisService.DATASET_ARTIFACT);
        assertThat(store.listArtifacts()).containsExactlyInAnyOrder(
                "unified_dataset", "data_report", "correlation_matrix", "outlier_report", "impact_ranking");

        ImpactRankingReport ranking = store.loadRecord("impact_ranking", null, ImpactRankingReport.class);
        assertThat(ranking.getKpiName()).isEqualTo(KPI);
        assertThat(ranking.isFailed()).isFalse();
        assertThat(ranking.getRanking().get(0).getDriverName()).isEqualTo("driver_A");

        CorrelationReport correlation = store.loadRecord("correlation_matrix", null, CorrelationReport.class);
        assertThat(correlation.getDrivers()).hasSize(2);
        assertThat(correlation.getDrivers().get(0).getMethod()).isEqualTo(CorrelationMethod.LINEAR);

        OutlierReport outliers = store.loadRecord("outlier_report", null, OutlierReport.class);
        assertThat(outliers.getKpi()).isEqualTo(KPI);
        assertThat(outliers.getSummary()).isNotBlank();
    }

    @Test
    @DisplayName("A missing KPI should persist error reports, and ranking should carry the correlation error")
    void shouldPersistEnvelopesForMissingKpi() {
        DataTable table = AnalysisFixtures.scenarioA();

        CorrelationReport correlation = service.correlate(table, "value_speed");
        ImpactRankingReport ranking = service.rank(correlation);

        assertThat(correlation.isFailed()).isTrue();
        assertThat(ranking.isFailed()).isTrue();
        assertThat(ranking.getStage()).isEqualTo("correlation");
        assertThat(ranking.getRanking()).isEmpty();

        Map<String, Object> stored = store.loadRecord("correlation_matrix");
        assertThat(stored).containsEntry("error_state", true)
                .containsEntry("stage", "correlation")
                .containsEntry("drivers", List.of())
                .containsKeys("error_message", "user_message", "suggestions", "technical_details");
        assertThat((String) stored.get("user_message")).isNotBlank();

        Map<String, Object> storedRanking = store.loadRecord("impact_ranking");
        assertThat(storedRanking).containsEntry("error_state", true)
                .containsEntry("ranking", List.of());
    }

    @Test
    @DisplayName("A successful report should carry no envelope fields")
    void shouldOmitEnvelopeOnSuccess() {
        DataTable table = DataTable.builder()
                .numericColumn(KPI, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10)
                .numericColumn("value_a", 1, 2, 3, 4, 5, 6, 7, 8, 9, 30)
                .build();

        OutlierReport report = service.detectOutliers(table, KPI);

        assertThat(report.getOutliers()).containsExactly(new OutlierPoint(9, "value_a"));
        assertThat(store.loadRecord("outlier_report"))
                .containsOnlyKeys("kpi", "outliers", "summary");
    }

    @Test
    @DisplayName("Each save should add a new version of the same report")
    void shouldVersionRepeatedRuns() {
        DataTable table = AnalysisFixtures.scenarioA();
        service.correlate(table, KPI);
        service.correlate(table, KPI);

        assertThat(store.listVersions("correlation_matrix", ArtifactKind.RECORD))
                .containsExactly(1, 2);
    }

    @Test
    @DisplayName("A KPI without variance should persist a numeric error instead of an empty success")
    void shouldReportDegenerateKpi() {
        double[] missing = new double[10];
        Arrays.fill(missing, Double.NaN);
        DataTable table = DataTable.builder()
                .numericColumn(KPI, missing)
                .numericColumn("value_a", 1, 2, 3, 4, 5, 6, 7, 8, 9, 10)
                .build();

        CorrelationReport correlation = service.correlate(table, KPI);
        ImpactRankingReport ranking = service.rank(correlation);

        assertThat(correlation.isFailed()).isTrue();
        assertThat(correlation.getDrivers()).isEmpty();
        assertThat(correlation.getStage()).isEqualTo("correlation");
        assertThat(correlation.getUserMessage()).isEqualTo(ErrorCategory.NUMERIC.getUserMessage());
        assertThat(ranking.isFailed()).isTrue();
        assertThat(ranking.getErrorMessage()).isEqualTo(correlation.getErrorMessage());
    }

    @Test
    @DisplayName("Unusable input should still persist all three reports, each carrying the input error")
    void shouldReportUnusableInput() {
        AnalysisOutcome outcome = service.analyze(
                TableInput.rawBytes(new byte[0]), KPI, null);

        assertThat(outcome.isComplete()).isFalse();
        assertThat(outcome.getDataset()).isNull();
        assertThat(outcome.getCorrelation().getStage()).isEqualTo("correlation");
        assertThat(outcome.getOutliers().getStage()).isEqualTo("outliers");
        assertThat(outcome.getRanking().getStage()).isEqualTo("correlation");
        assertThat(outcome.getCorrelation().getUserMessage())
                .isEqualTo(ErrorCategory.INVALID_VALUE.getUserMessage());
        assertThat(store.listArtifacts()).containsExactlyInAnyOrder(
                "correlation_matrix", "outlier_report", "impact_ranking");
        assertThat(store.loadRecord("outlier_report"))
                .containsEntry("error_state", true)
                .containsEntry("outliers", List.of());
    }

    @Test
    @DisplayName("A reference to an unknown table should be reported as a missing file")
    void shouldReportUnknownReference() {
        AnalysisOutcome outcome = service.analyze(TableInput.reference("measurements"), KPI, 5);

        assertThat(outcome.getCorrelation().isFailed()).isTrue();
        assertThat(outcome.getCorrelation().getUserMessage())
                .isEqualTo(ErrorCategory.MISSING_FILE.getUserMessage());
        assertThat(outcome.getRanking().isFailed()).isTrue();
    }

    @Test
    @DisplayName("Several inputs should be joined into one dataset with a saved profile")
    void shouldJoinInputsAndSaveProfile() {
        Map<String, TableInput> inputs = new LinkedHashMap<>();
        inputs.put("kpi.csv", TableInput.rawBytes(
                "batch,KPI\nB1,1\nB2,2\nB3,3\nB4,4\n".getBytes(StandardCharsets.UTF_8)));
        inputs.put("drivers.csv", TableInput.rawBytes(
                "batch,driver_A\nB4,8.5\nB3,6.5\nB2,4.5\nB1,2.5\n".getBytes(StandardCharsets.UTF_8)));

        service.saveDatasets(inputs);

        DataTable dataset = service.loadDataset();
        assertThat(dataset.getColumnNames()).containsExactly("batch", "KPI", "driver_A");
        assertThat(dataset.getColumnType("batch")).isEqualTo(ColumnType.TEXT);
        assertThat(dataset.numericValues("driver_A")).containsExactly(2.5, 4.5, 6.5, 8.5);

        DataReport report = store.loadRecord(DriverAnalysisService.DATA_REPORT_ARTIFACT, null, DataReport.class);
        assertThat(report.getJoinKey()).isEqualTo("batch");
        assertThat(report.isSurrogateKey()).isFalse();
        assertThat(report.getUnifiedRows()).isEqualTo(4);
        assertThat(report.getTables()).extracting(DataReport.TableProfile::getSource)
                .containsExactly("kpi.csv", "drivers.csv");
    }

    @Test
    @DisplayName("Readers should return the stored reports")
    void shouldReadStoredReports() {
        service.analyze(TableInput.inline(AnalysisFixtures.scenarioA()), KPI, 1);

        assertThat(service.readCorrelation().getDrivers()).hasSize(2);
        assertThat(service.readRanking().getRanking()).hasSize(1);
        assertThat(service.readRanking().isFailed()).isFalse();
        assertThat(service.readOutliers().getKpi()).isEqualTo(KPI);
    }

    @Test
    @DisplayName("Readers should return empty reports with an envelope when nothing usable is stored")
    void shouldReadEmptyReportsWhenUnavailable() throws IOException {
        ImpactRankingReport ranking = service.readRanking();
        assertThat(ranking.getRanking()).isEmpty();
        assertThat(ranking.isFailed()).isTrue();
        assertThat(ranking.getStage()).isEqualTo("ranking");
        assertThat(ranking.getUserMessage()).isEqualTo(ErrorCategory.MISSING_FILE.getUserMessage());
        assertThat(service.readCorrelation().getDrivers()).isEmpty();

        service.analyze(TableInput.inline(AnalysisFixtures.scenarioA()), KPI, null);
        Path outlierFile = store.getSession().getSessionDirectory().resolve("outlier_report.v1.json");
        Files.writeString(outlierFile, "{\"outliers\": 42}", StandardCharsets.UTF_8);

        OutlierReport outliers = service.readOutliers();
        assertThat(outliers.isFailed()).isTrue();
        assertThat(outliers.getOutliers()).isEmpty();
        assertThat(outliers.getStage()).isEqualTo("outliers");
    }
}
