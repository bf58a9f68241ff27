package com.driverlens.job;

import com.driverlens.core.analysis.AnalysisOutcome;
import com.driverlens.core.config.AnalysisSettings;
import com.driverlens.core.model.RankedDriver;
import com.driverlens.core.store.Session;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end runs of {@link DriverAnalysisJob} against a temporary store.
 */
class DriverAnalysisJobTest {

    @TempDir
    Path tempDir;

    private Path dataset;
    private Path storeDir;

    @BeforeEach
    void writeDataset() throws IOException {
        StringBuilder csv = new StringBuilder("batch,value_speed,value_temp,value_noise\n");
        for (int i = 0; i < 30; i++) {
            csv.append("b").append(i % 3).append(',')
                    .append(i).append(',')
                    .append(2.0 * i + Math.sin(i)).append(',')
                    .append(Math.cos(1.7 * i)).append('\n');
        }
        dataset = tempDir.resolve("run.csv");
        Files.writeString(dataset, csv.toString(), StandardCharsets.UTF_8);
        storeDir = tempDir.resolve("ctx");
    }

    @Test
    @DisplayName("Parallel run should persist the dataset and all three reports")
    void shouldRunInParallel() throws Exception {
        AnalysisOutcome outcome = DriverAnalysisJob.run(config(true).build(), AnalysisSettings.defaults());

        assertThat(outcome.isComplete()).isTrue();
        assertThat(outcome.getDataset().getName()).isEqualTo("unified_dataset");
        assertThat(storeDir.resolve(outcome.getDataset().getRelativePath())).exists();

        List<RankedDriver> ranking = outcome.getRanking().getRanking();
        assertThat(ranking).extracting(RankedDriver::getDriverName).startsWith("value_temp");
        assertThat(ranking.get(0).getDescription()).isEqualTo("Oven temperature");
        assertThat(ranking.get(0).getUnit()).isEqualTo("°C");

        assertThat(registeredMetadata()).contains("unified_dataset", "data_report", "correlation_matrix",
                "impact_ranking", "outlier_report");
    }

    @Test
    @DisplayName("Sequential run should produce the same ranking as the parallel run")
    void shouldRunSequentially() {
        AnalysisOutcome parallel = DriverAnalysisJob.run(config(true).build(), AnalysisSettings.defaults());
        AnalysisOutcome sequential = DriverAnalysisJob.run(config(false).build(), AnalysisSettings.defaults());

        assertThat(sequential.isComplete()).isTrue();
        assertThat(sequential.getRanking().getRanking()).isEqualTo(parallel.getRanking().getRanking());
        assertThat(sequential.getCorrelation().getDrivers()).isEqualTo(parallel.getCorrelation().getDrivers());
    }

    @Test
    @DisplayName("Top-k from the job config should truncate the ranking")
    void shouldApplyTopK() {
        AnalysisOutcome outcome = DriverAnalysisJob.run(config(true).topK(1).build(), AnalysisSettings.defaults());

        assertThat(outcome.getRanking().getRanking()).hasSize(1);
        assertThat(outcome.getCorrelation().getDrivers()).hasSize(2);
    }

    @Test
    @DisplayName("An unknown KPI should yield error reports instead of failing the run")
    void shouldReportMissingKpi() {
        AnalysisOutcome outcome = DriverAnalysisJob.run(
                config(true).kpiColumn("value_yield").build(), AnalysisSettings.defaults());

        assertThat(outcome.isComplete()).isFalse();
        assertThat(outcome.getCorrelation().isFailed()).isTrue();
        assertThat(outcome.getCorrelation().getStage()).isEqualTo("correlation");
        assertThat(outcome.getRanking().isFailed()).isTrue();
        assertThat(outcome.getRanking().getRanking()).isEmpty();
        assertThat(outcome.getOutliers().isFailed()).isTrue();
        assertThat(outcome.getOutliers().getStage()).isEqualTo("outliers");
    }

    @Test
    @DisplayName("A missing dataset file should fail the run")
    void shouldFailOnMissingDataset() {
        JobConfig config = config(true).datasetPath(tempDir.resolve("absent.csv")).build();

        assertThatThrownBy(() -> DriverAnalysisJob.run(config, AnalysisSettings.defaults()))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("absent.csv");
    }

    @Test
    @DisplayName("An empty dataset file should yield error reports instead of failing the run")
    void shouldReportEmptyDataset() throws IOException {
        Path empty = tempDir.resolve("empty.csv");
        Files.write(empty, new byte[0]);

        AnalysisOutcome outcome = DriverAnalysisJob.run(config(true).datasetPath(empty).build(),
                AnalysisSettings.defaults());

        assertThat(outcome.isComplete()).isFalse();
        assertThat(outcome.getDataset()).isNull();
        assertThat(outcome.getCorrelation().isFailed()).isTrue();
        assertThat(outcome.getOutliers().isFailed()).isTrue();
        assertThat(outcome.getRanking().isFailed()).isTrue();
        assertThat(registeredMetadata()).contains("correlation_matrix", "impact_ranking", "outlier_report")
                .doesNotContain("unified_dataset");
    }

    @Test
    @DisplayName("Several dataset files should be joined on their shared key before analysis")
    void shouldJoinSeveralDatasets() throws IOException {
        StringBuilder speed = new StringBuilder("batch,value_speed\n");
        StringBuilder drivers = new StringBuilder("batch,value_temp,value_noise\n");
        for (int i = 0; i < 30; i++) {
            speed.append("b").append(i).append(',').append(i).append('\n');
        }
        for (int i = 29; i >= 0; i--) {
            drivers.append("b").append(i).append(',')
                    .append(2.0 * i + Math.sin(i)).append(',')
                    .append(Math.cos(1.7 * i)).append('\n');
        }
        Path speedFile = tempDir.resolve("speed.csv");
        Path driverFile = tempDir.resolve("drivers.csv");
        Files.writeString(speedFile, speed.toString(), StandardCharsets.UTF_8);
        Files.writeString(driverFile, drivers.toString(), StandardCharsets.UTF_8);

        AnalysisOutcome outcome = DriverAnalysisJob.run(
                config(false).datasetPaths(List.of(speedFile, driverFile)).build(), AnalysisSettings.defaults());

        assertThat(outcome.isComplete()).isTrue();
        assertThat(outcome.getRanking().getRanking()).extracting(RankedDriver::getDriverName)
                .startsWith("value_temp");
        assertThat(registeredMetadata()).contains("data_report");
    }

    @Test
    @DisplayName("A malformed metadata document should not stop the run")
    void shouldRunWithMalformedMetadata() throws IOException {
        Path metadata = tempDir.resolve("drivers.json");
        Files.writeString(metadata, "{\"drivers\": {\"temp\": ", StandardCharsets.UTF_8);

        AnalysisOutcome outcome = DriverAnalysisJob.run(config(true).driverMetadataPath(metadata).build(),
                AnalysisSettings.defaults());

        assertThat(outcome.isComplete()).isTrue();
        RankedDriver top = outcome.getRanking().getRanking().get(0);
        assertThat(top.getDriverName()).isEqualTo("value_temp");
        assertThat(top.getDescription()).isNull();
        assertThat(top.getDisplayName()).isEqualTo("Driver temp");
    }

    private JobConfig.Builder config(boolean parallel) {
        try {
            return new JobConfig.Builder()
                    .datasetPath(dataset)
                    .storeBaseDir(storeDir)
                    .driverMetadataPath(Path.of(getClass().getResource("/drivers_metadata.json").toURI()))
                    .parallel(parallel);
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    private String registeredMetadata() throws IOException {
        try (Stream<Path> sessions = Files.list(storeDir)) {
            List<Path> dirs = sessions.filter(Files::isDirectory).collect(Collectors.toList());
            assertThat(dirs).hasSize(1);
            return Files.readString(dirs.get(0).resolve(Session.METADATA_FILE), StandardCharsets.UTF_8);
        }
    }
}
