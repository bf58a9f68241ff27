package com.driverlens.job;

import com.driverlens.core.analysis.AnalysisOutcome;
import com.driverlens.core.analysis.DriverAnalysisService;
import com.driverlens.core.analysis.DriverMetadataProvider;
import com.driverlens.core.analysis.JsonDriverMetadataProvider;
import com.driverlens.core.config.AnalysisSettings;
import com.driverlens.core.config.SettingsLoader;
import com.driverlens.core.model.DataTable;
import com.driverlens.core.report.CorrelationReport;
import com.driverlens.core.report.ImpactRankingReport;
import com.driverlens.core.report.OutlierReport;
import com.driverlens.core.store.ArtifactReference;
import com.driverlens.core.store.ArtifactStore;
import com.driverlens.core.store.Session;
import com.driverlens.core.store.TableInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point for a single driver analysis run.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   CSV file(s) (DATASET_PATH)
 *     → new session under STORE_BASE_DIR, joined and saved as
 *       unified_dataset + data_report
 *     ├→ correlation_matrix → impact_ranking
 *     └→ outlier_report
 * </pre>
 *
 * <p>
 * The two branches run on a two-thread pool when {@code ANALYSIS_PARALLEL} is
 * set (the default); ranking starts only once correlation has finished, and
 * the run returns only after both branches complete. A failed stage still
 * produces its report, carrying the error envelope. A file that exists but is
 * not a usable table is reported the same way, in all three reports.
 * </p>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job settings come from environment variables via {@link JobConfig};
 * statistical tuning via {@link SettingsLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DriverAnalysisJob {

    private static final Logger LOG = LoggerFactory.getLogger(DriverAnalysisJob.class);

    static final int WORKER_THREADS = 2;

    private DriverAnalysisJob() {
        // entry-point class — not instantiable
    }

    public static void main(String[] args) {
        // 1. Load configuration
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting driver analysis with config: {}", config);
        AnalysisSettings settings = SettingsLoader.load();

        // 2. Run
        AnalysisOutcome outcome = run(config, settings);

        // 3. Report
        if (outcome.isComplete()) {
            LOG.info("Analysis finished: {} driver(s) ranked, {}", outcome.getRanking().getRanking().size(),
                    outcome.getOutliers().getSummary());
        } else {
            LOG.warn("Analysis finished with errors: {}", outcome);
        }
    }

    /**
     * Run one analysis in a new session.
     *
     * @param config   job configuration
     * @param settings statistical tuning
     * @return the persisted reports
     * @throws UncheckedIOException if a dataset file cannot be read
     */
    public static AnalysisOutcome run(JobConfig config, AnalysisSettings settings) {
        Objects.requireNonNull(config, "JobConfig must not be null");
        Objects.requireNonNull(settings, "AnalysisSettings must not be null");

        Session session = ArtifactStore.startSession(config.getStoreBaseDir());
        DriverAnalysisService service = DriverAnalysisService.create(
                new ArtifactStore(session), settings, loadMetadata(config));

        ArtifactReference dataset;
        try {
            dataset = service.saveDatasets(readDatasets(config));
        } catch (IllegalArgumentException e) {
            AnalysisOutcome outcome = service.reportInputFailure(config.getKpiColumn(), e);
            LOG.warn("Session {} stopped on unusable input: {}", session.getSessionId(), e.getMessage());
            return outcome;
        }
        DataTable table = service.loadDataset();

        AnalysisOutcome outcome = config.isParallel()
                ? runParallel(service, table, dataset, config)
                : runSequential(service, table, dataset, config);
        LOG.info("Session {} complete: {}", session.getSessionId(), outcome);
        return outcome;
    }

    // ---------------------------------------------------------------
    // Scheduling
    // ---------------------------------------------------------------

    static AnalysisOutcome runSequential(DriverAnalysisService service, DataTable table,
            ArtifactReference dataset, JobConfig config) {
        String kpi = config.getKpiColumn();
        CorrelationReport correlation = service.correlate(table, kpi);
        ImpactRankingReport ranking = service.rank(correlation, config.getTopK());
        OutlierReport outliers = service.detectOutliers(table, kpi);
        return new AnalysisOutcome(dataset, correlation, ranking, outliers);
    }

    static AnalysisOutcome runParallel(DriverAnalysisService service, DataTable table,
            ArtifactReference dataset, JobConfig config) {
        String kpi = config.getKpiColumn();
        ExecutorService executor = Executors.newFixedThreadPool(WORKER_THREADS, workerThreads());
        try {
            CompletableFuture<CorrelationReport> correlation = CompletableFuture
                    .supplyAsync(() -> service.correlate(table, kpi), executor);
            CompletableFuture<ImpactRankingReport> ranking = correlation
                    .thenApply(report -> service.rank(report, config.getTopK()));
            CompletableFuture<OutlierReport> outliers = CompletableFuture
                    .supplyAsync(() -> service.detectOutliers(table, kpi), executor);

            CompletableFuture.allOf(ranking, outliers).join();
            return new AnalysisOutcome(dataset, correlation.join(), ranking.join(), outliers.join());
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        } finally {
            executor.shutdown();
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Map<String, TableInput> readDatasets(JobConfig config) {
        Map<String, TableInput> inputs = new LinkedHashMap<>();
        for (Path path : config.getDatasetPaths()) {
            try {
                inputs.put(path.toString(), TableInput.rawBytes(Files.readAllBytes(path)));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read dataset: " + path, e);
            }
        }
        return inputs;
    }

    private static DriverMetadataProvider loadMetadata(JobConfig config) {
        if (config.getDriverMetadataPath() == null) {
            LOG.info("No driver metadata configured, ranking without enrichment");
            return DriverMetadataProvider.none();
        }
        return JsonDriverMetadataProvider.fromFile(config.getDriverMetadataPath());
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "analysis-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
