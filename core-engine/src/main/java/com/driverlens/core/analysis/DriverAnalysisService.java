package com.driverlens.core.analysis;

import com.driverlens.core.config.AnalysisSettings;
import com.driverlens.core.error.AnalysisError;
import com.driverlens.core.error.AnalysisResult;
import com.driverlens.core.error.AnalysisStage;
import com.driverlens.core.model.DataTable;
import com.driverlens.core.profile.DataProfiler;
import com.driverlens.core.profile.ProfiledDataset;
import com.driverlens.core.report.CorrelationReport;
import com.driverlens.core.report.ImpactRankingReport;
import com.driverlens.core.report.OutlierReport;
import com.driverlens.core.report.StageReport;
import com.driverlens.core.store.ArtifactCorruptException;
import com.driverlens.core.store.ArtifactNotFoundException;
import com.driverlens.core.store.ArtifactReference;
import com.driverlens.core.store.ArtifactStore;
import com.driverlens.core.store.TableInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Runs the statistical stages against one session and persists their
 * reports.
 *
 * <p>
 * Each stage report is saved under its fixed artifact name whether the stage
 * succeeded or not, so downstream readers always find a structurally valid
 * record:
 * </p>
 * <ul>
 * <li>{@value #DATASET_ARTIFACT}: the resolved, unified input table</li>
 * <li>{@value #DATA_REPORT_ARTIFACT}: the profile of the input tables</li>
 * <li>{@code correlation_matrix}: {@link CorrelationReport}</li>
 * <li>{@code impact_ranking}: {@link ImpactRankingReport}</li>
 * <li>{@code outlier_report}: {@link OutlierReport}</li>
 * </ul>
 *
 * <p>
 * {@link #correlate} and {@link #detectOutliers} are independent and may be
 * called concurrently; {@link #rank} needs a finished correlation report.
 * An input that cannot be resolved still yields the three stage reports, each
 * carrying the input's error (see {@link #reportInputFailure}). Storage
 * failures propagate to the caller.
 * </p>
 *
 * @since 1.0.0
 */
public class DriverAnalysisService {

    private static final Logger LOG = LoggerFactory.getLogger(DriverAnalysisService.class);

    /** Artifact name of the resolved input table. */
    public static final String DATASET_ARTIFACT = "unified_dataset";

    /** Artifact name of the input profile. */
    public static final String DATA_REPORT_ARTIFACT = "data_report";

    private final DataProfiler profiler = new DataProfiler();
    private final ArtifactStore store;
    private final CorrelationEngine correlationEngine;
    private final ImpactRanker impactRanker;
    private final OutlierDetector outlierDetector;

    public DriverAnalysisService(ArtifactStore store, CorrelationEngine correlationEngine,
            ImpactRanker impactRanker, OutlierDetector outlierDetector) {
        this.store = Objects.requireNonNull(store, "ArtifactStore must not be null");
        this.correlationEngine = Objects.requireNonNull(correlationEngine, "CorrelationEngine must not be null");
        this.impactRanker = Objects.requireNonNull(impactRanker, "ImpactRanker must not be null");
        this.outlierDetector = Objects.requireNonNull(outlierDetector, "OutlierDetector must not be null");
    }

    /**
     * Wire the three stages from one settings object.
     */
    public static DriverAnalysisService create(ArtifactStore store, AnalysisSettings settings,
            DriverMetadataProvider metadata) {
        return new DriverAnalysisService(store,
                new CorrelationEngine(settings),
                new ImpactRanker(settings, metadata),
                new OutlierDetector(settings));
    }

    public ArtifactStore getStore() {
        return store;
    }

    /**
     * Resolve an input and save it as {@value #DATASET_ARTIFACT}, with its
     * profile as {@value #DATA_REPORT_ARTIFACT}.
     *
     * @param input the table, a reference to one, or raw CSV bytes
     * @return the reference of the saved version
     * @throws IllegalArgumentException  if raw content is not a valid table
     * @throws ArtifactNotFoundException if a referenced table does not exist
     */
    public ArtifactReference saveDataset(TableInput input) {
        Objects.requireNonNull(input, "input must not be null");
        return saveDatasets(Map.of(input.toString(), input));
    }

    /**
     * Resolve several inputs, merge them with {@link DataProfiler} and save
     * the result as {@value #DATASET_ARTIFACT} and the profile as
     * {@value #DATA_REPORT_ARTIFACT}.
     *
     * <p>
     * Nothing is saved unless every input resolves.
     * </p>
     *
     * @param inputs source label to input, in join order
     * @return the reference of the saved table version
     * @throws IllegalArgumentException  if no input is given or one is not a
     *                                   valid table
     * @throws ArtifactNotFoundException if a referenced table does not exist
     */
    public ArtifactReference saveDatasets(Map<String, TableInput> inputs) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        Map<String, DataTable> tables = new LinkedHashMap<>();
        for (Map.Entry<String, TableInput> input : inputs.entrySet()) {
            tables.put(input.getKey(), input.getValue().resolve(store));
        }
        ProfiledDataset profiled = profiler.profile(tables);
        DataTable table = profiled.getTable();

        ArtifactReference reference = store.saveTable(DATASET_ARTIFACT, table);
        ArtifactReference report = store.saveRecord(DATA_REPORT_ARTIFACT, profiled.getReport());
        LOG.info("{} input(s) saved as {} ({} rows, {} columns), profile saved as {}", inputs.size(),
                reference, table.getRowCount(), table.getColumnCount(), report);
        return reference;
    }

    /**
     * @return the latest saved input table
     */
    public DataTable loadDataset() {
        return store.loadTable(DATASET_ARTIFACT);
    }

    public CorrelationReport correlate(DataTable table, String kpi) {
        CorrelationReport report = CorrelationReport.of(kpi, correlationEngine.correlate(table, kpi));
        persist(AnalysisStage.CORRELATION, report.isFailed(), report);
        return report;
    }

    public OutlierReport detectOutliers(DataTable table, String kpi) {
        OutlierReport report = OutlierReport.of(kpi, outlierDetector.detect(table, kpi));
        persist(AnalysisStage.OUTLIERS, report.isFailed(), report);
        return report;
    }

    /**
     * Rank using the configured default top-k.
     */
    public ImpactRankingReport rank(CorrelationReport correlation) {
        return rank(correlation, impactRanker.getDefaultTopK());
    }

    /**
     * Rank a finished correlation report.
     *
     * <p>
     * A failed correlation report yields an empty ranking that carries the
     * correlation stage's envelope.
     * </p>
     *
     * @param correlation the correlation report
     * @param topK        maximum drivers to keep; {@code null} or {@code <= 0}
     *                    keeps all
     * @return the persisted ranking report
     */
    public ImpactRankingReport rank(CorrelationReport correlation, Integer topK) {
        Objects.requireNonNull(correlation, "correlation must not be null");
        ImpactRankingReport report;
        if (correlation.isFailed()) {
            LOG.warn("Correlation for '{}' failed, ranking carries its error", correlation.getKpi());
            report = ImpactRankingReport.carrying(correlation.getKpi(),
                    correlation.getEnvelope().orElseThrow());
        } else {
            report = ImpactRankingReport.of(correlation.getKpi(),
                    impactRanker.rank(correlation.getDrivers(), topK));
        }
        persist(AnalysisStage.RANKING, report.isFailed(), report);
        return report;
    }

    /**
     * Persist failed reports for an input that could not be turned into a
     * table.
     *
     * <p>
     * Correlation and outlier reports carry the input's error under their
     * own stage; the ranking carries the correlation envelope as usual.
     * </p>
     *
     * @param kpi     the KPI column
     * @param failure why the input could not be resolved
     * @return an outcome without a dataset reference
     */
    public AnalysisOutcome reportInputFailure(String kpi, RuntimeException failure) {
        Objects.requireNonNull(failure, "failure must not be null");
        LOG.error("Input for KPI '{}' could not be resolved, saving error reports: {}", kpi, failure.getMessage());

        CorrelationReport correlation = CorrelationReport.failed(kpi,
                AnalysisError.of(AnalysisStage.CORRELATION, failure));
        persist(AnalysisStage.CORRELATION, true, correlation);
        OutlierReport outliers = OutlierReport.of(kpi,
                AnalysisResult.failure(AnalysisError.of(AnalysisStage.OUTLIERS, failure)));
        persist(AnalysisStage.OUTLIERS, true, outliers);
        ImpactRankingReport ranking = rank(correlation, null);
        return new AnalysisOutcome(null, correlation, ranking, outliers);
    }

    /**
     * Run every stage sequentially on one input.
     *
     * @param input the dataset
     * @param kpi   the KPI column
     * @param topK  ranking truncation; {@code null} or {@code <= 0} keeps all
     * @return the persisted reports
     */
    public AnalysisOutcome analyze(TableInput input, String kpi, Integer topK) {
        Objects.requireNonNull(input, "input must not be null");
        return analyze(Map.of(input.toString(), input), kpi, topK);
    }

    /**
     * Run every stage sequentially on the merge of several inputs.
     *
     * <p>
     * An input that is not a valid table, or a reference to a table that does
     * not exist, is reported through {@link #reportInputFailure} instead of
     * being thrown.
     * </p>
     *
     * @param inputs source label to input, in join order
     * @param kpi    the KPI column
     * @param topK   ranking truncation; {@code null} or {@code <= 0} keeps all
     * @return the persisted reports
     */
    public AnalysisOutcome analyze(Map<String, TableInput> inputs, String kpi, Integer topK) {
        ArtifactReference dataset;
        try {
            dataset = saveDatasets(inputs);
        } catch (IllegalArgumentException | ArtifactNotFoundException | ArtifactCorruptException e) {
            return reportInputFailure(kpi, e);
        }
        DataTable table = loadDataset();
        CorrelationReport correlation = correlate(table, kpi);
        OutlierReport outliers = detectOutliers(table, kpi);
        ImpactRankingReport ranking = rank(correlation, topK);
        return new AnalysisOutcome(dataset, correlation, ranking, outliers);
    }

    // ---------------------------------------------------------------
    // Readers
    // ---------------------------------------------------------------

    /**
     * @return the latest correlation report, or an empty one carrying the
     *         reason it could not be read
     */
    public CorrelationReport readCorrelation() {
        return readReport(AnalysisStage.CORRELATION, CorrelationReport.class,
                error -> CorrelationReport.failed(null, error));
    }

    /**
     * @return the latest ranking report, or an empty one carrying the reason
     *         it could not be read
     */
    public ImpactRankingReport readRanking() {
        return readReport(AnalysisStage.RANKING, ImpactRankingReport.class,
                error -> ImpactRankingReport.of(null, AnalysisResult.failure(error)));
    }

    /**
     * @return the latest outlier report, or an empty one carrying the reason
     *         it could not be read
     */
    public OutlierReport readOutliers() {
        return readReport(AnalysisStage.OUTLIERS, OutlierReport.class,
                error -> OutlierReport.of(null, AnalysisResult.failure(error)));
    }

    private <R extends StageReport> R readReport(AnalysisStage stage, Class<R> type,
            Function<AnalysisError, R> empty) {
        try {
            return store.loadRecord(stage.getArtifactName(), null, type);
        } catch (ArtifactNotFoundException | ArtifactCorruptException e) {
            LOG.warn("Report '{}' cannot be read, returning an empty one: {}", stage.getArtifactName(),
                    e.getMessage());
            return empty.apply(AnalysisError.of(stage, e));
        }
    }

    private void persist(AnalysisStage stage, boolean failed, Object report) {
        ArtifactReference reference = store.saveRecord(stage.getArtifactName(), report);
        if (failed) {
            LOG.warn("Stage [{}] failed, error report saved as {}", stage, reference);
        } else {
            LOG.info("Stage [{}] completed, saved as {}", stage, reference);
        }
    }
}
