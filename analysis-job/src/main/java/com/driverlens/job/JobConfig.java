package com.driverlens.job;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the driver analysis job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job can be driven from a shell, a container {@code -e} flag or a
 * scheduler's environment block.
 * </p>
 *
 * <table>
 * <caption>Environment variables</caption>
 * <tr><th>Variable</th><th>Default</th></tr>
 * <tr><td>{@code DATASET_PATH}</td><td>required; several CSV files are
 * separated by commas and joined in the order given</td></tr>
 * <tr><td>{@code KPI_COLUMN}</td><td>{@code value_speed}</td></tr>
 * <tr><td>{@code STORE_BASE_DIR}</td><td>{@code flow_context}</td></tr>
 * <tr><td>{@code TOP_K}</td><td>{@code 10} ({@code 0} keeps all)</td></tr>
 * <tr><td>{@code DRIVER_METADATA_PATH}</td><td>none</td></tr>
 * <tr><td>{@code ANALYSIS_PARALLEL}</td><td>{@code true}</td></tr>
 * </table>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    // ---------------------------------------------------------------
    // Input
    // ---------------------------------------------------------------
    private final List<Path> datasetPaths;
    private final String kpiColumn;

    // ---------------------------------------------------------------
    // Storage
    // ---------------------------------------------------------------
    private final Path storeBaseDir;

    // ---------------------------------------------------------------
    // Ranking
    // ---------------------------------------------------------------
    private final int topK;
    private final Path driverMetadataPath;

    // ---------------------------------------------------------------
    // Execution
    // ---------------------------------------------------------------
    private final boolean parallel;

    private JobConfig(Builder b) {
        this.datasetPaths = List.copyOf(b.datasetPaths);
        this.kpiColumn = b.kpiColumn;
        this.storeBaseDir = b.storeBaseDir;
        this.topK = b.topK;
        this.driverMetadataPath = b.driverMetadataPath;
        this.parallel = b.parallel;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is missing or out
     *                                  of range
     */
    public static JobConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build a {@link JobConfig} from an explicit variable map.
     *
     * @param env variable name to value
     * @return fully populated configuration
     */
    static JobConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env must not be null");
        try {
            String metadata = env(env, "DRIVER_METADATA_PATH", "");
            return new Builder()
                    .datasetPaths(parsePaths(env(env, "DATASET_PATH", "")))
                    .kpiColumn(env(env, "KPI_COLUMN", "value_speed"))
                    .storeBaseDir(Path.of(env(env, "STORE_BASE_DIR", "flow_context")))
                    .topK(Integer.parseInt(env(env, "TOP_K", "10")))
                    .driverMetadataPath(metadata.isEmpty() ? null : Path.of(metadata))
                    .parallel(parseBoolean(env(env, "ANALYSIS_PARALLEL", "true")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return the input CSV files, in join order (never empty)
     */
    public List<Path> getDatasetPaths() {
        return datasetPaths;
    }

    public String getKpiColumn() {
        return kpiColumn;
    }

    public Path getStoreBaseDir() {
        return storeBaseDir;
    }

    /**
     * @return ranking truncation, {@code 0} keeps all drivers
     */
    public int getTopK() {
        return topK;
    }

    /**
     * @return the driver metadata document, or {@code null} for none
     */
    public Path getDriverMetadataPath() {
        return driverMetadataPath;
    }

    /**
     * @return whether correlation and outlier detection run concurrently
     */
    public boolean isParallel() {
        return parallel;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that at least one dataset path is
     * set, the KPI column is non-blank and top-k is not negative.
     * </p>
     */
    public static class Builder {
        private List<Path> datasetPaths = List.of();
        private String kpiColumn = "value_speed";
        private Path storeBaseDir = Path.of("flow_context");
        private int topK = 10;
        private Path driverMetadataPath;
        private boolean parallel = true;

        public Builder datasetPath(Path v) {
            this.datasetPaths = v != null ? List.of(v) : List.of();
            return this;
        }

        public Builder datasetPaths(List<Path> v) {
            this.datasetPaths = v != null ? v : List.of();
            return this;
        }

        public Builder kpiColumn(String v) {
            this.kpiColumn = v;
            return this;
        }

        public Builder storeBaseDir(Path v) {
            this.storeBaseDir = v;
            return this;
        }

        public Builder topK(int v) {
            this.topK = v;
            return this;
        }

        public Builder driverMetadataPath(Path v) {
            this.driverMetadataPath = v;
            return this;
        }

        public Builder parallel(boolean v) {
            this.parallel = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            if (datasetPaths.isEmpty()) {
                throw new IllegalArgumentException("datasetPath must be set (DATASET_PATH)");
            }
            for (Path path : datasetPaths) {
                if (path == null) {
                    throw new IllegalArgumentException("datasetPaths must not contain null");
                }
            }
            Objects.requireNonNull(storeBaseDir, "storeBaseDir required");
            if (kpiColumn == null || kpiColumn.isBlank()) {
                throw new IllegalArgumentException("kpiColumn must not be null or blank");
            }
            if (topK < 0) {
                throw new IllegalArgumentException("topK must be >= 0, got: " + topK);
            }
            return new JobConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    private static List<Path> parsePaths(String value) {
        List<Path> paths = new ArrayList<>();
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                paths.add(Path.of(part.trim()));
            }
        }
        return paths;
    }

    private static boolean parseBoolean(String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalStateException("ANALYSIS_PARALLEL must be true or false, got: " + value);
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "datasetPaths=" + datasetPaths +
                ", kpiColumn='" + kpiColumn + '\'' +
                ", storeBaseDir=" + storeBaseDir +
                ", topK=" + topK +
                ", driverMetadataPath=" + driverMetadataPath +
                ", parallel=" + parallel +
                '}';
    }
}
