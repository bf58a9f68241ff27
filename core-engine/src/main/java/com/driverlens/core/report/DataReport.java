package com.driverlens.core.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Profile of the input tables behind one {@code unified_dataset}, saved as
 * {@code data_report}.
 *
 * <pre>
 * {
 *   "tables": [{"source": "speed.csv", "rows": 30,
 *               "columns": {"batch": {"dtype": "numeric", "nulls": 0}}}],
 *   "join_key": "batch",
 *   "surrogate_key": false,
 *   "unified_rows": 30
 * }
 * </pre>
 *
 * <p>
 * {@code join_key} is absent when a single table was supplied.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"tables", "join_key", "surrogate_key", "unified_rows"})
public class DataReport {

    private List<TableProfile> tables = new ArrayList<>();
    private String joinKey;
    private boolean surrogateKey;
    private int unifiedRows;

    /** No-arg constructor required by Jackson. */
    public DataReport() {
    }

    @JsonProperty("tables")
    public List<TableProfile> getTables() {
        return tables;
    }

    @JsonProperty("tables")
    public void setTables(List<TableProfile> tables) {
        this.tables = tables != null ? new ArrayList<>(tables) : new ArrayList<>();
    }

    /**
     * @return the column the tables were joined on, or {@code null} for a
     *         single table
     */
    @JsonProperty("join_key")
    public String getJoinKey() {
        return joinKey;
    }

    @JsonProperty("join_key")
    public void setJoinKey(String joinKey) {
        this.joinKey = joinKey;
    }

    /**
     * @return {@code true} if no shared unique column existed and rows were
     *         aligned by position instead
     */
    @JsonProperty("surrogate_key")
    public boolean isSurrogateKey() {
        return surrogateKey;
    }

    @JsonProperty("surrogate_key")
    public void setSurrogateKey(boolean surrogateKey) {
        this.surrogateKey = surrogateKey;
    }

    @JsonProperty("unified_rows")
    public int getUnifiedRows() {
        return unifiedRows;
    }

    @JsonProperty("unified_rows")
    public void setUnifiedRows(int unifiedRows) {
        this.unifiedRows = unifiedRows;
    }

    @Override
    public String toString() {
        return "DataReport{tables=" + tables.size() + ", joinKey='" + joinKey
                + "', surrogateKey=" + surrogateKey + ", unifiedRows=" + unifiedRows + '}';
    }

    // ---------------------------------------------------------------
    // Per-table profile
    // ---------------------------------------------------------------

    @JsonPropertyOrder({"source", "rows", "columns"})
    public static class TableProfile {

        private String source;
        private int rows;
        private Map<String, ColumnProfile> columns = new LinkedHashMap<>();

        public TableProfile() {
        }

        public TableProfile(String source, int rows, Map<String, ColumnProfile> columns) {
            this.source = source;
            this.rows = rows;
            setColumns(columns);
        }

        @JsonProperty("source")
        public String getSource() {
            return source;
        }

        @JsonProperty("source")
        public void setSource(String source) {
            this.source = source;
        }

        @JsonProperty("rows")
        public int getRows() {
            return rows;
        }

        @JsonProperty("rows")
        public void setRows(int rows) {
            this.rows = rows;
        }

        /**
         * @return column name to profile, in table order
         */
        @JsonProperty("columns")
        public Map<String, ColumnProfile> getColumns() {
            return columns;
        }

        @JsonProperty("columns")
        public void setColumns(Map<String, ColumnProfile> columns) {
            this.columns = columns != null ? new LinkedHashMap<>(columns) : new LinkedHashMap<>();
        }
    }

    @JsonPropertyOrder({"dtype", "nulls"})
    public static class ColumnProfile {

        private String dtype;
        private int nulls;

        public ColumnProfile() {
        }

        public ColumnProfile(String dtype, int nulls) {
            this.dtype = dtype;
            this.nulls = nulls;
        }

        /**
         * @return {@code numeric} or {@code text}
         */
        @JsonProperty("dtype")
        public String getDtype() {
            return dtype;
        }

        @JsonProperty("dtype")
        public void setDtype(String dtype) {
            this.dtype = dtype;
        }

        @JsonProperty("nulls")
        public int getNulls() {
            return nulls;
        }

        @JsonProperty("nulls")
        public void setNulls(int nulls) {
            this.nulls = nulls;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof ColumnProfile that))
                return false;
            return nulls == that.nulls && Objects.equals(dtype, that.dtype);
        }

        @Override
        public int hashCode() {
            return Objects.hash(dtype, nulls);
        }

        @Override
        public String toString() {
            return dtype + "/" + nulls;
        }
    }
}
