package com.driverlens.core.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Registry entry describing the latest saved version of one artifact name.
 *
 * <p>
 * Table entries additionally carry the row count, column count and column
 * names; these are omitted from JSON for records.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArtifactEntry {

    private ArtifactKind type;
    private String path;
    private int version;
    private Instant createdAt;
    private Integer rows;
    private Integer columns;
    private List<String> columnNames;

    /** No-arg constructor required by Jackson. */
    public ArtifactEntry() {
    }

    ArtifactEntry(ArtifactKind type, String path, int version, Instant createdAt) {
        this.type = type;
        this.path = path;
        this.version = version;
        this.createdAt = createdAt;
    }

    public ArtifactKind getType() {
        return type;
    }

    public void setType(ArtifactKind type) {
        this.type = type;
    }

    /**
     * @return path of the latest version, relative to the store base directory
     */
    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    @JsonProperty("created_at")
    public Instant getCreatedAt() {
        return createdAt;
    }

    @JsonProperty("created_at")
    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Integer getRows() {
        return rows;
    }

    public void setRows(Integer rows) {
        this.rows = rows;
    }

    public Integer getColumns() {
        return columns;
    }

    public void setColumns(Integer columns) {
        this.columns = columns;
    }

    @JsonProperty("column_names")
    public List<String> getColumnNames() {
        return columnNames;
    }

    @JsonProperty("column_names")
    public void setColumnNames(List<String> columnNames) {
        this.columnNames = columnNames != null ? List.copyOf(columnNames) : null;
    }

    @Override
    public String toString() {
        return "ArtifactEntry{" +
                "type=" + type +
                ", path='" + path + '\'' +
                ", version=" + version +
                ", createdAt=" + createdAt +
                '}';
    }
}
