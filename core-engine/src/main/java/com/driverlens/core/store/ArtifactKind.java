package com.driverlens.core.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The two kinds of artifact a session can hold, with their file extensions.
 */
public enum ArtifactKind {

    /** Rows by named columns, stored as CSV. */
    TABLE("table", "csv"),

    /** Structured key-value document, stored as JSON. */
    RECORD("record", "json");

    private final String typeName;
    private final String extension;

    ArtifactKind(String typeName, String extension) {
        this.typeName = typeName;
        this.extension = extension;
    }

    @JsonValue
    public String getTypeName() {
        return typeName;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Build the stored file name for a version of an artifact.
     *
     * @param name    artifact name
     * @param version version number
     * @return {@code name.v{version}.{extension}}
     */
    public String fileName(String name, int version) {
        return name + ".v" + version + "." + extension;
    }

    @JsonCreator
    public static ArtifactKind fromTypeName(String value) {
        for (ArtifactKind kind : values()) {
            if (kind.typeName.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown artifact type: '" + value
                + "'. Supported: table, record");
    }

    @Override
    public String toString() {
        return typeName;
    }
}
