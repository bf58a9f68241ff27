package com.driverlens.core.model;

/**
 * Storage type of a {@link DataTable} column.
 */
public enum ColumnType {
    NUMERIC,
    TEXT
}
