package com.driverlens.core.model;

/**
 * Thrown when a column is used as a type it does not have, e.g. a text column
 * designated as the KPI.
 *
 * @since 1.0.0
 */
public class ColumnTypeException extends ClassCastException {

    private static final long serialVersionUID = 1L;

    public ColumnTypeException(String columnName, ColumnType expected, ColumnType actual) {
        super("Column '" + columnName + "' is " + actual + ", expected " + expected);
    }
}
