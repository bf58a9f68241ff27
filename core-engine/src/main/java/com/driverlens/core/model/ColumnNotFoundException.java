package com.driverlens.core.model;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Thrown when a column is requested that the table does not contain.
 *
 * @since 1.0.0
 */
public class ColumnNotFoundException extends NoSuchElementException {

    private static final long serialVersionUID = 1L;

    private final String columnName;

    public ColumnNotFoundException(String columnName, List<String> available) {
        super("Column '" + columnName + "' not found; available columns: " + available);
        this.columnName = columnName;
    }

    public String getColumnName() {
        return columnName;
    }
}
