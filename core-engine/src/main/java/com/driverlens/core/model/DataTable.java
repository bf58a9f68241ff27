package com.driverlens.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, column-oriented table of observations.
 *
 * <p>
 * Every column has the same number of rows. A column is either
 * {@link ColumnType#NUMERIC} (values held as {@code double}, a missing value is
 * {@link Double#NaN}) or {@link ColumnType#TEXT} (values held as strings, a
 * missing value is {@code null}). Column order is preserved.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. Arrays handed to the builder are copied, and the
 * arrays returned by {@link #numericValues(String)} are copies as well, so a
 * table can be shared freely between concurrently running stages.
 * </p>
 *
 * @since 1.0.0
 */
public final class DataTable {

    private final Map<String, Column> columns;
    private final int rowCount;

    private DataTable(Map<String, Column> columns, int rowCount) {
        this.columns = Collections.unmodifiableMap(columns);
        this.rowCount = rowCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Shape
    // ---------------------------------------------------------------

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columns.size();
    }

    /**
     * @return column names in table order (unmodifiable)
     */
    public List<String> getColumnNames() {
        return List.copyOf(columns.keySet());
    }

    /**
     * @return names of all numeric columns, in table order
     */
    public List<String> getNumericColumnNames() {
        List<String> names = new ArrayList<>();
        for (Column column : columns.values()) {
            if (column.type == ColumnType.NUMERIC) {
                names.add(column.name);
            }
        }
        return names;
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    // ---------------------------------------------------------------
    // Column access
    // ---------------------------------------------------------------

    /**
     * @param name column name
     * @return the type of the named column
     * @throws ColumnNotFoundException if the column does not exist
     */
    public ColumnType getColumnType(String name) {
        return column(name).type;
    }

    /**
     * Return a copy of a numeric column's values.
     *
     * @param name column name
     * @return values, {@link Double#NaN} marking missing cells
     * @throws ColumnNotFoundException if the column does not exist
     * @throws ColumnTypeException     if the column is not numeric
     */
    public double[] numericValues(String name) {
        Column column = column(name);
        if (column.type != ColumnType.NUMERIC) {
            throw new ColumnTypeException(name, ColumnType.NUMERIC, column.type);
        }
        return column.numbers.clone();
    }

    /**
     * Return a single cell rendered as text.
     *
     * <p>
     * Numeric cells are rendered with {@link Double#toString(double)}; a
     * missing cell of either type yields {@code null}.
     * </p>
     *
     * @param name column name
     * @param row  zero-based row index
     * @return cell text, or {@code null} if missing
     */
    public String cellAsText(String name, int row) {
        Column column = column(name);
        Objects.checkIndex(row, rowCount);
        if (column.type == ColumnType.NUMERIC) {
            double v = column.numbers[row];
            return Double.isNaN(v) ? null : Double.toString(v);
        }
        return column.texts[row];
    }

    private Column column(String name) {
        Objects.requireNonNull(name, "Column name must not be null");
        Column column = columns.get(name);
        if (column == null) {
            throw new ColumnNotFoundException(name, getColumnNames());
        }
        return column;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DataTable that))
            return false;
        return rowCount == that.rowCount && columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rowCount);
    }

    @Override
    public String toString() {
        return "DataTable{rows=" + rowCount + ", columns=" + columns.keySet() + '}';
    }

    // ---------------------------------------------------------------
    // Column holder
    // ---------------------------------------------------------------

    private static final class Column {
        private final String name;
        private final ColumnType type;
        private final double[] numbers;
        private final String[] texts;

        private Column(String name, double[] numbers) {
            this.name = name;
            this.type = ColumnType.NUMERIC;
            this.numbers = numbers;
            this.texts = null;
        }

        private Column(String name, String[] texts) {
            this.name = name;
            this.type = ColumnType.TEXT;
            this.numbers = null;
            this.texts = texts;
        }

        private int length() {
            return type == ColumnType.NUMERIC ? numbers.length : texts.length;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Column that))
                return false;
            // Arrays.equals compares doubles bitwise, so NaN == NaN here
            return name.equals(that.name)
                    && type == that.type
                    && Arrays.equals(numbers, that.numbers)
                    && Arrays.equals(texts, that.texts);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, type, Arrays.hashCode(numbers), Arrays.hashCode(texts));
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link DataTable}.
     *
     * <p>
     * All columns must have the same length and distinct, non-blank names;
     * {@link #build()} throws {@link IllegalArgumentException} otherwise.
     * </p>
     */
    public static class Builder {
        private final Map<String, Column> columns = new LinkedHashMap<>();

        public Builder numericColumn(String name, double... values) {
            Objects.requireNonNull(values, "values must not be null");
            return add(new Column(requireName(name), values.clone()));
        }

        public Builder textColumn(String name, String... values) {
            Objects.requireNonNull(values, "values must not be null");
            return add(new Column(requireName(name), values.clone()));
        }

        private Builder add(Column column) {
            if (columns.containsKey(column.name)) {
                throw new IllegalArgumentException("Duplicate column name: '" + column.name + "'");
            }
            columns.put(column.name, column);
            return this;
        }

        private static String requireName(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Column name must not be null or blank");
            }
            return name;
        }

        /**
         * @return a new immutable table
         * @throws IllegalArgumentException if column lengths differ
         */
        public DataTable build() {
            int rows = -1;
            for (Column column : columns.values()) {
                if (rows < 0) {
                    rows = column.length();
                } else if (column.length() != rows) {
                    throw new IllegalArgumentException(
                            "Column '" + column.name + "' has " + column.length()
                                    + " rows, expected " + rows);
                }
            }
            return new DataTable(new LinkedHashMap<>(columns), Math.max(rows, 0));
        }
    }
}
