package com.driverlens.core.profile;

import com.driverlens.core.model.ColumnType;
import com.driverlens.core.model.DataTable;
import com.driverlens.core.report.DataReport;
import com.driverlens.core.report.DataReport.ColumnProfile;
import com.driverlens.core.report.DataReport.TableProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Profiles the input tables of a run and merges them into one table.
 *
 * <h3>Single table</h3>
 * <p>
 * The table is profiled and passed through unchanged.
 * </p>
 *
 * <h3>Several tables</h3>
 * <ol>
 * <li>The join key is the first column of the first table that every table
 * has and that is complete and unique in each of them.</li>
 * <li>Without such a column, rows are aligned by position under a numeric
 * {@value #SURROGATE_KEY} column and the report marks the key as
 * surrogate.</li>
 * <li>The tables are outer-joined on the key. Keys keep the order in which
 * they are first seen; a key absent from a table leaves that table's cells
 * missing.</li>
 * <li>Columns keep the first table's order, followed by each later table's
 * new columns. A column name seen twice keeps the first table's values.</li>
 * <li>Every column other than the key is coerced to numeric; a cell that does
 * not parse becomes missing.</li>
 * </ol>
 *
 * <p>
 * Stateless and safe to share.
 * </p>
 *
 * @since 1.0.0
 */
public class DataProfiler {

    private static final Logger LOG = LoggerFactory.getLogger(DataProfiler.class);

    /** Name of the position key used when the tables share no usable column. */
    public static final String SURROGATE_KEY = "_row_id";

    /**
     * Profile and merge the input tables.
     *
     * @param sources source label to table, in join order; must not be empty
     * @return the unified table and its report
     * @throws IllegalArgumentException if no table is given
     */
    public ProfiledDataset profile(Map<String, DataTable> sources) {
        Objects.requireNonNull(sources, "sources must not be null");
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("At least one input table is required");
        }
        DataReport report = new DataReport();
        for (Map.Entry<String, DataTable> source : sources.entrySet()) {
            report.getTables().add(profileTable(source.getKey(), source.getValue()));
        }

        List<DataTable> tables = new ArrayList<>(sources.values());
        DataTable unified;
        if (tables.size() == 1) {
            unified = tables.get(0);
        } else {
            String key = findJoinKey(tables);
            if (key == null) {
                key = surrogateName(tables);
                report.setSurrogateKey(true);
                LOG.warn("Input tables share no complete unique column, aligning {} tables by row position",
                        tables.size());
            } else {
                LOG.info("Joining {} tables on '{}'", tables.size(), key);
            }
            report.setJoinKey(key);
            unified = merge(tables, key, report.isSurrogateKey());
        }
        report.setUnifiedRows(unified.getRowCount());
        LOG.debug("Profiled {} input table(s): {}", tables.size(), report);
        return new ProfiledDataset(unified, report);
    }

    // ---------------------------------------------------------------
    // Profiling
    // ---------------------------------------------------------------

    static TableProfile profileTable(String source, DataTable table) {
        Map<String, ColumnProfile> columns = new LinkedHashMap<>();
        for (String name : table.getColumnNames()) {
            int nulls = 0;
            for (int r = 0; r < table.getRowCount(); r++) {
                if (table.cellAsText(name, r) == null) {
                    nulls++;
                }
            }
            String dtype = table.getColumnType(name).name().toLowerCase(Locale.ROOT);
            columns.put(name, new ColumnProfile(dtype, nulls));
        }
        return new TableProfile(source, table.getRowCount(), columns);
    }

    // ---------------------------------------------------------------
    // Join key
    // ---------------------------------------------------------------

    static String findJoinKey(List<DataTable> tables) {
        for (String candidate : tables.get(0).getColumnNames()) {
            boolean usable = true;
            for (DataTable table : tables) {
                if (!table.hasColumn(candidate) || !isCompleteAndUnique(table, candidate)) {
                    usable = false;
                    break;
                }
            }
            if (usable) {
                return candidate;
            }
        }
        return null;
    }

    private static boolean isCompleteAndUnique(DataTable table, String column) {
        Set<String> seen = new HashSet<>();
        for (int r = 0; r < table.getRowCount(); r++) {
            String value = table.cellAsText(column, r);
            if (value == null || !seen.add(value)) {
                return false;
            }
        }
        return true;
    }

    private static String surrogateName(List<DataTable> tables) {
        String name = SURROGATE_KEY;
        int suffix = 0;
        while (usedByAny(tables, name)) {
            name = SURROGATE_KEY + "_" + (++suffix);
        }
        return name;
    }

    private static boolean usedByAny(List<DataTable> tables, String name) {
        for (DataTable table : tables) {
            if (table.hasColumn(name)) {
                return true;
            }
        }
        return false;
    }

    // ---------------------------------------------------------------
    // Merge
    // ---------------------------------------------------------------

    private static DataTable merge(List<DataTable> tables, String key, boolean surrogate) {
        // unified key -> row index, per table
        List<Map<String, Integer>> rowsByKey = new ArrayList<>(tables.size());
        Map<String, Integer> unifiedKeys = new LinkedHashMap<>();
        for (DataTable table : tables) {
            Map<String, Integer> rows = new LinkedHashMap<>();
            for (int r = 0; r < table.getRowCount(); r++) {
                String value = surrogate ? Integer.toString(r) : table.cellAsText(key, r);
                rows.put(value, r);
                unifiedKeys.putIfAbsent(value, unifiedKeys.size());
            }
            rowsByKey.add(rows);
        }

        // column -> index of the table that owns it
        Map<String, Integer> owners = new LinkedHashMap<>();
        for (int t = 0; t < tables.size(); t++) {
            for (String column : tables.get(t).getColumnNames()) {
                if (!column.equals(key)) {
                    owners.putIfAbsent(column, t);
                }
            }
        }

        List<String> keys = new ArrayList<>(unifiedKeys.keySet());
        DataTable.Builder builder = DataTable.builder();
        if (surrogate) {
            builder.numericColumn(key, positions(keys.size()));
        }
        for (String column : tables.get(0).getColumnNames()) {
            if (column.equals(key)) {
                addKeyColumn(builder, key, keys);
            } else {
                addCoerced(builder, column, tables.get(0), rowsByKey.get(0), keys);
            }
        }
        for (Map.Entry<String, Integer> owner : owners.entrySet()) {
            int t = owner.getValue();
            if (t > 0) {
                addCoerced(builder, owner.getKey(), tables.get(t), rowsByKey.get(t), keys);
            }
        }
        return builder.build();
    }

    private static double[] positions(int count) {
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = i;
        }
        return values;
    }

    private static void addKeyColumn(DataTable.Builder builder, String key, List<String> keys) {
        double[] numbers = new double[keys.size()];
        for (int i = 0; i < keys.size(); i++) {
            Double parsed = parse(keys.get(i));
            if (parsed == null) {
                builder.textColumn(key, keys.toArray(new String[0]));
                return;
            }
            numbers[i] = parsed;
        }
        builder.numericColumn(key, numbers);
    }

    private static void addCoerced(DataTable.Builder builder, String column, DataTable owner,
            Map<String, Integer> ownerRows, List<String> keys) {
        boolean numeric = owner.getColumnType(column) == ColumnType.NUMERIC;
        double[] source = numeric ? owner.numericValues(column) : null;
        double[] values = new double[keys.size()];
        for (int i = 0; i < keys.size(); i++) {
            Integer row = ownerRows.get(keys.get(i));
            if (row == null) {
                values[i] = Double.NaN;
            } else if (numeric) {
                values[i] = source[row];
            } else {
                Double parsed = parse(owner.cellAsText(column, row));
                values[i] = parsed != null ? parsed : Double.NaN;
            }
        }
        builder.numericColumn(column, values);
    }

    private static Double parse(String cell) {
        if (cell == null || cell.isBlank()) {
            return null;
        }
        try {
            return Double.parseDouble(cell.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
