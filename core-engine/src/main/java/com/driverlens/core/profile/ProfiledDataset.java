package com.driverlens.core.profile;

import com.driverlens.core.model.DataTable;
import com.driverlens.core.report.DataReport;

import java.util.Objects;

/**
 * A unified table together with the profile of the inputs it came from.
 *
 * @since 1.0.0
 */
public final class ProfiledDataset {

    private final DataTable table;
    private final DataReport report;

    public ProfiledDataset(DataTable table, DataReport report) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.report = Objects.requireNonNull(report, "report must not be null");
    }

    public DataTable getTable() {
        return table;
    }

    public DataReport getReport() {
        return report;
    }

    @Override
    public String toString() {
        return "ProfiledDataset{table=" + table + ", report=" + report + '}';
    }
}
