package com.driverlens.core.analysis;

import com.driverlens.core.config.AnalysisSettings;
import com.driverlens.core.error.AnalysisResult;
import com.driverlens.core.error.AnalysisStage;
import com.driverlens.core.model.DataTable;
import com.driverlens.core.model.OutlierPoint;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Flags anomalous {@code (row, driver)} pairs in every numeric driver column.
 *
 * <p>
 * A value is flagged when either rule trips:
 * </p>
 * <ul>
 * <li><b>Z-score</b>: {@code |value - mean| / sd > outlierZThreshold}, with the
 * population standard deviation of the column's non-missing values; skipped
 * when that deviation is zero</li>
 * <li><b>Tukey fence</b>: value below {@code Q1 - k × IQR} or above
 * {@code Q3 + k × IQR}, quartiles by linear interpolation between order
 * statistics</li>
 * </ul>
 * <p>
 * The two sets are unioned, so each row appears once per driver. Columns with
 * fewer than two non-missing values are skipped. Stateless and safe to share
 * between threads.
 * </p>
 *
 * @since 1.0.0
 */
public class OutlierDetector {

    private static final Logger LOG = LoggerFactory.getLogger(OutlierDetector.class);

    static final String NO_OUTLIERS_SUMMARY = "No significant outliers were detected.";

    private final double zThreshold;
    private final double iqrMultiplier;

    public OutlierDetector(AnalysisSettings settings) {
        Objects.requireNonNull(settings, "AnalysisSettings must not be null");
        this.zThreshold = settings.getOutlierZThreshold();
        this.iqrMultiplier = settings.getIqrMultiplier();
    }

    /**
     * Detect outliers in every numeric column except {@code kpi}.
     *
     * @param table the resolved dataset
     * @param kpi   name of the KPI column, excluded from detection
     * @return flagged points (drivers in column order, rows ascending), or the
     *         failure for the {@link AnalysisStage#OUTLIERS} stage, including a
     *         table without a {@code kpi} column
     */
    public AnalysisResult<List<OutlierPoint>> detect(DataTable table, String kpi) {
        return AnalysisResult.capture(AnalysisStage.OUTLIERS, () -> detectAll(table, kpi));
    }

    private List<OutlierPoint> detectAll(DataTable table, String kpi) {
        Objects.requireNonNull(table, "Table must not be null");
        Objects.requireNonNull(kpi, "KPI column name must not be null");
        table.getColumnType(kpi);

        List<OutlierPoint> points = new ArrayList<>();
        for (String driver : table.getNumericColumnNames()) {
            if (driver.equals(kpi)) {
                continue;
            }
            for (int row : flaggedRows(table.numericValues(driver))) {
                points.add(new OutlierPoint(row, driver));
            }
        }
        LOG.info("Flagged {} outlying point(s) excluding '{}'", points.size(), kpi);
        return points;
    }

    /**
     * @param values column values, NaN for missing
     * @return flagged row indices in ascending order
     */
    Set<Integer> flaggedRows(double[] values) {
        int[] rows = new int[values.length];
        double[] present = new double[values.length];
        int n = 0;
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                rows[n] = i;
                present[n] = values[i];
                n++;
            }
        }
        Set<Integer> flagged = new TreeSet<>();
        if (n < 2) {
            return flagged;
        }
        present = Arrays.copyOf(present, n);

        double mean = new Mean().evaluate(present);
        double sd = new StandardDeviation(false).evaluate(present, mean);
        if (sd > 0) {
            for (int i = 0; i < n; i++) {
                if (Math.abs((present[i] - mean) / sd) > zThreshold) {
                    flagged.add(rows[i]);
                }
            }
        }

        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(present);
        double q1 = percentile.evaluate(25.0);
        double q3 = percentile.evaluate(75.0);
        double iqr = q3 - q1;
        double lower = q1 - iqrMultiplier * iqr;
        double upper = q3 + iqrMultiplier * iqr;
        for (int i = 0; i < n; i++) {
            if (present[i] < lower || present[i] > upper) {
                flagged.add(rows[i]);
            }
        }
        return flagged;
    }

    /**
     * One-line summary of a flagged set.
     *
     * @param points flagged points
     * @return {@code "N outlying data points were flagged across M driver(s): a, b."}
     *         with driver names sorted, or {@value #NO_OUTLIERS_SUMMARY}
     */
    public static String summarize(List<OutlierPoint> points) {
        Objects.requireNonNull(points, "points must not be null");
        if (points.isEmpty()) {
            return NO_OUTLIERS_SUMMARY;
        }
        Set<String> drivers = new TreeSet<>();
        Set<OutlierPoint> distinct = new LinkedHashSet<>(points);
        for (OutlierPoint point : distinct) {
            drivers.add(point.getDriver());
        }
        return distinct.size() + " outlying data points were flagged across " + drivers.size()
                + " driver(s): " + String.join(", ", drivers) + ".";
    }
}
