package com.driverlens.core.analysis;

import com.driverlens.core.config.AnalysisSettings;
import com.driverlens.core.error.AnalysisResult;
import com.driverlens.core.error.AnalysisStage;
import com.driverlens.core.model.CorrelationMethod;
import com.driverlens.core.model.CorrelationRecord;
import com.driverlens.core.model.DataTable;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.correlation.SpearmansCorrelation;
import org.apache.commons.math3.stat.descriptive.moment.Skewness;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Correlates every numeric driver column of a table against the KPI column.
 *
 * <h3>Method selection</h3>
 * <p>
 * Decided per driver. When both the driver and the KPI have
 * {@code |skewness| < skewnessThreshold} over the driver's valid pairs the
 * linear (Pearson) coefficient is used; otherwise the rank-based (Spearman,
 * average ranks for ties) coefficient. An undefined skewness (fewer than three
 * pairs) counts as skewed.
 * </p>
 *
 * <h3>Missing data</h3>
 * <p>
 * Rows missing either value are dropped pairwise. A driver with fewer than two
 * valid pairs, or whose coefficient is undefined, gets the neutral record
 * ({@code r = 0, p_value = 1}); the rest of the batch is unaffected.
 * </p>
 *
 * <p>
 * Records are returned in ascending {@code p_value} order; ties keep table
 * order. Stateless and safe to share between threads.
 * </p>
 *
 * @since 1.0.0
 */
public class CorrelationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(CorrelationEngine.class);

    /** Minimum number of complete pairs for a coefficient. */
    static final int MIN_PAIRS = 2;

    private final double skewnessThreshold;

    public CorrelationEngine(AnalysisSettings settings) {
        Objects.requireNonNull(settings, "AnalysisSettings must not be null");
        this.skewnessThreshold = settings.getSkewnessThreshold();
    }

    /**
     * Correlate all numeric non-KPI columns with {@code kpi}.
     *
     * <p>
     * Batch-level failures (KPI column absent or not numeric, table without
     * rows, KPI with fewer than two values or no variance) are returned as a
     * failed result for the
     * {@link AnalysisStage#CORRELATION} stage.
     * </p>
     *
     * @param table the resolved dataset
     * @param kpi   name of the KPI column
     * @return records sorted by ascending p-value, or the failure
     */
    public AnalysisResult<List<CorrelationRecord>> correlate(DataTable table, String kpi) {
        return AnalysisResult.capture(AnalysisStage.CORRELATION, () -> computeAll(table, kpi));
    }

    private List<CorrelationRecord> computeAll(DataTable table, String kpi) {
        Objects.requireNonNull(table, "Table must not be null");
        Objects.requireNonNull(kpi, "KPI column name must not be null");

        double[] target = table.numericValues(kpi);
        if (table.getRowCount() == 0) {
            throw new IllegalArgumentException("Table has no rows to correlate against '" + kpi + "'");
        }
        requireUsableTarget(kpi, target);

        List<CorrelationRecord> records = new ArrayList<>();
        for (String driver : table.getNumericColumnNames()) {
            if (driver.equals(kpi)) {
                continue;
            }
            records.add(correlateDriver(driver, table.numericValues(driver), target));
        }
        records.sort(Comparator.comparingDouble(CorrelationRecord::getPValue));

        LOG.info("Correlated {} driver(s) against '{}'", records.size(), kpi);
        return records;
    }

    /**
     * Reject a KPI column no driver can be correlated against: fewer than
     * {@value #MIN_PAIRS} non-missing values, or a single repeated value.
     */
    private static void requireUsableTarget(String kpi, double[] target) {
        int present = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : target) {
            if (!Double.isNaN(v)) {
                present++;
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
        }
        if (present < MIN_PAIRS) {
            throw new ArithmeticException("KPI column '" + kpi + "' has " + present
                    + " non-missing value(s), at least " + MIN_PAIRS + " are required");
        }
        if (min == max) {
            throw new ArithmeticException("KPI column '" + kpi + "' is constant (" + min + "), nothing to correlate");
        }
    }

    /**
     * Correlate one driver column with the target column.
     *
     * @param driver driver name
     * @param x      driver values, NaN for missing
     * @param y      target values, NaN for missing
     * @return the record, neutral when undefined
     */
    CorrelationRecord correlateDriver(String driver, double[] x, double[] y) {
        double[][] pairs = completePairs(x, y);
        double[] xs = pairs[0];
        double[] ys = pairs[1];
        int n = xs.length;
        if (n < MIN_PAIRS) {
            LOG.debug("Driver '{}': {} valid pair(s), using neutral record", driver, n);
            return CorrelationRecord.neutral(driver);
        }

        CorrelationMethod method = selectMethod(xs, ys);
        try {
            double r = method == CorrelationMethod.LINEAR
                    ? new PearsonsCorrelation().correlation(xs, ys)
                    : new SpearmansCorrelation().correlation(xs, ys);
            if (Double.isNaN(r)) {
                LOG.debug("Driver '{}': coefficient undefined (constant values), using neutral record", driver);
                return CorrelationRecord.neutral(driver);
            }
            double p = pValue(r, n);
            LOG.debug("Driver '{}': method={} n={} r={} p={}", driver, method, n, r, p);
            return new CorrelationRecord(driver, method, r, p);
        } catch (MathIllegalArgumentException | MathIllegalStateException | MathArithmeticException e) {
            LOG.warn("Driver '{}': correlation failed ({}), using neutral record", driver, e.getMessage());
            return CorrelationRecord.neutral(driver);
        }
    }

    /**
     * Pick the linear method when both sides are roughly symmetric.
     */
    CorrelationMethod selectMethod(double[] xs, double[] ys) {
        double skewX = new Skewness().evaluate(xs);
        double skewY = new Skewness().evaluate(ys);
        // NaN compares false, so an undefined skewness selects the rank method
        boolean symmetric = Math.abs(skewX) < skewnessThreshold && Math.abs(skewY) < skewnessThreshold;
        return symmetric ? CorrelationMethod.LINEAR : CorrelationMethod.RANK_BASED;
    }

    /**
     * Two-sided p-value of {@code r} under the null hypothesis of no
     * correlation, from a Student t distribution with {@code n - 2} degrees of
     * freedom.
     *
     * @param r coefficient in [-1, 1]
     * @param n number of pairs, at least 2
     * @return p-value in [0, 1]
     */
    static double pValue(double r, int n) {
        if (n <= 2) {
            return 1.0;
        }
        double absR = Math.abs(r);
        if (absR >= 1.0) {
            return 0.0;
        }
        int df = n - 2;
        double t = absR * Math.sqrt(df / (1.0 - absR * absR));
        double p = 2.0 * (1.0 - new TDistribution(df).cumulativeProbability(t));
        return Math.max(0.0, Math.min(1.0, p));
    }

    private static double[][] completePairs(double[] x, double[] y) {
        int len = Math.min(x.length, y.length);
        double[] xs = new double[len];
        double[] ys = new double[len];
        int n = 0;
        for (int i = 0; i < len; i++) {
            if (!Double.isNaN(x[i]) && !Double.isNaN(y[i])) {
                xs[n] = x[i];
                ys[n] = y[i];
                n++;
            }
        }
        return new double[][] { Arrays.copyOf(xs, n), Arrays.copyOf(ys, n) };
    }
}
