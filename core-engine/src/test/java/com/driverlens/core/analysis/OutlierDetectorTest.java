package com.driverlens.core.analysis;

import com.driverlens.core.config.AnalysisSettings;
import com.driverlens.core.error.ErrorCategory;
import com.driverlens.core.model.DataTable;
import com.driverlens.core.model.OutlierPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.driverlens.core.analysis.AnalysisFixtures.KPI;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link OutlierDetector}.
 */
class OutlierDetectorTest {

    private final OutlierDetector detector = new OutlierDetector(AnalysisSettings.defaults());

    @Test
    @DisplayName("A normal column with one value at mean + 10 sd should yield exactly one outlier")
    void shouldFlagInjectedOutlier() {
        DataTable table = DataTable.builder()
                .numericColumn(KPI, AnalysisFixtures.normalQuantiles(50))
                .numericColumn("value_speed", AnalysisFixtures.withInjectedOutlier(17))
                .build();

        List<OutlierPoint> outliers = detector.detect(table, KPI).getValue();

        assertThat(outliers).containsExactly(new OutlierPoint(17, "value_speed"));
    }

    @Test
    @DisplayName("A value tripping both rules should be reported once")
    void shouldReportUnionOnce() {
        double[] values = AnalysisFixtures.withInjectedOutlier(0);

        assertThat(detector.flaggedRows(values)).containsExactly(0);
    }

    @Test
    @DisplayName("Should flag a value outside the Tukey fence even when |z| <= 3")
    void shouldFlagByIqrAlone() {
        double[] values = {1, 2, 3, 4, 5, 6, 7, 8, 9, 30};

        assertThat(detector.flaggedRows(values)).containsExactly(9);
    }

    @Test
    @DisplayName("Should skip all-missing, single-value and constant columns")
    void shouldSkipDegenerateColumns() {
        double nan = Double.NaN;
        DataTable table = DataTable.builder()
                .numericColumn(KPI, 1, 2, 3, 4)
                .numericColumn("value_empty", nan, nan, nan, nan)
                .numericColumn("value_single", nan, 100, nan, nan)
                .numericColumn("value_constant", 5, 5, 5, 5)
                .build();

        assertThat(detector.detect(table, KPI).getValue()).isEmpty();
    }

    @Test
    @DisplayName("Should report rows ascending, drivers in column order and ignore the KPI")
    void shouldOrderOutput() {
        double[] a = new double[20];
        double[] b = new double[20];
        double[] kpi = new double[20];
        for (int i = 0; i < 20; i++) {
            a[i] = 10 + (i % 5);
            b[i] = 50 + (i % 4);
            kpi[i] = i;
        }
        a[15] = 500;
        a[3] = -500;
        b[8] = 1000;
        kpi[0] = 1e9;
        DataTable table = DataTable.builder()
                .numericColumn("value_b", b)
                .numericColumn(KPI, kpi)
                .numericColumn("value_a", a)
                .build();

        List<OutlierPoint> outliers = detector.detect(table, KPI).getValue();

        assertThat(outliers).containsExactly(
                new OutlierPoint(8, "value_b"),
                new OutlierPoint(3, "value_a"),
                new OutlierPoint(15, "value_a"));
    }

    @Test
    @DisplayName("Should summarize flagged points with sorted driver names")
    void shouldSummarize() {
        List<OutlierPoint> points = List.of(
                new OutlierPoint(3, "value_temp"),
                new OutlierPoint(1, "value_speed"),
                new OutlierPoint(4, "value_temp"));

        assertThat(OutlierDetector.summarize(points))
                .isEqualTo("3 outlying data points were flagged across 2 driver(s): value_speed, value_temp.");
        assertThat(OutlierDetector.summarize(List.of()))
                .isEqualTo("No significant outliers were detected.");
    }

    @Test
    @DisplayName("A null table should become a failed result rather than an exception")
    void shouldCaptureFailures() {
        assertThat(detector.detect(null, KPI).getError().orElseThrow().getCategory())
                .isEqualTo(ErrorCategory.UNEXPECTED);
    }

    @Test
    @DisplayName("A table without the KPI column should fail with a missing-key error")
    void shouldRejectMissingKpi() {
        DataTable table = DataTable.builder()
                .numericColumn("value_temp", 1, 2, 3, 4)
                .build();

        assertThat(detector.detect(table, KPI).getError().orElseThrow().getCategory())
                .isEqualTo(ErrorCategory.MISSING_KEY);
    }
}
