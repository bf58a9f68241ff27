/**
 * Persisted stage results.
 *
 * <ul>
 * <li>{@link com.driverlens.core.report.CorrelationReport}: saved as
 * {@code correlation_matrix}</li>
 * <li>{@link com.driverlens.core.report.ImpactRankingReport}: saved as
 * {@code impact_ranking}</li>
 * <li>{@link com.driverlens.core.report.OutlierReport}: saved as
 * {@code outlier_report}</li>
 * <li>{@link com.driverlens.core.report.DataReport}: saved as
 * {@code data_report}, the profile of the input tables</li>
 * </ul>
 *
 * <p>
 * A failed stage is saved under the same name with an empty collection and
 * the error envelope fields (see
 * {@link com.driverlens.core.report.StageReport}).
 * </p>
 *
 * @since 1.0.0
 */
package com.driverlens.core.report;
