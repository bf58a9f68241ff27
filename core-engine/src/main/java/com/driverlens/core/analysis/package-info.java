/**
 * Statistical driver analysis.
 *
 * <ul>
 * <li>{@link com.driverlens.core.analysis.CorrelationEngine}: per-driver
 * Pearson or Spearman correlation with the KPI and its p-value</li>
 * <li>{@link com.driverlens.core.analysis.ImpactRanker}: composite impact
 * score, strength class, explanation and metadata enrichment</li>
 * <li>{@link com.driverlens.core.analysis.OutlierDetector}: union of the
 * Z-score and Tukey fence rules per driver</li>
 * <li>{@link com.driverlens.core.analysis.DriverAnalysisService}: runs the
 * stages against a session and persists their reports</li>
 * </ul>
 *
 * <p>
 * The engines spawn no threads and hold no mutable state. Every public
 * operation returns an {@link com.driverlens.core.error.AnalysisResult}
 * instead of throwing for batch-level failures.
 * </p>
 *
 * @since 1.0.0
 */
package com.driverlens.core.analysis;
