/**
 * Domain model classes for Driver Lens.
 *
 * <p>
 * This package contains the values exchanged between the artifact store and
 * the statistical stages:
 * </p>
 * <ul>
 * <li>{@link com.driverlens.core.model.DataTable}: immutable table of
 * observations</li>
 * <li>{@link com.driverlens.core.model.CorrelationRecord}: one driver's
 * correlation with the KPI</li>
 * <li>{@link com.driverlens.core.model.RankedDriver}: a scored, classified
 * and optionally enriched driver</li>
 * <li>{@link com.driverlens.core.model.OutlierPoint}: a flagged
 * (row, driver) pair</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.driverlens.core.model;
