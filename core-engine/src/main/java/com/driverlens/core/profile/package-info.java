/**
 * Input profiling: per-table column types and missing counts, join-key
 * discovery and the outer join that produces {@code unified_dataset}.
 *
 * @since 1.0.0
 */
package com.driverlens.core.profile;
