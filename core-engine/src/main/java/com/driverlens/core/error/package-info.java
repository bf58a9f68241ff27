/**
 * Fallback policy for the statistical stages.
 *
 * <p>
 * Stages compute an {@link com.driverlens.core.error.AnalysisResult}; a
 * failure is described by an {@link com.driverlens.core.error.AnalysisError}
 * and presented to report consumers as an
 * {@link com.driverlens.core.error.ErrorEnvelope}.
 * </p>
 *
 * @since 1.0.0
 */
package com.driverlens.core.error;
