/**
 * Configuration loading and validation for the statistical stages.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.driverlens.core.config.SettingsLoader} into an
 * {@link com.driverlens.core.config.AnalysisSettings} instance, which is
 * validated right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.driverlens.core.config;
