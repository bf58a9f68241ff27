/**
 * Command-line entry point that runs one driver analysis over a CSV dataset.
 *
 * <ul>
 * <li>{@link com.driverlens.job.DriverAnalysisJob}: starts a session, saves the
 * dataset and runs the stages, correlation and outlier detection
 * concurrently</li>
 * <li>{@link com.driverlens.job.JobConfig}: environment-driven settings</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.driverlens.job;
