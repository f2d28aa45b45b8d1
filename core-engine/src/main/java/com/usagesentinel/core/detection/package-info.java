/**
 * Spike detection over daily usage series.
 *
 * <ul>
 * <li>{@link com.usagesentinel.core.detection.BaselineEstimator}: mean of the
 * leading history portion of a series</li>
 * <li>{@link com.usagesentinel.core.detection.SpikeClassifier}: per-day spike
 * verdict against a baseline</li>
 * <li>{@link com.usagesentinel.core.detection.SeriesAnalyzer}: full analysis
 * of one series</li>
 * <li>{@link com.usagesentinel.core.detection.FleetScanner}: bounded parallel
 * sweep over every series, ranked by severity</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.usagesentinel.core.detection;
