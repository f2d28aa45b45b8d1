/**
 * Domain model for usage spike detection.
 *
 * <ul>
 * <li>{@link com.usagesentinel.core.model.UsageRecord}: one day of
 * consumption for one series</li>
 * <li>{@link com.usagesentinel.core.model.SeriesKey}: (region, sub-region,
 * item) triple identifying a series</li>
 * <li>{@link com.usagesentinel.core.model.SeriesAnalysis}: annotated records,
 * stats and current alert for one series</li>
 * <li>{@link com.usagesentinel.core.model.FleetScanResult}: ranked alerts
 * across all series</li>
 * </ul>
 *
 * <p>
 * All result types are immutable and computed fresh for every request.
 * </p>
 *
 * @since 1.0.0
 */
package com.usagesentinel.core.model;
