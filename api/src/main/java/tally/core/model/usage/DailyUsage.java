package tally.core.model.usage;

import java.time.LocalDate;

/**
 * One point of a tenant's usage history.
 *
 * @param day the day
 * @param metricType the metric
 * @param value the total for the day
 * @param live true when the value comes from the live counter rather than the ledger
 */
public record DailyUsage(LocalDate day, MetricType metricType, long value, boolean live) {}
