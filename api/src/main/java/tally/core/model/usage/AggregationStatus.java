package tally.core.model.usage;

import java.time.LocalDate;

/**
 * Whether a day has been aggregated at least once.
 *
 * @param day the day checked
 * @param aggregated true iff at least one usage record exists for the day
 * @param tenantCount distinct tenants with records for the day
 * @param recordCount records stored for the day
 */
public record AggregationStatus(LocalDate day, boolean aggregated, long tenantCount, long recordCount) {}
