package tally.adapter.in.dto;

import tally.core.model.usage.AggregationStatus;

/**
 * DTO for the aggregation status of a day.
 *
 * @param day         the day (YYYY-MM-DD)
 * @param aggregated  whether any ledger record exists for the day
 * @param tenantCount distinct tenants with records
 * @param recordCount ledger records for the day
 */
public record AggregationStatusDto(String day, boolean aggregated, long tenantCount, long recordCount) {

    public static AggregationStatusDto fromModel(AggregationStatus status) {
        return new AggregationStatusDto(
                status.day().toString(), status.aggregated(), status.tenantCount(), status.recordCount());
    }
}
