package tally.adapter.in.dto;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import tally.core.model.usage.DailyUsage;
import tally.core.service.usage.UsageQueryService;

/**
 * DTO for a tenant's usage history.
 *
 * @param tenantId the tenant
 * @param from     first day of the range
 * @param to       last day of the range
 * @param days     daily values, ordered by day then metric
 * @param totals   sum per metric over the range
 */
public record UsageHistoryDto(String tenantId, String from, String to, List<Entry> days, Map<String, Long> totals) {

    /**
     * One metric value for one day.
     *
     * @param day    the day
     * @param metric the metric value name
     * @param value  the count
     * @param live   true when read from the live counter rather than the ledger
     */
    public record Entry(String day, String metric, long value, boolean live) {}

    public static UsageHistoryDto fromModel(String tenantId, String from, String to, List<DailyUsage> history) {
        final var days = history.stream()
                .map(u -> new Entry(u.day().toString(), u.metricType().value(), u.value(), u.live()))
                .toList();
        final var totals = new LinkedHashMap<String, Long>();
        UsageQueryService.totals(history).forEach((metric, total) -> totals.put(metric.value(), total));
        return new UsageHistoryDto(tenantId, from, to, days, totals);
    }
}
