package tally.adapter.in.dto;

/**
 * DTO for recording usage events.
 *
 * @param tenantId   tenant the events belong to (required)
 * @param metricType one of queries, documents, api_calls, storage_gb (required)
 * @param amount     number of events (null = 1)
 * @param day        UTC day as YYYY-MM-DD (null = today)
 */
public record RecordUsageRequest(String tenantId, String metricType, Long amount, String day) {}
