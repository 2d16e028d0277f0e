package tally.adapter.in.dto;

import java.time.Duration;
import java.util.List;

import tally.core.model.usage.AggregationRun;

/**
 * DTO for the summary of one aggregation run.
 *
 * @param targetDay      the aggregated day (YYYY-MM-DD)
 * @param tenantId       the tenant for targeted runs, null for full runs
 * @param keysScanned    counter keys returned by the scan
 * @param recordsWritten ledger records written
 * @param keysSkipped    keys ignored (malformed or already expired)
 * @param errors         keys that could not be written after retries
 * @param errorDetails   first error messages
 * @param outcome        SUCCESS, PARTIAL or FAILED
 * @param exitCode       0, 1 or 2, matching the outcome
 * @param startedAt      ISO-8601 start instant
 * @param durationMs     run duration in milliseconds
 */
public record AggregationRunDto(
        String targetDay,
        String tenantId,
        long keysScanned,
        long recordsWritten,
        long keysSkipped,
        long errors,
        List<String> errorDetails,
        String outcome,
        int exitCode,
        String startedAt,
        long durationMs) {

    public static AggregationRunDto fromModel(AggregationRun run) {
        return new AggregationRunDto(
                run.targetDay().toString(),
                run.tenantId().orElse(null),
                run.keysScanned(),
                run.recordsWritten(),
                run.keysSkipped(),
                run.errors(),
                run.errorDetails(),
                run.outcome().name(),
                run.outcome().exitCode(),
                run.startedAt().toString(),
                Duration.between(run.startedAt(), run.completedAt()).toMillis());
    }
}
