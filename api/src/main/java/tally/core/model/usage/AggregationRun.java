package tally.core.model.usage;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Summary of one aggregation pass over a day (optionally scoped to one tenant).
 *
 * @param targetDay the day aggregated
 * @param tenantId the tenant for targeted runs, empty for full runs
 * @param keysScanned keys returned by the scan
 * @param recordsWritten ledger upserts that succeeded
 * @param keysSkipped keys ignored because they were malformed or expired before being read
 * @param errors keys that failed after retries, plus a scan failure if one occurred
 * @param errorDetails human readable error messages, capped in size
 * @param scanFailed whether the counter store scan itself failed
 * @param startedAt when the run started
 * @param completedAt when the run finished
 */
public record AggregationRun(
        LocalDate targetDay,
        Optional<String> tenantId,
        long keysScanned,
        long recordsWritten,
        long keysSkipped,
        long errors,
        List<String> errorDetails,
        boolean scanFailed,
        Instant startedAt,
        Instant completedAt) {

    public AggregationRun {
        errorDetails = List.copyOf(errorDetails);
    }

    public AggregationOutcome outcome() {
        if (scanFailed && recordsWritten == 0) {
            return AggregationOutcome.FAILED;
        }
        return errors > 0 ? AggregationOutcome.PARTIAL : AggregationOutcome.SUCCESS;
    }
}
