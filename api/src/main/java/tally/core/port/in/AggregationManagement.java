package tally.core.port.in;

import java.time.LocalDate;
import java.util.List;

import io.smallrye.mutiny.Uni;

import tally.core.model.usage.AggregationRun;
import tally.core.model.usage.AggregationStatus;

/**
 * Port for reconciling usage counters into the durable ledger.
 *
 * <p>Every operation is idempotent: the ledger value is overwritten with the latest counter
 * value, so repeating a run for the same day never double counts.
 */
public interface AggregationManagement {

    /**
     * Aggregate every usage counter of a day.
     *
     * @param day the UTC day
     * @return Uni with the run summary; per-key failures are reported in the summary, not as a failed Uni
     */
    Uni<AggregationRun> run(LocalDate day);

    /**
     * Aggregate each day of an inclusive range, sequentially.
     *
     * @param start first day
     * @param end last day
     * @return Uni with one summary per day, in order
     * @throws IllegalArgumentException if {@code start} is after {@code end} or the range is too long
     */
    Uni<List<AggregationRun>> runRange(LocalDate start, LocalDate end);

    /**
     * Aggregate one tenant's counters for a day.
     *
     * @param tenantId the tenant
     * @param day the UTC day
     * @return Uni with the run summary
     */
    Uni<AggregationRun> runForTenant(String tenantId, LocalDate day);

    /**
     * Report whether a day has been aggregated.
     *
     * @param day the UTC day
     * @return Uni with the status
     */
    Uni<AggregationStatus> status(LocalDate day);
}
