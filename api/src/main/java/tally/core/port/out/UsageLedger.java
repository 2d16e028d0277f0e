package tally.core.port.out;

import java.time.LocalDate;
import java.util.List;

import io.smallrye.mutiny.Uni;

import tally.core.model.usage.UsageRecord;

/**
 * Port for the durable store of daily usage totals.
 *
 * <p>Records are unique on {@code (tenantId, day, metricType)}. Failed writes are signalled with
 * {@link tally.core.model.common.LedgerWriteException}, failed reads with
 * {@link tally.core.model.common.LedgerReadException}. Returned Unis are lazy.
 */
public interface UsageLedger {

    /**
     * Insert the record, or overwrite the value of the existing record with the same key.
     *
     * <p>Must be a single atomic statement; replaying it with the same value has no effect.
     *
     * @param record the record to write
     * @return Uni completing when the write is durable
     */
    Uni<Void> upsert(UsageRecord record);

    /**
     * All records for a day, across tenants and metrics.
     *
     * @param day the day
     * @return Uni with the records, empty list if none
     */
    Uni<List<UsageRecord>> findByDay(LocalDate day);

    /**
     * A tenant's records between two days, inclusive, ordered by day.
     *
     * @param tenantId the tenant
     * @param from first day, inclusive
     * @param to last day, inclusive
     * @return Uni with the records, empty list if none
     */
    Uni<List<UsageRecord>> findByTenant(String tenantId, LocalDate from, LocalDate to);
}
