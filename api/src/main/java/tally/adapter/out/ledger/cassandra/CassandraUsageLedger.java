package tally.adapter.out.ledger.cassandra;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.AsyncResultSet;
import com.datastax.oss.driver.api.core.cql.BatchStatement;
import com.datastax.oss.driver.api.core.cql.BatchType;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.Row;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import io.vertx.core.Context;
import io.vertx.core.Vertx;
import org.jboss.logging.Logger;

import tally.core.model.common.LedgerReadException;
import tally.core.model.common.LedgerWriteException;
import tally.core.model.usage.MetricType;
import tally.core.model.usage.UsageRecord;
import tally.core.port.out.UsageLedger;

/**
 * Cassandra implementation of {@link UsageLedger}.
 *
 * <p>Records are written to two query tables, one partitioned by day (used by aggregation
 * status) and one partitioned by tenant (used by usage history). Both inserts go in a single
 * LOGGED batch so the tables cannot diverge. A Cassandra {@code INSERT} on an existing
 * primary key overwrites it, which makes every write an idempotent upsert.
 *
 * <h2>Schema</h2>
 * <pre>
 * CREATE TABLE usage_records_by_day (
 *     day date, tenant_id text, metric_type text, value bigint, updated_at timestamp,
 *     PRIMARY KEY ((day), tenant_id, metric_type)
 * );
 * CREATE TABLE usage_records_by_tenant (
 *     tenant_id text, day date, metric_type text, value bigint, updated_at timestamp,
 *     PRIMARY KEY ((tenant_id), day, metric_type)
 * );
 * </pre>
 */
public class CassandraUsageLedger implements UsageLedger {

    private static final Logger LOG = Logger.getLogger(CassandraUsageLedger.class);

    private final CqlSession session;
    private final PreparedStatement insertByDayStmt;
    private final PreparedStatement insertByTenantStmt;
    private final PreparedStatement selectByDayStmt;
    private final PreparedStatement selectByTenantStmt;

    public CassandraUsageLedger(CqlSession session) {
        this.session = session;
        this.insertByDayStmt = session.prepare(
                """
                INSERT INTO usage_records_by_day (day, tenant_id, metric_type, value, updated_at)
                VALUES (?, ?, ?, ?, ?)
                """);
        this.insertByTenantStmt = session.prepare(
                """
                INSERT INTO usage_records_by_tenant (tenant_id, day, metric_type, value, updated_at)
                VALUES (?, ?, ?, ?, ?)
                """);
        this.selectByDayStmt = session.prepare(
                "SELECT day, tenant_id, metric_type, value, updated_at FROM usage_records_by_day WHERE day = ?");
        this.selectByTenantStmt = session.prepare(
                """
                SELECT tenant_id, day, metric_type, value, updated_at FROM usage_records_by_tenant
                WHERE tenant_id = ? AND day >= ? AND day <= ?
                """);
    }

    @Override
    public Uni<Void> upsert(UsageRecord record) {
        Executor executor = getContextExecutor();
        final var metric = record.metricType().value();
        final var updatedAt = record.updatedAt() != null ? record.updatedAt() : Instant.now();
        return Uni.createFrom()
                .completionStage(() -> {
                    final var batch = BatchStatement.newInstance(
                            BatchType.LOGGED,
                            insertByDayStmt.bind(record.day(), record.tenantId(), metric, record.value(), updatedAt),
                            insertByTenantStmt.bind(
                                    record.tenantId(), record.day(), metric, record.value(), updatedAt));
                    return session.executeAsync(batch).toCompletableFuture();
                })
                .emitOn(executor)
                .onFailure()
                .transform(e -> new LedgerWriteException(
                        "Failed to upsert usage for " + record.tenantId() + " on " + record.day(), e))
                .replaceWithVoid();
    }

    @Override
    public Uni<List<UsageRecord>> findByDay(LocalDate day) {
        Executor executor = getContextExecutor();
        return Uni.createFrom()
                .completionStage(() -> session.executeAsync(selectByDayStmt.bind(day))
                        .thenCompose(rs -> collect(rs, new ArrayList<>()))
                        .toCompletableFuture())
                .emitOn(executor)
                .onFailure()
                .transform(e -> new LedgerReadException("Failed to read usage records for " + day, e));
    }

    @Override
    public Uni<List<UsageRecord>> findByTenant(String tenantId, LocalDate from, LocalDate to) {
        Executor executor = getContextExecutor();
        return Uni.createFrom()
                .completionStage(() -> session.executeAsync(selectByTenantStmt.bind(tenantId, from, to))
                        .thenCompose(rs -> collect(rs, new ArrayList<>()))
                        .toCompletableFuture())
                .emitOn(executor)
                .onFailure()
                .transform(e -> new LedgerReadException("Failed to read usage records for tenant " + tenantId, e));
    }

    private CompletionStage<List<UsageRecord>> collect(AsyncResultSet rs, List<UsageRecord> into) {
        for (Row row : rs.currentPage()) {
            fromRow(row, into);
        }
        if (rs.hasMorePages()) {
            return rs.fetchNextPage().thenCompose(next -> collect(next, into));
        }
        return CompletableFuture.completedFuture(into);
    }

    private static void fromRow(Row row, List<UsageRecord> into) {
        final var metric = MetricType.fromValue(row.getString("metric_type"));
        if (metric.isEmpty()) {
            LOG.debugv("Ignoring ledger row with unknown metric {0}", row.getString("metric_type"));
            return;
        }
        into.add(new UsageRecord(
                row.getString("tenant_id"),
                row.getLocalDate("day"),
                metric.get(),
                row.getLong("value"),
                row.getInstant("updated_at")));
    }

    /**
     * Gets an executor that will run on the Vert.x context if available,
     * otherwise falls back to the default worker pool.
     */
    private Executor getContextExecutor() {
        Context context = Vertx.currentContext();
        if (context != null) {
            return command -> context.runOnContext(v -> command.run());
        }
        return Infrastructure.getDefaultWorkerPool();
    }
}
