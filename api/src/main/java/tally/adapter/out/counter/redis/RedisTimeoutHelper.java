package tally.adapter.out.counter.redis;

import java.time.Duration;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.TimeoutException;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tally.core.model.common.CounterStoreUnavailableException;
import tally.core.port.out.Metrics;

/**
 * Applies the counter store timeout to Redis operations and normalises their failures.
 *
 * <p>Timeouts and any other operational failure surface as
 * {@link CounterStoreUnavailableException}, so the core only has one failure type to handle
 * regardless of the backend. Timeouts ({@code tally.counterstore.timeouts}) and other
 * failures ({@code tally.counterstore.failures}) are counted separately.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final Metrics metrics;

    /**
     * @param timeout the timeout applied to each operation
     * @param metrics the metrics instance (may be null)
     */
    public RedisTimeoutHelper(Duration timeout, Metrics metrics) {
        this.timeout = timeout;
        this.metrics = metrics;
    }

    /**
     * Bound a single-result operation.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni failing with {@link CounterStoreUnavailableException} on timeout or failure
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> timedOut(operationName))
                .onFailure(error -> !(error instanceof CounterStoreUnavailableException))
                .transform(error -> failed(operationName, error));
    }

    /**
     * Bound a streaming operation: each item must arrive within the timeout.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param <T> the item type
     * @return a Multi failing with {@link CounterStoreUnavailableException} on timeout or failure
     */
    public <T> Multi<T> withTimeout(Multi<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> timedOut(operationName))
                .onFailure(error -> !(error instanceof CounterStoreUnavailableException))
                .transform(error -> failed(operationName, error));
    }

    private CounterStoreUnavailableException timedOut(String operationName) {
        LOG.warnv("Redis operation timeout: {0} after {1}", operationName, timeout);
        if (metrics != null) {
            metrics.recordCounterStoreTimeout(operationName);
        }
        return new CounterStoreUnavailableException(
                operationName, "Redis operation " + operationName + " timed out after " + timeout);
    }

    private CounterStoreUnavailableException failed(String operationName, Throwable error) {
        if (error instanceof TimeoutException) {
            return timedOut(operationName);
        }
        LOG.warnv("Redis operation failure: {0}: {1}", operationName, error.getMessage());
        if (metrics != null) {
            metrics.recordCounterStoreFailure(operationName);
        }
        return new CounterStoreUnavailableException(
                operationName, "Redis operation " + operationName + " failed: " + error.getMessage(), error);
    }
}
