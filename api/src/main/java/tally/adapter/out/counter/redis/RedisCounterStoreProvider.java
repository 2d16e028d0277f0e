package tally.adapter.out.counter.redis;

import java.time.Duration;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;

import tally.core.port.out.CounterStore;
import tally.core.port.out.Metrics;
import tally.spi.CounterStoreProvider;

/**
 * Redis counter store provider for distributed deployments.
 *
 * <p>Available whenever a Redis data source is configured.
 */
public final class RedisCounterStoreProvider implements CounterStoreProvider {

    private static final int PRIORITY = 10;
    private static final String NAME = "redis";

    private final ReactiveRedisDataSource redisDataSource;
    private final Duration timeout;
    private final Metrics metrics;

    public RedisCounterStoreProvider(ReactiveRedisDataSource redisDataSource, Duration timeout, Metrics metrics) {
        this.redisDataSource = redisDataSource;
        this.timeout = timeout;
        this.metrics = metrics;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return redisDataSource != null;
    }

    @Override
    public CounterStore createCounterStore() {
        if (redisDataSource == null) {
            throw new IllegalStateException("Redis data source not available");
        }
        return new RedisCounterStore(redisDataSource, new RedisTimeoutHelper(timeout, metrics));
    }
}
