package tally.adapter.out.counter.redis;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.keys.ReactiveKeyScanCursor;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;

import tally.core.model.common.InvalidCounterValueException;
import tally.core.port.out.CounterStore;

/**
 * Redis-backed counter store shared by all instances.
 *
 * <p>Increment and expiry run in one Lua script, so Redis applies them as a single atomic
 * step. The expiry is only set when the key has none ({@code TTL < 0}), which covers both a
 * freshly created key and a key whose expiry was lost.
 */
public final class RedisCounterStore implements CounterStore {

    /**
     * Atomic increment-and-maybe-expire.
     *
     * <ol>
     *   <li>KEYS[1] - the counter key</li>
     *   <li>ARGV[1] - increment</li>
     *   <li>ARGV[2] - expiry in seconds, applied when the key has none</li>
     * </ol>
     *
     * <p>Returns the value after the increment.
     */
    public static final String INCREMENT_SCRIPT =
            """
            local count = redis.call('INCRBY', KEYS[1], ARGV[1])
            if redis.call('TTL', KEYS[1]) < 0 then
                redis.call('EXPIRE', KEYS[1], ARGV[2])
            end
            return count
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveKeyCommands<String> keyCommands;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisCounterStore(ReactiveRedisDataSource redisDataSource, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.keyCommands = redisDataSource.key(String.class);
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Long> increment(String key, long amount, Duration ttl) {
        final var ttlSeconds = Math.max(1, ttl.toSeconds());
        final Uni<Long> operation = Uni.createFrom()
                .deferred(() -> redisDataSource.execute(
                        "EVAL",
                        INCREMENT_SCRIPT,
                        "1", // numkeys
                        key, // KEYS[1]
                        String.valueOf(amount), // ARGV[1]
                        String.valueOf(ttlSeconds) // ARGV[2]
                        ))
                .map(RedisCounterStore::toLong);
        return timeoutHelper.withTimeout(operation, "increment");
    }

    @Override
    public Uni<Optional<Long>> get(String key) {
        final Uni<String> operation = Uni.createFrom().deferred(() -> valueCommands.get(key));
        return timeoutHelper
                .withTimeout(operation, "get")
                .map(value -> Optional.ofNullable(value).map(v -> parseCounter(key, v)));
    }

    private static long parseCounter(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidCounterValueException(key, value);
        }
    }

    @Override
    public Multi<List<String>> scan(String pattern, int batchSize) {
        final var args = new KeyScanArgs().match(pattern).count(batchSize);
        return Multi.createFrom().deferred(() -> pages(keyCommands.scan(args)));
    }

    /**
     * One page per SCAN round-trip; the timeout bounds each call to the cursor, not the scan.
     */
    private Multi<List<String>> pages(ReactiveKeyScanCursor<String> cursor) {
        if (!cursor.hasNext()) {
            return Multi.createFrom().empty();
        }
        return timeoutHelper
                .withTimeout(Uni.createFrom().deferred(cursor::next), "scan")
                .onItem()
                .transformToMulti(page -> {
                    final Multi<List<String>> rest = Multi.createFrom().deferred(() -> pages(cursor));
                    if (page.isEmpty()) {
                        return rest;
                    }
                    return Multi.createBy()
                            .concatenating()
                            .streams(Multi.createFrom().item(List.copyOf(page)), rest);
                });
    }

    private static long toLong(Response response) {
        if (response == null) {
            throw new IllegalStateException("Null response from Redis");
        }
        return response.toLong();
    }
}
