package tally.core.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

/**
 * Caffeine-backed {@link LocalCache} with per-entry TTL jitter.
 *
 * <p>Each entry lives for the base TTL multiplied by a random factor in
 * {@code [1 - jitter, 1 + jitter]}, so instances started together do not all reload
 * at the same moment.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class CaffeineLocalCache<K, V> implements LocalCache<K, V> {

    private final Cache<K, V> cache;

    /**
     * @param ttl base time-to-live
     * @param maxSize maximum number of entries
     * @param jitterFactor 0.0 to 0.5; 0 disables jitter
     */
    public CaffeineLocalCache(Duration ttl, long maxSize, double jitterFactor) {
        if (jitterFactor < 0.0 || jitterFactor > 0.5) {
            throw new IllegalArgumentException("Jitter factor must be between 0.0 and 0.5, got: " + jitterFactor);
        }

        final var builder = Caffeine.newBuilder().maximumSize(maxSize);
        if (jitterFactor == 0.0) {
            this.cache = builder.expireAfterWrite(ttl).build();
        } else {
            this.cache = builder.expireAfter(new JitteredExpiry<K, V>(ttl.toNanos(), jitterFactor))
                    .build();
        }
    }

    @Override
    public Optional<V> get(K key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(K key, V value) {
        cache.put(key, value);
    }

    @Override
    public void invalidate(K key) {
        cache.invalidate(key);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public long estimatedSize() {
        return cache.estimatedSize();
    }

    private record JitteredExpiry<K, V>(long baseTtlNanos, double jitterFactor) implements Expiry<K, V> {

        @Override
        public long expireAfterCreate(K key, V value, long currentTime) {
            return jittered();
        }

        @Override
        public long expireAfterUpdate(K key, V value, long currentTime, long currentDuration) {
            return jittered();
        }

        @Override
        public long expireAfterRead(K key, V value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long jittered() {
            final var multiplier = 1.0 - jitterFactor + ThreadLocalRandom.current().nextDouble() * 2 * jitterFactor;
            return (long) (baseTtlNanos * multiplier);
        }
    }
}
