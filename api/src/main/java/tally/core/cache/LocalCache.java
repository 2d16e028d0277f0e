package tally.core.cache;

import java.util.Optional;

/**
 * Local in-memory cache with TTL-based expiry.
 *
 * <p>Entries expire on their own, so values cached on one instance converge with the
 * source of truth within one TTL.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface LocalCache<K, V> {

    /**
     * @param key the cache key
     * @return the value if present and not expired
     */
    Optional<V> get(K key);

    void put(K key, V value);

    void invalidate(K key);

    void invalidateAll();

    /**
     * @return estimated entry count
     */
    long estimatedSize();
}
