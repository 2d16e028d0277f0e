package tally.core.port.out;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

/**
 * Port for the shared, atomic counting cache behind rate-limit windows and usage counters.
 *
 * <p>Every mutation is a single atomic increment-and-maybe-expire: the key is created at
 * {@code amount} when absent, and its expiry is set whenever the key has none. Implementations
 * must never split the increment from the expiry, or a crash between the two could leave a
 * counter that never expires.
 *
 * <p>Operational failures (connection errors, timeouts) are signalled with
 * {@link tally.core.model.common.CounterStoreUnavailableException}. Unis returned by this port
 * are lazy: nothing happens until subscription, so callers may retry by resubscribing.
 */
public interface CounterStore {

    /**
     * Atomically add {@code amount} to the counter and return the new value.
     *
     * @param key the counter key
     * @param amount the increment, strictly positive
     * @param ttl expiry applied when the key has none
     * @return Uni with the value after the increment
     */
    Uni<Long> increment(String key, long amount, Duration ttl);

    /**
     * Read a counter without modifying it.
     *
     * @param key the counter key
     * @return Uni with the current value, or empty if the key does not exist; fails with
     *     {@link tally.core.model.common.InvalidCounterValueException} if the key holds a
     *     non-numeric value
     */
    Uni<Optional<Long>> get(String key);

    /**
     * Iterate the keys matching a glob pattern using a cursor, never a blocking full listing.
     *
     * <p>Keys created or expiring during the scan may or may not be returned; a key present
     * for the whole scan is returned at least once.
     *
     * @param pattern glob pattern ({@code *}, {@code ?}, backslash escapes)
     * @param batchSize hint for the number of keys per page
     * @return Multi emitting pages of keys
     */
    Multi<List<String>> scan(String pattern, int batchSize);
}
