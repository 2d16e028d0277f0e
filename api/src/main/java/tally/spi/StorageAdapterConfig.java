package tally.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration access for ledger providers.
 *
 * <p>Providers read their own settings through this interface instead of coupling to a
 * configuration framework.
 */
public interface StorageAdapterConfig {

    /**
     * @param key the configuration key
     * @return the value if present
     */
    Optional<String> get(String key);

    /**
     * @param key the configuration key
     * @param defaultValue value used when the key is absent
     * @return the configured value or the default
     */
    String getOrDefault(String key, String defaultValue);

    Optional<Integer> getInt(String key);

    Optional<Boolean> getBoolean(String key);

    /**
     * Duration value in ISO-8601 format, e.g. {@code PT2S}.
     */
    Optional<Duration> getDuration(String key);
}
