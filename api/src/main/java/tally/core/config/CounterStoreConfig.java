package tally.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the counter store.
 *
 * <p>Configuration prefix: {@code tally.counter-store}
 */
@ConfigMapping(prefix = "tally.counter-store")
public interface CounterStoreConfig {

    /**
     * Explicit provider name ({@code redis}, {@code memory}). When absent the highest priority
     * available provider is used.
     *
     * @return the configured provider
     */
    Optional<String> provider();

    /**
     * Prefix prepended to every counter key.
     *
     * @return key prefix (default: tally:)
     */
    @WithDefault("tally:")
    String keyPrefix();
}
