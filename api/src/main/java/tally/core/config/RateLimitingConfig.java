package tally.core.config;

import java.util.List;
import java.util.Map;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for request rate limiting.
 *
 * <p>Configuration prefix: {@code tally.rate-limiting}
 *
 * <p>Strategies are evaluated in a fixed order: source address, tenant, credential, endpoint.
 * Each one can be disabled on its own.
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code TALLY_RATE_LIMITING_ENABLED} - Enable/disable rate limiting</li>
 *   <li>{@code TALLY_RATE_LIMITING_SOURCE_ADDRESS_REQUESTS_PER_WINDOW} - Per-address ceiling</li>
 *   <li>{@code TALLY_RATE_LIMITING_CREDENTIAL_REQUESTS_PER_WINDOW} - Default per-credential ceiling</li>
 * </ul>
 *
 * <h2>Endpoint rules</h2>
 * <pre>{@code
 * tally.rate-limiting.endpoint.rules.login.path=/auth/login
 * tally.rate-limiting.endpoint.rules.login.requests-per-window=5
 * tally.rate-limiting.endpoint.rules.login.window-seconds=300
 * }</pre>
 */
@ConfigMapping(prefix = "tally.rate-limiting")
public interface RateLimitingConfig {

    /**
     * Enable or disable rate limiting globally.
     *
     * @return true if rate limiting is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Emit {@code X-RateLimit-*} headers on limited responses.
     *
     * @return true if headers are included (default: true)
     */
    @WithDefault("true")
    boolean includeHeaders();

    /**
     * Path prefixes that bypass rate limiting entirely.
     *
     * @return skipped path prefixes (default: /health)
     */
    @WithDefault("/health")
    List<String> skipPaths();

    /**
     * Per client address limit.
     */
    StrategyConfig sourceAddress();

    /**
     * Per tenant limit, used when the tenant has no plan.
     */
    StrategyConfig tenant();

    /**
     * Per credential (API key) limit.
     */
    CredentialConfig credential();

    /**
     * Per endpoint and client address limits.
     */
    EndpointConfig endpoint();

    interface StrategyConfig {

        @WithDefault("true")
        boolean enabled();

        @WithDefault("100")
        long requestsPerWindow();

        @WithDefault("60")
        long windowSeconds();
    }

    interface CredentialConfig extends StrategyConfig {

        /**
         * Per credential ceilings overriding {@link #requestsPerWindow()}, keyed by credential id.
         *
         * @return overrides, empty by default
         */
        Map<String, Long> overrides();
    }

    interface EndpointConfig {

        @WithDefault("true")
        boolean enabled();

        /**
         * Named endpoint rules. The longest matching path prefix wins.
         *
         * @return rules keyed by an arbitrary rule name
         */
        Map<String, EndpointRuleConfig> rules();
    }

    interface EndpointRuleConfig {

        /**
         * Request path prefix, e.g. {@code /auth/login}.
         */
        String path();

        long requestsPerWindow();

        long windowSeconds();
    }
}
