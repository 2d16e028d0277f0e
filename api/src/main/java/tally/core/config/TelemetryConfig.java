package tally.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for metrics and tracing.
 *
 * <pre>{@code
 * tally.telemetry.enabled=true
 * tally.telemetry.metrics.enabled=true
 * tally.telemetry.tracing.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "tally.telemetry")
public interface TelemetryConfig {

    /**
     * Master toggle. When disabled, all sub-features are disabled too.
     */
    @WithDefault("false")
    boolean enabled();

    MetricsConfig metrics();

    TracingConfig tracing();

    interface MetricsConfig {
        @WithDefault("true")
        boolean enabled();
    }

    interface TracingConfig {
        /**
         * Add rate-limit attributes to the current span.
         */
        @WithDefault("true")
        boolean enabled();
    }
}
