package tally.core.config;

import java.util.Map;

import io.smallrye.config.ConfigMapping;

/**
 * Configuration-backed tenant plans.
 *
 * <p>Configuration prefix: {@code tally.plans}
 *
 * <pre>{@code
 * tally.plans.definitions.starter.requests-per-window=600
 * tally.plans.definitions.starter.window-seconds=60
 * tally.plans.tenants.acme=starter
 * }</pre>
 */
@ConfigMapping(prefix = "tally.plans")
public interface PlanConfig {

    /**
     * Plan definitions keyed by plan id.
     */
    Map<String, PlanDefinition> definitions();

    /**
     * Plan id assigned to each tenant, keyed by tenant id.
     */
    Map<String, String> tenants();

    interface PlanDefinition {

        long requestsPerWindow();

        long windowSeconds();
    }
}
