package tally.adapter.in.bootstrap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import tally.core.config.UsageConfig;
import tally.core.model.ratelimit.RateLimitPolicy;
import tally.core.service.usage.UsageConfigValidator;

/**
 * Validates rate limit and usage configuration on application startup.
 *
 * <h2>Failure Behavior</h2>
 * <ul>
 *   <li>An endpoint rule without a path, or a non-positive limit or window: startup FAILS</li>
 *   <li>A usage counter TTL shorter than three aggregation intervals: startup FAILS</li>
 * </ul>
 */
@ApplicationScoped
public class StartupValidator {

    private static final Logger LOG = Logger.getLogger(StartupValidator.class);

    private final RateLimitPolicy policy;
    private final UsageConfig usageConfig;

    @Inject
    public StartupValidator(RateLimitPolicy policy, UsageConfig usageConfig) {
        this.policy = policy;
        this.usageConfig = usageConfig;
    }

    void onStart(@Observes StartupEvent event) {
        UsageConfigValidator.validate(usageConfig);
        LOG.infov(
                "Configuration valid: rate limiting {0}, {1} endpoint rule(s), counter TTL {2}, aggregation every {3}",
                policy.enabled() ? "enabled" : "disabled",
                policy.endpointRules().size(),
                usageConfig.counterTtl(),
                usageConfig.aggregation().interval());
    }
}
