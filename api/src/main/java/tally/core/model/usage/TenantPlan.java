package tally.core.model.usage;

import java.util.Objects;

/**
 * A tenant's plan as seen by the tenant rate-limit strategy.
 *
 * @param planId the plan identifier
 * @param requestsPerWindow the request ceiling
 * @param windowSeconds the window the ceiling applies to
 */
public record TenantPlan(String planId, long requestsPerWindow, long windowSeconds) {

    public TenantPlan {
        Objects.requireNonNull(planId, "planId must not be null");
    }
}
