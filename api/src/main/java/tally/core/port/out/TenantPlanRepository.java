package tally.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import tally.core.model.usage.TenantPlan;

/**
 * Port for looking up the plan a tenant is subscribed to.
 */
public interface TenantPlanRepository {

    /**
     * @param tenantId the tenant
     * @return Uni with the tenant's plan, or empty when the tenant has none
     */
    Uni<Optional<TenantPlan>> findByTenant(String tenantId);
}
