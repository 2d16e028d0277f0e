package tally.adapter.out.plan;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tally.core.config.PlanConfig;
import tally.core.model.usage.TenantPlan;
import tally.core.port.out.TenantPlanRepository;

/**
 * Tenant plans read from configuration ({@code tally.plans.*}).
 *
 * <p>Stands in for the external plan service; a tenant assigned to an undefined plan is
 * treated as having no plan.
 */
@ApplicationScoped
public class ConfigTenantPlanRepository implements TenantPlanRepository {

    private static final Logger LOG = Logger.getLogger(ConfigTenantPlanRepository.class);

    private final PlanConfig config;

    @Inject
    public ConfigTenantPlanRepository(PlanConfig config) {
        this.config = config;
    }

    @Override
    public Uni<Optional<TenantPlan>> findByTenant(String tenantId) {
        return Uni.createFrom().item(() -> {
            final var planId = config.tenants().get(tenantId);
            if (planId == null) {
                return Optional.<TenantPlan>empty();
            }
            final var definition = config.definitions().get(planId);
            if (definition == null) {
                LOG.warnv("Tenant {0} is assigned to undefined plan {1}", tenantId, planId);
                return Optional.<TenantPlan>empty();
            }
            return Optional.of(new TenantPlan(planId, definition.requestsPerWindow(), definition.windowSeconds()));
        });
    }
}
