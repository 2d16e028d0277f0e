package tally.core.service.ratelimit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import tally.core.model.ratelimit.RateLimitDecision;
import tally.core.model.ratelimit.RateLimitKey;
import tally.core.model.ratelimit.RateLimitOutcome;
import tally.core.model.ratelimit.RateLimitPolicy;
import tally.core.model.ratelimit.RateLimitRequest;
import tally.core.port.out.Metrics;

/**
 * Applies the configured strategies to a request.
 *
 * <p>Order: source address, tenant, credential, endpoint. The first rejection wins and the
 * remaining strategies are not consulted, so a rejected request does not consume quota in
 * later windows. Strategies whose scope is missing from the request are skipped.
 */
@ApplicationScoped
public class RateLimitService {

    private final FixedWindowRateLimiter limiter;
    private final TenantPlanResolver planResolver;
    private final RateLimitPolicy policy;
    private final Metrics metrics;

    @Inject
    public RateLimitService(
            FixedWindowRateLimiter limiter, TenantPlanResolver planResolver, RateLimitPolicy policy, Metrics metrics) {
        this.limiter = limiter;
        this.planResolver = planResolver;
        this.policy = policy;
        this.metrics = metrics;
    }

    public boolean isEnabled() {
        return policy.enabled();
    }

    /**
     * Evaluate every applicable strategy for a request.
     *
     * @param request the request identity
     * @return Uni with the combined outcome; never fails
     */
    public Uni<RateLimitOutcome> evaluate(RateLimitRequest request) {
        if (!policy.enabled()) {
            return Uni.createFrom().item(RateLimitOutcome.unrestricted());
        }
        return evaluateFrom(steps(request), 0, new ArrayList<>());
    }

    private List<Supplier<Uni<Optional<RateLimitDecision>>>> steps(RateLimitRequest request) {
        final var steps = new ArrayList<Supplier<Uni<Optional<RateLimitDecision>>>>(4);

        policy.sourceAddress()
                .ifPresent(limit -> steps.add(
                        () -> limiter.check(limit, request.sourceAddress()).map(Optional::of)));

        request.tenantId().ifPresent(tenantId -> steps.add(() -> planResolver
                .limitFor(tenantId)
                .flatMap(limit -> limit.isPresent()
                        ? limiter.check(limit.get(), tenantId).map(Optional::of)
                        : Uni.createFrom().item(Optional.<RateLimitDecision>empty()))));

        request.credentialId()
                .flatMap(credentialId -> policy.credentialLimit(credentialId)
                        .map(limit -> (Supplier<Uni<Optional<RateLimitDecision>>>)
                                () -> limiter.check(limit, credentialId).map(Optional::of)))
                .ifPresent(steps::add);

        policy.endpointRuleFor(request.endpoint())
                .ifPresent(rule -> steps.add(() -> limiter.check(
                                rule.limit(), RateLimitKey.endpointScope(rule.pathPrefix(), request.sourceAddress()))
                        .map(Optional::of)));

        return steps;
    }

    private Uni<RateLimitOutcome> evaluateFrom(
            List<Supplier<Uni<Optional<RateLimitDecision>>>> steps, int index, List<RateLimitDecision> decisions) {
        if (index >= steps.size()) {
            return Uni.createFrom().item(combine(decisions));
        }
        return steps.get(index).get().flatMap(result -> {
            if (result.isPresent()) {
                final var decision = result.get();
                decisions.add(decision);
                if (!decision.allowed()) {
                    metrics.recordRateLimitExceeded(decision.strategy());
                    return Uni.createFrom().item(new RateLimitOutcome(decisions, Optional.of(decision)));
                }
            }
            return evaluateFrom(steps, index + 1, decisions);
        });
    }

    private static RateLimitOutcome combine(List<RateLimitDecision> decisions) {
        final var tightest = decisions.stream().min(Comparator.comparingLong(RateLimitDecision::remaining));
        return new RateLimitOutcome(decisions, tightest);
    }
}
