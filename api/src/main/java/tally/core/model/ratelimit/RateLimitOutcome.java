package tally.core.model.ratelimit;

import java.util.List;
import java.util.Optional;

/**
 * Combined result of all strategies applied to one request.
 *
 * @param decisions decisions in evaluation order; evaluation stops at the first rejection
 * @param effective the decision reported to the client: the rejecting one, or the one with
 *     the fewest remaining requests when every strategy allowed
 */
public record RateLimitOutcome(List<RateLimitDecision> decisions, Optional<RateLimitDecision> effective) {

    public RateLimitOutcome {
        decisions = List.copyOf(decisions);
    }

    /**
     * Outcome for a request no strategy applied to.
     */
    public static RateLimitOutcome unrestricted() {
        return new RateLimitOutcome(List.of(), Optional.empty());
    }

    public boolean allowed() {
        return effective.map(RateLimitDecision::allowed).orElse(true);
    }
}
