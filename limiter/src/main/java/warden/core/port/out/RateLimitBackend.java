package warden.core.port.out;

import io.smallrye.mutiny.Uni;

import warden.core.model.ratelimit.HitResult;
import warden.core.model.ratelimit.Rule;
import warden.core.model.ratelimit.StrategyKind;

/**
 * Port to the shared store that holds all window and ban state.
 *
 * <p>A backend exposes one {@link WindowStrategy} per {@link StrategyKind}, all
 * sharing the same key space and ban policy.
 */
public interface RateLimitBackend {

    /**
     * Returns the name of this backend for logging and metrics.
     *
     * @return the backend name (e.g., "memory", "redis")
     */
    String name();

    /**
     * Returns the strategy implementing the given algorithm.
     *
     * @param kind the algorithm
     * @return the strategy
     */
    WindowStrategy strategy(StrategyKind kind);

    /**
     * Count one request against a rule using the rule's strategy.
     *
     * @param identifier the client identifier
     * @param rule       the rule
     * @return the hit outcome
     */
    default Uni<HitResult> hit(String identifier, Rule rule) {
        return strategy(rule.strategy()).hit(identifier, rule);
    }
}
