package warden.core.port.out;

import io.smallrye.mutiny.Uni;

import warden.core.model.ratelimit.HitResult;
import warden.core.model.ratelimit.Rule;
import warden.core.model.ratelimit.StrategyKind;

/**
 * One window counting algorithm bound to a shared store.
 *
 * <p>{@link #hit} runs as a single atomic transaction in the store:
 * <ol>
 *   <li>read the store clock once</li>
 *   <li>return immediately if a ban is live, without touching window state</li>
 *   <li>count the request if the window has room</li>
 *   <li>otherwise record an offense, which may fire a ban</li>
 * </ol>
 *
 * <p>Implementations must be safe to call concurrently from any number of
 * workers and processes for the same identifier.
 */
public interface WindowStrategy {

    /**
     * Returns the algorithm this strategy implements.
     *
     * @return the strategy kind
     */
    StrategyKind kind();

    /**
     * Count one request from an identifier against a rule.
     *
     * @param identifier the client identifier
     * @param rule       the rule supplying limit and window
     * @return the hit outcome, or a failure with
     *         {@link warden.spi.RateLimitStoreException} if the store could not complete it
     */
    Uni<HitResult> hit(String identifier, Rule rule);
}
