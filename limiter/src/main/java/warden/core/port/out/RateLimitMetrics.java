package warden.core.port.out;

import warden.core.model.ratelimit.Decision;

/**
 * Port for recording admission metrics.
 */
public interface RateLimitMetrics {

    /**
     * Record the combined decision for one request.
     *
     * @param decision the decision
     */
    void recordDecision(Decision decision);

    /**
     * Record a store round trip that failed or timed out.
     *
     * @param backend   the backend name
     * @param operation the failed operation
     */
    void recordStoreFailure(String backend, String operation);
}
