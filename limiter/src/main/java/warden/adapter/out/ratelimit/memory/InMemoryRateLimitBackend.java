package warden.adapter.out.ratelimit.memory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

import warden.core.model.ratelimit.BanPolicy;
import warden.core.model.ratelimit.KeySpace;
import warden.core.model.ratelimit.StrategyKind;
import warden.core.port.out.RateLimitBackend;
import warden.core.port.out.WindowStrategy;

/**
 * In-memory backend.
 *
 * <p>
 * Suitable for single-instance deployments or development/testing. Limits are
 * enforced per process.
 */
public final class InMemoryRateLimitBackend implements RateLimitBackend {

    private final ExpiringStore store;
    private final Map<StrategyKind, WindowStrategy> strategies = new EnumMap<>(StrategyKind.class);

    /**
     * Creates a new in-memory backend.
     *
     * @param clock     the store clock
     * @param keySpace  the key layout
     * @param banPolicy the ban escalation settings
     */
    public InMemoryRateLimitBackend(Clock clock, KeySpace keySpace, BanPolicy banPolicy) {
        this.store = new ExpiringStore(clock);
        strategies.put(StrategyKind.FIXED, new InMemoryFixedWindow(store, keySpace, banPolicy));
        strategies.put(StrategyKind.SLIDING_LOG, new InMemorySlidingLog(store, keySpace, banPolicy));
        strategies.put(StrategyKind.MOVING, new InMemoryMovingWindow(store, keySpace, banPolicy));
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public WindowStrategy strategy(StrategyKind kind) {
        return strategies.get(kind);
    }

    /**
     * Returns the underlying store, for inspection.
     *
     * @return the store
     */
    public ExpiringStore store() {
        return store;
    }
}
