package warden.adapter.out.ratelimit.memory;

import java.time.Clock;

import warden.core.model.ratelimit.BanPolicy;
import warden.core.model.ratelimit.KeySpace;
import warden.core.port.out.RateLimitBackend;
import warden.spi.RateLimitBackendProvider;

/**
 * Provider for the in-memory backend.
 *
 * <p>
 * Always available with the lowest priority, serving as the fallback when no
 * shared store is configured.
 */
public class InMemoryRateLimitBackendProvider implements RateLimitBackendProvider {

    private static final int PRIORITY = 0;
    private static final String NAME = "memory";

    private final KeySpace keySpace;
    private final BanPolicy banPolicy;

    public InMemoryRateLimitBackendProvider(KeySpace keySpace, BanPolicy banPolicy) {
        this.keySpace = keySpace;
        this.banPolicy = banPolicy;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public RateLimitBackend createBackend() {
        return new InMemoryRateLimitBackend(Clock.systemUTC(), keySpace, banPolicy);
    }
}
