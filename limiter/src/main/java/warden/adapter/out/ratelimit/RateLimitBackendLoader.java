package warden.adapter.out.ratelimit;

import java.util.Comparator;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import warden.adapter.out.ratelimit.memory.InMemoryRateLimitBackendProvider;
import warden.adapter.out.ratelimit.redis.RedisRateLimitBackendProvider;
import warden.config.WardenConfig;
import warden.core.model.ratelimit.BanPolicy;
import warden.core.model.ratelimit.KeySpace;
import warden.core.port.out.RateLimitBackend;
import warden.core.port.out.RateLimitMetrics;
import warden.spi.RateLimitBackendProvider;

/**
 * CDI producer for the store backend.
 *
 * <p>Picks the available provider with the highest priority:
 * <ul>
 *   <li>Redis (priority 10) - Used when Redis is enabled and a data source exists</li>
 *   <li>In-memory (priority 0) - Fallback, always available</li>
 * </ul>
 */
@ApplicationScoped
public class RateLimitBackendLoader {

    private static final Logger LOG = Logger.getLogger(RateLimitBackendLoader.class);

    private final WardenConfig config;
    private final KeySpace keySpace;
    private final BanPolicy banPolicy;
    private final RateLimitMetrics metrics;
    private final Instance<ReactiveRedisDataSource> redisDataSource;

    @Inject
    public RateLimitBackendLoader(
            WardenConfig config,
            KeySpace keySpace,
            BanPolicy banPolicy,
            RateLimitMetrics metrics,
            Instance<ReactiveRedisDataSource> redisDataSource) {
        this.config = config;
        this.keySpace = keySpace;
        this.banPolicy = banPolicy;
        this.metrics = metrics;
        this.redisDataSource = redisDataSource;
    }

    /**
     * Produces the backend for CDI injection.
     *
     * @return the selected backend
     */
    @Produces
    @ApplicationScoped
    public RateLimitBackend produceBackend() {
        final var provider = select(providers());
        LOG.infov("Using rate limit backend: {0}", provider.name());
        return provider.createBackend();
    }

    /**
     * Choose the available provider with the highest priority.
     *
     * @param providers candidate providers
     * @return the selected provider
     * @throws IllegalStateException if none is available
     */
    static RateLimitBackendProvider select(List<RateLimitBackendProvider> providers) {
        return providers.stream()
                .filter(RateLimitBackendProvider::isAvailable)
                .max(Comparator.comparingInt(RateLimitBackendProvider::priority))
                .orElseThrow(() -> new IllegalStateException("No rate limit backend available"));
    }

    private List<RateLimitBackendProvider> providers() {
        return List.of(redisProvider(), new InMemoryRateLimitBackendProvider(keySpace, banPolicy));
    }

    private RateLimitBackendProvider redisProvider() {
        final var redis = config.redis();
        ReactiveRedisDataSource dataSource = null;
        if (!redis.enabled()) {
            LOG.debug("Redis backend not enabled in configuration");
        } else if (!redisDataSource.isResolvable()) {
            LOG.warn("Redis backend enabled but ReactiveRedisDataSource not available");
        } else {
            dataSource = redisDataSource.get();
        }
        return new RedisRateLimitBackendProvider(
                dataSource, redis.enabled(), keySpace, banPolicy, redis.timeout(), metrics);
    }
}
