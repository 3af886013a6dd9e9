package warden.adapter.out.ratelimit.redis;

import java.time.Duration;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;

import warden.core.model.ratelimit.BanPolicy;
import warden.core.model.ratelimit.KeySpace;
import warden.core.port.out.RateLimitBackend;
import warden.core.port.out.RateLimitMetrics;
import warden.spi.RateLimitBackendProvider;

/**
 * Redis-based backend provider for distributed deployments.
 *
 * <p>This provider has higher priority than in-memory (10 vs 0) and is
 * selected when Redis is enabled in configuration and a data source exists.
 */
public final class RedisRateLimitBackendProvider implements RateLimitBackendProvider {

    private static final int PRIORITY = 10;

    private final ReactiveRedisDataSource redisDataSource;
    private final boolean redisConfigured;
    private final KeySpace keySpace;
    private final BanPolicy banPolicy;
    private final Duration timeout;
    private final RateLimitMetrics metrics;

    /**
     * Creates a new Redis provider.
     *
     * @param redisDataSource the Redis data source (may be null)
     * @param redisConfigured whether Redis is enabled for rate limiting
     * @param keySpace        the key layout
     * @param banPolicy       the ban escalation settings
     * @param timeout         the round trip timeout
     * @param metrics         the metrics sink (may be null)
     */
    public RedisRateLimitBackendProvider(
            ReactiveRedisDataSource redisDataSource,
            boolean redisConfigured,
            KeySpace keySpace,
            BanPolicy banPolicy,
            Duration timeout,
            RateLimitMetrics metrics) {
        this.redisDataSource = redisDataSource;
        this.redisConfigured = redisConfigured;
        this.keySpace = keySpace;
        this.banPolicy = banPolicy;
        this.timeout = timeout;
        this.metrics = metrics;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String name() {
        return RedisTimeoutHelper.BACKEND;
    }

    @Override
    public boolean isAvailable() {
        return redisConfigured && redisDataSource != null;
    }

    @Override
    public RateLimitBackend createBackend() {
        if (redisDataSource == null) {
            throw new IllegalStateException("Redis data source not available");
        }
        return new RedisRateLimitBackend(
                redisDataSource, keySpace, banPolicy, new RedisTimeoutHelper(timeout, metrics));
    }
}
