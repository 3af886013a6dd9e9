package warden.adapter.out.ratelimit.redis;

import java.util.EnumMap;
import java.util.Map;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;

import warden.core.model.ratelimit.BanPolicy;
import warden.core.model.ratelimit.KeySpace;
import warden.core.model.ratelimit.StrategyKind;
import warden.core.port.out.RateLimitBackend;
import warden.core.port.out.WindowStrategy;

/**
 * Redis-based backend for distributed deployments.
 *
 * <p>Every hit is one {@code EVAL} round trip, so counting, the ban check and
 * offense bookkeeping stay atomic across all instances.
 *
 * <p>Store failures surface as {@link warden.spi.RateLimitStoreException}; the
 * backend never admits or rejects on its own when Redis is unreachable.
 */
public final class RedisRateLimitBackend implements RateLimitBackend {

    private final Map<StrategyKind, WindowStrategy> strategies = new EnumMap<>(StrategyKind.class);

    public RedisRateLimitBackend(
            ReactiveRedisDataSource redisDataSource,
            KeySpace keySpace,
            BanPolicy banPolicy,
            RedisTimeoutHelper timeoutHelper) {
        for (final var kind : StrategyKind.values()) {
            strategies.put(kind, new RedisWindowStrategy(kind, redisDataSource, keySpace, banPolicy, timeoutHelper));
        }
    }

    @Override
    public String name() {
        return RedisTimeoutHelper.BACKEND;
    }

    @Override
    public WindowStrategy strategy(StrategyKind kind) {
        return strategies.get(kind);
    }
}
