package warden.adapter.out.ratelimit.redis;

import java.util.ArrayList;
import java.util.List;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;

import warden.core.model.ratelimit.BanPolicy;
import warden.core.model.ratelimit.HitKeys;
import warden.core.model.ratelimit.HitResult;
import warden.core.model.ratelimit.KeySpace;
import warden.core.model.ratelimit.Rule;
import warden.core.model.ratelimit.StrategyKind;
import warden.core.port.out.WindowStrategy;

/**
 * Runs one window strategy as a Lua script on the Redis server.
 *
 * <p>The script reads the server clock with {@code TIME}, so all processes
 * share one time source regardless of their local clocks.
 */
final class RedisWindowStrategy implements WindowStrategy {

    private static final int RESULT_SIZE = 5;

    private final StrategyKind kind;
    private final String script;
    private final ReactiveRedisDataSource redisDataSource;
    private final KeySpace keySpace;
    private final BanPolicy banPolicy;
    private final RedisTimeoutHelper timeoutHelper;

    RedisWindowStrategy(
            StrategyKind kind,
            ReactiveRedisDataSource redisDataSource,
            KeySpace keySpace,
            BanPolicy banPolicy,
            RedisTimeoutHelper timeoutHelper) {
        this.kind = kind;
        this.script = WindowScripts.forKind(kind);
        this.redisDataSource = redisDataSource;
        this.keySpace = keySpace;
        this.banPolicy = banPolicy;
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public StrategyKind kind() {
        return kind;
    }

    @Override
    public Uni<HitResult> hit(String identifier, Rule rule) {
        if (rule.strategy() != kind) {
            throw new IllegalArgumentException("Rule uses " + rule.strategy() + ", strategy is " + kind);
        }
        final var keys = keySpace.keysFor(identifier, rule, banPolicy.scope());
        final var eval = redisDataSource.execute("EVAL", evalArguments(keys, rule).toArray(String[]::new));
        return timeoutHelper.withTimeout(eval.map(this::parseResult), "hit:" + kind.tag());
    }

    /**
     * Arguments following {@code EVAL}: the script, the key count, the keys and
     * the script arguments, in the order {@link WindowScripts} reads them.
     */
    List<String> evalArguments(HitKeys keys, Rule rule) {
        final var scriptKeys = new ArrayList<String>();
        scriptKeys.add(keys.rateKey());
        scriptKeys.add(keys.banKey());
        scriptKeys.add(keys.metaKey());
        if (kind == StrategyKind.MOVING) {
            scriptKeys.addAll(keys.bucketKeys());
        }

        final var args = new ArrayList<String>();
        args.add(script);
        args.add(String.valueOf(scriptKeys.size()));
        args.addAll(scriptKeys);
        args.add(String.valueOf(rule.limit()));
        args.add(String.valueOf(rule.windowSeconds()));
        args.add(String.valueOf(banPolicy.effectiveThreshold()));
        args.add(String.valueOf(banPolicy.initialBanSeconds()));
        args.add(String.valueOf(banPolicy.maxBanSeconds()));
        args.add(String.valueOf(banPolicy.decaySeconds()));
        return args;
    }

    private HitResult parseResult(Response response) {
        if (response == null || response.size() != RESULT_SIZE) {
            throw new IllegalStateException("Unexpected script response: " + response);
        }
        return new HitResult(
                response.get(0).toLong() == 1,
                response.get(1).toLong(),
                response.get(2).toLong(),
                response.get(3).toLong(),
                response.get(4).toLong());
    }
}
