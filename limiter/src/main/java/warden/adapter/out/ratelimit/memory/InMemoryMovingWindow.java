package warden.adapter.out.ratelimit.memory;

import warden.core.model.ratelimit.BanPolicy;
import warden.core.model.ratelimit.EpochBucket;
import warden.core.model.ratelimit.HitKeys;
import warden.core.model.ratelimit.HitResult;
import warden.core.model.ratelimit.KeySpace;
import warden.core.model.ratelimit.Rule;
import warden.core.model.ratelimit.StrategyKind;

/**
 * Moving window approximated from the current and previous fixed buckets.
 *
 * <p>
 * The previous bucket is weighted by the share of it still inside the window.
 * Buckets are laid out as described in {@link EpochBucket}.
 */
final class InMemoryMovingWindow extends InMemoryWindowStrategy {

    InMemoryMovingWindow(ExpiringStore store, KeySpace keySpace, BanPolicy banPolicy) {
        super(store, keySpace, banPolicy);
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.MOVING;
    }

    @Override
    protected HitResult apply(StoreTransaction tx, HitKeys keys, Rule rule, long now) {
        final var window = rule.windowSeconds();
        final var epoch = now / window;
        final var current = keys.bucketKey(epoch);
        final var previous = keys.bucketKey(epoch - 1);
        final var resetAt = (epoch + 1) * window;

        final var banTtl = activeBan(tx, keys);
        if (banTtl > 0) {
            return HitResult.rejected(resetAt, banTtl, now);
        }

        final var previousCount = bucketCount(tx, previous, epoch - 1);
        final var currentCount = bucketCount(tx, current, epoch);
        final var weighted = weighted(previousCount, currentCount, now, window);
        if (weighted < rule.limit()) {
            if (currentCount == 0) {
                tx.hset(current, EpochBucket.EPOCH, epoch);
                tx.hset(current, EpochBucket.COUNT, 0);
            }
            final var count = tx.hincrBy(current, EpochBucket.COUNT, 1);
            tx.expire(current, window * 2);
            final var after = weighted(previousCount, count, now, window);
            return HitResult.allowed(Math.max(0, rule.limit() - after), resetAt, now);
        }

        final var banned = ledger.recordOffense(tx, keys, window);
        return HitResult.rejected(resetAt, banned, now);
    }

    private static long bucketCount(StoreTransaction tx, String key, long epoch) {
        if (tx.ttl(key) == -2 || tx.hget(key, EpochBucket.EPOCH) != epoch) {
            return 0;
        }
        return tx.hget(key, EpochBucket.COUNT);
    }

    static long weighted(long previousCount, long currentCount, long now, long window) {
        return previousCount * (window - now % window) / window + currentCount;
    }
}
