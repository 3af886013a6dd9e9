package warden.adapter.out.ratelimit.memory;

import warden.core.model.ratelimit.BanPolicy;
import warden.core.model.ratelimit.HitKeys;
import warden.core.model.ratelimit.HitResult;
import warden.core.model.ratelimit.KeySpace;
import warden.core.model.ratelimit.Rule;
import warden.core.model.ratelimit.StrategyKind;

/**
 * Exact sliding window over a log of admitted request times.
 *
 * <p>
 * Rejected requests are never logged, so a client hammering at the limit does
 * not extend its own lockout.
 */
final class InMemorySlidingLog extends InMemoryWindowStrategy {

    /** Extra lifetime of the log past the window. */
    static final long LOG_GRACE_SECONDS = 60;

    InMemorySlidingLog(ExpiringStore store, KeySpace keySpace, BanPolicy banPolicy) {
        super(store, keySpace, banPolicy);
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.SLIDING_LOG;
    }

    @Override
    protected HitResult apply(StoreTransaction tx, HitKeys keys, Rule rule, long now) {
        final var window = rule.windowSeconds();
        final var log = keys.rateKey();

        final var banTtl = activeBan(tx, keys);
        if (banTtl > 0) {
            return HitResult.rejected(tx.zfirstScore(log).orElse(now) + window, banTtl, now);
        }

        tx.zremRangeByScore(log, now - window);
        final var count = tx.zcard(log);
        if (count < rule.limit()) {
            // count only grows within one second, so the member is unique
            tx.zadd(log, now, now + ":" + count);
            tx.expire(log, window + LOG_GRACE_SECONDS);
            final var oldest = tx.zfirstScore(log).orElse(now);
            return HitResult.allowed(rule.limit() - count - 1, oldest + window, now);
        }

        final var banned = ledger.recordOffense(tx, keys, window);
        if (banned > 0) {
            return HitResult.rejected(now + window, banned, now);
        }
        return HitResult.rejected(tx.zfirstScore(log).orElse(now - window) + window, 0, now);
    }
}
