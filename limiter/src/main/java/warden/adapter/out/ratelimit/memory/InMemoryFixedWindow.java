package warden.adapter.out.ratelimit.memory;

import warden.core.model.ratelimit.BanPolicy;
import warden.core.model.ratelimit.HitKeys;
import warden.core.model.ratelimit.HitResult;
import warden.core.model.ratelimit.KeySpace;
import warden.core.model.ratelimit.Rule;
import warden.core.model.ratelimit.StrategyKind;

/**
 * Fixed window counter aligned to multiples of the window length.
 *
 * <p>
 * A client can get up to twice the limit through by straddling a window
 * boundary.
 */
final class InMemoryFixedWindow extends InMemoryWindowStrategy {

    InMemoryFixedWindow(ExpiringStore store, KeySpace keySpace, BanPolicy banPolicy) {
        super(store, keySpace, banPolicy);
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.FIXED;
    }

    @Override
    protected HitResult apply(StoreTransaction tx, HitKeys keys, Rule rule, long now) {
        final var window = rule.windowSeconds();
        final var windowEnd = now - now % window + window;

        final var banTtl = activeBan(tx, keys);
        if (banTtl > 0) {
            return HitResult.rejected(windowEnd, banTtl, now);
        }

        if (tx.getLong(keys.rateKey()) < rule.limit()) {
            final var count = tx.incr(keys.rateKey());
            tx.expireAt(keys.rateKey(), windowEnd);
            return HitResult.allowed(rule.limit() - count, windowEnd, now);
        }

        final var banned = ledger.recordOffense(tx, keys, window);
        return HitResult.rejected(windowEnd, banned, now);
    }
}
