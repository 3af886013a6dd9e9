package warden.adapter.out.ratelimit.memory;

import io.smallrye.mutiny.Uni;

import warden.core.model.ratelimit.BanPolicy;
import warden.core.model.ratelimit.HitKeys;
import warden.core.model.ratelimit.HitResult;
import warden.core.model.ratelimit.KeySpace;
import warden.core.model.ratelimit.Rule;
import warden.core.port.out.WindowStrategy;

/**
 * Base for strategies backed by an {@link ExpiringStore}.
 *
 * <p>
 * Subclasses implement one transaction body. Key derivation and the
 * transaction boundary live here.
 */
abstract class InMemoryWindowStrategy implements WindowStrategy {

    private final ExpiringStore store;
    private final KeySpace keySpace;
    private final BanPolicy banPolicy;
    protected final OffenseLedger ledger;

    InMemoryWindowStrategy(ExpiringStore store, KeySpace keySpace, BanPolicy banPolicy) {
        this.store = store;
        this.keySpace = keySpace;
        this.banPolicy = banPolicy;
        this.ledger = new OffenseLedger(banPolicy);
    }

    @Override
    public Uni<HitResult> hit(String identifier, Rule rule) {
        if (rule.strategy() != kind()) {
            throw new IllegalArgumentException("Rule uses " + rule.strategy() + ", strategy is " + kind());
        }
        final var keys = keySpace.keysFor(identifier, rule, banPolicy.scope());
        return Uni.createFrom().item(() -> store.atomically(tx -> apply(tx, keys, rule, tx.nowSeconds())));
    }

    /**
     * Run the strategy against the store.
     *
     * @param tx   the transaction
     * @param keys keys for this identifier and rule
     * @param rule the rule
     * @param now  the transaction clock in epoch seconds
     * @return the hit outcome
     */
    protected abstract HitResult apply(StoreTransaction tx, HitKeys keys, Rule rule, long now);

    /**
     * Returns the seconds left on the ban covering this hit, 0 if none.
     */
    protected static long activeBan(StoreTransaction tx, HitKeys keys) {
        return Math.max(0, tx.ttl(keys.banKey()));
    }
}
