package warden.adapter.out.ratelimit.memory;

import org.jboss.logging.Logger;

import warden.core.model.ratelimit.BanPolicy;
import warden.core.model.ratelimit.HitKeys;
import warden.core.model.ratelimit.OffenseRecord;

/**
 * Offense bookkeeping shared by every in-memory strategy.
 *
 * <p>
 * Must run inside the same transaction as the window update that produced the
 * over-limit hit.
 */
final class OffenseLedger {

    private static final Logger LOG = Logger.getLogger(OffenseLedger.class);

    private final BanPolicy policy;

    OffenseLedger(BanPolicy policy) {
        this.policy = policy;
    }

    /**
     * Record one offense and fire a ban once the threshold is reached.
     *
     * @param tx            the running transaction
     * @param keys          keys of the current hit
     * @param windowSeconds window of the rule that was exceeded
     * @return the duration of a ban fired by this offense, 0 if none fired
     */
    long recordOffense(StoreTransaction tx, HitKeys keys, long windowSeconds) {
        final var threshold = policy.effectiveThreshold();
        if (threshold <= 0) {
            return 0;
        }

        final var meta = keys.metaKey();
        final var offenses = tx.hincrBy(meta, OffenseRecord.OFFENSES, 1);
        tx.expire(meta, windowSeconds * 2);
        if (offenses < threshold) {
            return 0;
        }

        final var consecutiveBans = tx.hincrBy(meta, OffenseRecord.CONSECUTIVE_BANS, 1);
        final var duration = policy.banDurationSeconds(consecutiveBans);
        tx.setEx(keys.banKey(), 1, duration);
        tx.hset(meta, OffenseRecord.OFFENSES, 0);
        tx.expire(meta, Math.max(duration, policy.decaySeconds()));

        LOG.debugv("Ban {0} fired on {1} for {2}s", consecutiveBans, keys.banKey(), duration);
        return duration;
    }
}
