package warden.core.model.ratelimit;

import java.util.Objects;

/**
 * Offense and ban escalation settings shared by all strategies.
 *
 * <p>Every over-limit hit counts as an offense. Once {@code threshold} offenses
 * accumulate, a ban of {@code min(initialBan * 2^(n-1), maxBan)} seconds fires,
 * where {@code n} is the number of consecutive bans. The consecutive ban count
 * only decays when the offense record expires, which happens no sooner than
 * {@code decaySeconds} after the last ban.
 *
 * @param enabled           whether offenses are recorded and bans can fire
 * @param threshold         offenses needed to trigger a ban
 * @param initialBanSeconds duration of the first ban
 * @param maxBanSeconds     upper bound for escalated bans
 * @param decaySeconds      minimum lifetime of the offense record after a ban
 * @param scope             whether bans apply per rule or site-wide
 */
public record BanPolicy(
        boolean enabled,
        long threshold,
        long initialBanSeconds,
        long maxBanSeconds,
        long decaySeconds,
        BanScope scope) {

    public BanPolicy {
        Objects.requireNonNull(scope, "scope must not be null");
        if (enabled) {
            if (threshold < 1) {
                throw new IllegalArgumentException("threshold must be at least 1");
            }
            if (initialBanSeconds < 1) {
                throw new IllegalArgumentException("initialBanSeconds must be at least 1");
            }
            if (maxBanSeconds < 1) {
                throw new IllegalArgumentException("maxBanSeconds must be at least 1");
            }
            if (decaySeconds < 0) {
                throw new IllegalArgumentException("decaySeconds must be non-negative");
            }
        }
    }

    /**
     * Create a policy with bans switched off.
     *
     * @return a disabled policy
     */
    public static BanPolicy disabled() {
        return new BanPolicy(false, 0, 0, 0, 0, BanScope.SITE);
    }

    /**
     * Returns whether a ban blocks the identifier on every rule.
     *
     * @return true for site-wide bans
     */
    public boolean siteWide() {
        return scope == BanScope.SITE;
    }

    /**
     * Returns the offense threshold handed to store transactions.
     *
     * <p>Zero tells the transaction to skip offense bookkeeping entirely.
     *
     * @return the threshold, or 0 when bans are disabled
     */
    public long effectiveThreshold() {
        return enabled ? threshold : 0;
    }

    /**
     * Compute the duration of the n-th consecutive ban.
     *
     * @param consecutiveBans the ban number, starting at 1
     * @return the ban duration in seconds, capped at {@code maxBanSeconds}
     */
    public long banDurationSeconds(long consecutiveBans) {
        if (consecutiveBans < 1) {
            throw new IllegalArgumentException("consecutiveBans must be at least 1");
        }
        var duration = initialBanSeconds;
        for (long i = 1; i < consecutiveBans && duration < maxBanSeconds; i++) {
            if (duration > maxBanSeconds / 2) {
                duration = maxBanSeconds;
                break;
            }
            duration *= 2;
        }
        return Math.min(duration, maxBanSeconds);
    }
}
