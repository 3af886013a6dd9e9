package warden.core.model.ratelimit;

/**
 * Outcome of one atomic strategy hit.
 *
 * <p>All timestamps are epoch seconds read from the store's clock during the
 * same transaction.
 *
 * @param allowed   whether the request was counted and admitted
 * @param remaining requests left in the window (0 when not allowed)
 * @param resetAt   when the window (or oldest logged event) frees capacity
 * @param banTtl    seconds left on an active or freshly fired ban, 0 if none
 * @param serverNow the store time used for the decision
 */
public record HitResult(boolean allowed, long remaining, long resetAt, long banTtl, long serverNow) {

    public HitResult {
        if (remaining < 0) {
            throw new IllegalArgumentException("remaining must be non-negative");
        }
        if (banTtl < 0) {
            throw new IllegalArgumentException("banTtl must be non-negative");
        }
    }

    public static HitResult allowed(long remaining, long resetAt, long serverNow) {
        return new HitResult(true, remaining, resetAt, 0, serverNow);
    }

    public static HitResult rejected(long resetAt, long banTtl, long serverNow) {
        return new HitResult(false, 0, resetAt, banTtl, serverNow);
    }

    /**
     * Returns whether a ban is in force for this hit.
     *
     * @return true if {@code banTtl} is positive
     */
    public boolean banned() {
        return banTtl > 0;
    }
}
