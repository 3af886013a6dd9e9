package warden.core.model.ratelimit;

/**
 * Field layout of the two counters behind a moving window.
 *
 * <p>Buckets are named by epoch parity, so the key of the current and of the
 * previous epoch are always the two keys {@link HitKeys#bucketKey(long)}
 * returns, whatever the clock says. Each bucket is a hash that remembers which
 * epoch its {@link #COUNT} belongs to. A count whose {@link #EPOCH} is not the
 * epoch being asked for is stale and reads as 0.
 */
public final class EpochBucket {

    /** Epoch the count belongs to. */
    public static final String EPOCH = "epoch";

    /** Requests admitted during that epoch. */
    public static final String COUNT = "count";

    private EpochBucket() {}
}
