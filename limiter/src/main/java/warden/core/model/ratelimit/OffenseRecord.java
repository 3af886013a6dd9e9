package warden.core.model.ratelimit;

/**
 * Field layout of the offense record kept next to each ban key.
 *
 * <p>The record is a hash with two counters. {@link #OFFENSES} counts
 * over-limit hits since the last ban and resets to 0 whenever a ban fires.
 * {@link #CONSECUTIVE_BANS} only disappears when the whole record expires.
 */
public final class OffenseRecord {

    /** Over-limit hits since the last ban. */
    public static final String OFFENSES = "off";

    /** Bans fired since the record was created. */
    public static final String CONSECUTIVE_BANS = "bc";

    private OffenseRecord() {}
}
