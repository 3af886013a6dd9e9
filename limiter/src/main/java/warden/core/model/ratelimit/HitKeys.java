package warden.core.model.ratelimit;

import java.util.List;
import java.util.Objects;

/**
 * Storage keys touched by one strategy hit.
 *
 * @param rateKey the window state key
 * @param banKey  the ban flag key
 * @param metaKey the offense record key
 */
public record HitKeys(String rateKey, String banKey, String metaKey) {

    public HitKeys {
        Objects.requireNonNull(rateKey, "rateKey must not be null");
        Objects.requireNonNull(banKey, "banKey must not be null");
        Objects.requireNonNull(metaKey, "metaKey must not be null");
    }

    /**
     * Key of the moving-window bucket that holds the count for an epoch.
     *
     * @param epoch the epoch
     * @return the bucket key, shared by every other epoch of the same parity
     */
    public String bucketKey(long epoch) {
        return rateKey + ":" + Math.floorMod(epoch, 2);
    }

    /**
     * Both moving-window bucket keys, even parity first.
     *
     * @return the bucket keys
     */
    public List<String> bucketKeys() {
        return List.of(bucketKey(0), bucketKey(1));
    }
}
