package warden.adapter.out.ratelimit.memory;

import java.util.OptionalLong;

/**
 * Operations available inside one atomic {@link ExpiringStore} transaction.
 *
 * <p>
 * The operations mirror the Redis commands the scripts of the Redis backend
 * use, with the same expiry semantics. {@link #nowSeconds()} returns the same
 * value for the whole transaction.
 */
public interface StoreTransaction {

    /**
     * Returns the store time captured when the transaction started.
     *
     * @return epoch seconds
     */
    long nowSeconds();

    /**
     * Returns the remaining lifetime of a key, rounded to whole seconds.
     *
     * @param key the key
     * @return seconds left, -1 if the key has no expiry, -2 if it does not exist
     */
    long ttl(String key);

    /**
     * Read a counter.
     *
     * @param key the key
     * @return the counter value, 0 if missing
     */
    long getLong(String key);

    /**
     * Increment a counter, creating it at 0 if missing. Keeps any expiry.
     *
     * @param key the key
     * @return the new value
     */
    long incr(String key);

    /**
     * Set a plain value with a lifetime.
     *
     * @param key     the key
     * @param value   the value
     * @param seconds lifetime in seconds
     */
    void setEx(String key, long value, long seconds);

    /**
     * Set the lifetime of an existing key. No-op if the key is missing.
     *
     * @param key     the key
     * @param seconds lifetime in seconds
     */
    void expire(String key, long seconds);

    /**
     * Set an absolute expiry on an existing key. No-op if the key is missing.
     *
     * @param key          the key
     * @param epochSeconds expiry time in epoch seconds
     */
    void expireAt(String key, long epochSeconds);

    /**
     * Increment a hash field, creating hash and field as needed.
     *
     * @param key   the hash key
     * @param field the field
     * @param delta the increment
     * @return the new field value
     */
    long hincrBy(String key, String field, long delta);

    /**
     * Set a hash field.
     *
     * @param key   the hash key
     * @param field the field
     * @param value the value
     */
    void hset(String key, String field, long value);

    /**
     * Read a hash field.
     *
     * @param key   the hash key
     * @param field the field
     * @return the field value, 0 if missing
     */
    long hget(String key, String field);

    /**
     * Add a member to a sorted log.
     *
     * @param key    the log key
     * @param score  the member score
     * @param member the member, unique within the log
     */
    void zadd(String key, long score, String member);

    /**
     * Remove every member scored at or below {@code maxScore}.
     *
     * @param key      the log key
     * @param maxScore inclusive upper bound
     * @return members removed
     */
    long zremRangeByScore(String key, long maxScore);

    /**
     * Count the members of a sorted log.
     *
     * @param key the log key
     * @return the member count, 0 if missing
     */
    long zcard(String key);

    /**
     * Returns the lowest score in a sorted log.
     *
     * @param key the log key
     * @return the lowest score, empty if the log is missing
     */
    OptionalLong zfirstScore(String key);
}
