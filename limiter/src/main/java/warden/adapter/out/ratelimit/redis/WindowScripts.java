package warden.adapter.out.ratelimit.redis;

import warden.core.model.ratelimit.EpochBucket;
import warden.core.model.ratelimit.OffenseRecord;
import warden.core.model.ratelimit.StrategyKind;

/**
 * Lua scripts for the window strategies.
 *
 * <p>Every script is the shared prelude followed by one strategy body, so the
 * ban check and offense bookkeeping are identical across strategies.
 *
 * <p>Arguments:
 * <ol>
 *   <li>KEYS[1] - window state key</li>
 *   <li>KEYS[2] - ban key</li>
 *   <li>KEYS[3] - offense record key</li>
 *   <li>KEYS[4], KEYS[5] - moving window buckets for even and odd epochs, moving window only</li>
 *   <li>ARGV[1] - limit</li>
 *   <li>ARGV[2] - window in seconds</li>
 *   <li>ARGV[3] - offense threshold, 0 disables bans</li>
 *   <li>ARGV[4] - initial ban in seconds</li>
 *   <li>ARGV[5] - maximum ban in seconds</li>
 *   <li>ARGV[6] - minimum offense record lifetime after a ban</li>
 * </ol>
 *
 * <p>Returns array: [allowed (0/1), remaining, reset_at, ban_ttl, now]
 */
final class WindowScripts {

    /**
     * Reads arguments and the server clock, defines {@code record_offense} and
     * reads the ban TTL.
     */
    static final String PRELUDE =
            """
            local rate_key = KEYS[1]
            local ban_key = KEYS[2]
            local meta_key = KEYS[3]
            local limit = tonumber(ARGV[1])
            local win = tonumber(ARGV[2])
            local threshold = tonumber(ARGV[3])
            local initial_ban = tonumber(ARGV[4])
            local max_ban = tonumber(ARGV[5])
            local decay = tonumber(ARGV[6])
            local now = tonumber(redis.call('TIME')[1])

            -- Returns the duration of a ban fired by this offense, 0 if none
            local function record_offense()
                if threshold <= 0 then
                    return 0
                end
                local offenses = redis.call('HINCRBY', meta_key, '%1$s', 1)
                redis.call('EXPIRE', meta_key, win * 2)
                if offenses < threshold then
                    return 0
                end
                local bans = redis.call('HINCRBY', meta_key, '%2$s', 1)
                local duration = math.floor(math.min(initial_ban * 2 ^ (bans - 1), max_ban))
                redis.call('SET', ban_key, '1', 'EX', duration)
                redis.call('HSET', meta_key, '%1$s', 0)
                redis.call('EXPIRE', meta_key, math.max(duration, decay))
                return duration
            end

            local ban_ttl = redis.call('TTL', ban_key)
            """
                    .formatted(OffenseRecord.OFFENSES, OffenseRecord.CONSECUTIVE_BANS);

    static final String FIXED_WINDOW =
            PRELUDE
                    + """
            local window_end = now - now % win + win
            if ban_ttl > 0 then
                return {0, 0, window_end, ban_ttl, now}
            end

            local count = tonumber(redis.call('GET', rate_key) or '0')
            if count < limit then
                count = redis.call('INCR', rate_key)
                redis.call('EXPIREAT', rate_key, window_end)
                return {1, limit - count, window_end, 0, now}
            end

            return {0, 0, window_end, record_offense(), now}
            """;

    static final String SLIDING_LOG =
            PRELUDE
                    + """
            local function oldest_or(default)
                local first = redis.call('ZRANGE', rate_key, 0, 0, 'WITHSCORES')
                if #first > 0 then
                    return tonumber(first[2])
                end
                return default
            end

            if ban_ttl > 0 then
                return {0, 0, oldest_or(now) + win, ban_ttl, now}
            end

            redis.call('ZREMRANGEBYSCORE', rate_key, '-inf', now - win)
            local count = redis.call('ZCARD', rate_key)
            if count < limit then
                -- count only grows within one second, so the member is unique
                redis.call('ZADD', rate_key, now, now .. ':' .. count)
                redis.call('EXPIRE', rate_key, win + 60)
                return {1, limit - count - 1, oldest_or(now) + win, 0, now}
            end

            local banned = record_offense()
            if banned > 0 then
                return {0, 0, now + win, banned, now}
            end
            return {0, 0, oldest_or(now - win) + win, 0, now}
            """;

    static final String MOVING_WINDOW =
            PRELUDE
                    + """
            local epoch = math.floor(now / win)
            local parity = epoch %% 2
            local current_key = KEYS[4 + parity]
            local previous_key = KEYS[5 - parity]
            local reset_at = (epoch + 1) * win
            if ban_ttl > 0 then
                return {0, 0, reset_at, ban_ttl, now}
            end

            local function bucket_count(key, bucket_epoch)
                local stored = redis.call('HMGET', key, '%1$s', '%2$s')
                if tonumber(stored[1]) == bucket_epoch then
                    return tonumber(stored[2]) or 0
                end
                return 0
            end

            local previous = bucket_count(previous_key, epoch - 1)
            local current = bucket_count(current_key, epoch)
            local weighted = math.floor(previous * (win - now %% win) / win + current)
            if weighted < limit then
                if current == 0 then
                    redis.call('HSET', current_key, '%1$s', epoch, '%2$s', 0)
                end
                current = redis.call('HINCRBY', current_key, '%2$s', 1)
                redis.call('EXPIRE', current_key, win * 2)
                weighted = math.floor(previous * (win - now %% win) / win + current)
                return {1, math.max(0, limit - weighted), reset_at, 0, now}
            end

            return {0, 0, reset_at, record_offense(), now}
            """
                    .formatted(EpochBucket.EPOCH, EpochBucket.COUNT);

    private WindowScripts() {}

    static String forKind(StrategyKind kind) {
        return switch (kind) {
            case FIXED -> FIXED_WINDOW;
            case SLIDING_LOG -> SLIDING_LOG;
            case MOVING -> MOVING_WINDOW;
        };
    }
}
