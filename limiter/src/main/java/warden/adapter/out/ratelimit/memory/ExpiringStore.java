package warden.adapter.out.ratelimit.memory;

import java.time.Clock;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.OptionalLong;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Single-process key/value store with Redis-like expiry semantics.
 *
 * <p>
 * Every transaction runs under one lock and sees a single clock reading, which
 * gives the same atomicity the Redis backend gets from server-side scripts.
 * Expired keys are dropped when touched, and a sweep runs every
 * {@value #SWEEP_INTERVAL} transactions so unused keys do not accumulate.
 *
 * <p>
 * State is not shared across instances and is lost on restart.
 */
public final class ExpiringStore {

    static final int SWEEP_INTERVAL = 1024;

    private static final long NO_EXPIRY = Long.MAX_VALUE;

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Entry> entries = new HashMap<>();
    private long transactions;

    public ExpiringStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Run a function as one atomic transaction.
     *
     * @param work the transaction body
     * @param <T>  the result type
     * @return the result of {@code work}
     */
    public <T> T atomically(Function<StoreTransaction, T> work) {
        lock.lock();
        try {
            final var nowMillis = clock.millis();
            if (++transactions % SWEEP_INTERVAL == 0) {
                sweep(nowMillis);
            }
            return work.apply(new Transaction(nowMillis));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of keys currently held, including expired keys not
     * yet swept.
     *
     * @return the key count
     */
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    private void sweep(long nowMillis) {
        final Iterator<Entry> it = entries.values().iterator();
        while (it.hasNext()) {
            if (it.next().expiredAt(nowMillis)) {
                it.remove();
            }
        }
    }

    private static final class Entry {
        private Object value;
        private long expiresAtMillis = NO_EXPIRY;

        Entry(Object value) {
            this.value = value;
        }

        boolean expiredAt(long nowMillis) {
            return expiresAtMillis != NO_EXPIRY && expiresAtMillis <= nowMillis;
        }
    }

    private record Scored(long score, String member) implements Comparable<Scored> {
        @Override
        public int compareTo(Scored other) {
            final var byScore = Long.compare(score, other.score);
            return byScore != 0 ? byScore : member.compareTo(other.member);
        }
    }

    private static final class SortedLog {
        private final TreeSet<Scored> byScore = new TreeSet<>();
        private final Map<String, Long> scores = new HashMap<>();

        void add(long score, String member) {
            final var previous = scores.put(member, score);
            if (previous != null) {
                byScore.remove(new Scored(previous, member));
            }
            byScore.add(new Scored(score, member));
        }

        long removeUpTo(long maxScore) {
            long removed = 0;
            while (!byScore.isEmpty() && byScore.first().score() <= maxScore) {
                scores.remove(byScore.pollFirst().member());
                removed++;
            }
            return removed;
        }
    }

    private final class Transaction implements StoreTransaction {

        private final long nowMillis;

        Transaction(long nowMillis) {
            this.nowMillis = nowMillis;
        }

        @Override
        public long nowSeconds() {
            return Math.floorDiv(nowMillis, 1000L);
        }

        @Override
        public long ttl(String key) {
            final var entry = live(key);
            if (entry == null) {
                return -2;
            }
            if (entry.expiresAtMillis == NO_EXPIRY) {
                return -1;
            }
            return (entry.expiresAtMillis - nowMillis + 500) / 1000;
        }

        @Override
        public long getLong(String key) {
            final var entry = live(key);
            return entry == null ? 0 : valueOf(entry, Long.class, key);
        }

        @Override
        public long incr(String key) {
            final var entry = live(key);
            if (entry == null) {
                entries.put(key, new Entry(1L));
                return 1;
            }
            final long next = valueOf(entry, Long.class, key) + 1;
            entry.value = next;
            return next;
        }

        @Override
        public void setEx(String key, long value, long seconds) {
            final var entry = new Entry(value);
            entry.expiresAtMillis = nowMillis + seconds * 1000L;
            entries.put(key, entry);
        }

        @Override
        public void expire(String key, long seconds) {
            expireAtMillis(key, nowMillis + seconds * 1000L);
        }

        @Override
        public void expireAt(String key, long epochSeconds) {
            expireAtMillis(key, epochSeconds * 1000L);
        }

        @Override
        public long hincrBy(String key, String field, long delta) {
            final var hash = hashFor(key);
            return hash.merge(field, delta, Long::sum);
        }

        @Override
        public void hset(String key, String field, long value) {
            hashFor(key).put(field, value);
        }

        @Override
        public long hget(String key, String field) {
            final var entry = live(key);
            if (entry == null) {
                return 0;
            }
            @SuppressWarnings("unchecked")
            final Map<String, Long> hash = valueOf(entry, Map.class, key);
            return hash.getOrDefault(field, 0L);
        }

        @Override
        public void zadd(String key, long score, String member) {
            var entry = live(key);
            if (entry == null) {
                entry = new Entry(new SortedLog());
                entries.put(key, entry);
            }
            valueOf(entry, SortedLog.class, key).add(score, member);
        }

        @Override
        public long zremRangeByScore(String key, long maxScore) {
            final var entry = live(key);
            if (entry == null) {
                return 0;
            }
            final var log = valueOf(entry, SortedLog.class, key);
            final var removed = log.removeUpTo(maxScore);
            if (log.scores.isEmpty()) {
                entries.remove(key);
            }
            return removed;
        }

        @Override
        public long zcard(String key) {
            final var entry = live(key);
            return entry == null ? 0 : valueOf(entry, SortedLog.class, key).scores.size();
        }

        @Override
        public OptionalLong zfirstScore(String key) {
            final var entry = live(key);
            if (entry == null) {
                return OptionalLong.empty();
            }
            final var log = valueOf(entry, SortedLog.class, key);
            return log.byScore.isEmpty()
                    ? OptionalLong.empty()
                    : OptionalLong.of(log.byScore.first().score());
        }

        private Entry live(String key) {
            final var entry = entries.get(key);
            if (entry != null && entry.expiredAt(nowMillis)) {
                entries.remove(key);
                return null;
            }
            return entry;
        }

        @SuppressWarnings("unchecked")
        private Map<String, Long> hashFor(String key) {
            var entry = live(key);
            if (entry == null) {
                entry = new Entry(new HashMap<String, Long>());
                entries.put(key, entry);
            }
            return valueOf(entry, Map.class, key);
        }

        private void expireAtMillis(String key, long expiresAtMillis) {
            final var entry = live(key);
            if (entry == null) {
                return;
            }
            if (expiresAtMillis <= nowMillis) {
                entries.remove(key);
                return;
            }
            entry.expiresAtMillis = expiresAtMillis;
        }

        private <V> V valueOf(Entry entry, Class<V> type, String key) {
            if (!type.isInstance(entry.value)) {
                throw new IllegalStateException("Key " + key + " holds a "
                        + entry.value.getClass().getSimpleName() + ", expected " + type.getSimpleName());
            }
            return type.cast(entry.value);
        }
    }
}
