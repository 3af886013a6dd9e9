package warden.adapter.out.ratelimit.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.ratelimit.BanPolicy;
import warden.core.model.ratelimit.BanScope;
import warden.core.model.ratelimit.EpochBucket;
import warden.core.model.ratelimit.HitResult;
import warden.core.model.ratelimit.KeySpace;
import warden.core.model.ratelimit.OffenseRecord;
import warden.core.model.ratelimit.Rule;
import warden.core.model.ratelimit.StrategyKind;

@DisplayName("InMemoryRateLimitBackend")
class InMemoryRateLimitBackendTest {

    /** Aligned to every window used below. */
    private static final long START = 1_800_000_000L;

    private final KeySpace keySpace = KeySpace.withDefaultPrefix();
    private MutableClock clock;
    private InMemoryRateLimitBackend backend;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        backend = new InMemoryRateLimitBackend(clock, keySpace, BanPolicy.disabled());
    }

    private HitResult hit(String identifier, Rule rule) {
        return backend.hit(identifier, rule).await().atMost(Duration.ofSeconds(1));
    }

    private HitResult hit(InMemoryRateLimitBackend target, String identifier, Rule rule) {
        return target.hit(identifier, rule).await().atMost(Duration.ofSeconds(1));
    }

    @Nested
    @DisplayName("Fixed window")
    class FixedWindowTests {

        private final Rule rule = Rule.of("/api/*", 3, 60, StrategyKind.FIXED);

        @Test
        @DisplayName("should admit up to the limit then reject until the window ends")
        void shouldAdmitUpToLimit() {
            assertEquals(2, hit("client", rule).remaining());
            assertEquals(1, hit("client", rule).remaining());
            assertEquals(0, hit("client", rule).remaining());

            var rejected = hit("client", rule);

            assertFalse(rejected.allowed());
            assertEquals(0, rejected.remaining());
            assertEquals(START + 60, rejected.resetAt());
            assertEquals(0, rejected.banTtl());
            assertEquals(START, rejected.serverNow());
        }

        @Test
        @DisplayName("should admit up to twice the limit across a boundary")
        void shouldAdmitTwiceLimitAcrossBoundary() {
            clock.advanceSeconds(59);
            for (int i = 0; i < 3; i++) {
                assertTrue(hit("client", rule).allowed());
            }
            clock.advanceSeconds(1);
            for (int i = 0; i < 3; i++) {
                assertTrue(hit("client", rule).allowed());
            }
            assertFalse(hit("client", rule).allowed());
        }

        @Test
        @DisplayName("should expire the counter at the window end")
        void shouldExpireCounterAtWindowEnd() {
            hit("client", rule);
            clock.advanceSeconds(10);

            var key = keySpace.deriveKey("client", rule);
            assertEquals(50L, backend.store().<Long>atomically(tx -> tx.ttl(key)));
        }

        @Test
        @DisplayName("should reject everything when the limit is zero")
        void shouldRejectWithZeroLimit() {
            var closed = Rule.of("/closed", 0, 60, StrategyKind.FIXED);

            assertFalse(hit("client", closed).allowed());
        }

        @Test
        @DisplayName("should keep clients apart")
        void shouldKeepClientsApart() {
            for (int i = 0; i < 3; i++) {
                hit("client-1", rule);
            }

            assertEquals(2, hit("client-2", rule).remaining());
        }

        @Test
        @DisplayName("should never admit more than the limit under concurrency")
        void shouldNeverOverAdmitConcurrently() throws InterruptedException {
            var limited = Rule.of("/api/*", 50, 60, StrategyKind.FIXED);
            int threads = 8;
            int perThread = 25;
            var allowed = new AtomicInteger();
            var latch = new CountDownLatch(threads);
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            try {
                for (int t = 0; t < threads; t++) {
                    executor.submit(() -> {
                        for (int i = 0; i < perThread; i++) {
                            if (hit("client", limited).allowed()) {
                                allowed.incrementAndGet();
                            }
                        }
                        latch.countDown();
                    });
                }
                assertTrue(latch.await(10, TimeUnit.SECONDS));
            } finally {
                executor.shutdownNow();
            }

            assertEquals(50, allowed.get());
        }
    }

    @Nested
    @DisplayName("Sliding log")
    class SlidingLogTests {

        private final Rule rule = Rule.of("/auth/login", 3, 10, StrategyKind.SLIDING_LOG);

        @Test
        @DisplayName("should admit exactly the limit within any window")
        void shouldAdmitExactlyLimit() {
            assertEquals(2, hit("client", rule).remaining());
            clock.advanceSeconds(1);
            assertEquals(1, hit("client", rule).remaining());
            clock.advanceSeconds(1);
            var third = hit("client", rule);
            assertEquals(0, third.remaining());
            assertEquals(START + 10, third.resetAt());

            clock.advanceSeconds(1);
            var rejected = hit("client", rule);
            assertFalse(rejected.allowed());
            assertEquals(START + 10, rejected.resetAt());

            clock.advanceSeconds(6);
            assertFalse(hit("client", rule).allowed());

            clock.advanceSeconds(1);
            var afterOldestLeft = hit("client", rule);
            assertTrue(afterOldestLeft.allowed());
            assertEquals(START + 11, afterOldestLeft.resetAt());
        }

        @Test
        @DisplayName("should count every request within the same second")
        void shouldCountSameSecondRequests() {
            for (int i = 0; i < 3; i++) {
                assertTrue(hit("client", rule).allowed());
            }
            assertFalse(hit("client", rule).allowed());

            var key = keySpace.deriveKey("client", rule);
            assertEquals(3L, backend.store().<Long>atomically(tx -> tx.zcard(key)));
        }

        @Test
        @DisplayName("should not log rejected requests")
        void shouldNotLogRejectedRequests() {
            for (int i = 0; i < 3; i++) {
                hit("client", rule);
            }
            for (int i = 0; i < 5; i++) {
                clock.advanceSeconds(1);
                assertFalse(hit("client", rule).allowed());
            }

            clock.advanceSeconds(5);
            assertTrue(hit("client", rule).allowed());
        }

        @Test
        @DisplayName("should report a reset of one second when the limit is zero")
        void shouldHandleZeroLimit() {
            var closed = Rule.of("/closed", 0, 10, StrategyKind.SLIDING_LOG);

            var rejected = hit("client", closed);

            assertFalse(rejected.allowed());
            assertEquals(START, rejected.resetAt());
        }
    }

    @Nested
    @DisplayName("Moving window")
    class MovingWindowTests {

        private final Rule rule = Rule.of("/api/*", 10, 60, StrategyKind.MOVING);

        @Test
        @DisplayName("should weight the previous bucket by its remaining overlap")
        void shouldWeightPreviousBucket() {
            for (int i = 0; i < 10; i++) {
                assertTrue(hit("client", rule).allowed());
            }
            assertFalse(hit("client", rule).allowed());

            clock.advanceSeconds(90);
            int admitted = 0;
            HitResult last = null;
            for (int i = 0; i < 10; i++) {
                last = hit("client", rule);
                if (last.allowed()) {
                    admitted++;
                }
            }

            assertEquals(5, admitted);
            assertEquals(START + 120, last.resetAt());
        }

        @Test
        @DisplayName("should keep remaining between zero and the limit")
        void shouldBoundRemaining() {
            for (int i = 0; i < 15; i++) {
                var result = hit("client", rule);
                assertTrue(result.remaining() >= 0 && result.remaining() <= rule.limit());
            }
        }

        @Test
        @DisplayName("should report the current bucket end as reset time")
        void shouldReportBucketEnd() {
            clock.advanceSeconds(30);

            assertEquals(START + 60, hit("client", rule).resetAt());
        }

        @Test
        @DisplayName("should ignore a bucket left over from an older epoch of the same parity")
        void shouldIgnoreStaleBucket() {
            // written late in the epoch, so the bucket outlives the next epoch of its parity
            clock.advanceSeconds(59);
            for (int i = 0; i < 10; i++) {
                hit("client", rule);
            }

            clock.advanceSeconds(61);
            var first = hit("client", rule);

            assertTrue(first.allowed());
            assertEquals(9, first.remaining());
            var bucket = keySpace.keysFor("client", rule, BanScope.SITE).bucketKey(START / 60 + 2);
            assertEquals(START / 60 + 2, backend.store().<Long>atomically(tx -> tx.hget(bucket, EpochBucket.EPOCH)));
            assertEquals(1L, backend.store().<Long>atomically(tx -> tx.hget(bucket, EpochBucket.COUNT)));
        }

        @Test
        @DisplayName("should only ever use the two declared bucket keys")
        void shouldUseTwoBucketKeys() {
            hit("client", rule);
            for (int i = 0; i < 4; i++) {
                clock.advanceSeconds(60);
                hit("client", rule);
            }

            var keys = keySpace.keysFor("client", rule, BanScope.SITE);
            assertEquals(2, backend.store().size());
            assertEquals(120L, backend.store().<Long>atomically(tx -> tx.ttl(keys.bucketKey(0))));
            assertEquals(60L, backend.store().<Long>atomically(tx -> tx.ttl(keys.bucketKey(1))));
        }

        @Test
        @DisplayName("should compute the weighted count with floor division")
        void shouldComputeWeightedCount() {
            assertEquals(5, InMemoryMovingWindow.weighted(10, 0, 30, 60));
            assertEquals(2 + 6, InMemoryMovingWindow.weighted(7, 6, 40, 60));
        }
    }

    @Nested
    @DisplayName("Bans")
    class BanTests {

        private final Rule rule = Rule.of("/auth/login", 5, 60, StrategyKind.FIXED);

        private InMemoryRateLimitBackend banning(BanScope scope) {
            return new InMemoryRateLimitBackend(clock, keySpace, new BanPolicy(true, 3, 30, 120, 3600, scope));
        }

        @Test
        @DisplayName("should ban once the offense threshold is reached")
        void shouldBanAtThreshold() {
            var target = banning(BanScope.SITE);
            for (int i = 0; i < 5; i++) {
                assertTrue(hit(target, "client", rule).allowed());
            }

            var first = hit(target, "client", rule);
            var second = hit(target, "client", rule);
            var third = hit(target, "client", rule);

            assertFalse(first.banned());
            assertFalse(second.banned());
            assertTrue(third.banned());
            assertEquals(30, third.banTtl());

            var keys = keySpace.keysFor("client", rule, BanScope.SITE);
            assertEquals(0L, target.store().<Long>atomically(tx -> tx.hget(keys.metaKey(), OffenseRecord.OFFENSES)));
            assertEquals(1L, target.store().<Long>atomically(tx -> tx.hget(keys.metaKey(), OffenseRecord.CONSECUTIVE_BANS)));
            assertEquals(3600L, target.store().<Long>atomically(tx -> tx.ttl(keys.metaKey())));
        }

        @Test
        @DisplayName("should leave window state untouched while banned")
        void shouldLeaveWindowStateWhileBanned() {
            var target = banning(BanScope.SITE);
            for (int i = 0; i < 8; i++) {
                hit(target, "client", rule);
            }
            var key = keySpace.deriveKey("client", rule);
            var before = target.store().atomically(tx -> tx.getLong(key));

            clock.advanceSeconds(10);
            var during = hit(target, "client", rule);

            assertTrue(during.banned());
            assertEquals(20, during.banTtl());
            assertEquals(before, target.store().<Long>atomically(tx -> tx.getLong(key)));
        }

        @Test
        @DisplayName("should take precedence over available capacity")
        void shouldTakePrecedenceOverCapacity() {
            var target = banning(BanScope.SITE);
            var sliding = Rule.of("/search", 3, 5, StrategyKind.SLIDING_LOG);
            for (int i = 0; i < 6; i++) {
                hit(target, "client", sliding);
            }

            // window has emptied, ban still has 25 seconds
            clock.advanceSeconds(5);
            var result = hit(target, "client", sliding);

            assertFalse(result.allowed());
            assertEquals(25, result.banTtl());
            var key = keySpace.deriveKey("client", sliding);
            assertEquals(3L, target.store().<Long>atomically(tx -> tx.zcard(key)));
        }

        @Test
        @DisplayName("should double consecutive bans")
        void shouldDoubleConsecutiveBans() {
            var target = banning(BanScope.SITE);
            for (int i = 0; i < 8; i++) {
                hit(target, "client", rule);
            }

            clock.advanceSeconds(31);
            hit(target, "client", rule);
            hit(target, "client", rule);
            var second = hit(target, "client", rule);

            assertEquals(60, second.banTtl());
        }

        @Test
        @DisplayName("should block every rule when site-wide")
        void shouldBlockEveryRuleWhenSiteWide() {
            var target = banning(BanScope.SITE);
            var other = Rule.of("/api/*", 100, 60, StrategyKind.MOVING);
            for (int i = 0; i < 8; i++) {
                hit(target, "client", rule);
            }

            assertTrue(hit(target, "client", other).banned());
            assertTrue(hit(target, "someone-else", other).allowed());
        }

        @Test
        @DisplayName("should block only the offending rule when per rule")
        void shouldBlockOnlyOffendingRule() {
            var target = banning(BanScope.RULE);
            var other = Rule.of("/api/*", 100, 60, StrategyKind.MOVING);
            for (int i = 0; i < 8; i++) {
                hit(target, "client", rule);
            }

            assertTrue(hit(target, "client", rule).banned());
            assertTrue(hit(target, "client", other).allowed());
        }

        @Test
        @DisplayName("should never ban when bans are disabled")
        void shouldNeverBanWhenDisabled() {
            for (int i = 0; i < 50; i++) {
                assertFalse(hit("client", rule).banned());
            }

            var keys = keySpace.keysFor("client", rule, BanScope.SITE);
            assertEquals(-2L, backend.store().<Long>atomically(tx -> tx.ttl(keys.metaKey())));
        }
    }

    @Nested
    @DisplayName("Ban decay")
    class BanDecayTests {

        /** Every hit is over the limit, so every hit is an offense. */
        private final Rule rule = Rule.of("/auth/login", 0, 60, StrategyKind.FIXED);

        private final String metaKey = keySpace.keysFor("client", rule, BanScope.SITE).metaKey();

        private InMemoryRateLimitBackend target;

        @BeforeEach
        void setUpBanning() {
            target = new InMemoryRateLimitBackend(clock, keySpace, new BanPolicy(true, 3, 30, 480, 600, BanScope.SITE));
        }

        /** Commits offenses until a ban fires, then waits it out. */
        private long nextBan() {
            for (int i = 0; i < 3; i++) {
                var result = hit(target, "client", rule);
                if (result.banned()) {
                    clock.advanceSeconds(result.banTtl());
                    return result.banTtl();
                }
            }
            return 0;
        }

        @Test
        @DisplayName("should escalate consecutive bans up to the maximum")
        void shouldEscalateUpToMaximum() {
            var bans = new ArrayList<Long>();
            for (int i = 0; i < 6; i++) {
                bans.add(nextBan());
            }

            assertEquals(List.of(30L, 60L, 120L, 240L, 480L, 480L), bans);
        }

        @Test
        @DisplayName("should keep escalating while the offense record is alive")
        void shouldEscalateWhileRecordAlive() {
            nextBan();
            nextBan();

            // record lives max(ban, decay) = 600s from the second ban, 60s of it already spent
            clock.advanceSeconds(539);

            assertEquals(120, nextBan());
        }

        @Test
        @DisplayName("should start over from the initial ban once the offense record decays")
        void shouldResetConsecutiveBansAfterDecay() {
            nextBan();
            nextBan();

            clock.advanceSeconds(540);

            assertEquals(-2L, target.store().<Long>atomically(tx -> tx.ttl(metaKey)));
            assertEquals(30, nextBan());
            assertEquals(1L, target.store().<Long>atomically(tx -> tx.hget(metaKey, OffenseRecord.CONSECUTIVE_BANS)));
        }

        @Test
        @DisplayName("should forget offenses after two windows without one")
        void shouldForgetOffensesAfterTwoWindows() {
            hit(target, "client", rule);
            hit(target, "client", rule);

            clock.advanceSeconds(120);
            var afterGap = hit(target, "client", rule);

            assertFalse(afterGap.banned());
            assertEquals(1L, target.store().<Long>atomically(tx -> tx.hget(metaKey, OffenseRecord.OFFENSES)));
            assertFalse(hit(target, "client", rule).banned());
            assertTrue(hit(target, "client", rule).banned());
        }

        @Test
        @DisplayName("should remember offenses committed within two windows")
        void shouldRememberRecentOffenses() {
            hit(target, "client", rule);
            hit(target, "client", rule);

            clock.advanceSeconds(119);

            assertTrue(hit(target, "client", rule).banned());
        }
    }
}
