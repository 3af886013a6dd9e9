package warden.core.service.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.ratelimit.Decision;
import warden.core.model.ratelimit.HitResult;
import warden.core.model.ratelimit.Rule;
import warden.core.model.ratelimit.StrategyKind;
import warden.core.port.out.RateLimitBackend;
import warden.core.port.out.RateLimitMetrics;
import warden.spi.RateLimitStoreException;

@DisplayName("RuleEvaluator")
class RuleEvaluatorTest {

    private static final String CLIENT = "203.0.113.7";
    private static final Rule WIDE = Rule.of("/api/*", 100, 3600, StrategyKind.FIXED);
    private static final Rule NARROW = Rule.of("/api/search", 10, 60, StrategyKind.SLIDING_LOG);

    private RateLimitBackend backend;
    private RateLimitMetrics metrics;
    private RuleEvaluator evaluator;

    @BeforeEach
    void setUp() {
        backend = mock(RateLimitBackend.class);
        metrics = mock(RateLimitMetrics.class);
        evaluator = new RuleEvaluator(backend, metrics);
    }

    private void stub(Rule rule, HitResult result) {
        when(backend.hit(CLIENT, rule)).thenReturn(Uni.createFrom().item(result));
    }

    private Decision evaluate(List<Rule> rules) {
        return evaluator.evaluate(CLIENT, rules).await().atMost(Duration.ofSeconds(1));
    }

    @Nested
    @DisplayName("Admission")
    class AdmissionTests {

        @Test
        @DisplayName("should admit without headers when no rules apply")
        void shouldAdmitWithoutRules() {
            var decision = evaluate(List.of());

            var allowed = assertInstanceOf(Decision.Allowed.class, decision);
            assertTrue(allowed.headers().isEmpty());
            verify(backend, never()).hit(any(), any());
        }

        @Test
        @DisplayName("should report the rule with the least remaining capacity")
        void shouldReportTightestRule() {
            stub(WIDE, HitResult.allowed(80, 1_000 + 3_000, 1_000));
            stub(NARROW, HitResult.allowed(3, 1_000 + 45, 1_001));

            var decision = evaluate(List.of(WIDE, NARROW));

            var headers = assertInstanceOf(Decision.Allowed.class, decision).headers().orElseThrow();
            assertEquals(10, headers.limit());
            assertEquals(60, headers.windowSeconds());
            assertEquals(3, headers.remaining());
            assertEquals(45, headers.resetSeconds());
        }

        @Test
        @DisplayName("should keep the first rule on a tie")
        void shouldKeepFirstRuleOnTie() {
            stub(WIDE, HitResult.allowed(3, 1_100, 1_000));
            stub(NARROW, HitResult.allowed(3, 1_010, 1_000));

            var headers = assertInstanceOf(Decision.Allowed.class, evaluate(List.of(WIDE, NARROW)))
                    .headers()
                    .orElseThrow();

            assertEquals(100, headers.limit());
        }

        @Test
        @DisplayName("should report at least one second until reset")
        void shouldReportAtLeastOneSecond() {
            stub(WIDE, HitResult.allowed(5, 1_000, 1_000));

            var headers = assertInstanceOf(Decision.Allowed.class, evaluate(List.of(WIDE)))
                    .headers()
                    .orElseThrow();

            assertEquals(1, headers.resetSeconds());
        }
    }

    @Nested
    @DisplayName("Refusal")
    class RefusalTests {

        @Test
        @DisplayName("should stop at the first rejection and not charge later rules")
        void shouldShortCircuitOnRejection() {
            stub(WIDE, HitResult.rejected(1_030, 0, 1_000));

            var decision = evaluate(List.of(WIDE, NARROW));

            var limited = assertInstanceOf(Decision.RateLimited.class, decision);
            assertEquals(30, limited.retryAfterSeconds());
            assertEquals(100, limited.limit());
            assertEquals(3600, limited.windowSeconds());
            verify(backend, never()).hit(CLIENT, NARROW);
        }

        @Test
        @DisplayName("should measure retry-after from the first hit of the request")
        void shouldUseFirstHitTimestamp() {
            stub(WIDE, HitResult.allowed(50, 4_600, 1_000));
            stub(NARROW, HitResult.rejected(1_030, 0, 1_002));

            var limited = assertInstanceOf(Decision.RateLimited.class, evaluate(List.of(WIDE, NARROW)));

            assertEquals(30, limited.retryAfterSeconds());
        }

        @Test
        @DisplayName("should never ask a client to retry in less than one second")
        void shouldClampRetryAfter() {
            stub(WIDE, HitResult.rejected(990, 0, 1_000));

            var limited = assertInstanceOf(Decision.RateLimited.class, evaluate(List.of(WIDE)));

            assertEquals(1, limited.retryAfterSeconds());
        }

        @Test
        @DisplayName("should return the ban time to live when banned")
        void shouldReturnBan() {
            stub(WIDE, HitResult.allowed(50, 4_600, 1_000));
            stub(NARROW, HitResult.rejected(1_060, 300, 1_000));

            var banned = assertInstanceOf(Decision.Banned.class, evaluate(List.of(WIDE, NARROW)));

            assertEquals(300, banned.ttlSeconds());
        }
    }

    @Nested
    @DisplayName("Failures and metrics")
    class FailureTests {

        @Test
        @DisplayName("should propagate store failures")
        void shouldPropagateStoreFailures() {
            when(backend.hit(CLIENT, WIDE))
                    .thenReturn(Uni.createFrom().failure(new RateLimitStoreException("redis", "hit:fixed", "down")));

            var uni = evaluator.evaluate(CLIENT, List.of(WIDE));

            assertThrows(RateLimitStoreException.class, () -> uni.await().atMost(Duration.ofSeconds(1)));
            verify(metrics, never()).recordDecision(any());
        }

        @Test
        @DisplayName("should record every decision")
        void shouldRecordDecision() {
            stub(WIDE, HitResult.rejected(1_030, 0, 1_000));

            var decision = evaluate(List.of(WIDE));

            verify(metrics).recordDecision(decision);
        }
    }
}
