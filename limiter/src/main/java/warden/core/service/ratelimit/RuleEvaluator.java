package warden.core.service.ratelimit;

import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.ratelimit.Decision;
import warden.core.model.ratelimit.HitResult;
import warden.core.model.ratelimit.KeySpace;
import warden.core.model.ratelimit.PolicyHeaders;
import warden.core.model.ratelimit.Rule;
import warden.core.port.out.RateLimitBackend;
import warden.core.port.out.RateLimitMetrics;

/**
 * Combines the verdicts of every rule matching a request.
 *
 * <p>Rules are hit one after another in the given order. The first ban or
 * rejection ends evaluation, so later rules are not charged for a request that
 * is refused anyway. A request is admitted only if every rule admits it.
 *
 * <p>Timing values are relative to the store time returned by the first hit,
 * which serves as the timestamp of the whole request.
 */
@ApplicationScoped
public class RuleEvaluator {

    private static final Logger LOG = Logger.getLogger(RuleEvaluator.class);

    private final RateLimitBackend backend;
    private final RateLimitMetrics metrics;

    @Inject
    public RuleEvaluator(RateLimitBackend backend, RateLimitMetrics metrics) {
        this.backend = backend;
        this.metrics = metrics;
    }

    /**
     * Evaluate a request against its matching rules.
     *
     * @param identifier the client identifier
     * @param rules      the matching rules, possibly empty
     * @return the decision, or a failure with
     *         {@link warden.spi.RateLimitStoreException} if the store failed
     */
    public Uni<Decision> evaluate(String identifier, List<Rule> rules) {
        if (rules.isEmpty()) {
            return Uni.createFrom().item(Decision.Allowed.passThrough());
        }
        return evaluateFrom(identifier, rules, 0, Tally.EMPTY).invoke(this::recordDecision);
    }

    private Uni<Decision> evaluateFrom(String identifier, List<Rule> rules, int index, Tally tally) {
        if (index == rules.size()) {
            return Uni.createFrom().item(new Decision.Allowed(Optional.ofNullable(tally.tightest())));
        }

        final var rule = rules.get(index);
        return backend.hit(identifier, rule).flatMap(hit -> {
            final var requestNow = tally.requestNow(hit);

            if (hit.banned()) {
                LOG.debugv(
                        "Client {0} banned for {1}s on {2}",
                        KeySpace.hashIdentifier(identifier), hit.banTtl(), rule.pattern().canonical());
                return Uni.createFrom().item(new Decision.Banned(hit.banTtl()));
            }

            if (!hit.allowed()) {
                return Uni.createFrom()
                        .item(new Decision.RateLimited(
                                secondsUntil(hit.resetAt(), requestNow), rule.limit(), rule.windowSeconds()));
            }

            return evaluateFrom(identifier, rules, index + 1, tally.consider(rule, hit, requestNow));
        });
    }

    private void recordDecision(Decision decision) {
        if (metrics != null) {
            metrics.recordDecision(decision);
        }
    }

    static long secondsUntil(long epochSeconds, long now) {
        return Math.max(1, epochSeconds - now);
    }

    /**
     * Evaluation state carried from one rule to the next.
     *
     * @param now       store time of the first hit, null before the first hit
     * @param tightest  headers of the admitting rule with the least remaining capacity
     */
    private record Tally(Long now, PolicyHeaders tightest) {

        static final Tally EMPTY = new Tally(null, null);

        long requestNow(HitResult hit) {
            return now != null ? now : hit.serverNow();
        }

        Tally consider(Rule rule, HitResult hit, long requestNow) {
            if (tightest != null && tightest.remaining() <= hit.remaining()) {
                return new Tally(requestNow, tightest);
            }
            final var headers = new PolicyHeaders(
                    rule.limit(), rule.windowSeconds(), hit.remaining(), secondsUntil(hit.resetAt(), requestNow));
            return new Tally(requestNow, headers);
        }
    }
}
