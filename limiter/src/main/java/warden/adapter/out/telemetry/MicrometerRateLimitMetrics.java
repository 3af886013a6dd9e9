package warden.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import warden.core.model.ratelimit.Decision;
import warden.core.port.out.RateLimitMetrics;

/**
 * Micrometer implementation of {@link RateLimitMetrics}.
 *
 * <p>Metrics exposed:
 * <ul>
 *   <li>{@code warden.decisions.total} - Decisions by {@code outcome}
 *       (allowed, rate_limited, banned)</li>
 *   <li>{@code warden.store.failures.total} - Failed store round trips by
 *       {@code backend} and {@code operation}</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerRateLimitMetrics implements RateLimitMetrics {

    static final String DECISIONS = "warden.decisions.total";
    static final String STORE_FAILURES = "warden.store.failures.total";

    private final MeterRegistry registry;

    @Inject
    public MicrometerRateLimitMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordDecision(Decision decision) {
        Counter.builder(DECISIONS)
                .description("Admission decisions")
                .tag("outcome", outcome(decision))
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreFailure(String backend, String operation) {
        Counter.builder(STORE_FAILURES)
                .description("Failed or timed out store round trips")
                .tag("backend", backend)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    static String outcome(Decision decision) {
        if (decision instanceof Decision.Banned) {
            return "banned";
        }
        if (decision instanceof Decision.RateLimited) {
            return "rate_limited";
        }
        return "allowed";
    }
}
