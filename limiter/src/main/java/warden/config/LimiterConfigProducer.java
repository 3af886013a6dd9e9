package warden.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import warden.core.model.ratelimit.BanPolicy;
import warden.core.model.ratelimit.KeySpace;
import warden.core.service.ratelimit.RuleMatcher;
import warden.core.service.ratelimit.RuleSetFactory;

/**
 * CDI producer for the rule set, ban policy and key layout.
 *
 * <p>Everything is built once at startup. An invalid rule stops the
 * application before it serves traffic.
 */
@ApplicationScoped
public class LimiterConfigProducer {

    private static final Logger LOG = Logger.getLogger(LimiterConfigProducer.class);

    private final WardenConfig config;

    @Inject
    public LimiterConfigProducer(WardenConfig config) {
        this.config = config;
    }

    @Produces
    @Singleton
    public RuleMatcher produceRuleMatcher() {
        return RuleSetFactory.matcher(config);
    }

    @Produces
    @Singleton
    public BanPolicy produceBanPolicy() {
        final var policy = RuleSetFactory.banPolicy(config.ban());
        if (policy.enabled()) {
            LOG.infov(
                    "Bans enabled: threshold={0}, initial={1}s, max={2}s, scope={3}",
                    policy.threshold(), policy.initialBanSeconds(), policy.maxBanSeconds(), policy.scope());
        } else {
            LOG.info("Bans disabled");
        }
        return policy;
    }

    @Produces
    @Singleton
    public KeySpace produceKeySpace() {
        return new KeySpace(config.keyPrefix());
    }

    void onStart(@Observes StartupEvent event, RuleMatcher matcher, BanPolicy banPolicy) {
        LOG.infov("Admission control {0} with {1} rule(s)",
                config.enabled() ? "enabled" : "disabled", matcher.rules().size());
    }
}
