package warden.core.service.ratelimit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.jboss.logging.Logger;

import warden.config.WardenConfig;
import warden.core.model.ratelimit.BanPolicy;
import warden.core.model.ratelimit.PathPattern;
import warden.core.model.ratelimit.Rule;
import warden.core.model.ratelimit.StrategyKind;
import warden.core.util.DurationParser;
import warden.spi.RuleConfigurationException;

/**
 * Builds rules and the ban policy from configuration.
 *
 * <p>Any invalid value fails with {@link RuleConfigurationException} naming the
 * offending entry, so a bad deployment never starts.
 */
public final class RuleSetFactory {

    private static final Logger LOG = Logger.getLogger(RuleSetFactory.class);

    private RuleSetFactory() {}

    /**
     * Build the rule matcher.
     *
     * @param config the configuration
     * @return the matcher
     * @throws RuleConfigurationException if a rule is invalid
     */
    public static RuleMatcher matcher(WardenConfig config) {
        final var rules = rules(config.rules());
        final var exemptions = config.exempt().orElse(List.of()).stream()
                .filter(pattern -> !pattern.isBlank())
                .map(PathPattern::parse)
                .toList();
        LOG.infov("Loaded {0} rule(s) and {1} exemption(s)", rules.size(), exemptions.size());
        return new RuleMatcher(rules, exemptions);
    }

    /**
     * Build rules from named rule entries, in name order.
     *
     * @param entries rule entries keyed by name
     * @return the rules
     * @throws RuleConfigurationException if an entry is invalid
     */
    public static List<Rule> rules(Map<String, WardenConfig.RuleConfig> entries) {
        final var rules = new ArrayList<Rule>();
        for (final var entry : new TreeMap<>(entries).entrySet()) {
            rules.add(rule(entry.getKey(), entry.getValue()));
        }
        return rules;
    }

    /**
     * Build one rule.
     *
     * @param name  the rule name, for error messages
     * @param entry the rule entry
     * @return the rule
     * @throws RuleConfigurationException if the entry is invalid
     */
    public static Rule rule(String name, WardenConfig.RuleConfig entry) {
        try {
            final var strategy = StrategyKind.fromName(entry.strategy());
            final var window = DurationParser.parseSeconds(entry.window());
            return Rule.of(entry.path(), entry.limit(), window, strategy);
        } catch (RuleConfigurationException | IllegalArgumentException e) {
            throw new RuleConfigurationException("Invalid rule '" + name + "': " + e.getMessage(), e);
        }
    }

    /**
     * Build the ban policy.
     *
     * @param ban the ban configuration
     * @return the policy
     * @throws RuleConfigurationException if a value is invalid
     */
    public static BanPolicy banPolicy(WardenConfig.BanConfig ban) {
        if (!ban.enabled()) {
            return new BanPolicy(false, 0, 0, 0, 0, ban.scope());
        }
        try {
            return new BanPolicy(
                    true,
                    ban.offenses(),
                    DurationParser.parseSeconds(ban.length()),
                    DurationParser.parseSeconds(ban.maxLength()),
                    DurationParser.parseSeconds(ban.counterReset()),
                    ban.scope());
        } catch (IllegalArgumentException e) {
            throw new RuleConfigurationException("Invalid ban configuration: " + e.getMessage(), e);
        }
    }
}
