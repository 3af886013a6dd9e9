package warden.core.service.ratelimit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import warden.core.model.ratelimit.PathPattern;
import warden.core.model.ratelimit.Rule;

/**
 * Finds every rule that applies to a request path.
 *
 * <p>All matching rules apply; the order only decides which rule is reported
 * first. Wildcard rules come first by ascending prefix length, then exact
 * rules by descending path length. Rules that tie keep their configured order.
 */
public final class RuleMatcher {

    static final Comparator<Rule> REPORTING_ORDER = Comparator.comparing((Rule rule) -> !rule.wildcard())
            .thenComparingInt(rule -> rule.wildcard()
                    ? rule.pathPattern().length()
                    : -rule.pathPattern().length());

    private final List<Rule> rules;
    private final List<PathPattern> exemptions;

    /**
     * Create a matcher.
     *
     * @param rules      the configured rules
     * @param exemptions patterns of paths that bypass evaluation
     */
    public RuleMatcher(List<Rule> rules, List<PathPattern> exemptions) {
        final var ordered = new ArrayList<>(rules);
        ordered.sort(REPORTING_ORDER);
        this.rules = List.copyOf(ordered);
        this.exemptions = List.copyOf(exemptions);
    }

    /**
     * Returns all rules in reporting order.
     *
     * @return the rules
     */
    public List<Rule> rules() {
        return rules;
    }

    /**
     * Find the rules that apply to a path.
     *
     * @param path the request path, trailing slashes ignored
     * @return matching rules in reporting order, empty if none apply
     */
    public List<Rule> matchRules(String path) {
        final var normalized = PathPattern.normalizePath(path);
        final var matched = new ArrayList<Rule>();
        for (final var rule : rules) {
            if (rule.matches(normalized)) {
                matched.add(rule);
            }
        }
        return matched;
    }

    /**
     * Check whether a path bypasses evaluation.
     *
     * @param path the request path
     * @return true if an exemption pattern matches
     */
    public boolean isExempt(String path) {
        final var normalized = PathPattern.normalizePath(path);
        return exemptions.stream().anyMatch(pattern -> pattern.matches(normalized));
    }
}
