package warden.core.model.ratelimit;

import java.util.Objects;

/**
 * A configured rate limit rule.
 *
 * <p>Rules are immutable after configuration load. Two rules that differ in
 * pattern, limit, window or strategy never share storage keys.
 *
 * @param pattern       the normalized path pattern
 * @param limit         the maximum number of requests per window
 * @param windowSeconds the window length in seconds
 * @param strategy      the counting algorithm
 */
public record Rule(PathPattern pattern, long limit, long windowSeconds, StrategyKind strategy) {

    public Rule {
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative");
        }
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("windowSeconds must be positive");
        }
    }

    /**
     * Create a rule from a configured pattern.
     *
     * @param pattern       the configured pattern, e.g. {@code /api/*}
     * @param limit         the maximum requests per window
     * @param windowSeconds the window length in seconds
     * @param strategy      the counting algorithm
     * @return the rule
     */
    public static Rule of(String pattern, long limit, long windowSeconds, StrategyKind strategy) {
        return new Rule(PathPattern.parse(pattern), limit, windowSeconds, strategy);
    }

    /**
     * Returns the normalized exact path or wildcard prefix.
     *
     * @return the path pattern
     */
    public String pathPattern() {
        return pattern.path();
    }

    /**
     * Returns whether the rule also applies to nested paths.
     *
     * @return true for wildcard rules
     */
    public boolean wildcard() {
        return pattern.wildcard();
    }

    /**
     * Check whether this rule applies to a normalized request path.
     *
     * @param normalizedPath the normalized path
     * @return true if the rule applies
     */
    public boolean matches(String normalizedPath) {
        return pattern.matches(normalizedPath);
    }
}
