package warden.core.model.ratelimit;

import java.util.Locale;

import warden.spi.RuleConfigurationException;

/**
 * Window counting algorithms available to rate limit rules.
 *
 * <p>Each kind carries an explicit storage tag that is written into every key
 * derived for it, so the storage layout never depends on implementation class
 * names.
 */
public enum StrategyKind {

    /**
     * Fixed window.
     *
     * <p>One counter per epoch-aligned window. Cheap and predictable, but up to
     * twice the limit can be admitted around a window boundary.
     */
    FIXED("fixed"),

    /**
     * Sliding log.
     *
     * <p>One timestamped event per admitted request. Exact, at the cost of
     * storage proportional to the number of requests in the window.
     */
    SLIDING_LOG("sliding"),

    /**
     * Moving window.
     *
     * <p>Two adjacent epoch buckets combined with linear time weighting.
     * Constant storage and smoother than {@link #FIXED} at boundaries.
     */
    MOVING("moving");

    private final String tag;

    StrategyKind(String tag) {
        this.tag = tag;
    }

    /**
     * Returns the tag embedded in storage keys for this strategy.
     *
     * @return the storage tag
     */
    public String tag() {
        return tag;
    }

    /**
     * Resolve a configured strategy name.
     *
     * <p>Accepts the storage tag ({@code fixed}, {@code sliding}, {@code moving})
     * or the enum constant name, case-insensitively.
     *
     * @param name the configured name
     * @return the strategy kind
     * @throws RuleConfigurationException if the name is not a known strategy
     */
    public static StrategyKind fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new RuleConfigurationException("Strategy name must not be blank");
        }
        final var normalized = name.trim().toLowerCase(Locale.ROOT);
        for (final var kind : values()) {
            if (kind.tag.equals(normalized) || kind.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return kind;
            }
        }
        throw new RuleConfigurationException("Unknown strategy: " + name);
    }
}
