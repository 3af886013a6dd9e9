package warden.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import warden.core.model.ratelimit.BanScope;

/**
 * Configuration mapping for admission control.
 *
 * <p>Configuration prefix: {@code warden}
 *
 * <p>Duration values ({@code window}, {@code ban.length}, ...) accept lenient
 * strings such as {@code 60}, {@code 5m}, {@code 1h} or {@code 1 day}.
 *
 * <h2>Example</h2>
 * <pre>
 * warden.rules.login.path=/auth/login
 * warden.rules.login.limit=5
 * warden.rules.login.window=1m
 * warden.rules.login.strategy=sliding
 * warden.exempt=/health,/static/*
 * </pre>
 */
@ConfigMapping(prefix = "warden")
public interface WardenConfig {

    /**
     * Enable or disable admission control globally.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Prefix for every key written to the store.
     *
     * <p>Allows several applications to share one Redis instance.
     *
     * @return key prefix (default: "warden:")
     */
    @WithDefault("warden:")
    String keyPrefix();

    /**
     * Use the first {@code X-Forwarded-For} entry as the client identifier.
     *
     * <p>Only enable behind a proxy that overwrites the header.
     *
     * @return true to trust the header (default: false)
     */
    @WithDefault("false")
    boolean trustForwardedFor();

    /**
     * What to do with a request when the store cannot be reached.
     *
     * @return the policy (default: OPEN)
     */
    @WithDefault("OPEN")
    StoreFailurePolicy storeFailurePolicy();

    /**
     * Include {@code RateLimit-Policy} and {@code RateLimit} headers on
     * admitted responses.
     *
     * @return true to include headers (default: true)
     */
    @WithDefault("true")
    boolean includeHeaders();

    /**
     * Rules keyed by name.
     */
    Map<String, RuleConfig> rules();

    /**
     * Paths that bypass evaluation. Same pattern syntax as rule paths.
     */
    Optional<List<String>> exempt();

    /**
     * Offense and ban escalation configuration.
     */
    BanConfig ban();

    /**
     * Redis backend configuration.
     */
    RedisConfig redis();

    /**
     * One admission rule.
     */
    interface RuleConfig {

        /**
         * Path pattern, exact ({@code /auth/login}) or prefix ({@code /api/*}).
         */
        String path();

        /**
         * Maximum requests per window.
         */
        long limit();

        /**
         * Window length.
         *
         * @return duration string (default: 60 seconds)
         */
        @WithDefault("60")
        String window();

        /**
         * Counting algorithm: {@code fixed}, {@code sliding} or {@code moving}.
         *
         * @return strategy name (default: fixed)
         */
        @WithDefault("fixed")
        String strategy();
    }

    /**
     * Offense and ban escalation configuration.
     */
    interface BanConfig {

        /**
         * Record offenses and fire bans.
         *
         * @return true if enabled (default: true)
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Over-limit hits that trigger a ban.
         *
         * @return offense threshold (default: 8)
         */
        @WithDefault("8")
        long offenses();

        /**
         * Duration of the first ban. Each consecutive ban doubles it.
         *
         * @return duration string (default: 5m)
         */
        @WithDefault("5m")
        String length();

        /**
         * Upper bound for escalated bans.
         *
         * @return duration string (default: 30m)
         */
        @WithDefault("30m")
        String maxLength();

        /**
         * Minimum time after a ban before escalation history is forgotten.
         *
         * @return duration string (default: 1h)
         */
        @WithDefault("1h")
        String counterReset();

        /**
         * Whether a ban blocks one rule or every rule for the client.
         *
         * @return the scope (default: SITE)
         */
        @WithDefault("SITE")
        BanScope scope();
    }

    /**
     * Redis-specific configuration.
     */
    interface RedisConfig {

        /**
         * Enable Redis as the backend.
         *
         * <p>When disabled or unavailable, falls back to in-memory.
         *
         * @return true to use Redis (default: false)
         */
        @WithDefault("false")
        boolean enabled();

        /**
         * Timeout for one script round trip.
         *
         * @return timeout (default: 1 second)
         */
        @WithDefault("PT1S")
        Duration timeout();
    }

    /**
     * Behavior when the store fails.
     */
    enum StoreFailurePolicy {
        /** Admit the request. */
        OPEN,
        /** Answer 503. */
        CLOSED
    }
}
