package warden.core.model.ratelimit;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Derives storage keys from a client identifier and a rule.
 *
 * <p>Identifiers are stored only as a 16 hex character SHA-256 prefix. The
 * digest is wrapped in braces so every key belonging to one identifier hashes
 * to the same Redis Cluster slot, which multi-key scripts require.
 *
 * <p>Key format:
 * <ul>
 *   <li>Window state: {@code {prefix}rl:{strategy}:{{id}}:{limit}:{window}:{rule}}</li>
 *   <li>Per-rule ban: {@code {rateKey}:ban}</li>
 *   <li>Site-wide ban: {@code {prefix}ban:{{id}}}</li>
 *   <li>Offense record: {@code {banKey}:meta}</li>
 * </ul>
 *
 * <p>{@code rule} is a short digest of the normalized path pattern, so two
 * rules with equal limits on different paths never share a counter.
 */
public final class KeySpace {

    /** Default prefix for all keys written by the limiter. */
    public static final String DEFAULT_PREFIX = "warden:";

    static final int IDENTIFIER_HEX_CHARS = 16;
    static final int RULE_HEX_CHARS = 8;

    private final String prefix;

    public KeySpace(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix must not be null");
    }

    /**
     * Create a key space with the default prefix.
     *
     * @return the key space
     */
    public static KeySpace withDefaultPrefix() {
        return new KeySpace(DEFAULT_PREFIX);
    }

    /**
     * Hash an identifier to the form stored in keys.
     *
     * @param identifier the client identifier
     * @return the truncated digest
     */
    public static String hashIdentifier(String identifier) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        return digest(identifier, IDENTIFIER_HEX_CHARS);
    }

    /**
     * Derive the window state key for an identifier under a rule.
     *
     * @param identifier the client identifier
     * @param rule       the rule
     * @return the window state key
     */
    public String deriveKey(String identifier, Rule rule) {
        return prefix
                + "rl:"
                + rule.strategy().tag()
                + ":{" + hashIdentifier(identifier) + "}:"
                + rule.limit()
                + ":"
                + rule.windowSeconds()
                + ":"
                + ruleTag(rule);
    }

    /**
     * Derive the ban flag key.
     *
     * @param identifier the client identifier
     * @param rule       the rule being evaluated
     * @param siteWide   whether bans apply to every rule
     * @return the ban key
     */
    public String deriveBanKey(String identifier, Rule rule, boolean siteWide) {
        if (siteWide) {
            return prefix + "ban:{" + hashIdentifier(identifier) + "}";
        }
        return deriveKey(identifier, rule) + ":ban";
    }

    /**
     * Derive the offense record key that belongs to a key.
     *
     * @param key the owning key
     * @return the offense record key
     */
    public String deriveMetaKey(String key) {
        return key + ":meta";
    }

    /**
     * Derive every key one hit touches.
     *
     * <p>The offense record follows the ban key, so it is tracked per identifier
     * when bans are site-wide and per rule otherwise.
     *
     * @param identifier the client identifier
     * @param rule       the rule
     * @param scope      the ban scope
     * @return the keys
     */
    public HitKeys keysFor(String identifier, Rule rule, BanScope scope) {
        final var banKey = deriveBanKey(identifier, rule, scope == BanScope.SITE);
        return new HitKeys(deriveKey(identifier, rule), banKey, deriveMetaKey(banKey));
    }

    private static String ruleTag(Rule rule) {
        return digest(rule.pattern().canonical(), RULE_HEX_CHARS);
    }

    /** Leading {@code hexChars} characters of the SHA-256 hex digest, an even count. */
    private static String digest(String value, int hexChars) {
        try {
            final var sha256 = MessageDigest.getInstance("SHA-256");
            final var bytes = sha256.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes, 0, hexChars / 2);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
