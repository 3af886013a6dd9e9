package warden.core.model.ratelimit;

import java.util.Objects;

/**
 * A normalized path pattern used by rules and exemptions.
 *
 * <p>A pattern ending in {@code /*} is a wildcard: it matches its prefix and
 * any path nested under it. Any other pattern matches only the identical
 * path. Trailing slashes are stripped from patterns and from incoming paths
 * before comparison, so {@code /api/} and {@code /api} are the same path.
 *
 * @param path     the normalized exact path or wildcard prefix
 * @param wildcard whether the pattern matches nested paths
 */
public record PathPattern(String path, boolean wildcard) {

    private static final String WILDCARD_SUFFIX = "/*";

    public PathPattern {
        Objects.requireNonNull(path, "path must not be null");
    }

    /**
     * Parse a configured pattern.
     *
     * @param raw the configured pattern, e.g. {@code /api/*} or {@code /login/}
     * @return the normalized pattern
     */
    public static PathPattern parse(String raw) {
        Objects.requireNonNull(raw, "pattern must not be null");
        final var trimmed = raw.trim();
        if (trimmed.endsWith(WILDCARD_SUFFIX)) {
            final var prefix = trimmed.substring(0, trimmed.length() - WILDCARD_SUFFIX.length());
            return new PathPattern(stripTrailingSlashes(prefix), true);
        }
        return new PathPattern(stripTrailingSlashes(trimmed), false);
    }

    /**
     * Normalize an incoming request path for matching.
     *
     * @param path the request path (may be null)
     * @return the path without trailing slashes, empty for the root
     */
    public static String normalizePath(String path) {
        if (path == null) {
            return "";
        }
        return stripTrailingSlashes(path);
    }

    /**
     * Check whether a normalized path matches this pattern.
     *
     * @param normalizedPath a path already passed through {@link #normalizePath(String)}
     * @return true if the path matches
     */
    public boolean matches(String normalizedPath) {
        if (!wildcard) {
            return path.equals(normalizedPath);
        }
        return normalizedPath.equals(path) || normalizedPath.startsWith(path + "/");
    }

    /**
     * Returns the pattern in its configured form, e.g. {@code /api/*}.
     *
     * @return the canonical pattern string
     */
    public String canonical() {
        return wildcard ? path + WILDCARD_SUFFIX : path;
    }

    private static String stripTrailingSlashes(String value) {
        var end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }
}
