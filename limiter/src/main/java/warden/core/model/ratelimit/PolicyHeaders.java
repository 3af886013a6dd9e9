package warden.core.model.ratelimit;

/**
 * Rate limit details a protocol adapter can render as response headers.
 *
 * @param limit         the rule limit
 * @param windowSeconds the rule window
 * @param remaining     requests left under the rule
 * @param resetSeconds  seconds until capacity frees up
 */
public record PolicyHeaders(long limit, long windowSeconds, long remaining, long resetSeconds) {

    /**
     * Renders the policy, e.g. {@code 100;w=60}.
     *
     * @return the policy string
     */
    public String policy() {
        return limit + ";w=" + windowSeconds;
    }

    /**
     * Renders the status, e.g. {@code limit=100, remaining=42, reset=17}.
     *
     * @return the status string
     */
    public String status() {
        return "limit=" + limit + ", remaining=" + remaining + ", reset=" + resetSeconds;
    }
}
