package warden.core.model.ratelimit;

import java.util.Optional;

/**
 * Combined admission verdict for one request across all matching rules.
 */
public sealed interface Decision {

    /**
     * Request may proceed.
     *
     * @param headers details of the most restrictive matching rule, empty when no rule matched
     */
    record Allowed(Optional<PolicyHeaders> headers) implements Decision {

        public Allowed {
            headers = headers == null ? Optional.empty() : headers;
        }

        /**
         * Pass-through decision for requests no rule applies to.
         */
        public static Allowed passThrough() {
            return new Allowed(Optional.empty());
        }
    }

    /**
     * A rule's window is exhausted.
     *
     * @param retryAfterSeconds seconds until the client may retry, at least 1
     * @param limit             the limit of the rejecting rule
     * @param windowSeconds     the window of the rejecting rule
     */
    record RateLimited(long retryAfterSeconds, long limit, long windowSeconds) implements Decision {

        /**
         * Returns the headers describing the exhausted rule.
         *
         * @return headers with zero remaining
         */
        public PolicyHeaders headers() {
            return new PolicyHeaders(limit, windowSeconds, 0, retryAfterSeconds);
        }
    }

    /**
     * The client is banned regardless of window state.
     *
     * @param ttlSeconds seconds left on the ban
     */
    record Banned(long ttlSeconds) implements Decision {}
}
