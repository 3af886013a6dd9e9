package warden.system.filter;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON body of a refused request.
 *
 * @param error      machine-readable reason
 * @param detail     human-readable explanation
 * @param retryAfter seconds until the client may retry
 */
public record RateLimitProblem(String error, String detail, @JsonProperty("retry_after") long retryAfter) {

    static final String RATE_LIMIT_EXCEEDED = "rate_limit_exceeded";
    static final String FORBIDDEN = "forbidden";
    static final String SERVICE_UNAVAILABLE = "service_unavailable";
}
