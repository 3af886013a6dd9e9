package warden.system.filter;

import java.util.List;
import java.util.Locale;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import warden.core.model.ratelimit.Decision;

/**
 * Builds responses for refused requests.
 *
 * <p>API clients get JSON: requests that accept {@code application/json} or
 * come from a command line user agent. Everyone else gets a small HTML page.
 */
public final class RateLimitResponses {

    static final String RETRY_AFTER = "Retry-After";
    static final String RATE_LIMIT_POLICY = "RateLimit-Policy";
    static final String RATE_LIMIT = "RateLimit";

    private static final List<String> CLI_AGENTS = List.of("curl", "wget", "postman", "python-requests");

    private static final String PAGE =
            """
            <!DOCTYPE html>
            <html lang="en">
            <head><meta charset="utf-8"><title>%1$s</title></head>
            <body>
            <h1>%1$s</h1>
            <p>%2$s</p>
            <p>Try again in %3$d seconds.</p>
            </body>
            </html>
            """;

    private RateLimitResponses() {}

    /**
     * Build a 429 response.
     *
     * @param decision  the rejection
     * @param accept    the {@code Accept} header, may be null
     * @param userAgent the {@code User-Agent} header, may be null
     * @return the response
     */
    public static Response rateLimited(Decision.RateLimited decision, String accept, String userAgent) {
        final var headers = decision.headers();
        final var retryAfter = decision.retryAfterSeconds();
        return build(
                        Response.Status.TOO_MANY_REQUESTS,
                        new RateLimitProblem(
                                RateLimitProblem.RATE_LIMIT_EXCEEDED, "Rate limit exceeded", retryAfter),
                        "Too Many Requests",
                        wantsJson(accept, userAgent))
                .header(RETRY_AFTER, retryAfter)
                .header(RATE_LIMIT_POLICY, headers.policy())
                .header(RATE_LIMIT, headers.status())
                .build();
    }

    /**
     * Build a 403 response for a banned client.
     *
     * @param decision  the ban
     * @param accept    the {@code Accept} header, may be null
     * @param userAgent the {@code User-Agent} header, may be null
     * @return the response
     */
    public static Response banned(Decision.Banned decision, String accept, String userAgent) {
        final var ttl = decision.ttlSeconds();
        return build(
                        Response.Status.FORBIDDEN,
                        new RateLimitProblem(
                                RateLimitProblem.FORBIDDEN, "Access blocked due to repeated abuse", ttl),
                        "Forbidden",
                        wantsJson(accept, userAgent))
                .header(RETRY_AFTER, ttl)
                .build();
    }

    /**
     * Build a 503 response for when the store is unreachable.
     *
     * @param accept    the {@code Accept} header, may be null
     * @param userAgent the {@code User-Agent} header, may be null
     * @return the response
     */
    public static Response storeUnavailable(String accept, String userAgent) {
        return build(
                        Response.Status.SERVICE_UNAVAILABLE,
                        new RateLimitProblem(
                                RateLimitProblem.SERVICE_UNAVAILABLE, "Admission control unavailable", 1),
                        "Service Unavailable",
                        wantsJson(accept, userAgent))
                .header(RETRY_AFTER, 1)
                .build();
    }

    static boolean wantsJson(String accept, String userAgent) {
        if (accept != null && accept.toLowerCase(Locale.ROOT).contains(MediaType.APPLICATION_JSON)) {
            return true;
        }
        if (userAgent == null) {
            return false;
        }
        final var agent = userAgent.toLowerCase(Locale.ROOT);
        return CLI_AGENTS.stream().anyMatch(agent::contains);
    }

    private static Response.ResponseBuilder build(
            Response.Status status, RateLimitProblem problem, String title, boolean json) {
        if (json) {
            return Response.status(status).type(MediaType.APPLICATION_JSON_TYPE).entity(problem);
        }
        return Response.status(status)
                .type(MediaType.TEXT_HTML_TYPE)
                .entity(PAGE.formatted(title, problem.detail(), problem.retryAfter()));
    }
}
