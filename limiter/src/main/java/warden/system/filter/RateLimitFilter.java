package warden.system.filter;

import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;
import org.jboss.resteasy.reactive.server.ServerResponseFilter;

import warden.config.WardenConfig;
import warden.core.model.ratelimit.Decision;
import warden.core.service.ratelimit.RuleEvaluator;
import warden.core.service.ratelimit.RuleMatcher;
import warden.spi.RateLimitStoreException;

/**
 * Reactive filter that admits or refuses requests.
 *
 * <p>Runs early in the request chain (before authentication) to reject
 * excessive traffic before incurring authentication overhead.
 *
 * <p>Outcomes:
 * <ul>
 *   <li>Exempt or unmatched path - passes untouched</li>
 *   <li>Allowed - passes; rate limit headers are added to the response</li>
 *   <li>Rate limited - 429</li>
 *   <li>Banned - 403</li>
 *   <li>Store failure - passes or 503, per {@code warden.store-failure-policy}</li>
 * </ul>
 */
public class RateLimitFilter {

    private static final Logger LOG = Logger.getLogger(RateLimitFilter.class);

    static final String FORWARDED_FOR = "X-Forwarded-For";
    static final String DECISION_ATTR = "warden.ratelimit.decision";

    private final WardenConfig config;
    private final RuleMatcher matcher;
    private final RuleEvaluator evaluator;
    private final ClientIdentifierResolver identifierResolver;

    @Inject
    public RateLimitFilter(WardenConfig config, RuleMatcher matcher, RuleEvaluator evaluator) {
        this.config = config;
        this.matcher = matcher;
        this.evaluator = evaluator;
        this.identifierResolver = new ClientIdentifierResolver(config.trustForwardedFor());
    }

    /**
     * Reactive filter method for admission control.
     *
     * @param requestContext the request context
     * @param request        the underlying HTTP request, for the remote address
     * @return Uni with null to continue, or Response to abort
     */
    @ServerRequestFilter(priority = Priorities.AUTHENTICATION - 50)
    public Uni<Response> filter(ContainerRequestContext requestContext, HttpServerRequest request) {
        if (!config.enabled()) {
            return Uni.createFrom().nullItem();
        }

        final var path = requestContext.getUriInfo().getPath();
        if (matcher.isExempt(path)) {
            return Uni.createFrom().nullItem();
        }

        final var rules = matcher.matchRules(path);
        if (rules.isEmpty()) {
            return Uni.createFrom().nullItem();
        }

        final var identifier = identifierResolver.resolve(
                requestContext.getHeaderString(FORWARDED_FOR), remoteHost(request));

        return evaluator
                .evaluate(identifier, rules)
                .map(decision -> handleDecision(requestContext, decision))
                .onFailure(RateLimitStoreException.class)
                .recoverWithItem(error -> handleStoreFailure(requestContext, path, error));
    }

    /**
     * Adds rate limit headers to admitted responses.
     *
     * @param requestContext  the request context
     * @param responseContext the response context
     */
    @ServerResponseFilter
    public void addHeaders(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        if (!config.includeHeaders()) {
            return;
        }
        if (requestContext.getProperty(DECISION_ATTR) instanceof Decision.Allowed allowed) {
            allowed.headers().ifPresent(headers -> {
                responseContext.getHeaders().putSingle(RateLimitResponses.RATE_LIMIT_POLICY, headers.policy());
                responseContext.getHeaders().putSingle(RateLimitResponses.RATE_LIMIT, headers.status());
            });
        }
    }

    private Response handleDecision(ContainerRequestContext ctx, Decision decision) {
        ctx.setProperty(DECISION_ATTR, decision);
        final var accept = ctx.getHeaderString(HttpHeaders.ACCEPT);
        final var userAgent = ctx.getHeaderString(HttpHeaders.USER_AGENT);

        if (decision instanceof Decision.RateLimited limited) {
            return RateLimitResponses.rateLimited(limited, accept, userAgent);
        }
        if (decision instanceof Decision.Banned banned) {
            return RateLimitResponses.banned(banned, accept, userAgent);
        }
        return null;
    }

    private Response handleStoreFailure(ContainerRequestContext ctx, String path, Throwable error) {
        if (config.storeFailurePolicy() == WardenConfig.StoreFailurePolicy.OPEN) {
            LOG.warnv("Admitting request to {0} without a decision: {1}", path, error.getMessage());
            return null;
        }
        LOG.warnv("Refusing request to {0}, store unavailable: {1}", path, error.getMessage());
        return RateLimitResponses.storeUnavailable(
                ctx.getHeaderString(HttpHeaders.ACCEPT), ctx.getHeaderString(HttpHeaders.USER_AGENT));
    }

    private static String remoteHost(HttpServerRequest request) {
        if (request == null || request.remoteAddress() == null) {
            return null;
        }
        return request.remoteAddress().host();
    }
}
