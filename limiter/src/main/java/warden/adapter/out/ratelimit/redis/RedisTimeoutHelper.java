package warden.adapter.out.ratelimit.redis;

import java.time.Duration;

import io.smallrye.mutiny.TimeoutException;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.port.out.RateLimitMetrics;
import warden.spi.RateLimitStoreException;

/**
 * Applies a timeout to Redis round trips and turns every failure into a
 * {@link RateLimitStoreException}.
 *
 * <p>Failures are logged and counted here, then propagated. Whether a request
 * is admitted when the store is down is decided by the caller, never by the
 * backend.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    static final String BACKEND = "redis";

    private final Duration timeout;
    private final RateLimitMetrics metrics;

    /**
     * Create a new timeout helper.
     *
     * @param timeout the timeout for one round trip
     * @param metrics the metrics instance for recording failures (may be null)
     */
    public RedisTimeoutHelper(Duration timeout, RateLimitMetrics metrics) {
        this.timeout = timeout;
        this.metrics = metrics;
    }

    /**
     * Apply the timeout and failure mapping to an operation.
     *
     * @param operation     the Redis operation
     * @param operationName name for logging and metrics
     * @param <T>           the result type
     * @return a Uni that fails with {@link RateLimitStoreException} on timeout or failure
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .fail()
                .onFailure()
                .transform(error -> toStoreException(error, operationName));
    }

    private RateLimitStoreException toStoreException(Throwable error, String operationName) {
        if (error instanceof RateLimitStoreException storeException) {
            return storeException;
        }
        recordFailure(operationName);
        if (error instanceof TimeoutException) {
            LOG.warnv("Redis operation timeout: {0} after {1}", operationName, timeout);
            return new RateLimitStoreException(BACKEND, operationName, "Timed out after " + timeout, error);
        }
        LOG.warnv("Redis operation failure: {0}: {1}", operationName, error.getMessage());
        return new RateLimitStoreException(BACKEND, operationName, error.getMessage(), error);
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordStoreFailure(BACKEND, operationName);
        }
    }
}
