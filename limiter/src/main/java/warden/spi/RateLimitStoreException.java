package warden.spi;

/**
 * Exception signalling that the shared rate limit store could not complete an
 * atomic hit.
 *
 * <p>Covers unreachable stores, timeouts and script errors. The engine never
 * retries and never converts this failure into an allow or deny verdict; the
 * caller decides whether to fail open or closed.
 */
public class RateLimitStoreException extends RuntimeException {

    private final String backend;
    private final String operation;

    public RateLimitStoreException(String backend, String operation, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
        this.operation = operation;
    }

    public RateLimitStoreException(String backend, String operation, String message) {
        this(backend, operation, message, null);
    }

    /** Returns the name of the backend that failed. */
    public String getBackend() {
        return backend;
    }

    /** Returns the operation that failed. */
    public String getOperation() {
        return operation;
    }
}
