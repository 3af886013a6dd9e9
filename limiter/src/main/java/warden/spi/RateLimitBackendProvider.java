package warden.spi;

import warden.core.port.out.RateLimitBackend;

/**
 * Service Provider Interface for rate limit store backends.
 *
 * <p>When several providers are available, the one with the highest priority
 * wins.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>In-memory (priority 0) - single process only, always available</li>
 *   <li>Redis (priority 10) - shared across processes, used when configured</li>
 * </ul>
 */
public interface RateLimitBackendProvider {

    /**
     * Return the priority of this provider. Higher values win.
     *
     * @return the provider priority
     */
    int priority();

    /**
     * Return the name of this provider for logging.
     *
     * @return the provider name
     */
    String name();

    /**
     * Check whether this provider can be used in the current environment.
     *
     * @return true if the provider can create a backend
     */
    boolean isAvailable();

    /**
     * Create the backend. Called once during startup.
     *
     * @return a thread-safe backend
     */
    RateLimitBackend createBackend();
}
