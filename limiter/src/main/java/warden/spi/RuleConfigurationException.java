package warden.spi;

/**
 * Exception thrown when rate limit rules or ban policy settings are invalid.
 *
 * <p>Raised while the rule set is built at startup, never while a request is
 * being evaluated.
 */
public class RuleConfigurationException extends RuntimeException {

    public RuleConfigurationException(String message) {
        super(message);
    }

    public RuleConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
