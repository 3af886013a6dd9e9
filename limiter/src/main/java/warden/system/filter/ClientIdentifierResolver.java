package warden.system.filter;

/**
 * Resolves the client identifier used as the counting key.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>First {@code X-Forwarded-For} entry, only when the header is trusted</li>
 *   <li>Remote socket address</li>
 *   <li>{@value #UNKNOWN}</li>
 * </ol>
 *
 * <p>All clients without a usable address share the {@value #UNKNOWN} bucket.
 */
public final class ClientIdentifierResolver {

    static final String UNKNOWN = "unknown";

    private final boolean trustForwardedFor;

    public ClientIdentifierResolver(boolean trustForwardedFor) {
        this.trustForwardedFor = trustForwardedFor;
    }

    /**
     * Resolve the identifier.
     *
     * @param forwardedFor  the {@code X-Forwarded-For} header, may be null
     * @param remoteAddress the remote socket host, may be null
     * @return the client identifier
     */
    public String resolve(String forwardedFor, String remoteAddress) {
        if (trustForwardedFor && forwardedFor != null) {
            final var first = forwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        if (remoteAddress != null && !remoteAddress.isBlank()) {
            return remoteAddress;
        }
        return UNKNOWN;
    }
}
