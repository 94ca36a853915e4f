package bulwark.spi;

/**
 * Validation callback for managed API keys (for example keys stored hashed in a database).
 *
 * <p>The authenticator consults the statically configured key set first and
 * only falls back to this callback when none of those keys match.
 * Implementations must be thread-safe; they are invoked concurrently from
 * request threads and may be replaced at any time through
 * {@link bulwark.core.service.auth.ApiKeyAuthenticator#setDynamicValidator}.
 *
 * <h2>Registration</h2>
 * <pre>{@code
 * authenticator.setDynamicValidator((context, key) -> managedKeys.isActive(key));
 * }</pre>
 */
@FunctionalInterface
public interface ApiKeyValidator {

    /**
     * Decide whether a presented key is valid.
     *
     * @param context    the request being authenticated
     * @param incomingKey the trimmed, non-empty key taken from the request
     * @return true to accept the key
     */
    boolean validate(ApiKeyRequestContext context, String incomingKey);
}
