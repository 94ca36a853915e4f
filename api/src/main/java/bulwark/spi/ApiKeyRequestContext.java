package bulwark.spi;

/**
 * Request-scoped view handed to API key validation.
 *
 * <p>The HTTP layer adapts its own request type to this interface so that the
 * authenticator never depends on a web framework. The marker slot is how a
 * successful API key match is communicated to later handlers (session checks,
 * admin endpoints) on the same request.
 */
public interface ApiKeyRequestContext {

    /**
     * Read a request header.
     *
     * @param name header name, case-insensitive
     * @return header value or null when absent
     */
    String header(String name);

    /**
     * Request path, without query string.
     */
    String path();

    /**
     * Flag this request as authenticated by API key.
     */
    void markApiKeyAuthenticated();

    /**
     * Whether {@link #markApiKeyAuthenticated()} has been called for this request.
     */
    boolean isApiKeyAuthenticated();
}
