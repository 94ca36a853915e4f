package bulwark.core.model.auth;

/**
 * Result of evaluating an API key on a request.
 *
 * <p>Only {@link #REJECTED} is a failure. A missing key is not: it defers to
 * the other authentication mechanisms of the request path.
 */
public enum ApiKeyAuthOutcome {
    /** Authentication is disabled or has neither keys nor a validator. */
    BYPASSED,
    /** No key was presented. */
    NO_CREDENTIAL,
    /** The key matched. The request context has been marked. */
    AUTHENTICATED,
    /** A key was presented and did not match. */
    REJECTED;

    public boolean allowed() {
        return this != REJECTED;
    }
}
