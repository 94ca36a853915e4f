package bulwark.core.cache;

/**
 * Raised when an artifact could not be built.
 *
 * <p>All callers waiting on the same build round receive the same instance.
 * Nothing is cached for a failed round; the next request builds again.
 */
public class BuildFailedException extends RuntimeException {

    public BuildFailedException(String message) {
        super(message);
    }

    public BuildFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    static BuildFailedException wrap(String artifact, Throwable failure) {
        if (failure instanceof BuildFailedException buildFailed) {
            return buildFailed;
        }
        return new BuildFailedException("Failed to build " + artifact + ": " + failure.getMessage(), failure);
    }
}
