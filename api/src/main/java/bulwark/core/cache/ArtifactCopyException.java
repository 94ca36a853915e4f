package bulwark.core.cache;

/**
 * Raised by an {@link ArtifactCopier} that cannot produce an independent copy.
 */
public class ArtifactCopyException extends RuntimeException {

    public ArtifactCopyException(String message, Throwable cause) {
        super(message, cause);
    }
}
