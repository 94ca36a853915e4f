package bulwark.core.cache;

/**
 * Produces deep, independent copies of cached artifacts.
 *
 * @param <T> the artifact type
 */
@FunctionalInterface
public interface ArtifactCopier<T> {

    /**
     * Copy a value so that mutating the copy cannot affect the original.
     *
     * @param value the value to copy, never null
     * @return an independent copy
     * @throws ArtifactCopyException if the value cannot be copied
     */
    T copy(T value);
}
