package bulwark.core.cache;

/**
 * What {@link MemoizedBuilder} does when a caller copy cannot be made.
 */
public enum CopyFailurePolicy {
    /** Hand out the shared instance; callers treat it as read-only. */
    RETURN_SHARED,
    /** Fail the read with {@link BuildFailedException}. */
    FAIL
}
