package bulwark.core.model.auth;

import java.time.Instant;
import java.util.Optional;

/**
 * Point-in-time view of one tracked identifier.
 *
 * @param identifier        the tracked identifier
 * @param failureCount      failures in the current window
 * @param locked            true if the identifier is locked right now
 * @param lockedUntil       end of the current or most recent lock, if one was ever set
 * @param remainingAttempts attempts left before the next lock
 */
public record LockoutStatus(
        String identifier, int failureCount, boolean locked, Optional<Instant> lockedUntil, int remainingAttempts) {

    public static LockoutStatus clean(String identifier, int maxAttempts) {
        return new LockoutStatus(identifier, 0, false, Optional.empty(), maxAttempts);
    }
}
