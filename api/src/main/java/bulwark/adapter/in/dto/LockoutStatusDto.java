package bulwark.adapter.in.dto;

import java.time.Duration;
import java.time.Instant;

import bulwark.core.model.auth.LockoutStatus;

/**
 * DTO for the lockout state of one identifier.
 *
 * @param identifier        tracked identifier, for example {@code ip:10.0.0.1}
 * @param failureCount      failures in the current window
 * @param locked            whether the identifier is locked right now
 * @param lockedUntil       lock expiry, null when never locked
 * @param retryAfterSeconds seconds until the lock expires, 0 when not locked
 * @param remainingAttempts attempts left before the next lock
 */
public record LockoutStatusDto(
        String identifier,
        int failureCount,
        boolean locked,
        Instant lockedUntil,
        long retryAfterSeconds,
        int remainingAttempts) {

    public static LockoutStatusDto fromModel(LockoutStatus status, Instant now) {
        final var until = status.lockedUntil().orElse(null);
        final var retryAfter = status.locked() && until != null
                ? Math.max(0, Duration.between(now, until).toSeconds())
                : 0;
        return new LockoutStatusDto(
                status.identifier(),
                status.failureCount(),
                status.locked(),
                until,
                retryAfter,
                status.remainingAttempts());
    }
}
