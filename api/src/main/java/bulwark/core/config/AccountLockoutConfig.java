package bulwark.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for failed-attempt tracking and lockout.
 *
 * <p>Configuration prefix: {@code bulwark.auth.lockout}
 *
 * @see bulwark.core.service.auth.AttemptTracker
 */
@ConfigMapping(prefix = "bulwark.auth.lockout")
public interface AccountLockoutConfig {

    /**
     * Enable lockout enforcement in the HTTP layer.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Failed attempts before an identifier is locked.
     *
     * @return max attempts (default: 5)
     */
    @WithDefault("5")
    int maxAttempts();

    /**
     * How long an identifier stays locked once the threshold is reached.
     *
     * @return lockout duration (default: 15 minutes)
     */
    @WithDefault("PT15M")
    Duration lockoutDuration();

    /**
     * Interval of the background sweep that drops abandoned partial attempts.
     *
     * @return sweep interval (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration sweepInterval();

    /**
     * Include remaining-attempt headers in 401 responses.
     *
     * @return true if headers should be included (default: true)
     */
    @WithDefault("true")
    boolean includeHeaders();

    /**
     * Key lockouts on the client address from {@code Forwarded} and
     * {@code X-Forwarded-For}. Enable only behind a proxy that overwrites
     * those headers; otherwise a client can pick a new lockout key per request.
     *
     * @return true if forwarding headers are trusted (default: false)
     */
    @WithDefault("false")
    boolean trustForwardedHeaders();
}
