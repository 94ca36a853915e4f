package bulwark.system.filter;

import java.time.Duration;
import java.time.Instant;

import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;

import io.micrometer.core.instrument.MeterRegistry;
import io.quarkiverse.resteasy.problem.HttpProblem;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;

import bulwark.adapter.in.http.ContainerApiKeyRequestContext;
import bulwark.adapter.in.problem.PanelProblem;
import bulwark.core.config.AccountLockoutConfig;
import bulwark.core.model.auth.ApiKeyAuthOutcome;
import bulwark.core.service.auth.ApiKeyAuthenticator;
import bulwark.core.service.auth.AttemptTracker;
import bulwark.core.service.common.ClientIpExtractor;
import bulwark.core.util.SecureHash;

/**
 * Reactive filter that authenticates API key requests and enforces lockouts.
 *
 * <p>Flow:
 * <ol>
 *   <li>Requests carrying the API key header, and all {@code /admin} requests,
 *       are refused with 429 while the client IP is locked out</li>
 *   <li>A rejected key counts as a failed attempt for {@code ip:<address>} and
 *       yields 401 (or 429 once the attempt locks the client)</li>
 *   <li>An accepted key clears the attempts and marks the request</li>
 *   <li>{@code /admin} requests without the marker get 401</li>
 * </ol>
 */
public class ApiKeyAuthFilter {

    private static final Logger LOG = Logger.getLogger(ApiKeyAuthFilter.class);

    static final String ADMIN_PATH_PREFIX = "/admin";
    static final String REMAINING_ATTEMPTS_HEADER = "X-Auth-Remaining-Attempts";
    static final String LOCKOUT_RESET_HEADER = "X-Auth-Lockout-Reset";
    private static final String PROBLEM_JSON = "application/problem+json";

    private final ApiKeyAuthenticator authenticator;
    private final AttemptTracker attemptTracker;
    private final AccountLockoutConfig lockoutConfig;
    private final MeterRegistry meterRegistry;

    @Inject
    public ApiKeyAuthFilter(
            ApiKeyAuthenticator authenticator,
            AttemptTracker attemptTracker,
            AccountLockoutConfig lockoutConfig,
            MeterRegistry meterRegistry) {
        this.authenticator = authenticator;
        this.attemptTracker = attemptTracker;
        this.lockoutConfig = lockoutConfig;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Reactive filter method for API key authentication.
     *
     * @param requestContext the request context
     * @param request        the underlying HTTP request, for the remote address
     * @return Uni with null to continue, or Response to abort
     */
    @ServerRequestFilter(priority = Priorities.AUTHENTICATION)
    public Uni<Response> filter(ContainerRequestContext requestContext, HttpServerRequest request) {
        return Uni.createFrom().item(() -> decide(requestContext, remoteAddress(request)));
    }

    Response decide(ContainerRequestContext requestContext, String remoteAddress) {
        final var context = new ContainerApiKeyRequestContext(requestContext);
        final var admin = context.path().startsWith(ADMIN_PATH_PREFIX);
        final var presented = context.header(authenticator.headerName());

        final var clientIp = lockoutConfig.trustForwardedHeaders()
                ? ClientIpExtractor.extract(requestContext::getHeaderString, remoteAddress)
                : ClientIpExtractor.fromRemoteAddress(remoteAddress);
        final var lockoutKey = "ip:" + clientIp;

        if (lockoutConfig.enabled() && (presented != null || admin) && attemptTracker.isLocked(lockoutKey)) {
            meterRegistry.counter("bulwark.auth.lockout.rejected").increment();
            LOG.debugf("Refusing request from locked client %s", SecureHash.forLog(lockoutKey));
            return lockedOutResponse(lockoutKey);
        }

        final var outcome = authenticator.evaluate(context, presented);
        meterRegistry
                .counter("bulwark.auth.api_key.requests", "outcome", outcome.name().toLowerCase())
                .increment();

        if (outcome == ApiKeyAuthOutcome.REJECTED) {
            return rejectedResponse(lockoutKey);
        }

        if (outcome == ApiKeyAuthOutcome.AUTHENTICATED && lockoutConfig.enabled()) {
            attemptTracker.resetAttempts(lockoutKey);
        }

        if (admin && !context.isApiKeyAuthenticated()) {
            return unauthorized(PanelProblem.unauthorized("Admin endpoints require a valid API key"))
                    .build();
        }

        return null;
    }

    private Response rejectedResponse(String lockoutKey) {
        if (!lockoutConfig.enabled()) {
            return unauthorized(PanelProblem.invalidApiKey(-1)).build();
        }

        attemptTracker.recordFailure(lockoutKey);
        if (attemptTracker.isLocked(lockoutKey)) {
            return lockedOutResponse(lockoutKey);
        }

        final var remaining = attemptTracker.getRemainingAttempts(lockoutKey);
        final var builder = unauthorized(PanelProblem.invalidApiKey(remaining));
        if (lockoutConfig.includeHeaders()) {
            builder.header(REMAINING_ATTEMPTS_HEADER, remaining);
        }
        return builder.build();
    }

    private Response lockedOutResponse(String lockoutKey) {
        final var lockedUntil = attemptTracker.lockedUntil(lockoutKey)
                .orElseGet(() -> Instant.now().plus(attemptTracker.lockoutDuration()));
        final var retryAfter = retryAfterSeconds(lockedUntil);

        final var builder = Response.status(429)
                .type(PROBLEM_JSON)
                .header("Retry-After", retryAfter)
                .entity(PanelProblem.lockedOut(retryAfter, lockedUntil));
        if (lockoutConfig.includeHeaders()) {
            builder.header(LOCKOUT_RESET_HEADER, lockedUntil.getEpochSecond());
        }
        return builder.build();
    }

    private Response.ResponseBuilder unauthorized(HttpProblem problem) {
        return Response.status(Response.Status.UNAUTHORIZED)
                .type(PROBLEM_JSON)
                .header(HttpHeaders.WWW_AUTHENTICATE, "ApiKey header=\"" + authenticator.headerName() + "\"")
                .entity(problem);
    }

    static long retryAfterSeconds(Instant lockedUntil) {
        final var millis = Duration.between(Instant.now(), lockedUntil).toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }

    private static String remoteAddress(HttpServerRequest request) {
        return request != null && request.remoteAddress() != null
                ? request.remoteAddress().host()
                : null;
    }
}
