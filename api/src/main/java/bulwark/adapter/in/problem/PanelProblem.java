package bulwark.adapter.in.problem;

import java.time.Instant;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for panel API errors.
 *
 * <p>Client errors are expected behaviour and are not logged by the mappers.
 */
public final class PanelProblem {

    private PanelProblem() {
        // Utility class - prevent instantiation
    }

    public static HttpProblem notFound(String detail) {
        return HttpProblem.builder()
                .withTitle("Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    // ========== Authentication ==========

    public static HttpProblem unauthorized(String detail) {
        return HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail(detail)
                .build();
    }

    /**
     * A 401 for a presented API key that matched nothing.
     *
     * @param remainingAttempts attempts left before lockout, or negative when lockout is off
     */
    public static HttpProblem invalidApiKey(int remainingAttempts) {
        final var builder = HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail("Invalid API key");
        if (remainingAttempts >= 0) {
            builder.with("remainingAttempts", remainingAttempts);
        }
        return builder.build();
    }

    /**
     * A 429 for a locked out client.
     *
     * @param retryAfterSeconds seconds until the lock expires
     * @param lockedUntil       lock expiry
     */
    public static HttpProblem lockedOut(long retryAfterSeconds, Instant lockedUntil) {
        return HttpProblem.builder()
                .withTitle("Too Many Requests")
                .withStatus(Status.fromStatusCode(429))
                .withDetail("Too many failed authentication attempts. Retry after %d seconds."
                        .formatted(retryAfterSeconds))
                .with("retryAfter", retryAfterSeconds)
                .with("resetAt", lockedUntil.getEpochSecond())
                .build();
    }

    // ========== Server Errors ==========

    public static HttpProblem internalError(String detail) {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem featureDisabled(String feature) {
        return HttpProblem.builder()
                .withTitle("Feature Disabled")
                .withStatus(Status.NOT_FOUND)
                .withDetail("%s is disabled".formatted(feature))
                .build();
    }
}
