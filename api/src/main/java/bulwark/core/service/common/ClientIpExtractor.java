package bulwark.core.service.common;

import java.util.function.UnaryOperator;

/**
 * Utility for extracting the client IP address of an incoming request.
 *
 * <p>Checks, in order:
 * <ol>
 *   <li>RFC 7239 {@code Forwarded} header's {@code for} parameter (first entry)</li>
 *   <li>Legacy {@code X-Forwarded-For} header (first IP in chain)</li>
 *   <li>The socket's remote address</li>
 * </ol>
 */
public final class ClientIpExtractor {

    static final String UNKNOWN = "unknown";

    private ClientIpExtractor() {}

    /**
     * Extract the original client IP address.
     *
     * @param headers       header lookup, returning null for absent headers
     * @param remoteAddress socket address, may be null
     * @return the client IP, or {@code unknown}
     */
    public static String extract(UnaryOperator<String> headers, String remoteAddress) {
        final var forwarded = headers.apply("Forwarded");
        if (forwarded != null) {
            final var ip = parseForwardedFor(forwarded);
            if (ip != null) {
                return ip;
            }
        }

        final var xForwardedFor = headers.apply("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            return xForwardedFor.split(",")[0].trim();
        }

        return fromRemoteAddress(remoteAddress);
    }

    /**
     * Client IP from the socket alone, ignoring forwarding headers.
     *
     * @param remoteAddress socket address, may be null
     * @return the address, or {@code unknown}
     */
    public static String fromRemoteAddress(String remoteAddress) {
        return remoteAddress == null || remoteAddress.isBlank() ? UNKNOWN : remoteAddress;
    }

    /**
     * Parse the client IP from the first entry of an RFC 7239 Forwarded header.
     *
     * @param forwarded the header value
     * @return the client IP without port, or null if there is no {@code for} parameter
     */
    static String parseForwardedFor(String forwarded) {
        final var firstEntry = forwarded.split(",")[0].trim();

        for (final var part : firstEntry.split(";")) {
            final var trimmed = part.trim();
            if (!trimmed.toLowerCase().startsWith("for=")) {
                continue;
            }
            var value = trimmed.substring(4);
            if (value.startsWith("\"") && value.endsWith("\"") && value.length() > 1) {
                value = value.substring(1, value.length() - 1);
            }
            // [v6]:port
            if (value.startsWith("[")) {
                final var bracketEnd = value.indexOf(']');
                if (bracketEnd > 0) {
                    return value.substring(1, bracketEnd);
                }
            }
            // a single colon means v4 with port
            final var colonCount = value.length() - value.replace(":", "").length();
            if (colonCount == 1) {
                value = value.substring(0, value.indexOf(':'));
            }
            return value.isEmpty() ? null : value;
        }
        return null;
    }
}
