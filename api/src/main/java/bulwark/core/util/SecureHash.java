package bulwark.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Utility for hashing and comparing sensitive values.
 *
 * <p>Uses SHA-256 to derive log-safe identifiers (lockout keys, e-mail
 * addresses, client IPs) and a constant-time comparison for credential
 * matching so that response timing does not leak how many leading bytes
 * of a candidate key were correct.
 */
public final class SecureHash {

    private static final int MAX_HEX_CHARS = 64;

    private SecureHash() {}

    /**
     * Return a truncated SHA-256 hex digest of the input string.
     *
     * @param input    the string to hash
     * @param hexChars number of hex characters to return (1-64)
     * @return truncated hex digest
     * @throws IllegalArgumentException if hexChars is less than 1 or greater than 64
     */
    public static String truncatedSha256(String input, int hexChars) {
        if (hexChars < 1 || hexChars > MAX_HEX_CHARS) {
            throw new IllegalArgumentException("hexChars must be between 1 and " + MAX_HEX_CHARS + ", got " + hexChars);
        }
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            final var hashBytes = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            final var fullHex = HexFormat.of().formatHex(hashBytes);
            return fullHex.substring(0, hexChars);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 must be available per Java spec", e);
        }
    }

    /**
     * Short digest used wherever an identifier ends up in a log line.
     *
     * @param identifier the identifier, may be null
     * @return 12 hex characters, or {@code "none"} for null
     */
    public static String forLog(String identifier) {
        if (identifier == null) {
            return "none";
        }
        return truncatedSha256(identifier, 12);
    }

    /**
     * Compare two strings in time independent of where they first differ.
     *
     * <p>Length differences are still observable, which is acceptable for
     * randomly generated keys.
     *
     * @param candidate the value presented by the client
     * @param expected  the accepted value
     * @return true if both are non-null and equal
     */
    public static boolean constantTimeEquals(String candidate, String expected) {
        if (candidate == null || expected == null) {
            return false;
        }
        return MessageDigest.isEqual(
                candidate.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8));
    }
}
