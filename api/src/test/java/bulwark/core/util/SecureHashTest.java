package bulwark.core.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SecureHash")
class SecureHashTest {

    @Nested
    @DisplayName("truncatedSha256()")
    class TruncatedSha256Tests {

        @Test
        @DisplayName("should return the requested number of hex characters")
        void shouldReturnRequestedLength() {
            assertEquals(8, SecureHash.truncatedSha256("ip:10.0.0.1", 8).length());
            assertEquals(64, SecureHash.truncatedSha256("ip:10.0.0.1", 64).length());
        }

        @Test
        @DisplayName("should match the known SHA-256 prefix")
        void shouldMatchKnownDigest() {
            // sha256("abc") = ba7816bf...
            assertEquals("ba7816bf", SecureHash.truncatedSha256("abc", 8));
        }

        @Test
        @DisplayName("should reject out of range lengths")
        void shouldRejectOutOfRangeLengths() {
            assertThrows(IllegalArgumentException.class, () -> SecureHash.truncatedSha256("abc", 0));
            assertThrows(IllegalArgumentException.class, () -> SecureHash.truncatedSha256("abc", 65));
        }
    }

    @Nested
    @DisplayName("forLog()")
    class ForLogTests {

        @Test
        @DisplayName("should not contain the identifier")
        void shouldNotContainIdentifier() {
            final var hashed = SecureHash.forLog("ip:203.0.113.7");

            assertEquals(12, hashed.length());
            assertFalse(hashed.contains("203"));
        }

        @Test
        @DisplayName("should render null as none")
        void shouldRenderNull() {
            assertEquals("none", SecureHash.forLog(null));
        }

        @Test
        @DisplayName("should be stable and distinguish identifiers")
        void shouldBeStable() {
            assertEquals(SecureHash.forLog("user:a"), SecureHash.forLog("user:a"));
            assertNotEquals(SecureHash.forLog("user:a"), SecureHash.forLog("user:b"));
        }
    }

    @Nested
    @DisplayName("constantTimeEquals()")
    class ConstantTimeEqualsTests {

        @Test
        @DisplayName("should match equal strings")
        void shouldMatchEqualStrings() {
            assertTrue(SecureHash.constantTimeEquals("secret-key-1", "secret-key-1"));
        }

        @Test
        @DisplayName("should reject strings differing in one character or length")
        void shouldRejectDifferentStrings() {
            assertFalse(SecureHash.constantTimeEquals("secret-key-1", "secret-key-2"));
            assertFalse(SecureHash.constantTimeEquals("secret-key", "secret-key-1"));
        }

        @Test
        @DisplayName("should reject null on either side")
        void shouldRejectNull() {
            assertFalse(SecureHash.constantTimeEquals(null, "secret"));
            assertFalse(SecureHash.constantTimeEquals("secret", null));
            assertFalse(SecureHash.constantTimeEquals(null, null));
        }
    }
}
