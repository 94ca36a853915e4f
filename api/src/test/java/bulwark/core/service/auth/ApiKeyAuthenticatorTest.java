package bulwark.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import bulwark.core.config.ApiKeyAuthConfig;
import bulwark.core.model.auth.ApiKeyAuthOutcome;
import bulwark.core.model.auth.ApiKeyAuthSettings;
import bulwark.spi.ApiKeyRequestContext;

@DisplayName("ApiKeyAuthenticator")
class ApiKeyAuthenticatorTest {

    static Stream<Arguments> strategies() {
        return Stream.of(Arguments.of("atomic snapshot", true), Arguments.of("read-write lock", false));
    }

    private static ApiKeyAuthenticator authenticator(boolean atomic, boolean enabled, List<String> keys) {
        final var settings = ApiKeyAuthSettings.of(enabled, null, keys);
        return new ApiKeyAuthenticator(
                atomic ? new AtomicSnapshotApiKeySettingsStore(settings) : new ReadWriteLockApiKeySettingsStore(settings));
    }

    @Nested
    @DisplayName("evaluate()")
    class EvaluateTests {

        @ParameterizedTest(name = "{0}")
        @MethodSource("bulwark.core.service.auth.ApiKeyAuthenticatorTest#strategies")
        @DisplayName("should pass through when disabled")
        void shouldBypassWhenDisabled(String name, boolean atomic) {
            final var auth = authenticator(atomic, false, List.of("k1"));
            final var ctx = new TestRequestContext();

            assertEquals(ApiKeyAuthOutcome.BYPASSED, auth.evaluate(ctx, "wrong"));
            assertTrue(auth.authenticate(ctx, "wrong"));
            assertFalse(ctx.isApiKeyAuthenticated());
        }

        @ParameterizedTest(name = "{0}")
        @MethodSource("bulwark.core.service.auth.ApiKeyAuthenticatorTest#strategies")
        @DisplayName("should pass through when enabled without keys or validator")
        void shouldBypassWhenUnconfigured(String name, boolean atomic) {
            final var auth = authenticator(atomic, true, List.of());

            assertFalse(auth.isEnabled());
            assertEquals(ApiKeyAuthOutcome.BYPASSED, auth.evaluate(new TestRequestContext(), "anything"));
        }

        @ParameterizedTest(name = "{0}")
        @MethodSource("bulwark.core.service.auth.ApiKeyAuthenticatorTest#strategies")
        @DisplayName("should let requests without a key through unmarked")
        void shouldPassMissingKey(String name, boolean atomic) {
            final var auth = authenticator(atomic, true, List.of("k1"));
            final var ctx = new TestRequestContext();

            assertEquals(ApiKeyAuthOutcome.NO_CREDENTIAL, auth.evaluate(ctx, null));
            assertEquals(ApiKeyAuthOutcome.NO_CREDENTIAL, auth.evaluate(ctx, "   "));
            assertFalse(ctx.isApiKeyAuthenticated());
        }

        @ParameterizedTest(name = "{0}")
        @MethodSource("bulwark.core.service.auth.ApiKeyAuthenticatorTest#strategies")
        @DisplayName("should authenticate a configured key and mark the request")
        void shouldAuthenticateConfiguredKey(String name, boolean atomic) {
            final var auth = authenticator(atomic, true, List.of("k1", "k2"));
            final var ctx = new TestRequestContext();

            assertEquals(ApiKeyAuthOutcome.AUTHENTICATED, auth.evaluate(ctx, "k2"));
            assertTrue(ctx.isApiKeyAuthenticated());
        }

        @ParameterizedTest(name = "{0}")
        @MethodSource("bulwark.core.service.auth.ApiKeyAuthenticatorTest#strategies")
        @DisplayName("should trim the presented key")
        void shouldTrimPresentedKey(String name, boolean atomic) {
            final var auth = authenticator(atomic, true, List.of("k1"));

            assertEquals(ApiKeyAuthOutcome.AUTHENTICATED, auth.evaluate(new TestRequestContext(), "  k1 "));
        }

        @ParameterizedTest(name = "{0}")
        @MethodSource("bulwark.core.service.auth.ApiKeyAuthenticatorTest#strategies")
        @DisplayName("should reject every single-character mutation of a valid key")
        void shouldRejectMutations(String name, boolean atomic) {
            final var key = "panel-key-7Qx2";
            final var auth = authenticator(atomic, true, List.of(key));

            for (var i = 0; i < key.length(); i++) {
                final var chars = key.toCharArray();
                chars[i] = chars[i] == 'z' ? 'y' : 'z';
                final var ctx = new TestRequestContext();
                assertEquals(ApiKeyAuthOutcome.REJECTED, auth.evaluate(ctx, new String(chars)), "position " + i);
                assertFalse(ctx.isApiKeyAuthenticated());
            }
        }

        @ParameterizedTest(name = "{0}")
        @MethodSource("bulwark.core.service.auth.ApiKeyAuthenticatorTest#strategies")
        @DisplayName("should fall back to the dynamic validator")
        void shouldUseDynamicValidator(String name, boolean atomic) {
            final var auth = authenticator(atomic, true, List.of());
            final var seen = new ConcurrentLinkedQueue<String>();
            auth.setDynamicValidator((ctx, key) -> {
                seen.add(key);
                return key.startsWith("managed-");
            });

            assertTrue(auth.isEnabled());
            assertEquals(ApiKeyAuthOutcome.AUTHENTICATED, auth.evaluate(new TestRequestContext(), "managed-1"));
            assertEquals(ApiKeyAuthOutcome.REJECTED, auth.evaluate(new TestRequestContext(), "other"));
            assertEquals(List.of("managed-1", "other"), new ArrayList<>(seen));
        }

        @ParameterizedTest(name = "{0}")
        @MethodSource("bulwark.core.service.auth.ApiKeyAuthenticatorTest#strategies")
        @DisplayName("should not consult the validator when a static key matches")
        void shouldPreferStaticKeys(String name, boolean atomic) {
            final var auth = authenticator(atomic, true, List.of("k1"));
            final var calls = new AtomicInteger();
            auth.setDynamicValidator((ctx, key) -> {
                calls.incrementAndGet();
                return false;
            });

            assertEquals(ApiKeyAuthOutcome.AUTHENTICATED, auth.evaluate(new TestRequestContext(), "k1"));
            assertEquals(0, calls.get());
        }

        @ParameterizedTest(name = "{0}")
        @MethodSource("bulwark.core.service.auth.ApiKeyAuthenticatorTest#strategies")
        @DisplayName("should reject after the validator is removed")
        void shouldRemoveValidator(String name, boolean atomic) {
            final var auth = authenticator(atomic, true, List.of("k1"));
            auth.setDynamicValidator((ctx, key) -> true);
            auth.setDynamicValidator(null);

            assertEquals(ApiKeyAuthOutcome.REJECTED, auth.evaluate(new TestRequestContext(), "k2"));
        }
    }

    @Nested
    @DisplayName("configure()")
    class ConfigureTests {

        @ParameterizedTest(name = "{0}")
        @MethodSource("bulwark.core.service.auth.ApiKeyAuthenticatorTest#strategies")
        @DisplayName("should replace keys so old keys stop working")
        void shouldReplaceKeys(String name, boolean atomic) {
            final var auth = authenticator(atomic, true, List.of("old"));

            auth.configure(true, "X-Panel-Key", List.of("new"));

            assertEquals("X-Panel-Key", auth.headerName());
            assertEquals(ApiKeyAuthOutcome.REJECTED, auth.evaluate(new TestRequestContext(), "old"));
            assertEquals(ApiKeyAuthOutcome.AUTHENTICATED, auth.evaluate(new TestRequestContext(), "new"));
        }

        @ParameterizedTest(name = "{0}")
        @MethodSource("bulwark.core.service.auth.ApiKeyAuthenticatorTest#strategies")
        @DisplayName("should hand out settings detached from later updates")
        void shouldReturnDetachedSettings(String name, boolean atomic) {
            final var auth = authenticator(atomic, true, List.of("k1"));
            final var before = auth.currentSettings();

            auth.configure(true, null, List.of("k2", "k3"));

            assertEquals(Set.of("k1"), before.acceptedKeys());
            assertEquals(Set.of("k2", "k3"), auth.currentSettings().acceptedKeys());
        }

        @ParameterizedTest(name = "{0}")
        @MethodSource("bulwark.core.service.auth.ApiKeyAuthenticatorTest#strategies")
        @DisplayName("should never expose a mix of two configurations to readers")
        void shouldNeverTearReads(String name, boolean atomic) throws InterruptedException {
            final var auth = authenticator(atomic, true, List.of("a1", "a2"));
            final var executor = Executors.newFixedThreadPool(9);
            final var start = new CountDownLatch(1);
            final var stop = new AtomicBoolean();
            final var torn = new AtomicInteger();
            final var reads = new AtomicInteger();

            executor.submit(() -> {
                start.await();
                for (var i = 0; i < 5_000; i++) {
                    if (i % 2 == 0) {
                        auth.configure(true, "X-B", List.of("b1", "b2", "b3"));
                    } else {
                        auth.configure(true, "X-A", List.of("a1", "a2"));
                    }
                }
                stop.set(true);
                return null;
            });
            for (var r = 0; r < 8; r++) {
                executor.submit(() -> {
                    start.await();
                    while (!stop.get()) {
                        final var settings = auth.currentSettings();
                        final var consistent = settings.headerName().equals("X-B")
                                ? settings.acceptedKeys().equals(Set.of("b1", "b2", "b3"))
                                : settings.acceptedKeys().equals(Set.of("a1", "a2"));
                        if (!consistent) {
                            torn.incrementAndGet();
                        }
                        auth.evaluate(new TestRequestContext(), "a1");
                        reads.incrementAndGet();
                    }
                    return null;
                });
            }

            start.countDown();
            executor.shutdown();
            assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));
            assertEquals(0, torn.get());
            assertTrue(reads.get() > 0);
        }
    }

    @Nested
    @DisplayName("setAtomicSnapshotEnabled()")
    class StrategySwitchTests {

        @Test
        @DisplayName("should carry configuration and validator across a switch")
        void shouldCarryConfigurationAcrossSwitch() {
            final var auth = authenticator(true, true, List.of("k1"));
            auth.setDynamicValidator((ctx, key) -> key.equals("dyn"));

            auth.setAtomicSnapshotEnabled(false);

            assertFalse(auth.isAtomicSnapshotEnabled());
            assertEquals(ApiKeyAuthOutcome.AUTHENTICATED, auth.evaluate(new TestRequestContext(), "k1"));
            assertEquals(ApiKeyAuthOutcome.AUTHENTICATED, auth.evaluate(new TestRequestContext(), "dyn"));

            auth.setAtomicSnapshotEnabled(true);

            assertTrue(auth.isAtomicSnapshotEnabled());
            assertEquals(Set.of("k1"), auth.currentSettings().acceptedKeys());
        }

        @Test
        @DisplayName("should seed from configuration")
        void shouldSeedFromConfig() {
            final var config = mock(ApiKeyAuthConfig.class);
            lenient().when(config.enabled()).thenReturn(true);
            lenient().when(config.header()).thenReturn("X-Admin-Key");
            lenient().when(config.keys()).thenReturn(Optional.of(List.of("seed-key", " ")));
            lenient().when(config.atomicSnapshot()).thenReturn(false);

            final var auth = new ApiKeyAuthenticator(config);

            assertFalse(auth.isAtomicSnapshotEnabled());
            assertEquals("X-Admin-Key", auth.headerName());
            assertEquals(Set.of("seed-key"), auth.currentSettings().acceptedKeys());
        }
    }

    @Test
    @DisplayName("matchesAny() should find a key in any position")
    void matchesAnyShouldFindKeyInAnyPosition() {
        assertTrue(ApiKeyAuthenticator.matchesAny("c", Set.of("a", "b", "c")));
        assertFalse(ApiKeyAuthenticator.matchesAny("d", Set.of("a", "b", "c")));
        assertFalse(ApiKeyAuthenticator.matchesAny("a", Set.of()));
    }

    static final class TestRequestContext implements ApiKeyRequestContext {
        private volatile boolean marked;

        @Override
        public String header(String name) {
            return null;
        }

        @Override
        public String path() {
            return "/api/resource/users";
        }

        @Override
        public void markApiKeyAuthenticated() {
            marked = true;
        }

        @Override
        public boolean isApiKeyAuthenticated() {
            return marked;
        }
    }
}
