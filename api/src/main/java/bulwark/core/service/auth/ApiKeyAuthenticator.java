package bulwark.core.service.auth;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import bulwark.core.config.ApiKeyAuthConfig;
import bulwark.core.model.auth.ApiKeyAuthOutcome;
import bulwark.core.model.auth.ApiKeyAuthSettings;
import bulwark.core.util.SecureHash;
import bulwark.spi.ApiKeyRequestContext;
import bulwark.spi.ApiKeyValidator;

/**
 * Runtime-reconfigurable API key authenticator.
 *
 * <p>
 * The request path ({@link #evaluate}) reads one consistent settings snapshot
 * from the active {@link ApiKeySettingsStore}; administrative writes
 * ({@link #configure}, {@link #setDynamicValidator}) replace the configuration
 * as a unit and never interrupt in-flight validation.
 *
 * <p>
 * Behavior per request:
 * <ul>
 * <li>Disabled, or enabled without keys and validator: pass-through</li>
 * <li>No key presented: pass-through, other mechanisms decide</li>
 * <li>Key matches a configured key or the dynamic validator: authenticated,
 * request marked</li>
 * <li>Key present but invalid: rejected</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * Writers are serialized by a single lock so that a read strategy switch
 * cannot lose a concurrent update. Readers never take that lock.
 */
@ApplicationScoped
public class ApiKeyAuthenticator {

    private static final Logger LOG = Logger.getLogger(ApiKeyAuthenticator.class);

    private final ReentrantLock writeLock = new ReentrantLock();

    private volatile ApiKeySettingsStore store;

    @Inject
    public ApiKeyAuthenticator(ApiKeyAuthConfig config) {
        this(storeFor(
                config.atomicSnapshot(),
                ApiKeyAuthSettings.of(config.enabled(), config.header(), config.keys().orElse(List.of()))));
        LOG.infof(
                "API key authentication initialized (enabled: %s, header: %s, keys: %d, snapshot reads: %s)",
                config.enabled(), headerName(), currentSettings().acceptedKeys().size(), config.atomicSnapshot());
        if (!currentSettings().active()) {
            LOG.warn("API key authentication is inactive; /admin endpoints will answer 401 until keys are "
                    + "configured through bulwark.auth.api-key.*");
        }
    }

    public ApiKeyAuthenticator(ApiKeySettingsStore store) {
        this.store = store;
    }

    /**
     * Replace enable flag, header name and accepted keys in one step.
     *
     * <p>The header is trimmed and defaults to {@value ApiKeyAuthSettings#DEFAULT_HEADER};
     * keys are trimmed and blank ones dropped. The dynamic validator is kept.
     *
     * @param enabled    enable flag
     * @param headerName header carrying the key
     * @param keys       accepted keys
     */
    public void configure(boolean enabled, String headerName, Collection<String> keys) {
        final var published = write(current -> current.withConfig(enabled, headerName, keys));
        LOG.infof(
                "API key configuration replaced (enabled: %s, header: %s, keys: %d)",
                published.enabled(), published.headerName(), published.acceptedKeys().size());
    }

    /**
     * Replace the dynamic validator. Pass null to remove it.
     *
     * @param validator callback for managed keys
     */
    public void setDynamicValidator(ApiKeyValidator validator) {
        write(current -> current.withValidator(validator));
        LOG.infof("API key dynamic validator %s", validator == null ? "removed" : "installed");
    }

    /**
     * Switch between lock-free snapshot reads and read-write-lock reads.
     *
     * <p>The current configuration is carried over to the new store.
     *
     * @param enabled true for lock-free snapshot reads
     */
    public void setAtomicSnapshotEnabled(boolean enabled) {
        writeLock.lock();
        try {
            final var current = store;
            if (current.lockFree() == enabled) {
                return;
            }
            store = storeFor(enabled, current.current());
        } finally {
            writeLock.unlock();
        }
        LOG.infof("API key read strategy switched to %s", enabled ? "atomic snapshot" : "read-write lock");
    }

    public boolean isAtomicSnapshotEnabled() {
        return store.lockFree();
    }

    /**
     * Whether authentication is enabled and has keys or a validator to check against.
     */
    public boolean isEnabled() {
        return store.current().active();
    }

    /**
     * Header the HTTP layer should read the key from.
     */
    public String headerName() {
        return store.current().headerName();
    }

    /**
     * Immutable copy of the current configuration.
     */
    public ApiKeyAuthSettings currentSettings() {
        return store.current();
    }

    /**
     * Validate a presented key.
     *
     * @param context  the request, marked on success
     * @param incoming raw header value, may be null
     * @return false only when a non-empty key was presented and rejected
     */
    public boolean authenticate(ApiKeyRequestContext context, String incoming) {
        return evaluate(context, incoming).allowed();
    }

    /**
     * Validate a presented key and report why it passed or failed.
     *
     * @param context  the request, marked on success
     * @param incoming raw header value, may be null
     * @return the outcome
     */
    public ApiKeyAuthOutcome evaluate(ApiKeyRequestContext context, String incoming) {
        final var settings = store.current();
        if (!settings.active()) {
            return ApiKeyAuthOutcome.BYPASSED;
        }

        final var key = incoming == null ? "" : incoming.trim();
        if (key.isEmpty()) {
            return ApiKeyAuthOutcome.NO_CREDENTIAL;
        }

        var valid = matchesAny(key, settings.acceptedKeys());
        if (!valid && settings.dynamicValidator().isPresent()) {
            valid = settings.dynamicValidator().get().validate(context, key);
        }

        if (!valid) {
            return ApiKeyAuthOutcome.REJECTED;
        }

        if (context != null) {
            context.markApiKeyAuthenticated();
        }
        return ApiKeyAuthOutcome.AUTHENTICATED;
    }

    // Every key is compared, a match does not short-circuit the loop
    static boolean matchesAny(String incoming, Set<String> keys) {
        var matched = false;
        for (final var key : keys) {
            matched |= SecureHash.constantTimeEquals(incoming, key);
        }
        return matched;
    }

    private ApiKeyAuthSettings write(UnaryOperator<ApiKeyAuthSettings> change) {
        writeLock.lock();
        try {
            return store.update(change);
        } finally {
            writeLock.unlock();
        }
    }

    private static ApiKeySettingsStore storeFor(boolean atomicSnapshot, ApiKeyAuthSettings settings) {
        return atomicSnapshot
                ? new AtomicSnapshotApiKeySettingsStore(settings)
                : new ReadWriteLockApiKeySettingsStore(settings);
    }
}
