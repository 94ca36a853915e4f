package bulwark.core.service.auth;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;

import bulwark.core.model.auth.ApiKeyAuthSettings;
import bulwark.spi.ApiKeyValidator;

/**
 * Settings store guarding mutable fields with a read-write lock.
 *
 * <p>Every read takes the shared lock and copies the key list out, so callers
 * never hold a reference into the live fields.
 */
public final class ReadWriteLockApiKeySettingsStore implements ApiKeySettingsStore {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // guarded by lock
    private boolean enabled;
    private String headerName;
    private final List<String> keys = new ArrayList<>();
    private ApiKeyValidator validator;

    public ReadWriteLockApiKeySettingsStore(ApiKeyAuthSettings initial) {
        assign(Objects.requireNonNull(initial, "initial settings"));
    }

    @Override
    public ApiKeyAuthSettings current() {
        lock.readLock().lock();
        try {
            return snapshotLocked();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public ApiKeyAuthSettings update(UnaryOperator<ApiKeyAuthSettings> change) {
        lock.writeLock().lock();
        try {
            final var next = Objects.requireNonNull(change.apply(snapshotLocked()), "settings");
            assign(next);
            return next;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean lockFree() {
        return false;
    }

    private ApiKeyAuthSettings snapshotLocked() {
        return new ApiKeyAuthSettings(
                enabled, headerName, new LinkedHashSet<>(keys), Optional.ofNullable(validator));
    }

    private void assign(ApiKeyAuthSettings settings) {
        enabled = settings.enabled();
        headerName = settings.headerName();
        keys.clear();
        keys.addAll(settings.acceptedKeys());
        validator = settings.dynamicValidator().orElse(null);
    }
}
