package bulwark.core.service.auth;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

import bulwark.core.model.auth.ApiKeyAuthSettings;

/**
 * Lock-free settings store.
 *
 * <p>Writers build a new immutable {@link ApiKeyAuthSettings} and publish it
 * with one compare-and-set; readers perform a single volatile read.
 */
public final class AtomicSnapshotApiKeySettingsStore implements ApiKeySettingsStore {

    private final AtomicReference<ApiKeyAuthSettings> snapshot;

    public AtomicSnapshotApiKeySettingsStore(ApiKeyAuthSettings initial) {
        this.snapshot = new AtomicReference<>(Objects.requireNonNull(initial, "initial settings"));
    }

    @Override
    public ApiKeyAuthSettings current() {
        return snapshot.get();
    }

    @Override
    public ApiKeyAuthSettings update(UnaryOperator<ApiKeyAuthSettings> change) {
        return snapshot.updateAndGet(current -> Objects.requireNonNull(change.apply(current), "settings"));
    }

    @Override
    public boolean lockFree() {
        return true;
    }
}
