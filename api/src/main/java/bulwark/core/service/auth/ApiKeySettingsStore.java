package bulwark.core.service.auth;

import java.util.function.UnaryOperator;

import bulwark.core.model.auth.ApiKeyAuthSettings;

/**
 * Holder for the live API key configuration.
 *
 * <p>Two strategies exist and must be observably identical:
 * <ul>
 *   <li>{@link ReadWriteLockApiKeySettingsStore} - fields guarded by a read-write lock,
 *       key set copied out on every read</li>
 *   <li>{@link AtomicSnapshotApiKeySettingsStore} - immutable snapshot published with a
 *       single atomic store, readers never block</li>
 * </ul>
 *
 * <p>Readers must never observe a configuration mixing fields of two updates.
 */
public interface ApiKeySettingsStore {

    /**
     * Current configuration as one consistent snapshot.
     */
    ApiKeyAuthSettings current();

    /**
     * Replace the configuration atomically.
     *
     * @param change function from the current to the next settings; may be
     *               called more than once and must not have side effects
     * @return the settings that were published
     */
    ApiKeyAuthSettings update(UnaryOperator<ApiKeyAuthSettings> change);

    /**
     * Whether reads avoid locking entirely.
     */
    boolean lockFree();
}
