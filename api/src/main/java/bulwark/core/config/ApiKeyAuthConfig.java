package bulwark.core.config;

import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for static API key authentication.
 *
 * <p>Configuration prefix: {@code bulwark.auth.api-key}
 *
 * <p>These values only seed the authenticator at startup. Administrators can
 * replace the whole configuration at runtime through
 * {@link bulwark.core.service.auth.ApiKeyAuthenticator#configure}.
 *
 * <h2>Example</h2>
 * <pre>
 * bulwark.auth.api-key.enabled=true
 * bulwark.auth.api-key.header=X-API-Key
 * bulwark.auth.api-key.keys=first-key,second-key
 * </pre>
 */
@ConfigMapping(prefix = "bulwark.auth.api-key")
public interface ApiKeyAuthConfig {

    /**
     * Enable API key authentication.
     *
     * @return true if enabled (default: false)
     */
    @WithDefault("false")
    boolean enabled();

    /**
     * Header carrying the API key.
     *
     * <p>A blank value falls back to {@code X-API-Key}.
     *
     * @return header name (default: X-API-Key)
     */
    @WithDefault("X-API-Key")
    String header();

    /**
     * Statically accepted keys. Blank entries are dropped.
     *
     * @return accepted keys, or empty when none are configured
     */
    Optional<List<String>> keys();

    /**
     * Use lock-free snapshot reads on the request path.
     *
     * <p>When false, reads go through a read-write lock and copy the key set
     * on every request. Both modes behave identically; the snapshot mode
     * avoids lock contention under high fan-out.
     *
     * @return true for snapshot reads (default: true)
     */
    @WithDefault("true")
    boolean atomicSnapshot();
}
