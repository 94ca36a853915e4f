package bulwark.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import bulwark.core.cache.CopyFailurePolicy;

/**
 * Configuration mapping for the generated API specification document.
 *
 * <p>Configuration prefix: {@code bulwark.openapi}
 *
 * <h2>Configuration Properties</h2>
 * <ul>
 *   <li>{@code bulwark.openapi.cache-ttl} - how long a built document is served before rebuilding;
 *       {@code PT0S} disables caching (useful during development)</li>
 *   <li>{@code bulwark.openapi.copy-failure} - what to do when a caller copy cannot be made</li>
 * </ul>
 */
@ConfigMapping(prefix = "bulwark.openapi")
public interface SpecDocumentConfig {

    @WithDefault("PT5M")
    Duration cacheTtl();

    @WithDefault("Panel API")
    String title();

    @WithDefault("1.0.0")
    String version();

    @WithDefault("REST API for the admin panel")
    String description();

    @WithDefault("http://localhost:8080")
    String serverUrl();

    Optional<String> serverDescription();

    @WithDefault("RETURN_SHARED")
    CopyFailurePolicy copyFailure();
}
