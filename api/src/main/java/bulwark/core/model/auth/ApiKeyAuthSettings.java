package bulwark.core.model.auth;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import bulwark.spi.ApiKeyValidator;

/**
 * Immutable snapshot of the API key authentication configuration.
 *
 * <p>Instances are replaced wholesale, never mutated, so a reader holding a
 * reference always sees one consistent configuration.
 *
 * @param enabled          whether API key authentication is active
 * @param headerName       header carrying the key, never blank
 * @param acceptedKeys     statically accepted keys, no blank entries
 * @param dynamicValidator optional callback for managed keys
 */
public record ApiKeyAuthSettings(
        boolean enabled, String headerName, Set<String> acceptedKeys, Optional<ApiKeyValidator> dynamicValidator) {

    public static final String DEFAULT_HEADER = "X-API-Key";

    public static final ApiKeyAuthSettings DISABLED =
            new ApiKeyAuthSettings(false, DEFAULT_HEADER, Set.of(), Optional.empty());

    public ApiKeyAuthSettings {
        headerName = normalizeHeader(headerName);
        acceptedKeys = normalizeKeys(acceptedKeys);
        if (dynamicValidator == null) {
            dynamicValidator = Optional.empty();
        }
    }

    /**
     * Build settings from raw administrative input.
     *
     * @param enabled    enable flag
     * @param headerName header name, trimmed; blank falls back to {@value #DEFAULT_HEADER}
     * @param keys       raw keys, trimmed; blank entries are dropped
     * @return normalized settings without a dynamic validator
     */
    public static ApiKeyAuthSettings of(boolean enabled, String headerName, Collection<String> keys) {
        return new ApiKeyAuthSettings(enabled, headerName, copyOf(keys), Optional.empty());
    }

    /**
     * True when enabled and there is something to validate against.
     */
    public boolean active() {
        return enabled && (!acceptedKeys.isEmpty() || dynamicValidator.isPresent());
    }

    public ApiKeyAuthSettings withConfig(boolean newEnabled, String newHeaderName, Collection<String> newKeys) {
        return new ApiKeyAuthSettings(newEnabled, newHeaderName, copyOf(newKeys), dynamicValidator);
    }

    public ApiKeyAuthSettings withValidator(ApiKeyValidator validator) {
        return new ApiKeyAuthSettings(enabled, headerName, acceptedKeys, Optional.ofNullable(validator));
    }

    // LinkedHashSet rather than Set.copyOf: raw input may contain nulls
    private static Set<String> copyOf(Collection<String> keys) {
        return keys == null ? Set.of() : new LinkedHashSet<>(keys);
    }

    private static String normalizeHeader(String headerName) {
        if (headerName == null || headerName.isBlank()) {
            return DEFAULT_HEADER;
        }
        return headerName.trim();
    }

    private static Set<String> normalizeKeys(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return Set.of();
        }
        final var normalized = new LinkedHashSet<String>();
        for (final var key : keys) {
            if (key == null) {
                continue;
            }
            final var trimmed = key.trim();
            if (!trimmed.isEmpty()) {
                normalized.add(trimmed);
            }
        }
        return Set.copyOf(normalized);
    }
}
