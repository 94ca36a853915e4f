package bulwark.adapter.in.dto;

import java.util.List;

import bulwark.core.model.auth.ApiKeyAuthSettings;

/**
 * Admin view of the API key authentication configuration. Keys are masked.
 */
public record ApiKeyAuthStatusDto(
        boolean enabled,
        boolean active,
        String header,
        int keyCount,
        List<String> keys,
        boolean dynamicValidator,
        boolean atomicSnapshot) {

    private static final int VISIBLE_PREFIX = 4;

    public static ApiKeyAuthStatusDto fromSettings(ApiKeyAuthSettings settings, boolean atomicSnapshot) {
        final var masked = settings.acceptedKeys().stream()
                .map(ApiKeyAuthStatusDto::mask)
                .sorted()
                .toList();
        return new ApiKeyAuthStatusDto(
                settings.enabled(),
                settings.active(),
                settings.headerName(),
                masked.size(),
                masked,
                settings.dynamicValidator().isPresent(),
                atomicSnapshot);
    }

    static String mask(String key) {
        if (key.length() <= VISIBLE_PREFIX * 2) {
            return "****";
        }
        return key.substring(0, VISIBLE_PREFIX) + "****";
    }
}
