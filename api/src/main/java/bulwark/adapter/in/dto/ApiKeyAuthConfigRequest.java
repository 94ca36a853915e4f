package bulwark.adapter.in.dto;

import java.util.List;

import jakarta.validation.constraints.NotNull;

/**
 * Replacement API key authentication configuration.
 *
 * @param enabled whether API key authentication is on (required)
 * @param header  header carrying the key; blank selects {@code X-API-Key}
 * @param keys    accepted keys; blank entries are dropped
 */
public record ApiKeyAuthConfigRequest(
        @NotNull(message = "enabled is required") Boolean enabled, String header, List<String> keys) {

    public List<String> keysOrEmpty() {
        return keys != null ? keys : List.of();
    }
}
