package bulwark.adapter.in.dto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import bulwark.core.model.auth.ApiKeyAuthSettings;

@DisplayName("ApiKeyAuthStatusDto")
class ApiKeyAuthStatusDtoTest {

    @Test
    @DisplayName("should never expose full keys")
    void shouldMaskKeys() {
        final var dto = ApiKeyAuthStatusDto.fromSettings(
                ApiKeyAuthSettings.of(true, null, List.of("live-3f9a8c7d2e", "short")), true);

        assertEquals(List.of("****", "live****"), dto.keys());
        assertEquals(2, dto.keyCount());
        assertTrue(dto.active());
        assertTrue(dto.atomicSnapshot());
        assertFalse(dto.dynamicValidator());
    }
}
