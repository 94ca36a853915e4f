package bulwark.core.cache;

import java.io.IOException;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Deep copy through a Jackson serialize/deserialize round trip.
 *
 * <p>Works for any type the mapper can write and read back, including
 * records holding mutable collections.
 *
 * @param <T> the artifact type
 */
public class JacksonArtifactCopier<T> implements ArtifactCopier<T> {

    private final ObjectMapper objectMapper;
    private final JavaType type;

    public JacksonArtifactCopier(ObjectMapper objectMapper, Class<T> type) {
        this.objectMapper = objectMapper;
        this.type = objectMapper.getTypeFactory().constructType(type);
    }

    @Override
    public T copy(T value) {
        try {
            final var bytes = objectMapper.writeValueAsBytes(value);
            return objectMapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new ArtifactCopyException("Cannot copy " + type.getTypeName() + ": " + e.getMessage(), e);
        }
    }
}
