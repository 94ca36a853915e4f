package bulwark.core.model.openapi;

import java.util.List;

/**
 * Interface boundary to the panel resource system: what the document generator
 * needs to know about one registered resource.
 *
 * @param slug   URL segment, for example {@code users}
 * @param label  display name
 * @param fields exposed fields
 */
public record ResourceDescriptor(String slug, String label, List<ResourceField> fields) {

    public ResourceDescriptor {
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("Resource slug cannot be blank");
        }
        slug = slug.trim();
        if (label == null || label.isBlank()) {
            label = slug;
        }
        fields = fields == null ? List.of() : List.copyOf(fields);
    }
}
