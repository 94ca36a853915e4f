package bulwark.adapter.in.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

import bulwark.core.model.openapi.ResourceDescriptor;
import bulwark.core.model.openapi.ResourceField;

/**
 * DTO for registering a panel resource.
 *
 * @param label  display name; defaults to the slug
 * @param fields exposed fields
 */
public record ResourceRegistrationRequest(String label, @Valid List<FieldDto> fields) {

    /**
     * One exposed field.
     */
    public record FieldDto(
            @NotBlank(message = "field name is required") String name,
            String type,
            Boolean required,
            Boolean readOnly) {}

    public ResourceDescriptor toModel(String slug) {
        final var modelFields = fields == null
                ? List.<ResourceField>of()
                : fields.stream()
                        .map(f -> new ResourceField(
                                f.name(),
                                f.type() != null ? f.type() : "text",
                                f.required() != null && f.required(),
                                f.readOnly() != null && f.readOnly()))
                        .toList();
        return new ResourceDescriptor(slug, label, modelFields);
    }
}
