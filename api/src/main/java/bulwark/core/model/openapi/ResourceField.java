package bulwark.core.model.openapi;

/**
 * A field of a registered panel resource.
 *
 * @param name     field key as exposed by the REST API
 * @param type     panel field type ({@code text}, {@code email}, {@code number}, {@code boolean},
 *                 {@code date}, {@code datetime}, ...)
 * @param required whether the field must be present on create
 * @param readOnly whether the field is server-managed
 */
public record ResourceField(String name, String type, boolean required, boolean readOnly) {

    public static ResourceField of(String name, String type) {
        return new ResourceField(name, type, false, false);
    }
}
