package bulwark.core.model.openapi;

/**
 * An OpenAPI security scheme entry.
 *
 * @param type        scheme type, for example {@code apiKey}
 * @param in          where the credential travels: {@code header}, {@code cookie} or {@code query}
 * @param name        header or cookie name
 * @param description human-readable description
 */
public record SecurityScheme(String type, String in, String name, String description) {}
