package bulwark.core.service.openapi;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;

import bulwark.core.config.SpecDocumentConfig;
import bulwark.core.model.openapi.ApiSpecDocument;
import bulwark.core.model.openapi.ResourceDescriptor;
import bulwark.core.model.openapi.ResourceField;
import bulwark.core.model.openapi.SecurityScheme;
import bulwark.core.model.openapi.SpecComponents;
import bulwark.core.model.openapi.SpecInfo;
import bulwark.core.model.openapi.SpecOperation;
import bulwark.core.model.openapi.SpecProperty;
import bulwark.core.model.openapi.SpecSchema;
import bulwark.core.model.openapi.SpecServer;
import bulwark.core.model.openapi.SpecTag;

/**
 * Builds the API specification document from the registered resources.
 *
 * <p>Each resource gets a tag, an object schema and the five CRUD operations
 * under {@code /api/resource/{slug}}. All operations accept either the session
 * cookie or the API key header.
 */
@ApplicationScoped
public class SpecGenerator {

    static final String OPENAPI_VERSION = "3.0.3";
    static final String COOKIE_SCHEME = "cookieAuth";
    static final String API_KEY_SCHEME = "apiKeyAuth";
    static final String SESSION_COOKIE = "session_token";

    private final SpecDocumentConfig config;

    public SpecGenerator(SpecDocumentConfig config) {
        this.config = config;
    }

    /**
     * Generate a new document. Every call returns fresh, mutable collections.
     *
     * @param resources    resources to describe
     * @param apiKeyHeader header name advertised for the API key scheme
     * @return the document
     */
    public ApiSpecDocument generate(Collection<ResourceDescriptor> resources, String apiKeyHeader) {
        final var schemes = new LinkedHashMap<String, SecurityScheme>();
        schemes.put(COOKIE_SCHEME, new SecurityScheme("apiKey", "cookie", SESSION_COOKIE, "Session cookie authentication"));
        schemes.put(API_KEY_SCHEME, new SecurityScheme("apiKey", "header", apiKeyHeader, "API key authentication"));

        final var schemas = new LinkedHashMap<String, SpecSchema>();
        final var paths = new LinkedHashMap<String, Map<String, SpecOperation>>();
        final var tags = new ArrayList<SpecTag>();

        for (final var resource : resources) {
            final var schemaName = toPascalCase(resource.slug());
            schemas.put(schemaName, schemaFor(resource));
            tags.add(new SpecTag(resource.label(), "Operations on " + resource.label()));

            final var collectionPath = "/api/resource/" + resource.slug();
            final var collection = new LinkedHashMap<String, SpecOperation>();
            collection.put("get", operation(resource, "List " + resource.label(), "list" + schemaName, "200"));
            collection.put("post", operation(resource, "Create " + resource.label(), "create" + schemaName, "201"));
            paths.put(collectionPath, collection);

            final var item = new LinkedHashMap<String, SpecOperation>();
            item.put("get", operation(resource, "Show " + resource.label(), "show" + schemaName, "200"));
            item.put("put", operation(resource, "Update " + resource.label(), "update" + schemaName, "200"));
            item.put("delete", operation(resource, "Delete " + resource.label(), "delete" + schemaName, "204"));
            paths.put(collectionPath + "/{id}", item);
        }

        final var servers = new ArrayList<SpecServer>();
        servers.add(new SpecServer(config.serverUrl(), config.serverDescription().orElse("")));

        return new ApiSpecDocument(
                OPENAPI_VERSION,
                new SpecInfo(config.title(), config.version(), config.description()),
                servers,
                paths,
                new SpecComponents(schemas, schemes),
                tags);
    }

    private SpecOperation operation(ResourceDescriptor resource, String summary, String operationId, String status) {
        final var responses = new LinkedHashMap<String, String>();
        responses.put(status, "Success");
        responses.put("401", "Unauthorized");
        responses.put("429", "Too Many Requests");

        // either scheme alone satisfies the operation
        final var security = new ArrayList<Map<String, List<String>>>();
        security.add(requirement(COOKIE_SCHEME));
        security.add(requirement(API_KEY_SCHEME));

        return new SpecOperation(new ArrayList<>(List.of(resource.label())), summary, operationId, responses, security);
    }

    private static Map<String, List<String>> requirement(String scheme) {
        final var requirement = new LinkedHashMap<String, List<String>>();
        requirement.put(scheme, new ArrayList<>());
        return requirement;
    }

    private SpecSchema schemaFor(ResourceDescriptor resource) {
        final var properties = new LinkedHashMap<String, SpecProperty>();
        final var required = new ArrayList<String>();
        for (final var field : resource.fields()) {
            properties.put(field.name(), propertyFor(field));
            if (field.required()) {
                required.add(field.name());
            }
        }
        return new SpecSchema("object", properties, required);
    }

    static SpecProperty propertyFor(ResourceField field) {
        final var type = field.type() == null ? "text" : field.type().toLowerCase();
        return switch (type) {
            case "number", "integer", "id" -> new SpecProperty("integer", "int64", field.readOnly());
            case "decimal", "money" -> new SpecProperty("number", "double", field.readOnly());
            case "boolean", "switch" -> new SpecProperty("boolean", null, field.readOnly());
            case "date" -> new SpecProperty("string", "date", field.readOnly());
            case "datetime" -> new SpecProperty("string", "date-time", field.readOnly());
            case "email" -> new SpecProperty("string", "email", field.readOnly());
            case "password" -> new SpecProperty("string", "password", field.readOnly());
            default -> new SpecProperty("string", null, field.readOnly());
        };
    }

    static String toPascalCase(String slug) {
        final var result = new StringBuilder(slug.length());
        var capitalize = true;
        for (final var ch : slug.toCharArray()) {
            if (ch == '-' || ch == '_' || ch == ' ') {
                capitalize = true;
                continue;
            }
            result.append(capitalize ? Character.toUpperCase(ch) : ch);
            capitalize = false;
        }
        return result.toString();
    }
}
