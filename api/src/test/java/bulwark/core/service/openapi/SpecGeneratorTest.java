package bulwark.core.service.openapi;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import bulwark.core.cache.CopyFailurePolicy;
import bulwark.core.config.SpecDocumentConfig;
import bulwark.core.model.openapi.ResourceDescriptor;
import bulwark.core.model.openapi.ResourceField;

@ExtendWith(MockitoExtension.class)
@DisplayName("SpecGenerator")
class SpecGeneratorTest {

    @Mock
    private SpecDocumentConfig config;

    private SpecGenerator generator;

    @BeforeEach
    void setUp() {
        lenient().when(config.title()).thenReturn("Panel API");
        lenient().when(config.version()).thenReturn("2.1.0");
        lenient().when(config.description()).thenReturn("Admin panel");
        lenient().when(config.serverUrl()).thenReturn("https://panel.example.com");
        lenient().when(config.serverDescription()).thenReturn(Optional.of("Production"));
        lenient().when(config.copyFailure()).thenReturn(CopyFailurePolicy.RETURN_SHARED);
        generator = new SpecGenerator(config);
    }

    private static ResourceDescriptor users() {
        return new ResourceDescriptor(
                "users",
                "Users",
                List.of(
                        new ResourceField("id", "id", false, true),
                        new ResourceField("email", "email", true, false),
                        ResourceField.of("active", "boolean")));
    }

    @Test
    @DisplayName("should fill info and servers from configuration")
    void shouldFillInfoAndServers() {
        final var document = generator.generate(List.of(), "X-API-Key");

        assertEquals(SpecGenerator.OPENAPI_VERSION, document.openapi());
        assertEquals("Panel API", document.info().title());
        assertEquals("2.1.0", document.info().version());
        assertEquals("https://panel.example.com", document.servers().get(0).url());
        assertEquals("Production", document.servers().get(0).description());
        assertTrue(document.paths().isEmpty());
    }

    @Test
    @DisplayName("should advertise cookie and API key security schemes")
    void shouldAdvertiseSecuritySchemes() {
        final var schemes = generator.generate(List.of(), "X-Panel-Key").components().securitySchemes();

        assertEquals("cookie", schemes.get(SpecGenerator.COOKIE_SCHEME).in());
        assertEquals("session_token", schemes.get(SpecGenerator.COOKIE_SCHEME).name());
        assertEquals("header", schemes.get(SpecGenerator.API_KEY_SCHEME).in());
        assertEquals("X-Panel-Key", schemes.get(SpecGenerator.API_KEY_SCHEME).name());
    }

    @Test
    @DisplayName("should describe CRUD operations for each resource")
    void shouldDescribeCrudOperations() {
        final var document = generator.generate(List.of(users()), "X-API-Key");

        final var collection = document.paths().get("/api/resource/users");
        final var item = document.paths().get("/api/resource/users/{id}");
        assertEquals(List.of("get", "post"), List.copyOf(collection.keySet()));
        assertEquals(List.of("get", "put", "delete"), List.copyOf(item.keySet()));
        assertEquals("createUsers", collection.get("post").operationId());
        assertEquals(List.of("Users"), item.get("delete").tags());
        assertTrue(item.get("delete").responses().containsKey("204"));
        assertEquals(2, item.get("get").security().size());
        assertEquals("Users", document.tags().get(0).name());
    }

    @Test
    @DisplayName("should map field types and required fields into the schema")
    void shouldBuildSchema() {
        final var schema = generator.generate(List.of(users()), "X-API-Key").components().schemas().get("Users");

        assertEquals("object", schema.type());
        assertEquals(List.of("email"), schema.required());
        assertEquals("integer", schema.properties().get("id").type());
        assertTrue(schema.properties().get("id").readOnly());
        assertEquals("email", schema.properties().get("email").format());
        assertEquals("boolean", schema.properties().get("active").type());
        assertNull(schema.properties().get("active").format());
    }

    @Test
    @DisplayName("should return independent collections on every call")
    void shouldReturnFreshCollections() {
        final var first = generator.generate(List.of(users()), "X-API-Key");
        final var second = generator.generate(List.of(users()), "X-API-Key");

        assertEquals(first, second);
        assertNotSame(first.paths(), second.paths());
        first.tags().clear();
        assertEquals(1, second.tags().size());
    }

    @Test
    @DisplayName("should convert slugs to schema names")
    void shouldConvertSlugs() {
        assertEquals("BlogPosts", SpecGenerator.toPascalCase("blog-posts"));
        assertEquals("OrderItems", SpecGenerator.toPascalCase("order_items"));
        assertEquals("Users", SpecGenerator.toPascalCase("users"));
    }

    @Test
    @DisplayName("should default unknown field types to string")
    void shouldDefaultUnknownTypes() {
        final var property = SpecGenerator.propertyFor(ResourceField.of("bio", "richtext"));

        assertEquals("string", property.type());
        assertNull(property.format());
    }
}
