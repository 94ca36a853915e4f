package bulwark.core.model.openapi;

import java.util.List;
import java.util.Map;

/**
 * Object schema generated for one resource.
 *
 * @param type       always {@code object} for resource schemas
 * @param properties field name to property, in declaration order
 * @param required   names of required fields
 */
public record SpecSchema(String type, Map<String, SpecProperty> properties, List<String> required) {}
