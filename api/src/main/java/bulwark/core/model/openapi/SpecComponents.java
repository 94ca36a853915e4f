package bulwark.core.model.openapi;

import java.util.Map;

public record SpecComponents(Map<String, SpecSchema> schemas, Map<String, SecurityScheme> securitySchemes) {}
