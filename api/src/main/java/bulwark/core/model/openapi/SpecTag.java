package bulwark.core.model.openapi;

public record SpecTag(String name, String description) {}
