package bulwark.core.model.openapi;

public record SpecInfo(String title, String version, String description) {}
