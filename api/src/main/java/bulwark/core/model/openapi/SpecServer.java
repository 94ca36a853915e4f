package bulwark.core.model.openapi;

public record SpecServer(String url, String description) {}
