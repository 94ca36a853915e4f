package bulwark.core.model.openapi;

public record SpecProperty(String type, String format, boolean readOnly) {}
